package app.govexplorer.sdk.view;

/**
 * One bar of the days-in-stage chart.
 */
public record BarChartPoint(String bundleName, int days) {
}
