package app.govexplorer.sdk.view;

import java.util.List;

/**
 * Ranked metrics rows plus the bar chart derived from them.
 */
public record MetricsReport(List<MetricsRow> rows, List<BarChartPoint> chart) {

    public static final MetricsReport EMPTY = new MetricsReport(List.of(), List.of());

    public MetricsReport {
        rows = List.copyOf(rows);
        chart = List.copyOf(chart);
    }
}
