package app.govexplorer.sdk.view;

import app.govexplorer.sdk.facts.BundleFactExtractor;
import app.govexplorer.sdk.model.Bundle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Which bundles have been sitting in their current stage the longest.
 */
public final class MetricsView {

    public static final int DEFAULT_TOP_N = 15;

    /**
     * Longest-waiting first, indeterminate rows last, ties in input order.
     */
    static final Comparator<MetricsRow> RANKING = Comparator
        .comparing(MetricsRow::isIndeterminate)
        .thenComparing(Comparator.comparingInt(MetricsRow::daysInCurrentStage).reversed());

    private MetricsView() {
    }

    public static MetricsReport report(List<Bundle> bundles, Instant now, int topN) {
        List<MetricsRow> ranked = rank(rows(bundles, now));
        return new MetricsReport(ranked, chart(ranked, topN));
    }

    /**
     * @return one row per bundle, in input order
     */
    public static List<MetricsRow> rows(List<Bundle> bundles, Instant now) {
        Objects.requireNonNull(now, "now");
        if (bundles == null || bundles.isEmpty()) {
            return List.of();
        }
        List<MetricsRow> rows = new ArrayList<>(bundles.size());
        for (Bundle bundle : bundles) {
            if (bundle == null) {
                continue;
            }
            rows.add(new MetricsRow(
                bundle.name(),
                bundle.projectName(),
                bundle.policyName(),
                bundle.currentStage(),
                BundleFactExtractor.currentStageAssignee(bundle),
                BundleFactExtractor.daysInCurrentStage(bundle, now)
            ));
        }
        return List.copyOf(rows);
    }

    public static List<MetricsRow> rank(List<MetricsRow> rows) {
        List<MetricsRow> ranked = new ArrayList<>(rows);
        ranked.sort(RANKING);
        return List.copyOf(ranked);
    }

    /**
     * Top {@code topN} rows with a known age, by days descending. A non-positive {@code topN} selects
     * {@link #DEFAULT_TOP_N}.
     */
    public static List<BarChartPoint> chart(List<MetricsRow> rows, int topN) {
        int limit = topN > 0 ? topN : DEFAULT_TOP_N;
        return rank(rows).stream()
            .filter(row -> !row.isIndeterminate())
            .limit(limit)
            .map(row -> new BarChartPoint(row.bundleName(), row.daysInCurrentStage()))
            .toList();
    }
}
