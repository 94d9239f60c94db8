package app.govexplorer.sdk.view;

import app.govexplorer.sdk.facts.BundleFactExtractor;
import app.govexplorer.sdk.model.Bundle;
import app.govexplorer.sdk.time.TemporalNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Current state of every bundle, one row per bundle, ordered by name ignoring case.
 */
public final class AllBundlesView {

    private AllBundlesView() {
    }

    public static List<BundleRow> rows(List<Bundle> bundles, Instant now) {
        Objects.requireNonNull(now, "now");
        if (bundles == null || bundles.isEmpty()) {
            return List.of();
        }
        List<Bundle> sorted = new ArrayList<>(bundles);
        sorted.removeIf(Objects::isNull);
        sorted.sort(Comparator.comparing(bundle -> bundle.name().toLowerCase(Locale.ROOT)));
        List<BundleRow> rows = new ArrayList<>(sorted.size());
        for (Bundle bundle : sorted) {
            rows.add(row(bundle, now));
        }
        return List.copyOf(rows);
    }

    public static BundleRow row(Bundle bundle, Instant now) {
        List<String> stageNames = BundleFactExtractor.orderedDistinctStageNames(bundle);
        List<String> stageAssignees = new ArrayList<>(stageNames.size());
        for (String stageName : stageNames) {
            stageAssignees.add(BundleFactExtractor.stageAssignee(bundle.stages(), stageName));
        }
        return new BundleRow(
            bundle.name(),
            bundle.state(),
            bundle.currentStage(),
            BundleFactExtractor.currentStageAssignee(bundle),
            TemporalNormalizer.formatUtc(BundleFactExtractor.lastUpdated(bundle)),
            bundle.projectName(),
            bundle.policyName(),
            TemporalNormalizer.formatUtc(TemporalNormalizer.normalize(bundle.createdAt())),
            bundle.owner(),
            stageNames,
            stageAssignees,
            BundleFactExtractor.mostRecentBranch(bundle.attachments()),
            bundle.id(),
            BundleFactExtractor.daysInCurrentStage(bundle, now)
        );
    }
}
