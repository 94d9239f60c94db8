package app.govexplorer.sdk.facts;

import app.govexplorer.sdk.model.Attachment;
import app.govexplorer.sdk.model.Bundle;
import app.govexplorer.sdk.model.StageAssignment;
import app.govexplorer.sdk.time.TemporalNormalizer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Derives display facts from a single bundle snapshot.
 *
 * <p>
 * All methods are pure and never throw for document content. Facts that cannot be resolved are reported either as
 * an empty {@link Optional} or, on the string/int convenience variants, as the sentinels {@link #UNASSIGNED},
 * {@link #INDETERMINATE_DAYS} and {@code ""}.
 * </p>
 */
public final class BundleFactExtractor {

    public static final String UNASSIGNED = "Unassigned";
    public static final int INDETERMINATE_DAYS = -1;
    public static final int STAGE_SLOTS = 4;

    private BundleFactExtractor() {
    }

    /**
     * @return the assignee of the bundle's current stage, or {@link #UNASSIGNED}
     */
    public static String currentStageAssignee(Bundle bundle) {
        return stageAssignee(bundle.stages(), bundle.currentStage());
    }

    /**
     * @return the assignee of the named stage, or {@link #UNASSIGNED} when the stage is missing or nobody is assigned
     */
    public static String stageAssignee(List<StageAssignment> stages, String stageName) {
        return resolveStageAssignee(stages, stageName).orElse(UNASSIGNED);
    }

    /**
     * Looks up the first stage entry carrying {@code stageName}. Later entries with the same name are not consulted,
     * even when the first one has no assignee.
     *
     * @return the assignee name, or empty when the stage is missing, unnamed or unassigned
     */
    public static Optional<String> resolveStageAssignee(List<StageAssignment> stages, String stageName) {
        if (stageName == null || stageName.isEmpty() || stages == null) {
            return Optional.empty();
        }
        for (StageAssignment stage : stages) {
            if (stageName.equals(stage.stageName())) {
                String assignee = stage.assigneeName();
                return assignee.isEmpty() ? Optional.empty() : Optional.of(assignee);
            }
        }
        return Optional.empty();
    }

    /**
     * @return non-empty stage names without duplicates, in first-seen order
     */
    public static List<String> distinctStageNames(Bundle bundle) {
        Set<String> seen = new LinkedHashSet<>();
        for (StageAssignment stage : bundle.stages()) {
            String name = stage.stageName();
            if (!name.isEmpty()) {
                seen.add(name);
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Fixed-width variant of {@link #distinctStageNames(Bundle)}: always {@link #STAGE_SLOTS} entries, truncated or
     * padded with {@code ""}.
     */
    public static List<String> orderedDistinctStageNames(Bundle bundle) {
        List<String> names = distinctStageNames(bundle);
        List<String> slots = new ArrayList<>(STAGE_SLOTS);
        for (int i = 0; i < STAGE_SLOTS; i++) {
            slots.add(i < names.size() ? names.get(i) : "");
        }
        return Collections.unmodifiableList(slots);
    }

    /**
     * @return the latest of the bundle's creation time and its attachments' creation times, or empty when none parses
     */
    public static Optional<Instant> lastUpdated(Bundle bundle) {
        return Stream.concat(
                Stream.of(bundle.createdAt()),
                bundle.attachments().stream().map(Attachment::createdAt))
            .map(TemporalNormalizer::normalize)
            .flatMap(Optional::stream)
            .max(Comparator.naturalOrder());
    }

    /**
     * Whole days elapsed between {@link #lastUpdated(Bundle)} and {@code now}, rounded down.
     *
     * @return the day count, {@code 0} when the last update lies after {@code now}, or {@link #INDETERMINATE_DAYS}
     *         when the bundle carries no parseable timestamp
     */
    public static int daysInCurrentStage(Bundle bundle, Instant now) {
        Objects.requireNonNull(now, "now");
        Optional<Instant> updated = lastUpdated(bundle);
        if (updated.isEmpty()) {
            return INDETERMINATE_DAYS;
        }
        Duration elapsed = Duration.between(updated.get(), now);
        if (elapsed.isNegative()) {
            return 0;
        }
        long days = elapsed.toDays();
        return days > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) days;
    }

    /**
     * Scans attachments from newest to oldest (unknown timestamps last, ties in document order) and returns the first
     * branch found.
     *
     * @return the branch name, or {@code ""} when no attachment names one
     */
    public static String mostRecentBranch(List<Attachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return "";
        }
        List<Attachment> sorted = new ArrayList<>(attachments);
        sorted.sort(Comparator.comparing(
            (Attachment attachment) -> TemporalNormalizer.orMin(TemporalNormalizer.normalize(attachment.createdAt())))
            .reversed());
        for (Attachment attachment : sorted) {
            String branch = attachment.branch();
            if (!branch.isEmpty()) {
                return branch;
            }
        }
        return "";
    }
}
