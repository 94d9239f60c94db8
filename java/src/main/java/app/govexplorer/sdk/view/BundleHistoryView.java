package app.govexplorer.sdk.view;

import app.govexplorer.sdk.audit.AuditEventProjector;
import app.govexplorer.sdk.audit.EventCatalog;
import app.govexplorer.sdk.audit.FieldChangeSummary;
import app.govexplorer.sdk.model.AuditEvent;
import app.govexplorer.sdk.model.AuditEventQuery;
import app.govexplorer.sdk.model.Bundle;
import app.govexplorer.sdk.time.TemporalNormalizer;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Audit history of one bundle: filter choices, the audit query to issue and the resulting rows.
 */
public final class BundleHistoryView {

    static final String START_OF_DAY = "T00:00:00Z";
    static final String END_OF_DAY = "T23:59:59Z";

    private BundleHistoryView() {
    }

    /**
     * @return distinct non-empty bundle names, sorted ignoring case
     */
    public static List<String> bundleNameOptions(List<Bundle> bundles) {
        TreeSet<String> names = new TreeSet<>(Comparator.comparing((String name) -> name.toLowerCase(Locale.ROOT))
            .thenComparing(Comparator.naturalOrder()));
        for (Bundle bundle : nonNull(bundles)) {
            if (!bundle.name().isEmpty()) {
                names.add(bundle.name());
            }
        }
        return List.copyOf(names);
    }

    public static List<String> actionNameOptions() {
        return EventCatalog.GOVERNANCE_EVENTS;
    }

    /**
     * @return distinct non-empty project names, sorted
     */
    public static List<String> projectNameOptions(List<Bundle> bundles) {
        TreeSet<String> names = new TreeSet<>();
        for (Bundle bundle : nonNull(bundles)) {
            if (!bundle.projectName().isEmpty()) {
                names.add(bundle.projectName());
            }
        }
        return List.copyOf(names);
    }

    /**
     * Resolves a bundle name to an id. When several bundles share the name, the most recently created one wins and
     * bundles without a parseable creation time lose.
     */
    public static Optional<String> resolveBundleId(List<Bundle> bundles, String bundleName) {
        if (bundleName == null || bundleName.isEmpty()) {
            return Optional.empty();
        }
        Bundle newest = null;
        for (Bundle bundle : nonNull(bundles)) {
            if (!bundleName.equals(bundle.name())) {
                continue;
            }
            if (newest == null || createdAtKey(bundle).isAfter(createdAtKey(newest))) {
                newest = bundle;
            }
        }
        if (newest == null || newest.id().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(newest.id());
    }

    /**
     * Builds the audit trail query for a bundle. A window bound is only sent when it parses. A full timestamp is
     * passed through as typed; anything else is widened to the start (or end) of its UTC day.
     */
    public static AuditEventQuery query(String bundleId, int limit, String start, String end) {
        return AuditEventQuery.forBundle(bundleId)
            .limit(limit)
            .sort(AuditEventQuery.SORT_NEWEST_FIRST)
            .since(windowBound(start, START_OF_DAY))
            .until(windowBound(end, END_OF_DAY))
            .build();
    }

    public static List<HistoryRow> rows(List<AuditEvent> events, Collection<String> actionNames,
                                        Collection<String> projectNames) {
        List<AuditEvent> kept = AuditEventProjector.filterEvents(events, actionNames, projectNames);
        List<HistoryRow> rows = new ArrayList<>(kept.size());
        for (AuditEvent event : kept) {
            rows.add(row(event));
        }
        return List.copyOf(rows);
    }

    public static HistoryRow row(AuditEvent event) {
        FieldChangeSummary change = AuditEventProjector.dominantFieldChange(event);
        return new HistoryRow(
            TemporalNormalizer.formatUtc(TemporalNormalizer.normalize(event.timestamp())),
            event.actionName(),
            AuditEventProjector.affectedStageName(event),
            event.actorName(),
            event.projectName(),
            AuditEventProjector.bundleName(event),
            change.before(),
            change.after(),
            change.fieldKind(),
            AuditEventProjector.rawFieldChanges(event)
        );
    }

    static String windowBound(String text, String timeOfDay) {
        if (text == null) {
            return null;
        }
        Optional<Instant> parsed = TemporalNormalizer.parse(text);
        if (parsed.isEmpty()) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.contains("T")) {
            return trimmed;
        }
        return parsed.get().atOffset(ZoneOffset.UTC).toLocalDate() + timeOfDay;
    }

    private static Instant createdAtKey(Bundle bundle) {
        return TemporalNormalizer.orMin(TemporalNormalizer.normalize(bundle.createdAt()));
    }

    private static List<Bundle> nonNull(List<Bundle> bundles) {
        if (bundles == null) {
            return List.of();
        }
        List<Bundle> result = new ArrayList<>(bundles);
        result.removeIf(Objects::isNull);
        return result;
    }
}
