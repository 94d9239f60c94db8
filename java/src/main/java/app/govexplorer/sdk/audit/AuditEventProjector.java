package app.govexplorer.sdk.audit;

import app.govexplorer.sdk.internal.Json;
import app.govexplorer.sdk.model.AuditEvent;
import app.govexplorer.sdk.model.EntityRef;
import app.govexplorer.sdk.model.FieldChange;
import app.govexplorer.sdk.model.NamedEntity;
import app.govexplorer.sdk.model.Target;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Projects audit events into display facts.
 *
 * <p>
 * The projector never re-sorts events; the audit trail endpoint already returns them newest first.
 * </p>
 */
public final class AuditEventProjector {

    private static final Logger LOGGER = Logger.getLogger(AuditEventProjector.class.getName());

    public static final String FIELD_STAGE = "stage";
    public static final String FIELD_STATE = "state";
    public static final String FIELD_ASSIGNEE = "assignee";
    public static final String UNASSIGNED = "Unassigned";
    static final String TRANSITION_ARROW = " → ";

    private AuditEventProjector() {
    }

    /**
     * Resolves the stage an event relates to. A stage listed under {@code affecting} wins; otherwise the first
     * {@code stage} field change is rendered as {@code "<before> → <after>"}.
     *
     * @return the stage name or transition, or {@code ""}
     */
    public static String affectedStageName(AuditEvent event) {
        for (EntityRef affected : event.affecting()) {
            if (affected.isOfType(EntityRef.GOVERNANCE_POLICY_STAGE) && !affected.name().isEmpty()) {
                return affected.name();
            }
        }
        for (Target target : event.targets()) {
            for (FieldChange change : target.fieldChanges()) {
                if (FIELD_STAGE.equals(change.fieldName())) {
                    return change.beforeText() + TRANSITION_ARROW + change.afterText();
                }
            }
        }
        return "";
    }

    /**
     * Picks the first {@code stage}, {@code state} or {@code assignee} change in document order across all targets.
     * Assignee changes are read from {@code removed}/{@code added}, using {@link #UNASSIGNED} for a missing side.
     *
     * @return the summary, or {@link FieldChangeSummary#NONE} when no recognised field changed
     */
    public static FieldChangeSummary dominantFieldChange(AuditEvent event) {
        for (Target target : event.targets()) {
            for (FieldChange change : target.fieldChanges()) {
                String field = change.fieldName();
                if (FIELD_STAGE.equals(field) || FIELD_STATE.equals(field)) {
                    return new FieldChangeSummary(change.beforeText(), change.afterText(), field);
                }
                if (FIELD_ASSIGNEE.equals(field)) {
                    return new FieldChangeSummary(firstName(change.removed()), firstName(change.added()), FIELD_ASSIGNEE);
                }
            }
        }
        return FieldChangeSummary.NONE;
    }

    /**
     * Keeps events matching both filters, preserving their order. A {@code null} or empty filter does not restrict.
     */
    public static List<AuditEvent> filterEvents(List<AuditEvent> events, Collection<String> actionNames,
                                                Collection<String> projectNames) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        Set<String> actions = actionNames == null ? Set.of() : new HashSet<>(actionNames);
        Set<String> projects = projectNames == null ? Set.of() : new HashSet<>(projectNames);
        List<AuditEvent> kept = new ArrayList<>();
        for (AuditEvent event : events) {
            if (event == null) {
                continue;
            }
            if (!actions.isEmpty() && !actions.contains(event.actionName())) {
                continue;
            }
            if (!projects.isEmpty() && !projects.contains(event.projectName())) {
                continue;
            }
            kept.add(event);
        }
        return List.copyOf(kept);
    }

    /**
     * @return the name of the last governance bundle target that has one, or {@code ""}
     */
    public static String bundleName(AuditEvent event) {
        String name = "";
        for (Target target : event.targets()) {
            EntityRef entity = target.entity();
            if (entity.isOfType(EntityRef.GOVERNANCE_BUNDLE) && !entity.name().isEmpty()) {
                name = entity.name();
            }
        }
        return name;
    }

    /**
     * Pretty-printed JSON array holding each target's field-change list, for detail expansion.
     */
    public static String rawFieldChanges(AuditEvent event) {
        List<List<FieldChange>> changes = new ArrayList<>();
        for (Target target : event.targets()) {
            changes.add(target.fieldChanges());
        }
        try {
            return Json.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(changes);
        } catch (JsonProcessingException ex) {
            LOGGER.log(Level.WARNING, "[governance-explorer] unable to render raw field changes", ex);
            return "[]";
        }
    }

    private static String firstName(List<NamedEntity> entities) {
        if (entities.isEmpty() || entities.get(0).name().isEmpty()) {
            return UNASSIGNED;
        }
        return entities.get(0).name();
    }
}
