package app.govexplorer.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable audit trail record for one state-changing action, as returned by
 * {@code /api/audittrail/v1/auditevents}. {@code timestamp} is kept raw: ISO text or epoch milliseconds.
 */
public record AuditEvent(
    Object timestamp,
    EventAction action,
    NamedEntity actor,
    @JsonProperty("in") NamedEntity project,
    List<Target> targets,
    List<EntityRef> affecting
) {

    public AuditEvent {
        action = action == null ? EventAction.EMPTY : action;
        actor = NamedEntity.orEmpty(actor);
        project = NamedEntity.orEmpty(project);
        targets = Documents.list(targets);
        affecting = Documents.list(affecting);
    }

    public String actionName() {
        return action.eventName();
    }

    public String actorName() {
        return actor.name();
    }

    public String projectName() {
        return project.name();
    }
}
