package app.govexplorer.sdk.model;

import java.util.List;

/**
 * Response wrapper for the audit events endpoint.
 */
public record AuditEventPage(List<AuditEvent> events, int estimatedMatches) {

    public static final AuditEventPage EMPTY = new AuditEventPage(List.of(), 0);

    public AuditEventPage {
        events = Documents.list(events);
    }
}
