package app.govexplorer.sdk.model;

/**
 * Action descriptor of an audit event.
 */
public record EventAction(String eventName) {

    public static final EventAction EMPTY = new EventAction("");

    public EventAction {
        eventName = Documents.text(eventName);
    }
}
