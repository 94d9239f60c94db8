package app.govexplorer.sdk.model;

/**
 * One stage entry of a bundle together with the user assigned to it.
 */
public record StageAssignment(NamedEntity stage, NamedEntity assignee) {

    public StageAssignment {
        stage = NamedEntity.orEmpty(stage);
        assignee = NamedEntity.orEmpty(assignee);
    }

    public static StageAssignment of(String stageName, String assigneeName) {
        return new StageAssignment(NamedEntity.named(stageName), NamedEntity.named(assigneeName));
    }

    public String stageName() {
        return stage.name();
    }

    public String assigneeName() {
        return assignee.name();
    }
}
