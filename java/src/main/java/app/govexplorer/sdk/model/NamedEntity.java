package app.govexplorer.sdk.model;

/**
 * Any referenced entity that is displayed by name: a stage, an assignee, an actor or a project.
 */
public record NamedEntity(String id, String name) {

    public static final NamedEntity EMPTY = new NamedEntity(null, "");

    public NamedEntity {
        name = Documents.text(name);
    }

    public static NamedEntity named(String name) {
        return new NamedEntity(null, name);
    }

    static NamedEntity orEmpty(NamedEntity entity) {
        return entity == null ? EMPTY : entity;
    }
}
