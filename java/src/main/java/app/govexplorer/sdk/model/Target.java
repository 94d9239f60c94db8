package app.govexplorer.sdk.model;

import java.util.List;

/**
 * Entity touched by an audit event along with the field changes applied to it.
 */
public record Target(EntityRef entity, List<FieldChange> fieldChanges) {

    public Target {
        entity = entity == null ? EntityRef.EMPTY : entity;
        fieldChanges = Documents.list(fieldChanges);
    }
}
