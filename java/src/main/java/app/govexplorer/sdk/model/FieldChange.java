package app.govexplorer.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A single field delta inside an audit event target.
 *
 * <p>
 * {@code before} and {@code after} may hold any JSON value. Multi-valued fields such as assignees report
 * their delta through {@code added} and {@code removed} instead.
 * </p>
 */
public record FieldChange(
    String fieldName,
    JsonNode before,
    JsonNode after,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<NamedEntity> added,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<NamedEntity> removed
) {

    public FieldChange {
        fieldName = Documents.text(fieldName);
        added = Documents.list(added);
        removed = Documents.list(removed);
    }

    public String beforeText() {
        return text(before);
    }

    public String afterText() {
        return text(after);
    }

    /**
     * Renders a JSON value for display: absent, null and empty values become {@code ""}, text is returned as is,
     * anything else as its compact JSON form.
     */
    static String text(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isContainerNode()) {
            return value.isEmpty() ? "" : value.toString();
        }
        return value.asText();
    }
}
