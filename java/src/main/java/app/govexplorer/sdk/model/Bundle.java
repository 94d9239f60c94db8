package app.govexplorer.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Governance bundle snapshot as returned by {@code /api/governance/v1/bundles}.
 *
 * <p>
 * Absent names decode to {@code ""} and absent collections to empty lists. {@code createdAt} is left raw (a string,
 * a number, {@code null} or whatever else the server sent); the temporal normalizer reads anything it does not
 * understand as unknown.
 * </p>
 */
public record Bundle(
    String id,
    String name,
    String state,
    @JsonProperty("stage") String currentStage,
    String projectName,
    String policyName,
    String projectOwner,
    UserRef createdBy,
    Object createdAt,
    List<StageAssignment> stages,
    List<Attachment> attachments
) {

    public Bundle {
        id = Documents.text(id);
        name = Documents.text(name);
        state = Documents.text(state);
        currentStage = Documents.text(currentStage);
        projectName = Documents.text(projectName);
        policyName = Documents.text(policyName);
        projectOwner = Documents.text(projectOwner);
        createdBy = createdBy == null ? UserRef.EMPTY : createdBy;
        stages = Documents.list(stages);
        attachments = Documents.list(attachments);
    }

    /**
     * @return the project owner, falling back to the creating user, or {@code ""}.
     */
    public String owner() {
        if (!projectOwner.isEmpty()) {
            return projectOwner;
        }
        return createdBy.userName();
    }
}
