package app.govexplorer.sdk.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of the all-bundles table.
 *
 * <p>
 * {@code stageNames} and {@code stageAssignees} always hold four slots. {@code daysInStage} is kept alongside the
 * row for sorting but is not a display column.
 * </p>
 */
public record BundleRow(
    String bundleName,
    String state,
    String currentStage,
    String currentStageAssignee,
    String lastUpdated,
    String projectName,
    String policyName,
    String dateCreated,
    String owner,
    List<String> stageNames,
    List<String> stageAssignees,
    String repoBranch,
    String bundleId,
    int daysInStage
) implements DerivedRow {

    public static final String BUNDLE_NAME = "Bundle Name";
    public static final String STATE = "State";
    public static final String CURRENT_STAGE = "Current Stage";
    public static final String CURRENT_STAGE_ASSIGNEE = "Current Stage Assignee";
    public static final String LAST_UPDATED = "Last Updated";
    public static final String PROJECT_NAME = "Project Name";
    public static final String POLICY_NAME = "Policy Name";
    public static final String DATE_CREATED = "Date Bundle Created";
    public static final String OWNER = "Owner";
    public static final String REPO_BRANCH = "Repo Branch";
    public static final String BUNDLE_ID = "Bundle ID";

    public BundleRow {
        stageNames = List.copyOf(stageNames);
        stageAssignees = List.copyOf(stageAssignees);
    }

    public static String stageNameColumn(int slot) {
        return "Stage " + slot + " Name";
    }

    public static String stageAssigneeColumn(int slot) {
        return "Stage " + slot + " Assignee";
    }

    @Override
    public Map<String, Object> columns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(BUNDLE_NAME, bundleName);
        columns.put(STATE, state);
        columns.put(CURRENT_STAGE, currentStage);
        columns.put(CURRENT_STAGE_ASSIGNEE, currentStageAssignee);
        columns.put(LAST_UPDATED, lastUpdated);
        columns.put(PROJECT_NAME, projectName);
        columns.put(POLICY_NAME, policyName);
        columns.put(DATE_CREATED, dateCreated);
        columns.put(OWNER, owner);
        for (int i = 0; i < stageNames.size(); i++) {
            columns.put(stageNameColumn(i + 1), stageNames.get(i));
            columns.put(stageAssigneeColumn(i + 1), stageAssignees.get(i));
        }
        columns.put(REPO_BRANCH, repoBranch);
        columns.put(BUNDLE_ID, bundleId);
        return Collections.unmodifiableMap(columns);
    }
}
