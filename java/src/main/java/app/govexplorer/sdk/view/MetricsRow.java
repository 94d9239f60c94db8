package app.govexplorer.sdk.view;

import app.govexplorer.sdk.facts.BundleFactExtractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage-age row of the metrics view. {@code daysInCurrentStage} is {@code -1} when indeterminate.
 */
public record MetricsRow(
    String bundleName,
    String projectName,
    String policyName,
    String currentStage,
    String currentStageAssignee,
    int daysInCurrentStage
) implements DerivedRow {

    public static final String BUNDLE_NAME = "Bundle Name";
    public static final String PROJECT_NAME = "Project Name";
    public static final String POLICY_NAME = "Policy Name";
    public static final String CURRENT_STAGE = "Current Stage";
    public static final String CURRENT_STAGE_ASSIGNEE = "Current Stage Assignee";
    public static final String DAYS_IN_CURRENT_STAGE = "Days in Current Stage";

    public boolean isIndeterminate() {
        return daysInCurrentStage == BundleFactExtractor.INDETERMINATE_DAYS;
    }

    @Override
    public Map<String, Object> columns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(BUNDLE_NAME, bundleName);
        columns.put(PROJECT_NAME, projectName);
        columns.put(POLICY_NAME, policyName);
        columns.put(CURRENT_STAGE, currentStage);
        columns.put(CURRENT_STAGE_ASSIGNEE, currentStageAssignee);
        columns.put(DAYS_IN_CURRENT_STAGE, daysInCurrentStage);
        return Collections.unmodifiableMap(columns);
    }
}
