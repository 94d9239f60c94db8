package app.govexplorer.sdk.view;

import app.govexplorer.sdk.model.Attachment;
import app.govexplorer.sdk.model.Bundle;
import app.govexplorer.sdk.model.StageAssignment;
import app.govexplorer.sdk.model.UserRef;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AllBundlesViewTest {

    private static final Instant NOW = Instant.parse("2024-01-11T00:00:00Z");

    @Test
    void rowsAreOrderedByNameIgnoringCase() {
        List<BundleRow> rows = AllBundlesView.rows(List.of(
            bundle("b-3", "zeta", "", null),
            bundle("b-1", "Beta", "", null),
            bundle("b-2", "alpha", "", null)), NOW);

        assertEquals(List.of("alpha", "Beta", "zeta"), rows.stream().map(BundleRow::bundleName).toList());
        assertEquals(List.of(), AllBundlesView.rows(List.of(), NOW));
        assertEquals(List.of(), AllBundlesView.rows(null, NOW));
    }

    @Test
    void rowCarriesDerivedFacts() {
        Bundle bundle = new Bundle("b-200", "churn-model", "Active", "Validation", "retention", "Model Risk", "dana",
            new UserRef("u1", "erin"), "2024-01-01T00:00:00Z",
            List.of(StageAssignment.of("Development", "Alice"), StageAssignment.of("Validation", "Bob"),
                StageAssignment.of("Development", "Zed")),
            List.of(Attachment.of("2024-01-05T08:00:00Z", "feature/validation"), Attachment.of("2024-01-03", "")));

        BundleRow row = AllBundlesView.row(bundle, NOW);

        assertEquals("Bob", row.currentStageAssignee());
        assertEquals("2024-01-05T08:00:00Z", row.lastUpdated());
        assertEquals("2024-01-01T00:00:00Z", row.dateCreated());
        assertEquals("dana", row.owner());
        assertEquals(List.of("Development", "Validation", "", ""), row.stageNames());
        assertEquals(List.of("Alice", "Bob", "Unassigned", "Unassigned"), row.stageAssignees());
        assertEquals("feature/validation", row.repoBranch());
        assertEquals("b-200", row.bundleId());
        assertEquals(5, row.daysInStage());
    }

    @Test
    void rowWithoutTimestampsLeavesDatesBlank() {
        BundleRow row = AllBundlesView.row(bundle("b-1", "Apollo", "Approval", "not-a-date"), NOW);

        assertEquals("", row.lastUpdated());
        assertEquals("", row.dateCreated());
        assertEquals("erin", row.owner());
        assertEquals(-1, row.daysInStage());
        assertEquals("", row.repoBranch());
    }

    @Test
    void columnsFollowDisplayOrder() {
        Map<String, Object> columns = AllBundlesView.row(bundle("b-1", "Apollo", "Approval", null), NOW).columns();

        assertEquals(List.of(
            "Bundle Name", "State", "Current Stage", "Current Stage Assignee", "Last Updated", "Project Name",
            "Policy Name", "Date Bundle Created", "Owner",
            "Stage 1 Name", "Stage 1 Assignee", "Stage 2 Name", "Stage 2 Assignee",
            "Stage 3 Name", "Stage 3 Assignee", "Stage 4 Name", "Stage 4 Assignee",
            "Repo Branch", "Bundle ID"), List.copyOf(columns.keySet()));
        assertEquals("Apollo", columns.get(BundleRow.BUNDLE_NAME));
        assertEquals("Approval", columns.get(BundleRow.stageNameColumn(1)));
        assertEquals("Carol", columns.get(BundleRow.stageAssigneeColumn(1)));
        assertFalse(columns.containsKey("daysInStage"));
    }

    private static Bundle bundle(String id, String name, String stage, String createdAt) {
        return new Bundle(id, name, "Active", stage, "forecasting", "Lightweight", null,
            new UserRef("u9", "erin"), createdAt, List.of(StageAssignment.of("Approval", "Carol")), List.of());
    }
}
