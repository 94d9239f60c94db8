package app.govexplorer.sdk;

import app.govexplorer.sdk.audit.EventCatalog;
import app.govexplorer.sdk.model.AuditEventPage;
import app.govexplorer.sdk.model.AuditEventQuery;
import app.govexplorer.sdk.model.Bundle;
import app.govexplorer.sdk.view.BarChartPoint;
import app.govexplorer.sdk.view.BundleRow;
import app.govexplorer.sdk.view.HistoryRequest;
import app.govexplorer.sdk.view.HistoryRow;
import app.govexplorer.sdk.view.MetricsReport;
import app.govexplorer.sdk.view.MetricsRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GovernanceDashboardTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-11T00:00:00Z"), ZoneOffset.UTC);

    private GovernanceDashboard dashboard;

    @BeforeEach
    void setUp() throws Exception {
        Config config = Config.builder()
            .offline(true)
            .fixtureDirectory(FixtureDataSourceTest.fixtures())
            .build();
        dashboard = GovernanceDashboard.create(config, CLOCK);
    }

    @Test
    void allBundlesFromFixtures() {
        List<BundleRow> rows = dashboard.allBundles();

        assertEquals(List.of("Apollo", "churn-model"), rows.stream().map(BundleRow::bundleName).toList());
        BundleRow apollo = rows.get(0);
        assertEquals("Carol", apollo.currentStageAssignee());
        assertEquals("", apollo.lastUpdated());
        assertEquals("erin", apollo.owner());

        BundleRow churn = rows.get(1);
        assertEquals("Bob", churn.currentStageAssignee());
        assertEquals("2024-01-05T08:00:00Z", churn.lastUpdated());
        assertEquals("2024-01-01T00:00:00Z", churn.dateCreated());
        assertEquals(List.of("Development", "Validation", "Approval", ""), churn.stageNames());
        assertEquals(List.of("Alice", "Bob", "Unassigned", "Unassigned"), churn.stageAssignees());
        assertEquals("feature/validation", churn.repoBranch());
        assertEquals(5, churn.daysInStage());
    }

    @Test
    void filterOptionsFromFixtures() {
        assertEquals(List.of("Apollo", "churn-model"), dashboard.bundleNameOptions());
        assertEquals(List.of("forecasting", "retention"), dashboard.projectNameOptions());
        assertEquals(12, dashboard.actionNameOptions().size());
        assertTrue(dashboard.actionNameOptions().contains(EventCatalog.UPDATE_STAGE_ASSIGNEE));
    }

    @Test
    void bundleHistoryFromFixtures() {
        List<HistoryRow> rows = dashboard.bundleHistory(HistoryRequest.forBundle("churn-model"));

        assertEquals(3, rows.size());
        HistoryRow stageChange = rows.get(0);
        assertEquals("2024-01-05T08:00:00Z", stageChange.time());
        assertEquals("Development → Validation", stageChange.stage());
        assertEquals("Bob", stageChange.user());
        assertEquals("stage", stageChange.change());

        HistoryRow assigneeChange = rows.get(1);
        assertEquals("Validation", assigneeChange.stage());
        assertEquals("Unassigned", assigneeChange.before());
        assertEquals("Bob", assigneeChange.after());
        assertEquals("assignee", assigneeChange.change());

        HistoryRow created = rows.get(2);
        assertEquals("Create Governance Bundle", created.action());
        assertEquals("", created.change());
        assertEquals("churn-model", created.bundle());
    }

    @Test
    void bundleHistoryAppliesActionFilter() {
        HistoryRequest request = new HistoryRequest("churn-model", List.of("Create Governance Bundle"), List.of(),
            null, null);

        List<HistoryRow> rows = dashboard.bundleHistory(request);
        assertEquals(1, rows.size());
        assertEquals("dana", rows.get(0).user());
    }

    @Test
    void bundleHistoryForUnknownBundleIsEmpty() {
        assertEquals(List.of(), dashboard.bundleHistory(HistoryRequest.forBundle("nope")));
    }

    @Test
    void metricsFromFixtures() {
        MetricsReport report = dashboard.metrics(0);

        assertEquals(List.of("churn-model", "Apollo"), report.rows().stream().map(MetricsRow::bundleName).toList());
        assertTrue(report.rows().get(1).isIndeterminate());
        assertEquals(List.of(new BarChartPoint("churn-model", 5)), report.chart());
    }

    @Test
    void historyQueryCarriesLimitAndWindow() {
        RecordingDataSource source = new RecordingDataSource();
        GovernanceDashboard recording = new GovernanceDashboard(source, CLOCK, 0, 25);

        recording.bundleHistory(new HistoryRequest("churn", List.of(), List.of(), "2024-01-01", "2024-01-31"));

        AuditEventQuery query = source.lastQuery;
        assertNotNull(query);
        assertEquals("b-1", query.getTargetId());
        assertEquals(25, query.getLimit());
        assertEquals("2024-01-01T00:00:00Z", query.getSince());
        assertEquals("2024-01-31T23:59:59Z", query.getUntil());
        assertEquals(Config.DEFAULT_BUNDLE_LIMIT, source.lastBundleLimit);
    }

    @Test
    void dataSourceFailuresRenderEmptyViews() {
        GovernanceDashboard failing = new GovernanceDashboard(new FailingDataSource(), CLOCK, 10, 10);

        assertEquals(List.of(), failing.allBundles());
        assertEquals(List.of(), failing.bundleNameOptions());
        assertEquals(List.of(), failing.bundleHistory(HistoryRequest.forBundle("churn-model")));
        assertEquals(MetricsReport.EMPTY, failing.metrics(5));
    }

    @Test
    void auditFailureRendersEmptyHistory() {
        RecordingDataSource source = new RecordingDataSource();
        source.failEvents = true;
        GovernanceDashboard recording = new GovernanceDashboard(source, CLOCK, 10, 10);

        assertEquals(List.of(), recording.bundleHistory(HistoryRequest.forBundle("churn")));
        assertEquals(1, recording.allBundles().size());
    }

    private static class RecordingDataSource implements GovernanceDataSource {
        volatile AuditEventQuery lastQuery;
        volatile int lastBundleLimit;
        volatile boolean failEvents;

        @Override
        public List<Bundle> listBundles(int limit) {
            lastBundleLimit = limit;
            return List.of(new Bundle("b-1", "churn", "Active", "Review", "p", "policy", "owner", null,
                "2024-01-01T00:00:00Z", List.of(), List.of()));
        }

        @Override
        public AuditEventPage listAuditEvents(AuditEventQuery query) throws GovernanceException {
            lastQuery = query;
            if (failEvents) {
                throw new GovernanceException("audit trail offline");
            }
            return AuditEventPage.EMPTY;
        }
    }

    private static class FailingDataSource implements GovernanceDataSource {
        @Override
        public List<Bundle> listBundles(int limit) throws GovernanceException {
            throw new GovernanceApiException(GovernanceClient.BUNDLES_PATH, 503, "UNAVAILABLE", "try later");
        }

        @Override
        public AuditEventPage listAuditEvents(AuditEventQuery query) throws GovernanceException {
            throw new GovernanceApiException(GovernanceClient.AUDIT_EVENTS_PATH, 503, "UNAVAILABLE", "try later");
        }
    }
}
