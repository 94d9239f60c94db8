package app.govexplorer.sdk;

import app.govexplorer.sdk.model.AuditEventPage;
import app.govexplorer.sdk.model.AuditEventQuery;
import app.govexplorer.sdk.model.Bundle;
import app.govexplorer.sdk.view.AllBundlesView;
import app.govexplorer.sdk.view.BundleHistoryView;
import app.govexplorer.sdk.view.BundleRow;
import app.govexplorer.sdk.view.HistoryRequest;
import app.govexplorer.sdk.view.HistoryRow;
import app.govexplorer.sdk.view.MetricsReport;
import app.govexplorer.sdk.view.MetricsView;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for a presentation layer: fetches documents from a {@link GovernanceDataSource} on every call and
 * returns display-ready rows for the all-bundles, history and metrics views.
 * </p>
 *
 * <p>
 * Nothing is cached. A data source failure is logged and answered exactly like an empty document set, so callers
 * never see an exception from these methods.
 * </p>
 */
public final class GovernanceDashboard {

    private static final Logger LOGGER = Logger.getLogger(GovernanceDashboard.class.getName());

    private final GovernanceDataSource dataSource;
    private final Clock clock;
    private final int bundleLimit;
    private final int auditEventLimit;

    public GovernanceDashboard(GovernanceDataSource dataSource, Clock clock, int bundleLimit, int auditEventLimit) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.bundleLimit = bundleLimit > 0 ? bundleLimit : Config.DEFAULT_BUNDLE_LIMIT;
        this.auditEventLimit = auditEventLimit > 0 ? auditEventLimit : Config.DEFAULT_AUDIT_EVENT_LIMIT;
    }

    public static GovernanceDashboard create(Config config) {
        return create(config, Clock.systemUTC());
    }

    public static GovernanceDashboard create(Config config, Clock clock) {
        Config resolved = Objects.requireNonNull(config, "config").withDefaults();
        return new GovernanceDashboard(DataSources.fromConfig(resolved), clock,
            resolved.getBundleLimit(), resolved.getAuditEventLimit());
    }

    public List<BundleRow> allBundles() {
        return AllBundlesView.rows(fetchBundles(), clock.instant());
    }

    public List<String> bundleNameOptions() {
        return BundleHistoryView.bundleNameOptions(fetchBundles());
    }

    public List<String> projectNameOptions() {
        return BundleHistoryView.projectNameOptions(fetchBundles());
    }

    public List<String> actionNameOptions() {
        return BundleHistoryView.actionNameOptions();
    }

    /**
     * @return history rows for the selected bundle, newest first, or an empty list when the bundle is unknown
     */
    public List<HistoryRow> bundleHistory(HistoryRequest request) {
        Objects.requireNonNull(request, "request");
        Optional<String> bundleId = BundleHistoryView.resolveBundleId(fetchBundles(), request.bundleName());
        if (bundleId.isEmpty()) {
            LOGGER.info(() -> "[governance-explorer] no bundle named '" + request.bundleName() + "'");
            return List.of();
        }
        AuditEventQuery query = BundleHistoryView.query(bundleId.get(), auditEventLimit, request.start(), request.end());
        AuditEventPage page = fetchAuditEvents(query);
        return BundleHistoryView.rows(page.events(), request.actionNames(), request.projectNames());
    }

    public MetricsReport metrics(int topN) {
        return MetricsView.report(fetchBundles(), clock.instant(), topN);
    }

    private List<Bundle> fetchBundles() {
        try {
            List<Bundle> bundles = dataSource.listBundles(bundleLimit);
            return bundles == null ? List.of() : bundles;
        } catch (GovernanceException ex) {
            LOGGER.log(Level.WARNING, ex, () -> String.format(Locale.ROOT,
                "[governance-explorer] bundles unavailable, showing none: %s", ex.getMessage()));
            return List.of();
        }
    }

    private AuditEventPage fetchAuditEvents(AuditEventQuery query) {
        try {
            AuditEventPage page = dataSource.listAuditEvents(query);
            return page == null ? AuditEventPage.EMPTY : page;
        } catch (GovernanceException ex) {
            LOGGER.log(Level.WARNING, ex, () -> String.format(Locale.ROOT,
                "[governance-explorer] audit events unavailable for %s, showing none: %s", query, ex.getMessage()));
            return AuditEventPage.EMPTY;
        }
    }
}
