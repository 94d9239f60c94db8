package app.govexplorer.sdk;

import app.govexplorer.sdk.model.AuditEventPage;
import app.govexplorer.sdk.model.AuditEventQuery;
import app.govexplorer.sdk.model.Bundle;

import java.util.List;

/**
 * Supplier of fully materialised governance documents.
 */
public interface GovernanceDataSource {

    /**
     * @param limit maximum number of bundles to return
     * @return a snapshot of bundles; never {@code null}
     * @throws GovernanceException when the documents cannot be obtained
     */
    List<Bundle> listBundles(int limit) throws GovernanceException;

    /**
     * @return matching audit events in the order requested by the query; never {@code null}
     * @throws GovernanceException when the documents cannot be obtained
     */
    AuditEventPage listAuditEvents(AuditEventQuery query) throws GovernanceException;
}
