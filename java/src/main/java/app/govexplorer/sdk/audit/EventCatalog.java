package app.govexplorer.sdk.audit;

import java.util.List;

/**
 * Governance-related audit actions offered as history filter choices.
 */
public final class EventCatalog {

    public static final String CREATE_BUNDLE = "Create Governance Bundle";
    public static final String CHANGE_BUNDLE_STAGE = "Change Governance Bundle Stage";
    public static final String CHANGE_BUNDLE_STATE = "Change Governance Bundle State";
    public static final String CREATE_STAGE_APPROVAL_REQUEST = "Create Governance Bundle Stage Approval Request";
    public static final String ACCEPT_STAGE_APPROVAL_REQUEST = "Accept Governance Bundle Stage Approval Request";
    public static final String UPDATE_STAGE_ASSIGNEE = "Update Governance Bundle Stage Assignee";
    public static final String ADD_POLICY = "Add Policy to Governance Bundle";
    public static final String DEACTIVATE_POLICY = "Deactivate Policy in Governance Bundle";
    public static final String ADD_ATTACHMENT = "Add Attachment to Bundle";
    public static final String REMOVE_ATTACHMENT = "Remove Attachment from Bundle";
    public static final String SUBMIT_RESULTS = "Submit Results in a Bundle";
    public static final String COPY_RESULTS = "Copy Governance Bundle results from another Bundle";

    public static final List<String> GOVERNANCE_EVENTS = List.of(
        CREATE_BUNDLE,
        CHANGE_BUNDLE_STAGE,
        CHANGE_BUNDLE_STATE,
        CREATE_STAGE_APPROVAL_REQUEST,
        ACCEPT_STAGE_APPROVAL_REQUEST,
        UPDATE_STAGE_ASSIGNEE,
        ADD_POLICY,
        DEACTIVATE_POLICY,
        ADD_ATTACHMENT,
        REMOVE_ATTACHMENT,
        SUBMIT_RESULTS,
        COPY_RESULTS
    );

    private EventCatalog() {
    }
}
