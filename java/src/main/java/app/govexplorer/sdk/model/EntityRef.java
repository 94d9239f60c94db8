package app.govexplorer.sdk.model;

/**
 * Typed entity reference used by audit event targets and the {@code affecting} list.
 */
public record EntityRef(String entityType, String id, String name) {

    public static final String GOVERNANCE_BUNDLE = "governanceBundle";
    public static final String GOVERNANCE_POLICY_STAGE = "governancePolicyStage";

    public static final EntityRef EMPTY = new EntityRef("", null, "");

    public EntityRef {
        entityType = Documents.text(entityType);
        name = Documents.text(name);
    }

    public boolean isOfType(String type) {
        return entityType.equals(type);
    }
}
