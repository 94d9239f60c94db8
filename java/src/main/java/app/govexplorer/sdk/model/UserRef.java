package app.govexplorer.sdk.model;

/**
 * User reference as embedded in {@code createdBy}.
 */
public record UserRef(String id, String userName) {

    public static final UserRef EMPTY = new UserRef(null, "");

    public UserRef {
        userName = Documents.text(userName);
    }
}
