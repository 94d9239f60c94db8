package app.govexplorer.sdk.model;

/**
 * Attachment added to a bundle (report, model version, ...). {@code createdAt} is kept raw.
 */
public record Attachment(String type, Object createdAt, AttachmentIdentifier identifier) {

    public Attachment {
        type = Documents.text(type);
        identifier = identifier == null ? AttachmentIdentifier.EMPTY : identifier;
    }

    public static Attachment of(String createdAt, String branch) {
        return new Attachment(null, createdAt, new AttachmentIdentifier(branch));
    }

    public String branch() {
        return identifier.branch();
    }
}
