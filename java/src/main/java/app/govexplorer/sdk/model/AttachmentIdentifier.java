package app.govexplorer.sdk.model;

/**
 * Source coordinates of an attachment; only the branch is consumed.
 */
public record AttachmentIdentifier(String branch) {

    public static final AttachmentIdentifier EMPTY = new AttachmentIdentifier("");

    public AttachmentIdentifier {
        branch = Documents.text(branch);
    }
}
