package app.govexplorer.sdk.audit;

/**
 * The single field delta chosen to summarise an audit event.
 *
 * @param before    previous value as display text
 * @param after     new value as display text
 * @param fieldKind recognised field name ({@code stage}, {@code state} or {@code assignee}), or {@code ""}
 */
public record FieldChangeSummary(String before, String after, String fieldKind) {

    public static final FieldChangeSummary NONE = new FieldChangeSummary("", "", "");

    public boolean isPresent() {
        return !fieldKind.isEmpty();
    }
}
