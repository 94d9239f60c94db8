package app.govexplorer.sdk.model;

import java.util.List;
import java.util.Objects;

/**
 * Defaulting rules applied when documents are decoded.
 */
final class Documents {

    private Documents() {
    }

    static String text(String value) {
        return value == null ? "" : value;
    }

    static <T> List<T> list(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}
