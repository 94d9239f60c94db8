package app.govexplorer.sdk.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Binds arrays of JSON documents to model records one element at a time.
 */
public final class DocumentReader {

    private static final Logger LOGGER = Logger.getLogger(DocumentReader.class.getName());

    private DocumentReader() {
    }

    /**
     * @return the bound documents; an absent or non-array node yields an empty list and elements that fail to bind
     *         are skipped with a warning
     */
    public static <T> List<T> readList(JsonNode array, Class<T> type) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<T> results = new ArrayList<>(array.size());
        int index = 0;
        for (JsonNode node : array) {
            int position = index++;
            if (node == null || !node.isObject()) {
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[governance-explorer] skipping %s document #%d: not an object", type.getSimpleName(), position));
                continue;
            }
            try {
                results.add(Json.mapper().treeToValue(node, type));
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[governance-explorer] skipping %s document #%d: %s", type.getSimpleName(), position, ex.getMessage()));
            }
        }
        return List.copyOf(results);
    }
}
