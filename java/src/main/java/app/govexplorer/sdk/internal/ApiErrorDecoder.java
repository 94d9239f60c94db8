package app.govexplorer.sdk.internal;

import app.govexplorer.sdk.GovernanceApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Decodes error payloads from the governance and audit trail services.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static GovernanceApiException decode(String path, int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new GovernanceApiException(path, statusCode, null, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new GovernanceApiException(path, statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            String code = node.hasNonNull("code") ? node.get("code").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            return new GovernanceApiException(path, statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return new GovernanceApiException(path, statusCode, null, fallback);
        }
    }
}
