package app.govexplorer.sdk.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helper methods for issuing authenticated JSON GET requests.
 */
public final class HttpUtil {

    public static final String API_KEY_HEADER = "X-Domino-Api-Key";

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> getJson(HttpClient client, String url, Map<String, String> query,
                                                    String apiKey, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url + queryString(query)))
            .GET()
            .header("Accept", "application/json");

        if (apiKey != null && !apiKey.isBlank()) {
            builder.header(API_KEY_HEADER, apiKey);
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    static String queryString(Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        for (Map.Entry<String, String> entry : query.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
        }
        String result = joiner.toString();
        return "?".equals(result) ? "" : result;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
