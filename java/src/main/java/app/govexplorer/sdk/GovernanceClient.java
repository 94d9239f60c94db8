package app.govexplorer.sdk;

import app.govexplorer.sdk.internal.ApiErrorDecoder;
import app.govexplorer.sdk.internal.DocumentReader;
import app.govexplorer.sdk.internal.HttpUtil;
import app.govexplorer.sdk.internal.Json;
import app.govexplorer.sdk.model.AuditEvent;
import app.govexplorer.sdk.model.AuditEventPage;
import app.govexplorer.sdk.model.AuditEventQuery;
import app.govexplorer.sdk.model.Bundle;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * HTTP data source backed by the governance and audit trail REST APIs. The client is stateless apart from its
 * configuration and is safe to share between threads.
 * </p>
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code GET /api/governance/v1/bundles?limit=N}: bundles under {@code data} (older deployments use
 *       {@code bundles}).</li>
 *   <li>{@code GET /api/audittrail/v1/auditevents}: events under {@code events} plus {@code estimatedMatches}.</li>
 * </ul>
 *
 * <p>
 * Requests carry the configured API key in the {@value HttpUtil#API_KEY_HEADER} header. Non-2xx responses surface as
 * {@link GovernanceApiException}; transport failures as {@link GovernanceException}. Individual documents that do not
 * bind to the model are logged and skipped rather than failing the whole response.
 * </p>
 */
public final class GovernanceClient implements GovernanceDataSource, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(GovernanceClient.class.getName());

    static final String BUNDLES_PATH = "/api/governance/v1/bundles";
    static final String AUDIT_EVENTS_PATH = "/api/audittrail/v1/auditevents";

    private final Config config;
    private final HttpClient httpClient;
    private final String apiHost;

    /**
     * @param config client configuration; defaults are applied again so a partially built config is accepted
     */
    public GovernanceClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.apiHost = this.config.getApiHost();
        this.httpClient = this.config.getHttpClient();
    }

    @Override
    public List<Bundle> listBundles(int limit) throws GovernanceException {
        int resolvedLimit = limit > 0 ? limit : config.getBundleLimit();
        JsonNode root = get(BUNDLES_PATH, Map.of("limit", Integer.toString(resolvedLimit)), "bundles");

        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            data = root.path("bundles");
        }
        List<Bundle> bundles = DocumentReader.readList(data, Bundle.class);
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[governance-explorer] %s returned %d bundles", BUNDLES_PATH, bundles.size()));
        return bundles;
    }

    @Override
    public AuditEventPage listAuditEvents(AuditEventQuery query) throws GovernanceException {
        Objects.requireNonNull(query, "query");
        JsonNode root = get(AUDIT_EVENTS_PATH, query.toQueryParameters(), "audit events");

        List<AuditEvent> events = DocumentReader.readList(root.path("events"), AuditEvent.class);
        int estimatedMatches = root.path("estimatedMatches").asInt(events.size());
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[governance-explorer] %s returned %d events (estimated matches %d) for %s",
            AUDIT_EVENTS_PATH, events.size(), estimatedMatches, query));
        return new AuditEventPage(events, estimatedMatches);
    }

    /**
     * No-op: the {@link HttpClient} is owned by the configuration.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    private JsonNode get(String path, Map<String, String> query, String operation) throws GovernanceException {
        LOGGER.info(() -> "[governance-explorer] requesting " + path);
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.getJson(httpClient, apiHost + path, query, config.getApiKey(), config.getHttpTimeout());
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new GovernanceException("fetch " + operation + " interrupted", ex);
            }
            throw new GovernanceException("fetch " + operation + " request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                GovernanceApiException error = ApiErrorDecoder.decode(path, response.statusCode(), bodyStream);
                if (error.isAuthenticationFailure()) {
                    LOGGER.warning(() -> String.format(Locale.ROOT,
                        "[governance-explorer] %s rejected the API key (status %d); check %s",
                        path, error.getStatusCode(), Config.ENV_API_KEY));
                }
                throw error;
            }
            JsonNode root = Json.mapper().readTree(bodyStream);
            return root == null ? Json.mapper().missingNode() : root;
        } catch (IOException ex) {
            throw new GovernanceException("decode " + operation + " response: " + ex.getMessage(), ex);
        }
    }
}
