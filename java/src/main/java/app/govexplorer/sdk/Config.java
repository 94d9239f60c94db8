package app.govexplorer.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration used to build governance data sources.
 */
public final class Config {

    public static final String DEFAULT_API_HOST = "https://govqcexploratory.domino.tech";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_BUNDLE_LIMIT = 1000;
    public static final int DEFAULT_AUDIT_EVENT_LIMIT = 500;
    public static final Path DEFAULT_FIXTURE_DIRECTORY = Path.of("data");

    public static final String ENV_API_HOST = "API_HOST";
    public static final String ENV_API_KEY = "DOMINO_USER_API_KEY";
    public static final String ENV_OFFLINE = "OFFLINE";
    public static final String ENV_FIXTURE_DIR = "FIXTURE_DIR";

    private final String apiHost;
    private final String apiKey;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final boolean offline;
    private final Path fixtureDirectory;
    private final int bundleLimit;
    private final int auditEventLimit;

    private Config(Builder builder) {
        this.apiHost = builder.apiHost;
        this.apiKey = builder.apiKey;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.offline = builder.offline;
        this.fixtureDirectory = builder.fixtureDirectory;
        this.bundleLimit = builder.bundleLimit;
        this.auditEventLimit = builder.auditEventLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads configuration from environment variables: {@value #ENV_API_HOST}, {@value #ENV_API_KEY},
     * {@value #ENV_OFFLINE} ({@code true} in any case enables fixture mode) and {@value #ENV_FIXTURE_DIR}.
     *
     * @param env variable lookup, typically {@link System#getenv()}
     */
    public static Config fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder()
            .apiHost(env.get(ENV_API_HOST))
            .apiKey(env.get(ENV_API_KEY))
            .offline("true".equalsIgnoreCase(Optional.ofNullable(env.get(ENV_OFFLINE)).map(String::trim).orElse("")));
        String fixtureDir = trimToNull(env.get(ENV_FIXTURE_DIR));
        if (fixtureDir != null) {
            builder.fixtureDirectory(Path.of(fixtureDir));
        }
        return builder.build();
    }

    public Config withDefaults() {
        String resolvedHost = sanitizeUrl(Optional.ofNullable(trimToNull(apiHost)).orElse(DEFAULT_API_HOST));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .apiHost(resolvedHost)
            .apiKey(trimToNull(apiKey))
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .offline(offline)
            .fixtureDirectory(Optional.ofNullable(fixtureDirectory).orElse(DEFAULT_FIXTURE_DIRECTORY))
            .bundleLimit(bundleLimit > 0 ? bundleLimit : DEFAULT_BUNDLE_LIMIT)
            .auditEventLimit(auditEventLimit > 0 ? auditEventLimit : DEFAULT_AUDIT_EVENT_LIMIT)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + url, ex);
        }
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getApiHost() {
        return apiHost;
    }

    public String getApiKey() {
        return apiKey;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public boolean isOffline() {
        return offline;
    }

    public Path getFixtureDirectory() {
        return fixtureDirectory;
    }

    public int getBundleLimit() {
        return bundleLimit;
    }

    public int getAuditEventLimit() {
        return auditEventLimit;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "Config{apiHost=%s, apiKey=%s, offline=%s, fixtureDirectory=%s, bundleLimit=%d, auditEventLimit=%d}",
            apiHost, apiKey == null ? "<unset>" : "<redacted>", offline, fixtureDirectory, bundleLimit, auditEventLimit);
    }

    public static final class Builder {
        private String apiHost;
        private String apiKey;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private boolean offline;
        private Path fixtureDirectory;
        private int bundleLimit;
        private int auditEventLimit;

        public Builder apiHost(String apiHost) {
            this.apiHost = apiHost;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder offline(boolean offline) {
            this.offline = offline;
            return this;
        }

        public Builder fixtureDirectory(Path fixtureDirectory) {
            this.fixtureDirectory = fixtureDirectory;
            return this;
        }

        public Builder bundleLimit(int bundleLimit) {
            this.bundleLimit = bundleLimit;
            return this;
        }

        public Builder auditEventLimit(int auditEventLimit) {
            this.auditEventLimit = auditEventLimit;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
