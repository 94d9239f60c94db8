package app.govexplorer.sdk;

/**
 * Error returned by the governance or audit trail API for a non-2xx response. Carries the endpoint that failed
 * alongside the HTTP status and the error code from the response body.
 */
public final class GovernanceApiException extends GovernanceException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final int statusCode;
    private final String code;

    /**
     * @param path       request path without host or query, e.g. {@code /api/governance/v1/bundles}
     * @param statusCode HTTP status
     * @param code       error code from the body, or {@code null}
     * @param message    error message from the body; when blank a message naming the endpoint is used
     */
    public GovernanceApiException(String path, int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(path, statusCode, code) : message);
        this.path = path;
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return the endpoint path that answered with an error.
     */
    public String getPath() {
        return path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return error code from the response body, or {@code null} when the body did not include one.
     */
    public String getCode() {
        return code;
    }

    /**
     * @return {@code true} when the API rejected the configured API key (401 or 403).
     */
    public boolean isAuthenticationFailure() {
        return statusCode == 401 || statusCode == 403;
    }

    private static String defaultMessage(String path, int status, String code) {
        String endpoint = path == null ? "governance request" : "GET " + path;
        if (code == null || code.isBlank()) {
            return endpoint + " failed with status " + status;
        }
        return endpoint + " failed with status " + status + " (" + code + ")";
    }
}
