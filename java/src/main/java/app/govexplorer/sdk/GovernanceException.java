package app.govexplorer.sdk;

/**
 * Base exception raised by governance data sources.
 */
public class GovernanceException extends Exception {

    private static final long serialVersionUID = 1L;

    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
