package trader.scout.exception;

/**
 * Root of the scout error taxonomy. None of these errors is fatal to the process.
 */
public abstract class ScoutException extends RuntimeException {

    protected ScoutException(String message) {
        super(message);
    }

    protected ScoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
