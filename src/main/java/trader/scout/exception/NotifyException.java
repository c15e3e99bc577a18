package trader.scout.exception;

/**
 * A single alert could not be delivered. The pair stays out of the ledger and is retried next cycle.
 */
public class NotifyException extends ScoutException {

    public NotifyException(String message) {
        super(message);
    }

    public NotifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
