package trader.scout.exception;

/**
 * DEX Screener could not be reached, answered with an error, or returned an unparseable body.
 * The cycle that hit it is aborted without touching the ledger.
 */
public class FetchException extends ScoutException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
