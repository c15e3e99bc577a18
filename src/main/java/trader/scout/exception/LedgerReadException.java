package trader.scout.exception;

public class LedgerReadException extends ScoutException {

    public LedgerReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
