package trader.scout.exception;

public class LedgerWriteException extends ScoutException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
