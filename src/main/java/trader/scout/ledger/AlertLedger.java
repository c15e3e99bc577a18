package trader.scout.ledger;

import trader.scout.exception.LedgerReadException;
import trader.scout.exception.LedgerWriteException;

import java.util.Set;

/**
 * Persistent set of coin identifiers that already triggered an alert.
 * A single writer is assumed; callers serialize access.
 */
public interface AlertLedger {

    /**
     * @return a mutable copy of the persisted identifiers, empty when nothing was stored yet
     * @throws LedgerReadException when the store exists but cannot be read or parsed
     */
    Set<String> load();

    /**
     * Replaces the persisted contents with {@code identifiers}.
     *
     * @throws LedgerWriteException when the store cannot be written
     */
    void save(Set<String> identifiers);
}
