package trader.scout.model;

public enum CycleOutcome {
    COMPLETED,
    FETCH_FAILED,
    SKIPPED
}
