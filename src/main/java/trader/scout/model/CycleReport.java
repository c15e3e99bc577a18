package trader.scout.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Summary of one poll cycle, kept as the last report for the status endpoint.
 */
@Value
@Builder
public class CycleReport {
    Instant startedAt;
    Instant finishedAt;
    CycleOutcome outcome;
    int fetched;
    int selected;
    int notified;
    int failed;
    int ledgerWriteFailures;
    String lastError;

    public static CycleReport skipped(Instant at) {
        return CycleReport.builder()
                .startedAt(at)
                .finishedAt(at)
                .outcome(CycleOutcome.SKIPPED)
                .lastError("Another cycle is already running")
                .build();
    }
}
