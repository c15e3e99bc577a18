package trader.scout.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import trader.scout.client.DexScreenerClient;
import trader.scout.config.ScoutProperties;
import trader.scout.exception.FetchException;
import trader.scout.exception.LedgerReadException;
import trader.scout.exception.LedgerWriteException;
import trader.scout.exception.NotifyException;
import trader.scout.ledger.AlertLedger;
import trader.scout.model.CycleOutcome;
import trader.scout.model.CycleReport;
import trader.scout.model.FilterConfig;
import trader.scout.model.PairSnapshot;
import trader.scout.telegram.TelegramNotificationService;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the fetch, filter, notify and persist cycle.
 * At most one cycle runs at a time; a trigger arriving while a cycle is running is dropped.
 * The ledger is saved after every delivered alert.
 */
@Slf4j
@Service
public class PollScheduler {

    private final DexScreenerClient dexScreenerClient;
    private final CandidateFilter candidateFilter;
    private final AlertLedger alertLedger;
    private final TelegramNotificationService notificationService;
    private final Clock clock;
    private final FilterConfig filterConfig;
    private final long pollIntervalMs;

    private final Counter cyclesCompletedCounter;
    private final Counter cyclesFailedCounter;
    private final Counter alertsSentCounter;
    private final Counter alertsFailedCounter;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private final AtomicInteger ledgerSize = new AtomicInteger(0);

    public PollScheduler(
            DexScreenerClient dexScreenerClient,
            CandidateFilter candidateFilter,
            AlertLedger alertLedger,
            TelegramNotificationService notificationService,
            ScoutProperties scoutProperties,
            Clock clock,
            Counter cyclesCompletedCounter,
            Counter cyclesFailedCounter,
            Counter alertsSentCounter,
            Counter alertsFailedCounter) {
        this.dexScreenerClient = dexScreenerClient;
        this.candidateFilter = candidateFilter;
        this.alertLedger = alertLedger;
        this.notificationService = notificationService;
        this.clock = clock;
        this.filterConfig = scoutProperties.toFilterConfig();
        this.pollIntervalMs = scoutProperties.getPoll().getIntervalMs();
        this.cyclesCompletedCounter = cyclesCompletedCounter;
        this.cyclesFailedCounter = cyclesFailedCounter;
        this.alertsSentCounter = alertsSentCounter;
        this.alertsFailedCounter = alertsFailedCounter;
    }

    /**
     * Seeds the ledger size gauge from the persisted ledger before the first cycle runs.
     */
    @PostConstruct
    public void initLedgerSize() {
        ledgerSize.set(loadLedger().size());
        log.info("Starting with {} alerted coins in the ledger", ledgerSize.get());
    }

    @Scheduled(fixedDelayString = "${scout.poll.interval-ms:900000}",
            initialDelayString = "${scout.poll.initial-delay-ms:10000}")
    @Observed(name = "scout.poll", contextualName = "scheduled-poll-cycle")
    public void poll() {
        runCycle();
    }

    /**
     * Runs one cycle off the caller's thread, for the manual trigger endpoint.
     */
    public Mono<CycleReport> triggerNow() {
        return Mono.fromCallable(this::runCycle)
                .subscribeOn(Schedulers.boundedElastic());
    }

    public CycleReport runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Poll cycle already running, dropping this trigger");
            return CycleReport.skipped(clock.instant());
        }
        try {
            CycleReport report = executeCycle(clock.instant());
            lastReport.set(report);
            return report;
        } finally {
            running.set(false);
        }
    }

    private CycleReport executeCycle(Instant startedAt) {
        log.info("=== Poll cycle started ===");

        List<PairSnapshot> snapshots;
        try {
            snapshots = dexScreenerClient.fetchPairs().block();
        } catch (FetchException e) {
            log.error("Poll cycle aborted, ledger untouched: {}", e.getMessage(), e);
            cyclesFailedCounter.increment();
            return CycleReport.builder()
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .outcome(CycleOutcome.FETCH_FAILED)
                    .lastError(e.getMessage())
                    .build();
        }
        if (snapshots == null) {
            snapshots = List.of();
        }

        Set<String> alerted = loadLedger();
        ledgerSize.set(alerted.size());

        List<PairSnapshot> selected = candidateFilter.firstOccurrences(
                candidateFilter.select(snapshots, alerted, clock.instant(), filterConfig));
        log.info("{} of {} pairs qualify for an alert", selected.size(), snapshots.size());

        int notified = 0;
        int failed = 0;
        int ledgerWriteFailures = 0;
        String lastError = null;

        for (PairSnapshot pair : selected) {
            try {
                notificationService.notify(pair).block();
            } catch (NotifyException e) {
                failed++;
                alertsFailedCounter.increment();
                lastError = e.getMessage();
                log.error("Alert for {} not delivered, will retry next cycle: {}", pair.getName(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                // block() wraps an interrupt in an unchecked exception
                if (e.getCause() instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                failed++;
                alertsFailedCounter.increment();
                lastError = e.getMessage();
                log.error("Unexpected error alerting {}, will retry next cycle: {}", pair.getName(), e.getMessage(), e);
                continue;
            }

            notified++;
            alertsSentCounter.increment();
            alerted.add(pair.getName());
            ledgerSize.set(alerted.size());
            log.info("New coin detected and alert sent: {} ({})", pair.getName(), pair.getPairAddress());

            try {
                alertLedger.save(alerted);
            } catch (LedgerWriteException e) {
                ledgerWriteFailures++;
                lastError = e.getMessage();
                log.error("Could not persist ledger after alerting {}, it may be alerted again: {}",
                        pair.getName(), e.getMessage(), e);
            }
        }

        cyclesCompletedCounter.increment();
        log.info("=== Poll cycle finished: {} sent, {} failed ===", notified, failed);

        return CycleReport.builder()
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .outcome(CycleOutcome.COMPLETED)
                .fetched(snapshots.size())
                .selected(selected.size())
                .notified(notified)
                .failed(failed)
                .ledgerWriteFailures(ledgerWriteFailures)
                .lastError(lastError)
                .build();
    }

    // Unreadable ledger counts as empty so the cycle can still proceed
    private Set<String> loadLedger() {
        try {
            return new HashSet<>(alertLedger.load());
        } catch (LedgerReadException e) {
            log.warn("Ledger unreadable, continuing with an empty one: {}", e.getMessage());
            return new HashSet<>();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public CycleReport getLastReport() {
        return lastReport.get();
    }

    public int getLedgerSize() {
        return ledgerSize.get();
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }
}
