package trader.scout.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Mono;
import trader.scout.client.DexScreenerClient;
import trader.scout.config.ScoutProperties;
import trader.scout.exception.FetchException;
import trader.scout.exception.NotifyException;
import trader.scout.ledger.AlertLedger;
import trader.scout.ledger.JsonFileAlertLedger;
import trader.scout.model.CycleOutcome;
import trader.scout.model.CycleReport;
import trader.scout.model.PairSnapshot;
import trader.scout.telegram.TelegramNotificationService;

/**
 * Cycle-level tests for PollScheduler: real filter and file ledger, stubbed data source and Telegram.
 */
class PollSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @TempDir
    Path tempDir;

    @Mock
    private DexScreenerClient dexScreenerClient;

    @Mock
    private TelegramNotificationService notificationService;

    private SimpleMeterRegistry registry;
    private Path ledgerFile;
    private AlertLedger alertLedger;
    private PollScheduler pollScheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new SimpleMeterRegistry();
        ledgerFile = tempDir.resolve("alerted_coins.json");
        alertLedger = new JsonFileAlertLedger(new ObjectMapper(), ledgerFile);

        pollScheduler = new PollScheduler(
                dexScreenerClient,
                new CandidateFilter(),
                alertLedger,
                notificationService,
                new ScoutProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC),
                registry.counter("scout.cycles.completed"),
                registry.counter("scout.cycles.failed"),
                registry.counter("scout.alerts.sent"),
                registry.counter("scout.alerts.failed"));
    }

    private PairSnapshot pair(String name, String volume, Instant createdAt) {
        return PairSnapshot.builder()
                .name(name)
                .chainId("solana")
                .volume24h(new BigDecimal(volume))
                .createdAt(createdAt)
                .url("https://dexscreener.com/solana/" + name.toLowerCase())
                .build();
    }

    private PairSnapshot freshPair(String name) {
        return pair(name, "600000", NOW.minus(Duration.ofMinutes(10)));
    }

    private static PairSnapshot named(String name) {
        return argThat(pair -> pair != null && name.equals(pair.getName()));
    }

    @Test
    void runCycle_singleQualifyingPair_notifiesOnceAndRecordsIt() {
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of(freshPair("Moon"))));
        when(notificationService.notify(any())).thenReturn(Mono.empty());

        CycleReport report = pollScheduler.runCycle();

        verify(notificationService, times(1)).notify(any());
        assertThat(alertLedger.load()).containsExactly("Moon");
        assertThat(report.getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        assertThat(report.getNotified()).isEqualTo(1);
        assertThat(registry.counter("scout.alerts.sent").count()).isEqualTo(1.0);
        assertThat(pollScheduler.getLedgerSize()).isEqualTo(1);
    }

    @Test
    void runCycle_samePairTwiceInBatch_notifiesOnce() {
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of(freshPair("Moon"), freshPair("Moon"))));
        when(notificationService.notify(any())).thenReturn(Mono.empty());

        CycleReport report = pollScheduler.runCycle();

        verify(notificationService, times(1)).notify(any());
        assertThat(report.getSelected()).isEqualTo(1);
        assertThat(alertLedger.load()).containsExactly("Moon");
    }

    @Test
    void runCycle_fetchFails_noNotificationAndLedgerUntouched() throws IOException {
        Files.writeString(ledgerFile, "[\"Old\"]", StandardCharsets.UTF_8);
        when(dexScreenerClient.fetchPairs())
                .thenReturn(Mono.error(new FetchException("Failed to reach DexScreener: Connection refused")));

        CycleReport report = pollScheduler.runCycle();

        verify(notificationService, never()).notify(any());
        assertThat(Files.readString(ledgerFile)).isEqualTo("[\"Old\"]");
        assertThat(report.getOutcome()).isEqualTo(CycleOutcome.FETCH_FAILED);
        assertThat(report.getLastError()).contains("Connection refused");
        assertThat(registry.counter("scout.cycles.failed").count()).isEqualTo(1.0);
        assertThat(pollScheduler.isRunning()).isFalse();
    }

    @Test
    void runCycle_volumeExactlyAtThreshold_noNotification() {
        when(dexScreenerClient.fetchPairs())
                .thenReturn(Mono.just(List.of(pair("Flat", "500000", NOW.minus(Duration.ofMinutes(10))))));

        pollScheduler.runCycle();

        verify(notificationService, never()).notify(any());
        assertThat(ledgerFile).doesNotExist();
    }

    @Test
    void runCycle_missingCreationTimestamp_noNotification() {
        when(dexScreenerClient.fetchPairs())
                .thenReturn(Mono.just(List.of(pair("Ghost", "90000000", null))));

        pollScheduler.runCycle();

        verify(notificationService, never()).notify(any());
        assertThat(ledgerFile).doesNotExist();
    }

    @Test
    void runCycle_notifyFails_pairStaysOutOfLedgerAndIsRetried() {
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of(freshPair("Moon"))));
        when(notificationService.notify(any()))
                .thenReturn(Mono.error(new NotifyException("Telegram sendMessage timed out")))
                .thenReturn(Mono.empty());

        CycleReport first = pollScheduler.runCycle();

        assertThat(first.getFailed()).isEqualTo(1);
        assertThat(alertLedger.load()).doesNotContain("Moon");

        CycleReport second = pollScheduler.runCycle();

        verify(notificationService, times(2)).notify(any());
        assertThat(second.getNotified()).isEqualTo(1);
        assertThat(alertLedger.load()).containsExactly("Moon");
    }

    @Test
    void runCycle_oneNotifyFailure_doesNotStopOtherPairs() {
        when(dexScreenerClient.fetchPairs())
                .thenReturn(Mono.just(List.of(freshPair("Broken"), freshPair("Moon"))));
        when(notificationService.notify(named("Broken")))
                .thenReturn(Mono.error(new NotifyException("Bad Request: can't parse entities")));
        when(notificationService.notify(named("Moon"))).thenReturn(Mono.empty());

        CycleReport report = pollScheduler.runCycle();

        assertThat(report.getNotified()).isEqualTo(1);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(alertLedger.load()).containsExactly("Moon");
        assertThat(registry.counter("scout.alerts.failed").count()).isEqualTo(1.0);
    }

    @Test
    void runCycle_unexpectedNotifyError_doesNotStopOtherPairs() {
        when(dexScreenerClient.fetchPairs())
                .thenReturn(Mono.just(List.of(freshPair("Broken"), freshPair("Moon"))));
        when(notificationService.notify(named("Broken")))
                .thenReturn(Mono.error(new IllegalStateException("boom")));
        when(notificationService.notify(named("Moon"))).thenReturn(Mono.empty());

        CycleReport report = pollScheduler.runCycle();

        assertThat(report.getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        assertThat(report.getNotified()).isEqualTo(1);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getLastError()).isEqualTo("boom");
        assertThat(alertLedger.load()).containsExactly("Moon");
        assertThat(pollScheduler.getLastReport()).isSameAs(report);
        assertThat(pollScheduler.isRunning()).isFalse();
    }

    @Test
    void runCycle_ledgerWriteFails_keepsNotifyingAndReportsFailures() throws IOException {
        // A non-empty directory at the ledger path cannot be read or replaced
        Path blocked = tempDir.resolve("blocked.json");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("keep"), "x", StandardCharsets.UTF_8);
        PollScheduler scheduler = new PollScheduler(
                dexScreenerClient,
                new CandidateFilter(),
                new JsonFileAlertLedger(new ObjectMapper(), blocked),
                notificationService,
                new ScoutProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC),
                registry.counter("scout.cycles.completed"),
                registry.counter("scout.cycles.failed"),
                registry.counter("scout.alerts.sent"),
                registry.counter("scout.alerts.failed"));
        when(dexScreenerClient.fetchPairs())
                .thenReturn(Mono.just(List.of(freshPair("Moon"), freshPair("Star"))));
        when(notificationService.notify(any())).thenReturn(Mono.empty());

        CycleReport report = scheduler.runCycle();

        verify(notificationService, times(2)).notify(any());
        assertThat(report.getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        assertThat(report.getNotified()).isEqualTo(2);
        assertThat(report.getLedgerWriteFailures()).isEqualTo(2);
        assertThat(report.getLastError()).contains("Failed to write ledger");
        assertThat(registry.counter("scout.alerts.sent").count()).isEqualTo(2.0);
        assertThat(Files.isDirectory(blocked)).isTrue();
    }

    @Test
    void initLedgerSize_reportsPersistedEntriesBeforeFirstCycle() {
        alertLedger.save(Set.of("Old", "Moon"));

        pollScheduler.initLedgerSize();

        assertThat(pollScheduler.getLedgerSize()).isEqualTo(2);
        verify(dexScreenerClient, never()).fetchPairs();
    }

    @Test
    void initLedgerSize_corruptLedger_startsAtZero() throws IOException {
        Files.writeString(ledgerFile, "garbage", StandardCharsets.UTF_8);

        pollScheduler.initLedgerSize();

        assertThat(pollScheduler.getLedgerSize()).isZero();
    }

    @Test
    void runCycle_alreadyAlertedPair_isNotNotifiedAgain() {
        alertLedger.save(Set.of("Moon"));
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of(freshPair("Moon"))));

        CycleReport report = pollScheduler.runCycle();

        verify(notificationService, never()).notify(any());
        assertThat(report.getSelected()).isZero();
    }

    @Test
    void runCycle_secondCycleWithSameSnapshot_doesNotRealert() {
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of(freshPair("Moon"))));
        when(notificationService.notify(any())).thenReturn(Mono.empty());

        pollScheduler.runCycle();
        pollScheduler.runCycle();

        verify(notificationService, times(1)).notify(any());
    }

    @Test
    void runCycle_corruptLedger_treatedAsEmpty() throws IOException {
        Files.writeString(ledgerFile, "garbage", StandardCharsets.UTF_8);
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of(freshPair("Moon"))));
        when(notificationService.notify(any())).thenReturn(Mono.empty());

        CycleReport report = pollScheduler.runCycle();

        assertThat(report.getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        assertThat(alertLedger.load()).containsExactly("Moon");
    }

    @Test
    void runCycle_keepsExistingEntriesWhenAddingNewOnes() {
        alertLedger.save(Set.of("Old"));
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of(freshPair("Moon"))));
        when(notificationService.notify(any())).thenReturn(Mono.empty());

        pollScheduler.runCycle();

        assertThat(alertLedger.load()).containsExactlyInAnyOrder("Old", "Moon");
    }

    @Test
    void runCycle_whileAnotherCycleRuns_isSkipped() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.fromCallable(() -> {
            fetchStarted.countDown();
            releaseFetch.await(5, TimeUnit.SECONDS);
            return List.<PairSnapshot>of();
        }));

        CompletableFuture<CycleReport> inFlight = CompletableFuture.supplyAsync(pollScheduler::runCycle);
        assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();

        CycleReport skipped = pollScheduler.runCycle();
        releaseFetch.countDown();

        assertThat(skipped.getOutcome()).isEqualTo(CycleOutcome.SKIPPED);
        assertThat(inFlight.get(5, TimeUnit.SECONDS).getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        assertThat(pollScheduler.getLastReport().getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        assertThat(pollScheduler.isRunning()).isFalse();
    }

    @Test
    void triggerNow_runsCycleAndRecordsReport() {
        when(dexScreenerClient.fetchPairs()).thenReturn(Mono.just(List.of()));

        CycleReport report = pollScheduler.triggerNow().block(Duration.ofSeconds(5));

        assertThat(report.getOutcome()).isEqualTo(CycleOutcome.COMPLETED);
        assertThat(pollScheduler.getLastReport()).isSameAs(report);
    }
}
