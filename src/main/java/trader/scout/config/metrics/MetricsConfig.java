package trader.scout.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import trader.scout.service.PollScheduler;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter cyclesCompletedCounter(MeterRegistry registry) {
        return Counter.builder("scout.cycles.completed")
                .description("Number of poll cycles that ran to completion")
                .register(registry);
    }

    @Bean
    public Counter cyclesFailedCounter(MeterRegistry registry) {
        return Counter.builder("scout.cycles.failed")
                .description("Number of poll cycles aborted by a fetch failure")
                .register(registry);
    }

    @Bean
    public Counter alertsSentCounter(MeterRegistry registry) {
        return Counter.builder("scout.alerts.sent")
                .description("Number of new listing alerts delivered to Telegram")
                .register(registry);
    }

    @Bean
    public Counter alertsFailedCounter(MeterRegistry registry) {
        return Counter.builder("scout.alerts.failed")
                .description("Number of new listing alerts Telegram did not accept")
                .register(registry);
    }

    @Bean
    public Gauge ledgerSizeGauge(MeterRegistry registry, PollScheduler pollScheduler) {
        return Gauge.builder("scout.ledger.size", pollScheduler::getLedgerSize)
                .description("Coins already alerted")
                .register(registry);
    }

    /**
     * Enables {@code @Observed} on the poll cycle.
     */
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
