package trader.scout.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;
import trader.scout.service.PollScheduler;
import trader.scout.telegram.TelegramNotificationService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational endpoints: liveness, manual trigger and Telegram diagnostics.
 * None of them touches the ledger outside a regular cycle.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class StatusController {
    private final PollScheduler pollScheduler;
    private final TelegramNotificationService notificationService;

    @Bean
    public RouterFunction<ServerResponse> statusRoutes() {
        return RouterFunctions.route()
                .GET("/", this::handleRoot)
                .GET("/status", this::handleStatus)
                .POST("/trigger", this::handleTrigger)
                .GET("/test", this::handleTestMessage)
                .GET("/botinfo", this::handleBotInfo)
                .build();
    }

    private Mono<ServerResponse> handleRoot(ServerRequest request) {
        return ServerResponse.ok().bodyValue(Map.of("message", "Solana Scout Bot is running!"));
    }

    private Mono<ServerResponse> handleStatus(ServerRequest request) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("alive", true);
        status.put("running", pollScheduler.isRunning());
        status.put("pollIntervalMs", pollScheduler.getPollIntervalMs());
        status.put("ledgerSize", pollScheduler.getLedgerSize());
        if (pollScheduler.getLastReport() != null) {
            status.put("lastCycle", pollScheduler.getLastReport());
        }
        return ServerResponse.ok().bodyValue(status);
    }

    private Mono<ServerResponse> handleTrigger(ServerRequest request) {
        log.info("Manual poll cycle requested");
        return pollScheduler.triggerNow()
                .flatMap(report -> ServerResponse.ok().bodyValue(report));
    }

    private Mono<ServerResponse> handleTestMessage(ServerRequest request) {
        return notificationService.sendTestMessage()
                .flatMap(message -> ServerResponse.ok().bodyValue(Map.of("message", message)))
                .onErrorResume(error -> {
                    log.error("Test message failed: {}", error.getMessage());
                    return ServerResponse.ok().bodyValue(Map.of("error", String.valueOf(error.getMessage())));
                });
    }

    private Mono<ServerResponse> handleBotInfo(ServerRequest request) {
        return notificationService.describeDestination()
                .flatMap(info -> ServerResponse.ok().bodyValue(info))
                .onErrorResume(error -> {
                    log.error("Error getting bot info: {}", error.getMessage());
                    return ServerResponse.ok().bodyValue(Map.of("error", String.valueOf(error.getMessage())));
                });
    }
}
