package trader.scout.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import trader.scout.exception.NotifyException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Thin wrapper over the few Telegram Bot API methods the scout needs.
 * Every call resolves to the {@code result} node of the API envelope or fails with {@link NotifyException}.
 */
@Slf4j
@Component
public class TelegramClient {

    private final WebClient telegramWebClient;
    private final Duration callTimeout;

    public TelegramClient(
            @Qualifier("telegramWebClient") WebClient telegramWebClient,
            @Value("${telegram.send-timeout-ms:10000}") long callTimeoutMillis) {
        this.telegramWebClient = telegramWebClient;
        this.callTimeout = Duration.ofMillis(callTimeoutMillis);
    }

    public Mono<JsonNode> sendMessage(String chatId, String text, String parseMode) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        if (parseMode != null && !parseMode.isBlank()) {
            body.put("parse_mode", parseMode);
        }
        return call("sendMessage", body);
    }

    public Mono<JsonNode> getMe() {
        return call("getMe", Map.of());
    }

    public Mono<JsonNode> getChat(String chatId) {
        return call("getChat", Map.of("chat_id", chatId));
    }

    private Mono<JsonNode> call(String method, Map<String, Object> body) {
        return telegramWebClient.post()
                .uri(uriBuilder -> uriBuilder.path("/" + method).build())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(callTimeout)
                .switchIfEmpty(Mono.error(() -> new NotifyException("Telegram " + method + " returned an empty body")))
                .flatMap(response -> unwrap(method, response))
                .onErrorMap(error -> !(error instanceof NotifyException), error -> toNotifyException(method, error));
    }

    private Mono<JsonNode> unwrap(String method, JsonNode response) {
        if (!response.path("ok").asBoolean(false)) {
            String description = response.path("description").asText("no description");
            return Mono.error(new NotifyException("Telegram rejected " + method + ": " + description));
        }
        return Mono.just(response.path("result"));
    }

    private NotifyException toNotifyException(String method, Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException ex = (WebClientResponseException) error;
            return new NotifyException("Telegram " + method + " failed with status " + ex.getStatusCode().value()
                    + ": " + ex.getResponseBodyAsString(), error);
        }
        if (error instanceof TimeoutException) {
            return new NotifyException("Telegram " + method + " timed out after " + callTimeout.toMillis() + " ms", error);
        }
        return new NotifyException("Telegram " + method + " failed: " + error.getMessage(), error);
    }
}
