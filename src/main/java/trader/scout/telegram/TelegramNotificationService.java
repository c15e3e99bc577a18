package trader.scout.telegram;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import trader.scout.exception.NotifyException;
import trader.scout.model.DestinationInfo;
import trader.scout.model.PairSnapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Formats new listing alerts and delivers them to the configured chat.
 */
@Slf4j
@Service
public class TelegramNotificationService {
    static final String NOT_AVAILABLE = "N/A";

    private final TelegramClient telegramClient;
    private final String chatId;
    private final String parseMode;
    private final String networkTitle;

    @Autowired
    public TelegramNotificationService(
            TelegramClient telegramClient,
            Dotenv dotenv,
            @Value("${telegram.parse-mode:Markdown}") String parseMode,
            @Value("${scout.target-network:solana}") String targetNetwork) {
        this(telegramClient, dotenv.get("CHAT_ID", ""), parseMode, targetNetwork);
    }

    TelegramNotificationService(TelegramClient telegramClient, String chatId, String parseMode, String targetNetwork) {
        this.telegramClient = telegramClient;
        this.chatId = chatId;
        this.parseMode = parseMode;
        this.networkTitle = capitalize(targetNetwork);
    }

    /**
     * Sends the alert for a qualifying pair.
     *
     * @return empty Mono on delivery, {@link NotifyException} error signal otherwise
     */
    public Mono<Void> notify(PairSnapshot pair) {
        return Mono.defer(() -> {
                    requireChatId();
                    return telegramClient.sendMessage(chatId, formatAlertMessage(pair), parseMode);
                })
                .doOnSuccess(result -> log.info("Alert sent for {}", pair.getName()))
                .onErrorMap(error -> !(error instanceof NotifyException),
                        error -> new NotifyException("Failed to build alert for " + pair.getName(), error))
                .then();
    }

    public Mono<String> sendTestMessage() {
        return Mono.defer(() -> {
                    requireChatId();
                    return telegramClient.sendMessage(chatId, "Test message from bot", null);
                })
                .doOnSuccess(result -> log.debug("Test message sent successfully"))
                .thenReturn("Test message sent successfully!");
    }

    public Mono<DestinationInfo> describeDestination() {
        return Mono.defer(() -> {
            requireChatId();
            return Mono.zip(telegramClient.getMe(), telegramClient.getChat(chatId));
        }).map(tuple -> DestinationInfo.builder()
                .botName(tuple.getT1().path("first_name").asText(NOT_AVAILABLE))
                .botUsername(tuple.getT1().path("username").asText(NOT_AVAILABLE))
                .chatId(chatId)
                .chatType(tuple.getT2().path("type").asText(NOT_AVAILABLE))
                .chatTitle(tuple.getT2().path("title").asText(NOT_AVAILABLE))
                .build());
    }

    String formatAlertMessage(PairSnapshot pair) {
        // Ties round to even
        BigDecimal volume = (pair.getVolume24h() == null ? BigDecimal.ZERO : pair.getVolume24h())
                .setScale(0, RoundingMode.HALF_EVEN);
        String details = pair.getUrl() == null || pair.getUrl().isBlank()
                ? NOT_AVAILABLE
                : "[View on DEX Screener](" + pair.getUrl() + ")";

        return String.format(Locale.US,
                "🚨 *New %s Coin Alert* 🚨\n" +
                        "Coin: %s\n" +
                        "Volume in the first hour: $%,.0f\n" +
                        "Details: %s",
                networkTitle,
                escapeMarkdown(pair.getName()),
                volume,
                details);
    }

    // Legacy Markdown: these four characters open entities
    static String escapeMarkdown(String text) {
        if (text == null) {
            return NOT_AVAILABLE;
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '_' || c == '*' || c == '`' || c == '[') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private void requireChatId() {
        if (chatId == null || chatId.isBlank()) {
            throw new NotifyException("No CHAT_ID configured");
        }
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
