package trader.scout.config;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class RuntimeConfig {

    /**
     * Secrets come from a local .env file when present, otherwise from the process environment.
     */
    @Bean
    public Dotenv dotenv() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        String token = dotenv.get("TELEGRAM_TOKEN");
        if (token == null || token.isBlank()) {
            log.warn("No TELEGRAM_TOKEN found, alerts will fail until it is configured");
        } else {
            log.debug("Starting with TELEGRAM_TOKEN: {}...", token.substring(0, Math.min(4, token.length())));
        }
        String chatId = dotenv.get("CHAT_ID");
        if (chatId == null || chatId.isBlank()) {
            log.warn("No CHAT_ID found, alerts will fail until it is configured");
        } else {
            log.debug("CHAT_ID: {}", chatId);
        }
        return dotenv;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
