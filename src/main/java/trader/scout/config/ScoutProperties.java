package trader.scout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import trader.scout.model.FilterConfig;

import java.math.BigDecimal;

@Data
@Configuration
@ConfigurationProperties(prefix = "scout")
public class ScoutProperties {
    private String targetNetwork = "solana";
    private long maxAgeMinutes = 60;
    private BigDecimal minVolumeUsd = new BigDecimal("500000");
    private String ledgerFile = "alerted_coins.json";
    private Poll poll = new Poll();

    @Data
    public static class Poll {
        private long intervalMs = 900_000;
        private long initialDelayMs = 10_000;
    }

    public FilterConfig toFilterConfig() {
        return FilterConfig.builder()
                .targetNetwork(targetNetwork)
                .maxAgeMinutes(maxAgeMinutes)
                .minVolumeUsd(minVolumeUsd)
                .build();
    }
}
