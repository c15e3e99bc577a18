package trader.scout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One trading pair as reported by DEX Screener in a single poll.
 * Only {@code name} is used as the alert key; {@code pairAddress} is informational.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairSnapshot {
    private String name;
    private String chainId;
    private BigDecimal volume24h;
    private Instant createdAt;   // null when the source did not report it
    private String url;
    private String pairAddress;
}
