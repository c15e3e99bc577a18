package trader.scout.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class FilterConfig {
    String targetNetwork;
    @Builder.Default
    long maxAgeMinutes = 60;
    @Builder.Default
    BigDecimal minVolumeUsd = new BigDecimal("500000");
}
