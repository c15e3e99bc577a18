package trader.scout.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import trader.scout.model.FilterConfig;
import trader.scout.model.PairSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which pairs of a snapshot are fresh, liquid and not yet alerted.
 * Pure: the same inputs always give the same selection, in source order.
 */
@Slf4j
@Component
public class CandidateFilter {

    public List<PairSnapshot> select(List<PairSnapshot> snapshots,
                                     Set<String> alreadyAlerted,
                                     Instant now,
                                     FilterConfig config) {
        List<PairSnapshot> selected = new ArrayList<>();
        if (snapshots == null) {
            return selected;
        }
        for (PairSnapshot pair : snapshots) {
            if (pair != null && qualifies(pair, alreadyAlerted, now, config)) {
                selected.add(pair);
            }
        }
        return selected;
    }

    /**
     * Keeps the first pair for each coin name so one cycle never alerts a coin twice.
     */
    public List<PairSnapshot> firstOccurrences(List<PairSnapshot> pairs) {
        Set<String> seen = new HashSet<>();
        List<PairSnapshot> distinct = new ArrayList<>(pairs.size());
        for (PairSnapshot pair : pairs) {
            if (seen.add(pair.getName())) {
                distinct.add(pair);
            }
        }
        return distinct;
    }

    boolean qualifies(PairSnapshot pair, Set<String> alreadyAlerted, Instant now, FilterConfig config) {
        if (config.getTargetNetwork() == null || !config.getTargetNetwork().equals(pair.getChainId())) {
            return reject(pair, "network {}", pair.getChainId());
        }

        Instant createdAt = pair.getCreatedAt();
        if (createdAt == null || createdAt.toEpochMilli() == 0) {
            return reject(pair, "no creation timestamp {}", createdAt);
        }

        // Negative age means the source clock is ahead of ours; not trusted
        Duration age = Duration.between(createdAt, now);
        if (age.isNegative() || age.compareTo(Duration.ofMinutes(config.getMaxAgeMinutes())) > 0) {
            return reject(pair, "age {}", age);
        }

        if (pair.getVolume24h() == null || pair.getVolume24h().compareTo(config.getMinVolumeUsd()) <= 0) {
            return reject(pair, "volume {}", pair.getVolume24h());
        }

        if (pair.getName() == null || alreadyAlerted.contains(pair.getName())) {
            return reject(pair, "already alerted or unnamed {}", pair.getName());
        }
        return true;
    }

    private boolean reject(PairSnapshot pair, String reason, Object value) {
        if (log.isDebugEnabled()) {
            log.debug("Skipping pair {} ({}): " + reason, pair.getName(), pair.getPairAddress(), value);
        }
        return false;
    }
}
