package trader.scout.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import trader.scout.exception.FetchException;
import trader.scout.model.PairSnapshot;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Reads the latest pairs matching a search query from the public DEX Screener API.
 */
@Service
@Slf4j
public class DexScreenerClient {
    private static final String SEARCH_PATH = "/latest/dex/search";

    private final WebClient dexClient;
    private final ObjectMapper objectMapper;
    private final String searchQuery;
    private final Duration fetchTimeout;

    public DexScreenerClient(
            @Qualifier("dexClient") WebClient dexClient,
            ObjectMapper objectMapper,
            @Value("${dexscreener.api.search-query:${scout.target-network:solana}}") String searchQuery,
            @Value("${dexscreener.api.fetch-timeout-ms:15000}") long fetchTimeoutMillis) {
        this.dexClient = dexClient;
        this.objectMapper = objectMapper;
        this.searchQuery = searchQuery;
        this.fetchTimeout = Duration.ofMillis(fetchTimeoutMillis);
    }

    /**
     * Fetches one snapshot of pairs.
     *
     * @return Mono with the pairs in source order, or a {@link FetchException} error signal
     */
    public Mono<List<PairSnapshot>> fetchPairs() {
        log.info("Fetching DexScreener pairs for query '{}'", searchQuery);

        return dexClient.get()
                .uri(buildRequestUri())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(fetchTimeout)
                .map(this::parseResponse)
                .defaultIfEmpty(Collections.emptyList())
                .onErrorMap(error -> !(error instanceof FetchException), this::toFetchException)
                .doOnSuccess(pairs -> log.info("DexScreener returned {} pairs", pairs.size()));
    }

    private Function<UriBuilder, URI> buildRequestUri() {
        return uriBuilder -> uriBuilder
                .path(SEARCH_PATH)
                .queryParam("q", "{query}")
                .build(searchQuery);
    }

    private FetchException toFetchException(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException wcre = (WebClientResponseException) error;
            return new FetchException("DexScreener answered with status " + wcre.getStatusCode().value(), error);
        }
        if (error instanceof TimeoutException) {
            return new FetchException("DexScreener did not answer within " + fetchTimeout.toMillis() + " ms", error);
        }
        return new FetchException("Failed to reach DexScreener: " + error.getMessage(), error);
    }

    /**
     * Parses a search response. Fields that are missing or malformed degrade to
     * absent values instead of failing the whole snapshot.
     */
    List<PairSnapshot> parseResponse(String responseBody) {
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new FetchException("Failed to parse DexScreener response", e);
        }

        JsonNode pairsNode = rootNode == null ? null : rootNode.get("pairs");
        if (pairsNode == null || !pairsNode.isArray()) {
            log.warn("DexScreener response carries no pairs array");
            return Collections.emptyList();
        }

        List<PairSnapshot> pairs = new ArrayList<>(pairsNode.size());
        for (JsonNode pair : pairsNode) {
            if (!pair.isObject()) {
                continue;
            }
            pairs.add(PairSnapshot.builder()
                    .name(textOrNull(pair.path("baseToken").path("name")))
                    .chainId(textOrNull(pair.path("chainId")))
                    .volume24h(extractVolume(pair))
                    .createdAt(extractCreatedAt(pair))
                    .url(textOrNull(pair.path("url")))
                    .pairAddress(textOrNull(pair.path("pairAddress")))
                    .build());
        }
        return pairs;
    }

    private BigDecimal extractVolume(JsonNode pair) {
        JsonNode h24 = pair.path("volume").path("h24");
        if (h24.isNumber() || h24.isTextual()) {
            try {
                return new BigDecimal(h24.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Unparseable h24 volume '{}' for pair {}", h24.asText(), pair.path("pairAddress").asText());
            }
        }
        return BigDecimal.ZERO;
    }

    // 0 and missing both mean "unknown"
    private Instant extractCreatedAt(JsonNode pair) {
        JsonNode createdAt = pair.path("pairCreatedAt");
        if (!createdAt.canConvertToLong()) {
            return null;
        }
        long epochMillis = createdAt.asLong();
        return epochMillis == 0 ? null : Instant.ofEpochMilli(epochMillis);
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }
}
