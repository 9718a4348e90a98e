package com.openmandi.pricing.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.core.MarketSnapshotRepository;
import com.openmandi.pricing.core.OfferHistoryRepository;
import com.openmandi.pricing.domain.DataQuality;
import com.openmandi.pricing.domain.MarketSnapshot;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PricePoint;
import com.openmandi.pricing.domain.QualityGrade;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * HTTP adapter to the market-data service. Serves both the snapshot feed used
 * to build cache generations and the offer history the ethics rules read.
 */
@Slf4j
@Service
public class MarketDataClient implements MarketSnapshotRepository, OfferHistoryRepository {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PricingProperties.MarketData config;
    private final Clock clock;
    private final HttpUrl baseUrl;

    public MarketDataClient(ObjectMapper objectMapper, PricingProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.config = properties.getMarketData();
        this.clock = clock;
        this.baseUrl = HttpUrl.get(config.getBaseUrl());
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    public Optional<MarketSnapshot> fetchSnapshot(String product, String location, LocalDate date) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("v1/snapshots")
                .addPathSegment(product)
                .addPathSegment(location)
                .addQueryParameter("date", date.toString())
                .build();
        return executeRequest(url).map(this::parseSnapshot);
    }

    @Override
    public List<MarketSnapshot> fetchSnapshots(LocalDate from, LocalDate to) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("v1/snapshots")
                .addQueryParameter("from", from.toString())
                .addQueryParameter("to", to.toString())
                .build();
        List<MarketSnapshot> snapshots = new ArrayList<>();
        JsonNode body = executeRequest(url).orElse(null);
        if (body == null || !body.isArray()) {
            return snapshots;
        }
        for (JsonNode node : body) {
            try {
                snapshots.add(parseSnapshot(node));
            } catch (RuntimeException e) {
                log.warn("Skipping malformed snapshot {}/{}: {}",
                        node.path("product").asText(), node.path("location").asText(), e.getMessage());
            }
        }
        log.debug("Fetched {} snapshots for {} .. {}", snapshots.size(), from, to);
        return snapshots;
    }

    @Override
    public List<Offer> fetchHistory(String product, String counterpartId, Duration window) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("v1/offers")
                .addQueryParameter("product", product)
                .addQueryParameter("counterpartId", counterpartId)
                .addQueryParameter("since", clock.instant().minus(window).toString())
                .build();
        List<Offer> offers = new ArrayList<>();
        JsonNode body = executeRequest(url).orElse(null);
        if (body == null || !body.isArray()) {
            return offers;
        }
        for (JsonNode node : body) {
            Offer offer;
            try {
                offer = objectMapper.treeToValue(node, Offer.class);
            } catch (JsonProcessingException e) {
                throw new MarketDataUnavailableException("Malformed offer history for " + product, e);
            }
            if (offer.getRole() == null || offer.getUnitPrice() == null || offer.getUnitPrice().signum() <= 0) {
                log.warn("Skipping stored offer without role or positive price for {} toward {}",
                        product, counterpartId);
                continue;
            }
            offers.add(offer);
        }
        return offers;
    }

    MarketSnapshot parseSnapshot(JsonNode node) {
        MarketSnapshot.MarketSnapshotBuilder builder = MarketSnapshot.builder()
                .product(requiredText(node, "product"))
                .location(requiredText(node, "location"))
                .date(LocalDate.parse(requiredText(node, "date")))
                .minPrice(decimal(node.path("minPrice")))
                .maxPrice(decimal(node.path("maxPrice")))
                .modalPrice(decimal(node.path("modalPrice")))
                .unit(node.path("unit").asText("quintal"))
                .arrivalVolume(decimal(node.path("arrivalVolume")))
                .dataQuality(node.hasNonNull("dataQuality")
                        ? DataQuality.valueOf(node.get("dataQuality").asText())
                        : DataQuality.LOW);
        if (node.hasNonNull("qualityGrade")) {
            builder.qualityGrade(QualityGrade.parse(node.get("qualityGrade").asText()));
        }
        if (node.hasNonNull("recordedAt")) {
            builder.recordedAt(Instant.parse(node.get("recordedAt").asText()));
        }
        for (JsonNode point : node.path("history")) {
            builder.historyPoint(PricePoint.builder()
                    .date(LocalDate.parse(point.path("date").asText()))
                    .modalPrice(decimal(point.path("modalPrice")))
                    .build());
        }
        MarketSnapshot snapshot = builder.build();
        if (snapshot.getModalPrice() == null || snapshot.getModalPrice().signum() <= 0) {
            throw new IllegalArgumentException("modal price must be positive");
        }
        return snapshot;
    }

    private Optional<JsonNode> executeRequest(HttpUrl url) {
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .build();

        int retries = Math.max(1, config.getMaxRetries());
        for (int i = 0; i < retries; i++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.code() == 404) {
                    return Optional.empty();
                }
                if (!response.isSuccessful()) {
                    if ((response.code() == 429 || response.code() >= 500) && i < retries - 1) {
                        log.debug("Market data returned {} for {}, retrying", response.code(), url.encodedPath());
                        backoff(i + 1);
                        continue;
                    }
                    throw new MarketDataUnavailableException(
                            "Market data request failed: " + response.code() + " " + response.message());
                }
                ResponseBody body = response.body();
                if (body == null) {
                    return Optional.empty();
                }
                return Optional.of(objectMapper.readTree(body.string()));
            } catch (IOException e) {
                if (i == retries - 1) {
                    throw new MarketDataUnavailableException("Failed to call market data after retries: " + url, e);
                }
                log.debug("Transient failure calling {}: {}", url.encodedPath(), e.getMessage());
                backoff(1);
            }
        }
        throw new MarketDataUnavailableException("Market data request not attempted: " + url);
    }

    private void backoff(int attempt) {
        try {
            Thread.sleep(config.getRetryBackoff().toMillis() * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataUnavailableException("Interrupted while waiting to retry market data", e);
        }
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.asText();
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return new BigDecimal(node.asText());
    }
}
