package com.marketdesk.jobs.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketdesk.jobs.config.MarketDataProperties;
import com.marketdesk.jobs.config.RedisConfig;
import com.marketdesk.jobs.domain.SecCompanyTicker;
import com.marketdesk.jobs.domain.TickerDetails;
import com.marketdesk.jobs.domain.TickerListing;
import com.marketdesk.jobs.exception.MarketDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Market-data provider backed by the Polygon.io REST API and the SEC ticker file.
 */
@Component
@Slf4j
public class PolygonMarketDataClient implements MarketDataProvider {

    private static final String TICKERS_ENDPOINT = "/v3/reference/tickers";
    private static final String DETAILS_ENDPOINT = "/v3/reference/tickers/{ticker}";
    private static final String AGGS_ENDPOINT = "/v2/aggs/ticker/{ticker}/range/1/day/{from}/{to}";

    private final RestClient restClient;
    private final MarketDataProperties properties;
    private final Clock clock;

    public PolygonMarketDataClient(RestClient.Builder restClientBuilder, MarketDataProperties properties, Clock clock) {
        this.restClient = restClientBuilder.baseUrl(properties.getPolygon().getBaseUrl()).build();
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Whether the listing for a date can no longer change. Today's list still moves during the session.
     */
    public boolean isSettled(LocalDate date) {
        return date.isBefore(LocalDate.now(clock));
    }

    @Override
    @Cacheable(cacheNames = RedisConfig.TICKER_SNAPSHOT_CACHE, key = "#date.toString()",
            condition = "#root.target.isSettled(#date)")
    public List<TickerListing> fetchActiveTickers(LocalDate date) {
        MarketDataProperties.Polygon polygon = properties.getPolygon();
        List<TickerListing> listings = new ArrayList<>();

        URI next = UriComponentsBuilder.fromUriString(polygon.getBaseUrl() + TICKERS_ENDPOINT)
                .queryParam("market", "stocks")
                .queryParam("active", true)
                .queryParam("date", date)
                .queryParam("limit", polygon.getPageLimit())
                .queryParam("apiKey", polygon.getApiKey())
                .build()
                .toUri();

        int pages = 0;
        while (next != null) {
            JsonNode page = get(next, TICKERS_ENDPOINT + "?date=" + date);
            pages++;
            for (JsonNode result : page.path("results")) {
                listings.add(TickerListing.builder()
                        .ticker(result.path("ticker").asText())
                        .compositeFigi(result.path("composite_figi").asText(""))
                        .name(textOrNull(result, "name"))
                        .market(textOrNull(result, "market"))
                        .locale(textOrNull(result, "locale"))
                        .primaryExchange(textOrNull(result, "primary_exchange"))
                        .build());
            }
            String nextUrl = page.path("next_url").asText(null);
            next = nextUrl == null || nextUrl.isEmpty()
                    ? null
                    : UriComponentsBuilder.fromUriString(nextUrl)
                            .queryParam("apiKey", polygon.getApiKey())
                            .build(true)
                            .toUri();
        }

        log.debug("Fetched {} tickers for {} in {} pages", listings.size(), date, pages);
        return listings;
    }

    @Override
    public boolean hasDailyBars(String ticker, LocalDate from, LocalDate to) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getPolygon().getBaseUrl() + AGGS_ENDPOINT)
                .queryParam("adjusted", true)
                .queryParam("limit", 1)
                .queryParam("apiKey", properties.getPolygon().getApiKey())
                .buildAndExpand(Map.of("ticker", ticker, "from", from, "to", to))
                .encode()
                .toUri();

        JsonNode body = get(uri, "aggs " + ticker + " " + from + ".." + to);
        boolean exists = body.path("resultsCount").asInt(0) > 0 || body.path("results").size() > 0;
        log.debug("Daily bars for {} between {} and {}: {}", ticker, from, to, exists);
        return exists;
    }

    @Override
    @Cacheable(cacheNames = RedisConfig.SEC_TICKERS_CACHE, key = "'all'")
    public List<SecCompanyTicker> fetchSecCompanyTickers() {
        MarketDataProperties.Sec sec = properties.getSec();
        JsonNode body;
        try {
            body = restClient.get()
                    .uri(URI.create(sec.getCompanyTickersUrl()))
                    .header(HttpHeaders.USER_AGENT, sec.getUserAgent())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new MarketDataException("sec company tickers", e.getMessage(), e);
        }
        if (body == null) {
            throw new MarketDataException("sec company tickers", "empty response");
        }

        List<SecCompanyTicker> tickers = new ArrayList<>();
        Iterator<JsonNode> entries = body.elements();
        while (entries.hasNext()) {
            JsonNode entry = entries.next();
            tickers.add(SecCompanyTicker.builder()
                    .cik(entry.path("cik_str").asLong())
                    .ticker(entry.path("ticker").asText())
                    .title(entry.path("title").asText())
                    .build());
        }
        log.debug("Fetched {} SEC company tickers", tickers.size());
        return tickers;
    }

    @Override
    public Optional<TickerDetails> fetchTickerDetails(String ticker) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getPolygon().getBaseUrl() + DETAILS_ENDPOINT)
                .queryParam("apiKey", properties.getPolygon().getApiKey())
                .buildAndExpand(Map.of("ticker", ticker))
                .encode()
                .toUri();

        JsonNode result;
        try {
            result = get(uri, "details " + ticker).path("results");
        } catch (MarketDataException e) {
            if (e.getCause() instanceof HttpClientErrorException.NotFound) {
                log.debug("No details for {}", ticker);
                return Optional.empty();
            }
            throw e;
        }
        if (result.isMissingNode() || result.isNull()) {
            return Optional.empty();
        }

        JsonNode branding = result.path("branding");
        return Optional.of(TickerDetails.builder()
                .ticker(ticker)
                .name(textOrNull(result, "name"))
                .market(textOrNull(result, "market"))
                .locale(textOrNull(result, "locale"))
                .primaryExchange(textOrNull(result, "primary_exchange"))
                .active(result.hasNonNull("active") ? result.get("active").asBoolean() : null)
                .marketCap(result.hasNonNull("market_cap") ? result.get("market_cap").asLong() : null)
                .description(textOrNull(result, "description"))
                .logoUrl(textOrNull(branding, "logo_url"))
                .iconUrl(textOrNull(branding, "icon_url"))
                .build());
    }

    @Override
    public Optional<String> fetchBrandingImage(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        // Branding URLs are served by Polygon and need the key like any other call
        URI uri = UriComponentsBuilder.fromUriString(url)
                .queryParam("apiKey", properties.getPolygon().getApiKey())
                .build()
                .toUri();

        ResponseEntity<byte[]> response;
        try {
            response = restClient.get().uri(uri).retrieve().toEntity(byte[].class);
        } catch (RestClientException e) {
            throw new MarketDataException("branding " + url, e.getMessage(), e);
        }
        byte[] image = response.getBody();
        if (image == null || image.length == 0) {
            throw new MarketDataException("branding " + url, "empty image");
        }

        MediaType contentType = response.getHeaders().getContentType();
        String type = contentType == null || MediaType.APPLICATION_OCTET_STREAM.includes(contentType)
                ? guessImageType(url)
                : contentType.getType() + "/" + contentType.getSubtype();
        return Optional.of("data:" + type + ";base64," + Base64.getEncoder().encodeToString(image));
    }

    private static String guessImageType(String url) {
        String path = URI.create(url).getPath().toLowerCase(Locale.ROOT);
        if (path.endsWith(".svg")) {
            return "image/svg+xml";
        }
        if (path.endsWith(".png")) {
            return "image/png";
        }
        return "image/jpeg";
    }

    private JsonNode get(URI uri, String endpoint) {
        try {
            JsonNode body = restClient.get().uri(uri).retrieve().body(JsonNode.class);
            if (body == null) {
                throw new MarketDataException(endpoint, "empty response");
            }
            return body;
        } catch (RestClientException e) {
            throw new MarketDataException(endpoint, e.getMessage(), e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
