package com.marketdesk.jobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Endpoints and credentials of the upstream market-data sources.
 */
@Data
@ConfigurationProperties(prefix = "market-data")
public class MarketDataProperties {

    private final Polygon polygon = new Polygon();
    private final Sec sec = new Sec();

    @Data
    public static class Polygon {
        private String baseUrl = "https://api.polygon.io";
        private String apiKey = "";
        private int pageLimit = 1000;
        // Pause between securities in the details job, about ten lookups a second
        private Duration detailsRequestInterval = Duration.ofMillis(100);
    }

    @Data
    public static class Sec {
        private String companyTickersUrl = "https://www.sec.gov/files/company_tickers.json";
        private String userAgent = "market-jobs admin@example.com";
    }
}
