package com.marketdesk.jobs.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A ticker as reported active by the market-data provider on one day.
 * compositeFigi may be empty when the provider has none for the ticker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TickerListing {

    private String ticker;

    @Builder.Default
    private String compositeFigi = "";

    private String name;
    private String market;
    private String locale;
    private String primaryExchange;

    public static TickerListing of(String ticker, String compositeFigi) {
        return TickerListing.builder()
                .ticker(ticker)
                .compositeFigi(compositeFigi == null ? "" : compositeFigi)
                .build();
    }

    public boolean hasFigi() {
        return compositeFigi != null && !compositeFigi.isEmpty();
    }
}
