package com.marketdesk.jobs.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Descriptive reference data for one ticker, with links to its branding images.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TickerDetails {

    private String ticker;
    private String name;
    private String market;
    private String locale;
    private String primaryExchange;
    private Boolean active;
    private Long marketCap;
    private String description;
    private String logoUrl;
    private String iconUrl;
}
