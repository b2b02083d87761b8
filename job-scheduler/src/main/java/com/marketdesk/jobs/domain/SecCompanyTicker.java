package com.marketdesk.jobs.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the SEC company tickers file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SecCompanyTicker {

    private long cik;
    private String ticker;
    private String title;
}
