package com.marketdesk.jobs.infrastructure;

import com.marketdesk.jobs.domain.SecCompanyTicker;
import com.marketdesk.jobs.domain.TickerDetails;
import com.marketdesk.jobs.domain.TickerListing;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Upstream source of exchange listings, daily bars and SEC identifiers.
 */
public interface MarketDataProvider {

    /**
     * All tickers the exchange reported as active on the given date.
     *
     * @throws com.marketdesk.jobs.exception.MarketDataException if the listing cannot be fetched
     */
    List<TickerListing> fetchActiveTickers(LocalDate date);

    /**
     * Whether at least one daily bar exists for the ticker in [from, to].
     *
     * @throws com.marketdesk.jobs.exception.MarketDataException if the bars cannot be queried
     */
    boolean hasDailyBars(String ticker, LocalDate from, LocalDate to);

    /**
     * The SEC mapping of tickers to CIK numbers.
     */
    List<SecCompanyTicker> fetchSecCompanyTickers();

    /**
     * Current reference data for a ticker, empty when the provider does not know it.
     *
     * @throws com.marketdesk.jobs.exception.MarketDataException if the lookup fails
     */
    Optional<TickerDetails> fetchTickerDetails(String ticker);

    /**
     * Download a branding image as a {@code data:} URI, empty when the URL is blank.
     *
     * @throws com.marketdesk.jobs.exception.MarketDataException if the download fails
     */
    Optional<String> fetchBrandingImage(String url);
}
