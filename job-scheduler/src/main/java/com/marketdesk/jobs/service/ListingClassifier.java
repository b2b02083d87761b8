package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.ListingAction;
import com.marketdesk.jobs.domain.ListingDecision;
import com.marketdesk.jobs.domain.Security;
import com.marketdesk.jobs.domain.TickerListing;
import com.marketdesk.jobs.infrastructure.MarketDataProvider;
import com.marketdesk.jobs.repository.SecurityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Decides what a newly appeared ticker means for the securities table.
 * Tickers with a FIGI are matched by FIGI lineage; tickers without one by ticker alone.
 * A gap since the last close is treated as a false delisting when the ticker kept trading.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListingClassifier {

    private final SecurityRepository securityRepository;
    private final MarketDataProvider marketDataProvider;

    /**
     * Classify one addition seen on the given date.
     *
     * @param listing the ticker present today but not yesterday
     * @param date    the reconciliation date
     * @return the actions to apply and the row they apply to
     */
    public ListingDecision classify(TickerListing listing, LocalDate date) {
        return listing.hasFigi() ? classifyByFigi(listing, date) : classifyByTicker(listing, date);
    }

    private ListingDecision classifyByFigi(TickerListing listing, LocalDate date) {
        List<Security> history = securityRepository.findFigiHistory(listing.getCompositeFigi());
        if (history.isEmpty()) {
            return classifyUnknownFigi(listing, date);
        }

        Security latest = history.get(0);
        if (latest.getTicker().equals(listing.getTicker())) {
            if (latest.isListed()) {
                return ListingDecision.duplicate(listing, latest);
            }
            return ListingDecision.builder()
                    .listing(listing)
                    .action(ListingAction.FALSE_DELIST)
                    .target(latest)
                    .build();
        }

        boolean usedBefore = history.stream()
                .skip(1)
                .anyMatch(row -> row.getTicker().equals(listing.getTicker()));
        if (usedBefore) {
            return ListingDecision.duplicate(listing, latest);
        }

        ListingDecision.ListingDecisionBuilder decision = ListingDecision.builder()
                .listing(listing)
                .action(ListingAction.TICKER_CHANGE)
                .target(latest);
        if (!latest.isListed() && tradedSinceClose(latest.getTicker(), latest.getMaxDate(), date)) {
            decision.action(ListingAction.FALSE_DELIST);
        }
        return decision.build();
    }

    private ListingDecision classifyUnknownFigi(TickerListing listing, LocalDate date) {
        Security prior = latestForTicker(listing.getTicker());
        if (prior == null) {
            return ListingDecision.newListing(listing);
        }
        if (prior.isListed()) {
            return ListingDecision.builder()
                    .listing(listing)
                    .action(ListingAction.FIGI_CHANGE)
                    .target(prior)
                    .build();
        }
        if (tradedSinceClose(listing.getTicker(), prior.getMaxDate(), date)) {
            return ListingDecision.builder()
                    .listing(listing)
                    .action(ListingAction.FALSE_DELIST)
                    .action(ListingAction.FIGI_CHANGE)
                    .target(prior)
                    .build();
        }
        return ListingDecision.newListing(listing);
    }

    private ListingDecision classifyByTicker(TickerListing listing, LocalDate date) {
        Security prior = latestForTicker(listing.getTicker());
        if (prior == null) {
            return ListingDecision.newListing(listing);
        }
        if (prior.isListed()) {
            return ListingDecision.duplicate(listing, prior);
        }
        if (tradedSinceClose(listing.getTicker(), prior.getMaxDate(), date)) {
            return ListingDecision.builder()
                    .listing(listing)
                    .action(ListingAction.FALSE_DELIST)
                    .target(prior)
                    .build();
        }
        return ListingDecision.newListing(listing);
    }

    private Security latestForTicker(String ticker) {
        List<Security> history = securityRepository.findTickerHistory(ticker);
        return history.isEmpty() ? null : history.get(0);
    }

    /**
     * Whether the ticker has daily bars between the day after its last listed date and
     * the day before the date being reconciled. An empty gap counts as continuous.
     */
    boolean tradedSinceClose(String ticker, LocalDate closedOn, LocalDate date) {
        LocalDate from = closedOn.plusDays(1);
        LocalDate to = date.minusDays(1);
        if (from.isAfter(to)) {
            return true;
        }
        return marketDataProvider.hasDailyBars(ticker, from, to);
    }
}
