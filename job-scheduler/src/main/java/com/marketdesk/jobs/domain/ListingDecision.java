package com.marketdesk.jobs.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Classification of one added ticker.
 * target is the existing row the actions apply to; for a ticker change it is the
 * predecessor row of the FIGI lineage. It is null for new listings.
 */
@Value
@Builder
public class ListingDecision {

    TickerListing listing;
    @Singular
    Set<ListingAction> actions;
    Security target;

    public boolean has(ListingAction action) {
        return actions.contains(action);
    }

    public String describe() {
        return actions.stream().map(Enum::name).sorted().reduce((a, b) -> a + "+" + b).orElse("NONE");
    }

    public static ListingDecision newListing(TickerListing listing) {
        return ListingDecision.builder().listing(listing).action(ListingAction.NEW_LISTING).build();
    }

    public static ListingDecision duplicate(TickerListing listing, Security target) {
        return ListingDecision.builder().listing(listing).action(ListingAction.DUPLICATE_LISTING)
                .target(target).build();
    }
}
