package com.marketdesk.jobs.domain;

import lombok.Value;

/**
 * A ticker listed on both days whose composite FIGI changed.
 */
@Value
public class FigiChange {

    String ticker;
    String previousFigi;
    String newFigi;
}
