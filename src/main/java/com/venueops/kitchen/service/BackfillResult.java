package com.venueops.kitchen.service;

/**
 * @param scanned        orders found without tickets
 * @param processed      orders routed without error
 * @param ticketsCreated tickets inserted across all processed orders
 * @param failed         orders whose routing threw; retried on the next run
 */
public record BackfillResult(int scanned, int processed, int ticketsCreated, int failed) {

    public static final BackfillResult EMPTY = new BackfillResult(0, 0, 0, 0);

    public BackfillResult plus(BackfillResult other) {
        return new BackfillResult(
                scanned + other.scanned,
                processed + other.processed,
                ticketsCreated + other.ticketsCreated,
                failed + other.failed);
    }
}
