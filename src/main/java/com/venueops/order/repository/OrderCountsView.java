package com.venueops.order.repository;

/**
 * Row returned by {@link OrderRepository#aggregateCounts}. Numeric types vary by database,
 * so every column is read as a {@link Number}.
 */
public interface OrderCountsView {

    Number getLive();

    Number getEarlierToday();

    Number getHistory();

    Number getToday();

    Number getUnpaid();

    Number getRevenue();

    Number getPaidRevenue();
}
