package com.venueops.table.service;

/**
 * How an order points at its table: by row id, by the number printed on the table, or both.
 */
public record TableRef(Long tableId, Integer tableNumber) {

    public static TableRef of(Long tableId, Integer tableNumber) {
        return new TableRef(tableId, tableNumber);
    }

    public boolean isEmpty() {
        return tableId == null && tableNumber == null;
    }
}
