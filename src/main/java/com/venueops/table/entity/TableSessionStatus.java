package com.venueops.table.entity;

public enum TableSessionStatus {
    FREE,
    OCCUPIED,
    RESERVED,
    CLEANING,
    MERGED,
    SERVED,
    CLOSED
}
