package com.venueops.table.service;

public enum ReleaseOutcome {
    /** The table's session was closed as FREE. */
    RELEASED,
    /** Another active order still holds the table. */
    STILL_OCCUPIED,
    /** The order has no table, or the table no longer exists. */
    NO_TABLE,
    /** The table was not occupied: already free, reserved, cleaning or merged. */
    NOT_OCCUPIED
}
