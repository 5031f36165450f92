package com.venueops.common.access;

/**
 * Capability granted by the access-control layer for one call.
 * SCOPED callers act on a single venue; ELEVATED is reserved for system jobs that
 * sweep several venues.
 */
public enum AccessLevel {
    SCOPED,
    ELEVATED
}
