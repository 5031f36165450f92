package com.venueops.common.access;

/**
 * Headers set by the access-control layer in front of this service.
 */
public final class VenueHeaders {

    public static final String VENUE_ID = "X-Venue-Id";
    public static final String ACCESS_LEVEL = "X-Access-Level";

    private VenueHeaders() {
    }
}
