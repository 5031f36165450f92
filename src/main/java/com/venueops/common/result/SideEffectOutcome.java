package com.venueops.common.result;

/**
 * Result of one best-effort follow-up action (ticket seeding, table release, receipt).
 * A failed side effect never fails the primary operation; it is reported here instead.
 */
public record SideEffectOutcome(String name, boolean succeeded, String detail) {

    public static SideEffectOutcome success(String name, String detail) {
        return new SideEffectOutcome(name, true, detail);
    }

    public static SideEffectOutcome failure(String name, String detail) {
        return new SideEffectOutcome(name, false, detail);
    }
}
