package com.venueops.payment.service;

public enum WebhookOutcome {
    /** The new status was recorded and applied to the order. */
    APPLIED,
    /** The intent already had this status and the order already reflects it; nothing changed. */
    DUPLICATE,
    /** Recorded on the intent, but the order could not take the change (e.g. it was cancelled). */
    IGNORED
}
