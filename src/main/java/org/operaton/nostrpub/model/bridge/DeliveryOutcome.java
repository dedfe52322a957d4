package org.operaton.nostrpub.model.bridge;

/**
 * Terminal state of one (activity, inbox) delivery.
 */
public enum DeliveryOutcome {
    /** The inbox answered 2xx */
    DELIVERED,
    /** Every attempt failed; the activity was dropped */
    EXHAUSTED,
    /** The bridge shut down before the delivery finished */
    CANCELLED
}
