package org.operaton.nostrpub.relay;

/**
 * Connection state of one relay.
 * {@code DISCONNECTED -> CONNECTING -> SUBSCRIBED <-> DEGRADED -> DISCONNECTED}
 */
public enum RelayState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    /** Socket open, but the relay reported errors or rejected a publication */
    DEGRADED
}
