package org.operaton.nostrpub.relay;

import java.util.concurrent.CompletableFuture;

/**
 * Opens relay connections. Replaced by an in-memory fake in tests.
 */
public interface RelayTransport {

    /**
     * Connects to a relay.
     *
     * @param url WebSocket URL of the relay
     * @param listener receives the relay's messages until the socket is closed
     * @return completes with the open socket, or exceptionally if the connection fails
     */
    CompletableFuture<RelaySocket> connect(String url, RelayListener listener);
}
