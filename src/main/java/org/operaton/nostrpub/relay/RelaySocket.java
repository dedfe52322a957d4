package org.operaton.nostrpub.relay;

import java.util.concurrent.CompletableFuture;

/**
 * An open connection to a relay.
 */
public interface RelaySocket {

    /**
     * Sends one text frame. Frames are sent in call order.
     */
    CompletableFuture<Void> send(String text);

    void close();
}
