package org.operaton.nostrpub.model.bridge;

import lombok.Value;

/**
 * Answer of one relay to a published event.
 */
@Value
public class PublishResult {

    String relayUrl;
    boolean accepted;
    String message;

    public static PublishResult accepted(String relayUrl, String message) {
        return new PublishResult(relayUrl, true, message);
    }

    public static PublishResult rejected(String relayUrl, String message) {
        return new PublishResult(relayUrl, false, message);
    }
}
