package org.operaton.nostrpub.model.bridge;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything the translator needs to turn a fediverse object into a native event, resolved up front.
 */
@Value
@Builder
public class InboundContext {

    /** Reply parent, null if the object is no reply or the parent could not be bridged. */
    EventRef parent;

    /** Quoted event, null if none. */
    EventRef quote;

    /** Fallback {@code created_at} when the object carries no usable {@code published} date. */
    long receivedAt;

    /** Actor URIs and profile URLs of mentioned accounts, mapped to their native keys (hex). */
    @Builder.Default
    Map<String, String> mentionKeys = Map.of();
}
