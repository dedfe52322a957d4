package org.operaton.nostrpub.model.bridge;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A native event another object points at: a reply parent, a reaction or repost target, a quote.
 */
@Value
@Builder
public class EventRef {

    String eventId;
    String authorPubkey;

    /** Thread root of the referenced event, null when it is a root itself. */
    String rootEventId;

    /** Keys the referenced event tags with {@code p}; replies inherit them. */
    @Builder.Default
    List<String> mentionedPubkeys = List.of();

    /** Kind of the referenced event. */
    @Builder.Default
    int kind = 1;
}
