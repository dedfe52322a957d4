package org.operaton.nostrpub.model.bridge;

import lombok.Value;

/**
 * How a mentioned key appears on the fediverse.
 */
@Value
public class MentionTarget {

    String actorUri;

    /** Handle such as {@code @alice@mastodon.social}. */
    String handle;
}
