package org.operaton.nostrpub.model.nostr;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of Nostr event kinds the bridge translates.
 * Anything else is ignored at the relay boundary.
 */
public enum EventKind {
    /** NIP-01 profile metadata. */
    METADATA(0),
    /** NIP-01 short text note. */
    NOTE(1),
    /** NIP-02 follow list. */
    FOLLOW_LIST(3),
    /** NIP-09 deletion request. */
    DELETION(5),
    /** NIP-18 repost. */
    REPOST(6),
    /** NIP-25 reaction. */
    REACTION(7);

    private final int code;

    EventKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static Optional<EventKind> fromCode(int code) {
        return Arrays.stream(values())
            .filter(kind -> kind.code == code)
            .findFirst();
    }
}
