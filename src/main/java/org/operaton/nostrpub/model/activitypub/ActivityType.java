package org.operaton.nostrpub.model.activitypub;

import java.util.Arrays;
import java.util.Optional;

/**
 * Inbound activity types the bridge acts on. Anything else is acknowledged and ignored.
 */
public enum ActivityType {
    CREATE("Create"),
    LIKE("Like"),
    EMOJI_REACT("EmojiReact"),
    ANNOUNCE("Announce"),
    FOLLOW("Follow"),
    UNDO("Undo"),
    DELETE("Delete"),
    UPDATE("Update"),
    ACCEPT("Accept"),
    REJECT("Reject");

    private final String value;

    ActivityType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ActivityType> fromValue(Object type) {
        return Arrays.stream(values())
            .filter(t -> t.value.equals(type))
            .findFirst();
    }
}
