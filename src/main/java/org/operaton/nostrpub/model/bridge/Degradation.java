package org.operaton.nostrpub.model.bridge;

import lombok.Value;

/**
 * A lossy step taken while translating: the result is still usable but lost part of its meaning.
 */
@Value
public class Degradation {

    Reason reason;
    String detail;

    public enum Reason {
        /** Reply target unknown; bridged as a top-level post */
        MISSING_PARENT,
        /** Reply chain cut at a cycle, the depth limit or a failed fetch */
        REPLY_CHAIN_ABANDONED,
        /** Mention whose target could not be resolved; text kept, tag dropped */
        UNRESOLVED_MENTION,
        /** Reaction, repost or deletion target not bridged */
        MISSING_TARGET,
        /** Attachment type without counterpart; kept as a plain link */
        UNSUPPORTED_MEDIA
    }

    public static Degradation of(Reason reason, String detail) {
        return new Degradation(reason, detail);
    }
}
