package org.operaton.nostrpub.model.bridge;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything the translator needs to turn a native event into an activity, resolved up front
 * so translation itself performs no I/O.
 */
@Value
@Builder
public class OutboundContext {

    /** Actor URI of the event author. */
    String actorUri;

    String followersUri;

    /** Event ids referenced by the event, mapped to their fediverse objects. Unknown ids are absent. */
    @Builder.Default
    Map<String, ObjectRef> objects = Map.of();

    /** Mentioned keys (hex), mapped to their fediverse actors. Unknown keys are absent. */
    @Builder.Default
    Map<String, MentionTarget> mentions = Map.of();
}
