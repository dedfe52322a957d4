package org.operaton.nostrpub.model.bridge;

import lombok.Value;

/**
 * A fediverse object a native event points at, with the actor it belongs to.
 */
@Value
public class ObjectRef {

    String objectId;

    /** Actor URI of the object's author, may be null if unknown. */
    String authorUri;

    /** Native kind the object corresponds to: 1 for notes, 6 for announces, 7 for likes. */
    int kind;
}
