package org.operaton.nostrpub.model.bridge;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Map;

/**
 * A raw POST to one of the bridge's inboxes, captured before any parsing.
 */
@Value
@Builder
public class InboundRequest {

    String method;

    /** Path and query exactly as received, e.g. {@code /users/npub1.../inbox}. */
    String path;

    /** Header values keyed by lowercase header name. */
    Map<String, String> headers;

    byte[] body;

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * The {@code (request-target)} pseudo header of HTTP signatures.
     */
    public String requestTarget() {
        return method.toLowerCase(Locale.ROOT) + " " + path;
    }
}
