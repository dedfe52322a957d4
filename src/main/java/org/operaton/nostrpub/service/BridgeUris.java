package org.operaton.nostrpub.service;

import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.util.Bech32;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * The URIs the bridge mints for native keys and events.
 * Pure functions of the key or event id and the configured base URL, so they never disagree between calls.
 */
@Component
public class BridgeUris {

    private final String baseUrl;
    private final String domain;
    private final String reverseDomain;

    public BridgeUris(NostrPubProperties properties) {
        this.baseUrl = properties.getBaseUrl();
        this.domain = properties.getDomain();
        String[] labels = domain.split("\\.");
        StringBuilder reversed = new StringBuilder();
        for (int i = labels.length - 1; i >= 0; i--) {
            reversed.append(labels[i]);
            if (i > 0) {
                reversed.append('.');
            }
        }
        this.reverseDomain = reversed.toString();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String domain() {
        return domain;
    }

    /**
     * Label namespace of bridged events (NIP-32), the bridge domain in reverse order.
     */
    public String labelNamespace() {
        return reverseDomain;
    }

    public String actorUri(NativeIdentity identity) {
        return baseUrl + "/users/" + identity.npub();
    }

    public String sharedInbox() {
        return baseUrl + "/inbox";
    }

    public String noteUri(String eventId) {
        return baseUrl + "/notes/" + Bech32.encode("note", Bech32.fromHex(eventId));
    }

    public String activityUri(String eventId) {
        return baseUrl + "/activities/" + eventId;
    }

    public String hashtagUri(String tag) {
        return baseUrl + "/tags/" + tag.toLowerCase(Locale.ROOT);
    }

    public boolean isLocal(String uri) {
        return uri != null && (uri.equals(baseUrl) || uri.startsWith(baseUrl + "/"));
    }

    /**
     * Decodes {@code {base}/users/{npub}} back to its key without any I/O.
     */
    public Optional<NativeIdentity> parseActorUri(String uri) {
        String prefix = baseUrl + "/users/";
        if (uri == null || !uri.startsWith(prefix)) {
            return Optional.empty();
        }
        String rest = uri.substring(prefix.length());
        int end = indexOfAny(rest, '/', '#', '?');
        try {
            return Optional.of(NativeIdentity.fromBech32(end < 0 ? rest : rest.substring(0, end)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Decodes {@code {base}/notes/{note1...}} back to the hex event id.
     */
    public Optional<String> parseNoteUri(String uri) {
        String prefix = baseUrl + "/notes/";
        if (uri == null || !uri.startsWith(prefix)) {
            return Optional.empty();
        }
        String rest = uri.substring(prefix.length());
        int end = indexOfAny(rest, '/', '#', '?');
        try {
            Bech32.Decoded decoded = Bech32.decode(end < 0 ? rest : rest.substring(0, end));
            if (!"note".equals(decoded.getHrp()) || decoded.getData().length != 32) {
                return Optional.empty();
            }
            return Optional.of(Bech32.toHex(decoded.getData()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static int indexOfAny(String value, char... chars) {
        int result = -1;
        for (char c : chars) {
            int index = value.indexOf(c);
            if (index >= 0 && (result < 0 || index < result)) {
                result = index;
            }
        }
        return result;
    }
}
