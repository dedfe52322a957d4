package org.operaton.nostrpub.model.nostr;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A signed Nostr event as defined by NIP-01.
 *
 * Spec: https://github.com/nostr-protocol/nips/blob/master/01.md
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NostrEvent {

    /** Lowercase hex SHA-256 of the serialized event. */
    private String id;

    /** Lowercase hex x-only public key of the author. */
    private String pubkey;

    @JsonProperty("created_at")
    private long createdAt;

    private int kind;

    @Builder.Default
    private List<List<String>> tags = new ArrayList<>();

    @Builder.Default
    private String content = "";

    /** Hex BIP-340 Schnorr signature over the id. */
    private String sig;

    /**
     * All tags with the given name, e.g. {@code "e"} or {@code "p"}.
     */
    public List<List<String>> tags(String name) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
            .filter(tag -> !tag.isEmpty() && name.equals(tag.get(0)))
            .collect(Collectors.toList());
    }

    /**
     * Second element of the first tag with the given name.
     */
    public Optional<String> firstTagValue(String name) {
        return tags(name).stream()
            .filter(tag -> tag.size() > 1)
            .map(tag -> tag.get(1))
            .findFirst();
    }

    /**
     * Second elements of every tag with the given name.
     */
    public List<String> tagValues(String name) {
        return tags(name).stream()
            .filter(tag -> tag.size() > 1)
            .map(tag -> tag.get(1))
            .collect(Collectors.toList());
    }

    @JsonIgnore
    public Optional<EventKind> getEventKind() {
        return EventKind.fromCode(kind);
    }

    /**
     * Whether this event was produced by a bridge from an ActivityPub object (NIP-48 proxy tag).
     */
    @JsonIgnore
    public boolean isProxiedFromActivityPub() {
        return tags("proxy").stream()
            .anyMatch(tag -> tag.size() > 2 && "activitypub".equals(tag.get(2)));
    }
}
