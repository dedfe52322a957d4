package org.operaton.nostrpub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.model.activitypub.Actor;
import org.operaton.nostrpub.model.activitypub.OrderedCollection;
import org.operaton.nostrpub.model.activitypub.WebFingerResponse;
import org.operaton.nostrpub.model.entity.NoteMapping;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.store.BridgeStore;
import org.operaton.nostrpub.util.ActivityJson;
import org.operaton.nostrpub.util.Bech32;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the bridge's fediverse presence: actor documents, collections, notes and WebFinger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActorDirectory {

    private final IdentityMapper identityMapper;
    private final BridgeStore store;
    private final BridgeCache cache;
    private final BridgeUris uris;

    /**
     * Actor document of a key. Looking an actor up materializes it, so remote servers can follow any key.
     *
     * @param npub the key as {@code npub1...}
     * @return empty if the value is no valid key
     */
    public Optional<Actor> actor(String npub) {
        return parse(npub).map(identity -> {
            VirtualActor actor = identityMapper.resolveOrCreate(identity);
            return Actor.fromVirtualActor(actor, uris.sharedInbox(), "nostr:" + identity.npub());
        });
    }

    public Optional<OrderedCollection> followers(String npub) {
        return parse(npub).map(identity -> OrderedCollection.countOnly(
            uris.actorUri(identity) + "/followers", identityMapper.federatedFollowerCount(identity)));
    }

    public Optional<OrderedCollection> outbox(String npub) {
        return parse(npub).map(identity -> OrderedCollection.empty(uris.actorUri(identity) + "/outbox"));
    }

    /**
     * Minimal note for a bridged native event, pointing at the event itself.
     *
     * @param noteId the event id as {@code note1...}
     * @return empty if the event is unknown to the bridge
     */
    public Optional<Map<String, Object>> note(String noteId) {
        String noteUri = uris.baseUrl() + "/notes/" + noteId;
        Optional<String> eventId = uris.parseNoteUri(noteUri);
        if (eventId.isEmpty()) {
            return Optional.empty();
        }
        Optional<NostrEvent> event = cache.recentEvent(eventId.get());
        Optional<NoteMapping> mapping = store.findNoteByEventId(eventId.get());
        if (event.isEmpty() && mapping.isEmpty()) {
            return Optional.empty();
        }
        String author = event.map(NostrEvent::getPubkey).orElseGet(() -> mapping.get().getAuthorPubkey());

        Map<String, Object> note = new LinkedHashMap<>();
        note.put("@context", "https://www.w3.org/ns/activitystreams");
        note.put("id", noteUri);
        note.put("type", "Note");
        note.put("attributedTo", uris.actorUri(NativeIdentity.fromHex(author)));
        note.put("url", "nostr:" + Bech32.encode("note", Bech32.fromHex(eventId.get())));
        note.put("to", List.of(ActivityJson.PUBLIC));
        event.ifPresent(e -> {
            note.put("content", e.getContent());
            note.put("published", Instant.ofEpochSecond(e.getCreatedAt()).toString());
        });
        return Optional.of(note);
    }

    /**
     * WebFinger lookup for {@code acct:npub1...@domain}.
     *
     * @return empty if the resource names no key on this bridge
     */
    public Optional<WebFingerResponse> webFinger(String resource) {
        if (resource == null || !resource.startsWith("acct:")) {
            return Optional.empty();
        }
        String[] parts = resource.substring("acct:".length()).split("@");
        if (parts.length != 2 || !parts[1].equalsIgnoreCase(uris.domain())) {
            log.debug("WebFinger request for foreign resource {}", resource);
            return Optional.empty();
        }
        return parse(parts[0]).map(identity ->
            WebFingerResponse.forNpub(identity.npub(), uris.domain(), uris.actorUri(identity)));
    }

    private static Optional<NativeIdentity> parse(String npub) {
        try {
            return Optional.of(NativeIdentity.fromBech32(npub));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
