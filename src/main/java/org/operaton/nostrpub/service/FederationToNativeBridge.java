package org.operaton.nostrpub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.exception.TransportTransientException;
import org.operaton.nostrpub.model.activitypub.ActivityType;
import org.operaton.nostrpub.model.bridge.Degradation;
import org.operaton.nostrpub.model.bridge.EventRef;
import org.operaton.nostrpub.model.bridge.InboundContext;
import org.operaton.nostrpub.model.bridge.TranslationResult;
import org.operaton.nostrpub.model.entity.FollowerEntry;
import org.operaton.nostrpub.model.entity.NoteMapping;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.model.nostr.EventKind;
import org.operaton.nostrpub.model.nostr.Filter;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.relay.RelayPoolManager;
import org.operaton.nostrpub.security.NostrKeys;
import org.operaton.nostrpub.store.BridgeStore;
import org.operaton.nostrpub.util.ActivityJson;
import org.operaton.nostrpub.util.SingleFlight;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static org.operaton.nostrpub.util.ActivityJson.idOf;
import static org.operaton.nostrpub.util.ActivityJson.string;

/**
 * Bridges verified fediverse activities to native events signed with the sender's derived key.
 * Only called by {@link BridgeCoordinator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FederationToNativeBridge {

    private static final Set<String> NOTE_TYPES = Set.of("Note", "Article", "Page", "Question");

    private final IdentityMapper identityMapper;
    private final ContentTranslator translator;
    private final RelayPoolManager relayPool;
    private final RemoteActorResolver actorResolver;
    private final FederationDeliveryEngine deliveryEngine;
    private final NostrKeys nostrKeys;
    private final BridgeStore store;
    private final BridgeCache cache;
    private final BridgeUris uris;
    private final NostrPubProperties properties;
    private final Clock clock;

    private final SingleFlight<String, Optional<EventRef>> noteBridging = new SingleFlight<>();

    /**
     * Cheap checks that reject an activity before it is accepted for processing.
     *
     * @throws BridgeException if the activity can never be bridged
     */
    public void validate(InboxProcessor.VerifiedActivity verified) {
        Map<String, Object> activity = verified.getActivity();
        if (verified.getType().isEmpty()) {
            return;
        }
        switch (verified.getType().get()) {
            case FOLLOW -> {
                String followed = idOf(activity.get("object"));
                if (uris.parseActorUri(followed).isEmpty()) {
                    throw new BridgeException("Follow target is no bridge actor: " + followed);
                }
            }
            case CREATE -> {
                Map<String, Object> note = ActivityJson.asMap(activity.get("object"));
                if (note != null && string(note, "id") == null) {
                    throw new BridgeException("Created object has no id");
                }
                if (note != null && (uris.isLocal(string(note, "id")) || uris.isLocal(idOf(note.get("url"))))) {
                    throw new BridgeException("Note " + string(note, "id") + " already is a native event");
                }
            }
            default -> {
            }
        }
    }

    /**
     * Applies a verified activity.
     */
    public void bridge(InboxProcessor.VerifiedActivity verified) {
        RemoteIdentity actor = verified.getActor();
        Map<String, Object> activity = verified.getActivity();
        Optional<ActivityType> type = verified.getType();
        if (verified.isActorRefreshed() && type.filter(t -> t == ActivityType.UPDATE).isEmpty()) {
            publishProfile(actor);
        }
        if (type.isEmpty()) {
            log.debug("Ignoring {} from {}", string(activity, "type"), actor.getActorUri());
            return;
        }
        switch (type.get()) {
            case CREATE -> bridgeCreate(activity, actor);
            case LIKE, EMOJI_REACT -> bridgeReaction(activity, actor);
            case ANNOUNCE -> bridgeAnnounce(activity, actor);
            case FOLLOW -> bridgeFollow(activity, actor);
            case UNDO -> bridgeUndo(activity, actor);
            case DELETE -> bridgeDelete(activity, actor);
            case UPDATE -> bridgeUpdate(activity, actor);
            case ACCEPT -> log.info("{} accepted {}", actor.getActorUri(), idOf(activity.get("object")));
            case REJECT -> bridgeReject(activity, actor);
        }
    }

    private void bridgeCreate(Map<String, Object> activity, RemoteIdentity actor) {
        Map<String, Object> note = ActivityJson.asMap(activity.get("object"));
        if (note == null) {
            log.debug("Create {} carries no inline object", string(activity, "id"));
            return;
        }
        if (!NOTE_TYPES.contains(string(note, "type")) || string(note, "id") == null) {
            log.debug("Ignoring Create of {} {}", string(note, "type"), string(note, "id"));
            return;
        }
        if (!ActivityJson.isPublic(note)) {
            log.debug("Not bridging non-public note {}", string(note, "id"));
            return;
        }
        String author = idOf(note.get("attributedTo"));
        if (author == null || !ActivityJson.stripFragment(author).equals(actor.getActorUri())) {
            log.warn("Note {} is not attributed to its sender {}", string(note, "id"), actor.getActorUri());
            return;
        }
        bridgeThread(note);
    }

    /**
     * Bridges a note together with the ancestors nobody has bridged yet, oldest first.
     * The chain is cut at a cycle, the depth limit, a failed fetch or a non-public ancestor.
     */
    Optional<EventRef> bridgeThread(Map<String, Object> note) {
        List<Map<String, Object>> ancestors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(string(note, "id"));
        EventRef top = null;
        boolean abandoned = false;
        String parentId = idOf(note.get("inReplyTo"));
        int maxDepth = properties.getInbound().getMaxReplyDepth();

        while (parentId != null) {
            Optional<EventRef> known = eventRefOf(parentId);
            if (known.isPresent()) {
                top = known.get();
                break;
            }
            if (!visited.add(parentId) || ancestors.size() >= maxDepth || uris.isLocal(parentId)) {
                abandoned = true;
                break;
            }
            Optional<Map<String, Object>> fetched = fetchNote(parentId);
            if (fetched.isEmpty()) {
                abandoned = true;
                break;
            }
            ancestors.add(fetched.get());
            parentId = idOf(fetched.get().get("inReplyTo"));
        }

        if (abandoned) {
            log.warn("Reply chain of {} abandoned at {}: {}", string(note, "id"), parentId,
                Degradation.Reason.REPLY_CHAIN_ABANDONED);
        }
        EventRef parent = top;
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            parent = bridgeNote(ancestors.get(i), parent).orElse(null);
        }
        return bridgeNote(note, parent);
    }

    private Optional<EventRef> bridgeNote(Map<String, Object> note, EventRef parent) {
        String noteId = string(note, "id");
        return noteBridging.run(noteId, () -> {
            Optional<NoteMapping> existing = store.findNoteByApId(noteId);
            if (existing.isPresent()) {
                log.debug("Note {} already bridged as {}", noteId, existing.get().getEventId());
                return Optional.of(mappedRef(existing.get()));
            }
            String authorUri = ActivityJson.stripFragment(idOf(note.get("attributedTo")));
            if (isOptedOut(authorUri)) {
                log.debug("Not bridging note {} of opted-out {}", noteId, authorUri);
                return Optional.empty();
            }
            NativeIdentity author = identityMapper.resolveOrCreate(authorUri);

            InboundContext ctx = InboundContext.builder()
                .parent(parent)
                .quote(quoteOf(note).orElse(null))
                .receivedAt(clock.instant().getEpochSecond())
                .mentionKeys(mentionKeysOf(note))
                .build();
            TranslationResult<NostrEvent> result = translator.fromNote(note, ctx);
            logDegradations(noteId, result.getDegradations());
            if (result.isSkipped()) {
                return Optional.empty();
            }
            NostrEvent event = nostrKeys.signAs(authorUri, result.getValue().get());
            String root = parent == null ? null
                : (parent.getRootEventId() != null ? parent.getRootEventId() : parent.getEventId());

            store.saveNoteMapping(NoteMapping.builder()
                .apId(noteId)
                .eventId(event.getId())
                .authorPubkey(author.hex())
                .rootEventId(root)
                .kind(EventKind.NOTE.getCode())
                .build());
            publish(event);
            return Optional.of(EventRef.builder()
                .eventId(event.getId())
                .authorPubkey(author.hex())
                .rootEventId(root)
                .mentionedPubkeys(event.tagValues("p"))
                .build());
        });
    }

    private void bridgeReaction(Map<String, Object> activity, RemoteIdentity actor) {
        String activityId = string(activity, "id");
        if (activityId == null || isOptedOut(actor.getActorUri()) || store.findNoteByApId(activityId).isPresent()) {
            return;
        }
        Optional<EventRef> target = eventRefOf(idOf(activity.get("object")));
        if (target.isEmpty()) {
            log.debug("{}: {}", Degradation.Reason.MISSING_TARGET, idOf(activity.get("object")));
            return;
        }
        NostrEvent draft = translator.fromReaction(activity, target.get(), clock.instant().getEpochSecond());
        publishInteraction(activityId, draft, target.get(), actor);
    }

    private void bridgeAnnounce(Map<String, Object> activity, RemoteIdentity actor) {
        String activityId = string(activity, "id");
        if (activityId == null || isOptedOut(actor.getActorUri()) || store.findNoteByApId(activityId).isPresent()) {
            return;
        }
        if (!ActivityJson.isPublic(activity)) {
            log.debug("Not bridging non-public announce {}", activityId);
            return;
        }
        String objectId = idOf(activity.get("object"));
        Optional<EventRef> target = eventRefOf(objectId);
        if (target.isEmpty() && objectId != null && !uris.isLocal(objectId)) {
            target = fetchNote(objectId).flatMap(this::bridgeThread);
        }
        if (target.isEmpty()) {
            log.debug("{}: {}", Degradation.Reason.MISSING_TARGET, objectId);
            return;
        }
        NostrEvent draft = translator.fromAnnounce(activity, target.get(), clock.instant().getEpochSecond());
        publishInteraction(activityId, draft, target.get(), actor);
    }

    private void bridgeFollow(Map<String, Object> activity, RemoteIdentity actor) {
        Optional<NativeIdentity> followed = uris.parseActorUri(idOf(activity.get("object")));
        if (followed.isEmpty()) {
            return;
        }
        NativeIdentity follower = identityMapper.resolveOrCreate(actor.getActorUri());
        identityMapper.addFollower(followed.get(), follower, actor.getActorUri(), string(activity, "id"),
            FollowerEntry.Source.FEDERATION, clock.instant());

        VirtualActor virtualActor = identityMapper.resolveOrCreate(followed.get());
        String inbox = actor.getInboxUrl() != null ? actor.getInboxUrl() : actor.getDeliveryInbox();
        if (inbox != null) {
            deliveryEngine.deliver(translator.toAccept(virtualActor.getActorUri(), activity), virtualActor, inbox);
        }
        publishFollowList(actor, follower);
    }

    private void bridgeUndo(Map<String, Object> activity, RemoteIdentity actor) {
        Map<String, Object> undone = ActivityJson.asMap(activity.get("object"));
        String undoneId = idOf(activity.get("object"));
        String undoneType = string(undone, "type");
        NativeIdentity sender = identityMapper.resolveOrCreate(actor.getActorUri());

        if ("Follow".equals(undoneType)) {
            Optional<NativeIdentity> followed = uris.parseActorUri(idOf(undone.get("object")));
            if (followed.isPresent() && identityMapper.removeFollower(followed.get(), sender,
                FollowerEntry.Source.FEDERATION, clock.instant())) {
                publishFollowList(actor, sender);
            }
            return;
        }
        if (undoneId == null) {
            return;
        }
        Optional<NoteMapping> mapping = store.findNoteByApId(undoneId)
            .filter(m -> m.getKind() == EventKind.REACTION.getCode() || m.getKind() == EventKind.REPOST.getCode())
            .filter(m -> sender.hex().equals(m.getAuthorPubkey()));
        if (mapping.isEmpty()) {
            log.debug("Undo of unknown {} {}", undoneType, undoneId);
            return;
        }
        publishDeletion(activity, actor, mapping.get());
    }

    private void bridgeDelete(Map<String, Object> activity, RemoteIdentity actor) {
        String objectId = idOf(activity.get("object"));
        if (objectId == null) {
            return;
        }
        NativeIdentity sender = identityMapper.resolveOrCreate(actor.getActorUri());
        Optional<NoteMapping> mapping = store.findNoteByApId(objectId)
            .filter(m -> sender.hex().equals(m.getAuthorPubkey()));
        if (mapping.isEmpty()) {
            log.debug("Delete of unknown object {}", objectId);
            return;
        }
        publishDeletion(activity, actor, mapping.get());
    }

    private void bridgeUpdate(Map<String, Object> activity, RemoteIdentity actor) {
        Map<String, Object> object = ActivityJson.asMap(activity.get("object"));
        String objectId = idOf(activity.get("object"));
        if (object == null || objectId == null || !actor.getActorUri().equals(ActivityJson.stripFragment(objectId))) {
            log.debug("Ignoring update of {}", objectId);
            return;
        }
        cache.evictRemoteActor(actor.getActorUri());
        NostrEvent metadata = translator.fromActor(object, clock.instant().getEpochSecond());
        publish(nostrKeys.signAs(actor.getActorUri(), metadata));
        log.info("Updated profile of {}", actor.getActorUri());
    }

    private void bridgeReject(Map<String, Object> activity, RemoteIdentity actor) {
        Map<String, Object> follow = ActivityJson.asMap(activity.get("object"));
        if (follow == null || !"Follow".equals(string(follow, "type"))) {
            return;
        }
        Optional<NativeIdentity> follower = uris.parseActorUri(idOf(follow.get("actor")));
        if (follower.isEmpty()) {
            return;
        }
        NativeIdentity rejecting = identityMapper.resolveOrCreate(actor.getActorUri());
        if (identityMapper.removeFollower(rejecting, follower.get(), FollowerEntry.Source.FEDERATION, clock.instant())) {
            log.info("{} rejected follow from {}", actor.getActorUri(), follower.get().npub());
        }
    }

    private void publishInteraction(String activityId, NostrEvent draft, EventRef target, RemoteIdentity actor) {
        NativeIdentity author = identityMapper.resolveOrCreate(actor.getActorUri());
        NostrEvent event = nostrKeys.signAs(actor.getActorUri(), draft);
        store.saveNoteMapping(NoteMapping.builder()
            .apId(activityId)
            .eventId(event.getId())
            .authorPubkey(author.hex())
            .rootEventId(target.getEventId())
            .kind(event.getKind())
            .build());
        publish(event);
    }

    private void publishDeletion(Map<String, Object> activity, RemoteIdentity actor, NoteMapping mapping) {
        String activityId = string(activity, "id") != null ? string(activity, "id") : mapping.getApId() + "#delete";
        NostrEvent deletion = translator.deletion(activityId, List.of(mapping.getEventId()),
            clock.instant().getEpochSecond());
        publish(nostrKeys.signAs(actor.getActorUri(), deletion));
        log.info("Retracted event {} of {}", mapping.getEventId(), actor.getActorUri());
    }

    private void publishFollowList(RemoteIdentity actor, NativeIdentity follower) {
        List<FollowerEntry> following = identityMapper.following(follower);
        if (following.size() >= properties.getFollowListLimit()) {
            log.warn("Follow list of {} exceeds {} entries, not published", actor.getActorUri(),
                properties.getFollowListLimit());
            return;
        }
        List<NativeIdentity> keys = following.stream()
            .map(entry -> NativeIdentity.fromHex(entry.getFollowedPubkey()))
            .collect(Collectors.toList());
        publish(nostrKeys.signAs(actor.getActorUri(), translator.followList(keys, clock.instant().getEpochSecond())));
    }

    private void publishProfile(RemoteIdentity actor) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", actor.getActorUri());
        document.put("preferredUsername", actor.getPreferredUsername());
        document.put("name", actor.getDisplayName());
        document.put("summary", actor.getSummary());
        if (actor.getAvatarUrl() != null) {
            document.put("icon", Map.of("type", "Image", "url", actor.getAvatarUrl()));
        }
        publish(nostrKeys.signAs(actor.getActorUri(), translator.fromActor(document, clock.instant().getEpochSecond())));
    }

    private void publish(NostrEvent event) {
        cache.putRecentEvent(event);
        relayPool.publish(event).whenComplete((results, error) -> {
            if (error != null) {
                log.error("Publishing event {} failed", event.getId(), error);
            }
        });
    }

    /**
     * Native event behind a fediverse id: a bridge note URI or an object bridged earlier.
     */
    private Optional<EventRef> eventRefOf(String apId) {
        if (apId == null) {
            return Optional.empty();
        }
        Optional<String> localId = uris.parseNoteUri(apId);
        if (localId.isPresent()) {
            return nativeEvent(localId.get()).map(FederationToNativeBridge::eventRef);
        }
        return store.findNoteByApId(apId)
            .filter(mapping -> mapping.getKind() == EventKind.NOTE.getCode())
            .map(FederationToNativeBridge::mappedRef);
    }

    private Optional<NostrEvent> nativeEvent(String eventId) {
        Optional<NostrEvent> cached = cache.recentEvent(eventId);
        if (cached.isPresent()) {
            return cached;
        }
        long timeout = properties.getRelay().getQueryTimeout().toMillis();
        try {
            return relayPool.query(Filter.byId(eventId), properties.getRelay().getQueryTimeout())
                .get(timeout + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Query for event {} failed: {}", eventId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Map<String, Object>> fetchNote(String uri) {
        Map<String, Object> note;
        try {
            note = actorResolver.fetchObject(uri);
        } catch (TransportTransientException | BridgeException e) {
            log.debug("Cannot fetch {}: {}", uri, e.getMessage());
            return Optional.empty();
        }
        String id = string(note, "id");
        String author = idOf(note.get("attributedTo"));
        if (id == null || author == null || !NOTE_TYPES.contains(string(note, "type")) || !ActivityJson.isPublic(note)) {
            return Optional.empty();
        }
        String host = ActivityJson.host(id);
        if (host == null || !host.equalsIgnoreCase(ActivityJson.host(author)) || uris.isLocal(id)) {
            log.debug("Fetched note {} is not hosted by its author {}", id, author);
            return Optional.empty();
        }
        return Optional.of(note);
    }

    private Optional<EventRef> quoteOf(Map<String, Object> note) {
        for (String key : List.of("quoteUrl", "quoteUri", "_misskey_quote", "quote")) {
            String quoted = idOf(note.get(key));
            if (quoted != null) {
                return eventRefOf(quoted);
            }
        }
        return Optional.empty();
    }

    /**
     * Native keys of mentioned accounts, by actor URI and by {@code @user@domain} handle.
     */
    private Map<String, String> mentionKeysOf(Map<String, Object> note) {
        Map<String, String> keys = new LinkedHashMap<>();
        for (Map<String, Object> tag : ActivityJson.objects(note, "tag")) {
            String href = string(tag, "href");
            if (!"Mention".equals(string(tag, "type")) || href == null) {
                continue;
            }
            String key;
            try {
                key = identityMapper.resolveOrCreate(href).hex();
            } catch (IllegalArgumentException e) {
                continue;
            }
            keys.put(href, key);
            String name = string(tag, "name");
            if (name != null) {
                String handle = name.startsWith("@") ? name : "@" + name;
                if (handle.indexOf('@', 1) < 0 && ActivityJson.host(href) != null) {
                    handle = handle + "@" + ActivityJson.host(href);
                }
                int at = handle.indexOf('@', 1);
                keys.put(handle.substring(0, at + 1) + handle.substring(at + 1).toLowerCase(Locale.ROOT), key);
            }
        }
        return keys;
    }

    private boolean isOptedOut(String actorUri) {
        return properties.getOptedOutActors().contains(actorUri);
    }

    private static EventRef mappedRef(NoteMapping mapping) {
        return EventRef.builder()
            .eventId(mapping.getEventId())
            .authorPubkey(mapping.getAuthorPubkey())
            .rootEventId(mapping.getRootEventId())
            .kind(mapping.getKind())
            .build();
    }

    private static EventRef eventRef(NostrEvent event) {
        return EventRef.builder()
            .eventId(event.getId())
            .authorPubkey(event.getPubkey())
            .rootEventId(ContentTranslator.rootOf(event).orElse(null))
            .mentionedPubkeys(event.tagValues("p"))
            .kind(event.getKind())
            .build();
    }

    private void logDegradations(String objectId, List<Degradation> degradations) {
        for (Degradation degradation : degradations) {
            log.warn("Object {} degraded: {} {}", objectId, degradation.getReason(), degradation.getDetail());
        }
    }
}
