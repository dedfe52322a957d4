package org.operaton.nostrpub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.exception.TransportTransientException;
import org.operaton.nostrpub.model.bridge.Degradation;
import org.operaton.nostrpub.model.bridge.MentionTarget;
import org.operaton.nostrpub.model.bridge.ObjectRef;
import org.operaton.nostrpub.model.bridge.OutboundContext;
import org.operaton.nostrpub.model.bridge.TranslationResult;
import org.operaton.nostrpub.model.entity.FollowerEntry;
import org.operaton.nostrpub.model.entity.NoteMapping;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.model.nostr.EventKind;
import org.operaton.nostrpub.model.nostr.Filter;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.model.nostr.ProfileMetadata;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.relay.RelayPoolManager;
import org.operaton.nostrpub.store.BridgeStore;
import org.operaton.nostrpub.util.ActivityJson;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Bridges verified native events to the fediverse: resolves everything the translation needs,
 * records the mapping and hands the activities to the delivery engine.
 * Only called by {@link BridgeCoordinator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NativeToFederationBridge {

    private final IdentityMapper identityMapper;
    private final ContentTranslator translator;
    private final FederationDeliveryEngine deliveryEngine;
    private final RemoteActorResolver actorResolver;
    private final RelayPoolManager relayPool;
    private final BridgeStore store;
    private final BridgeCache cache;
    private final BridgeUris uris;
    private final NostrPubProperties properties;

    /**
     * Kind 0: refreshes the virtual actor and announces the change to its followers.
     */
    public void bridgeMetadata(NostrEvent event) {
        NativeIdentity author = NativeIdentity.fromHex(event.getPubkey());
        Optional<ProfileMetadata> metadata = translator.parseProfile(event);
        if (metadata.isEmpty()) {
            return;
        }
        Optional<VirtualActor> updated = identityMapper.updateProfile(author, metadata.get());
        if (updated.isEmpty()) {
            return;
        }
        Set<String> inboxes = followerInboxes(author);
        if (!inboxes.isEmpty()) {
            deliveryEngine.deliverAll(translator.toUpdate(updated.get(), event.getCreatedAt()), updated.get(), inboxes);
        }
    }

    /**
     * Kind 1: delivers a Create to the author's fediverse followers, mentioned actors and the parent's author.
     * Notes nobody on the fediverse would receive are not bridged.
     */
    public void bridgeNote(NostrEvent event) {
        NativeIdentity author = NativeIdentity.fromHex(event.getPubkey());
        Map<String, MentionTarget> mentions = new LinkedHashMap<>();
        Set<String> inboxes = new LinkedHashSet<>(followerInboxes(author));

        for (String key : ContentTranslator.mentionedKeysOf(event)) {
            mentionTarget(key, inboxes).ifPresent(target -> mentions.put(key, target));
        }

        Map<String, ObjectRef> objects = new LinkedHashMap<>();
        ContentTranslator.replyTargetOf(event).ifPresent(parentId ->
            objectRef(parentId, true).ifPresent(parent -> {
                objects.put(parentId, parent);
                remoteInboxOf(parent.getAuthorUri()).ifPresent(inboxes::add);
            }));
        event.firstTagValue("q").ifPresent(quoted -> objectRef(quoted, true).ifPresent(ref -> objects.put(quoted, ref)));

        if (inboxes.isEmpty()) {
            log.debug("Note {} has no fediverse audience", event.getId());
            return;
        }

        VirtualActor actor = identityMapper.resolveOrCreate(author);
        OutboundContext ctx = OutboundContext.builder()
            .actorUri(actor.getActorUri())
            .followersUri(actor.getFollowersUri())
            .objects(objects)
            .mentions(mentions)
            .build();
        TranslationResult<Map<String, Object>> result = translator.toCreate(event, ctx);
        logDegradations(event, result.getDegradations());

        store.saveNoteMapping(NoteMapping.builder()
            .apId(uris.noteUri(event.getId()))
            .eventId(event.getId())
            .authorPubkey(author.hex())
            .rootEventId(ContentTranslator.rootOf(event).orElse(null))
            .kind(EventKind.NOTE.getCode())
            .createdAt(Instant.ofEpochSecond(event.getCreatedAt()))
            .build());
        result.getValue().ifPresent(create -> deliveryEngine.deliverAll(create, actor, inboxes));
    }

    /**
     * Kind 7: reactions are delivered only when they target a note from the fediverse.
     */
    public void bridgeReaction(NostrEvent event) {
        bridgeInteraction(event, false);
    }

    /**
     * Kind 6: reposts of fediverse notes go to the note's author and the reposter's followers.
     */
    public void bridgeRepost(NostrEvent event) {
        bridgeInteraction(event, true);
    }

    /**
     * Kind 3: follows and unfollows of bridged fediverse actors.
     */
    public void bridgeFollowList(NostrEvent event) {
        NativeIdentity follower = NativeIdentity.fromHex(event.getPubkey());
        List<NativeIdentity> followed = new ArrayList<>();
        Map<String, String> actorUris = new LinkedHashMap<>();
        for (String key : new LinkedHashSet<>(event.tagValues("p"))) {
            NativeIdentity identity;
            try {
                identity = NativeIdentity.fromHex(key);
            } catch (IllegalArgumentException e) {
                continue;
            }
            identityMapper.remoteIdentityOf(identity).ifPresent(remote -> {
                followed.add(identity);
                actorUris.put(identity.hex(), remote.getActorUri());
            });
        }

        IdentityMapper.FollowListChange change = identityMapper.applyFollowList(
            follower, followed, Instant.ofEpochSecond(event.getCreatedAt()));
        if (change.isEmpty()) {
            return;
        }
        for (NativeIdentity removed : change.getRemoved()) {
            identityMapper.remoteIdentityOf(removed).ifPresent(remote -> actorUris.put(removed.hex(), remote.getActorUri()));
        }

        VirtualActor actor = identityMapper.resolveOrCreate(follower);
        List<String> added = change.getAdded().stream()
            .map(id -> actorUris.get(id.hex())).filter(Objects::nonNull).collect(Collectors.toList());
        List<String> removed = change.getRemoved().stream()
            .map(id -> actorUris.get(id.hex())).filter(Objects::nonNull).collect(Collectors.toList());
        List<Map<String, Object>> activities = translator.toFollowChanges(actor.getActorUri(), added, removed, event.getCreatedAt());
        for (Map<String, Object> activity : activities) {
            Map<String, Object> follow = "Undo".equals(activity.get("type"))
                ? ActivityJson.asMap(activity.get("object")) : activity;
            String target = ActivityJson.string(follow, "object");
            remoteInboxOf(target).ifPresent(inbox -> deliveryEngine.deliver(activity, actor, inbox));
        }
    }

    /**
     * Kind 5: retracts previously bridged notes, reactions and reposts of the same author.
     */
    public void bridgeDeletion(NostrEvent event) {
        NativeIdentity author = NativeIdentity.fromHex(event.getPubkey());
        Optional<VirtualActor> actor = store.findVirtualActor(author.hex());
        if (actor.isEmpty()) {
            return;
        }
        Map<String, ObjectRef> objects = new LinkedHashMap<>();
        Set<String> inboxes = new LinkedHashSet<>(followerInboxes(author));
        for (String eventId : event.tagValues("e")) {
            store.findNoteByEventId(eventId)
                .filter(mapping -> author.hex().equals(mapping.getAuthorPubkey()))
                .ifPresent(mapping -> objects.put(eventId,
                    new ObjectRef(mapping.getApId(), actor.get().getActorUri(), mapping.getKind())));
        }
        if (objects.isEmpty()) {
            return;
        }
        OutboundContext ctx = OutboundContext.builder()
            .actorUri(actor.get().getActorUri())
            .followersUri(actor.get().getFollowersUri())
            .objects(objects)
            .build();
        TranslationResult<List<Map<String, Object>>> result = translator.toDeletes(event, ctx);
        logDegradations(event, result.getDegradations());
        result.getValue().ifPresent(activities -> {
            for (Map<String, Object> activity : activities) {
                Set<String> recipients = new LinkedHashSet<>(inboxes);
                targetAuthorInbox(activity).ifPresent(recipients::add);
                deliveryEngine.deliverAll(activity, actor.get(), recipients);
            }
        });
    }

    private void bridgeInteraction(NostrEvent event, boolean repost) {
        Optional<String> targetId = ContentTranslator.targetOf(event);
        if (targetId.isEmpty()) {
            return;
        }
        Optional<NoteMapping> target = store.findNoteByEventId(targetId.get())
            .filter(mapping -> mapping.getKind() == EventKind.NOTE.getCode());
        Optional<RemoteIdentity> targetAuthor = target
            .flatMap(mapping -> identityMapper.remoteIdentityOf(NativeIdentity.fromHex(mapping.getAuthorPubkey())));
        if (targetAuthor.isEmpty()) {
            log.debug("{} {} targets no fediverse note", repost ? "Repost" : "Reaction", event.getId());
            return;
        }
        NativeIdentity author = NativeIdentity.fromHex(event.getPubkey());
        VirtualActor actor = identityMapper.resolveOrCreate(author);
        OutboundContext ctx = OutboundContext.builder()
            .actorUri(actor.getActorUri())
            .followersUri(actor.getFollowersUri())
            .objects(Map.of(targetId.get(),
                new ObjectRef(target.get().getApId(), targetAuthor.get().getActorUri(), EventKind.NOTE.getCode())))
            .build();
        TranslationResult<Map<String, Object>> result = repost ? translator.toAnnounce(event, ctx) : translator.toReaction(event, ctx);
        logDegradations(event, result.getDegradations());
        if (result.isSkipped()) {
            return;
        }
        Map<String, Object> activity = result.getValue().get();
        store.saveNoteMapping(NoteMapping.builder()
            .apId(ActivityJson.string(activity, "id"))
            .eventId(event.getId())
            .authorPubkey(author.hex())
            .rootEventId(targetId.get())
            .kind(event.getKind())
            .createdAt(Instant.ofEpochSecond(event.getCreatedAt()))
            .build());

        Set<String> inboxes = new LinkedHashSet<>();
        remoteInboxOf(targetAuthor.get().getActorUri()).ifPresent(inboxes::add);
        if (repost) {
            inboxes.addAll(followerInboxes(author));
        }
        if (inboxes.isEmpty()) {
            return;
        }
        deliveryEngine.deliverAll(activity, actor, inboxes);
    }

    /**
     * Reference to a note for replies and quotes. Bridged fediverse notes resolve through their mapping;
     * native notes through the event cache, then a relay query.
     */
    private Optional<ObjectRef> objectRef(String eventId, boolean queryRelays) {
        Optional<NoteMapping> mapping = store.findNoteByEventId(eventId);
        if (mapping.isPresent()) {
            NativeIdentity author = NativeIdentity.fromHex(mapping.get().getAuthorPubkey());
            String authorUri = identityMapper.remoteIdentityOf(author)
                .map(RemoteIdentity::getActorUri)
                .orElseGet(() -> uris.actorUri(author));
            return Optional.of(new ObjectRef(mapping.get().getApId(), authorUri, mapping.get().getKind()));
        }
        Optional<NostrEvent> parent = cache.recentEvent(eventId);
        if (parent.isEmpty() && queryRelays) {
            parent = queryEvent(eventId);
        }
        return parent.map(found -> new ObjectRef(
            uris.noteUri(found.getId()),
            uris.actorUri(NativeIdentity.fromHex(found.getPubkey())),
            found.getKind()));
    }

    private Optional<NostrEvent> queryEvent(String eventId) {
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

    private Optional<MentionTarget> mentionTarget(String key, Set<String> inboxes) {
        NativeIdentity identity;
        try {
            identity = NativeIdentity.fromHex(key);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        Optional<RemoteIdentity> remote = identityMapper.remoteIdentityOf(identity);
        if (remote.isPresent()) {
            String inbox = remoteInboxOf(remote.get().getActorUri()).orElse(null);
            if (inbox != null) {
                inboxes.add(inbox);
            }
            RemoteIdentity known = actorResolver.cached(remote.get().getActorUri()).orElse(remote.get());
            String handle = "@" + (known.getPreferredUsername() != null ? known.getPreferredUsername() : "user")
                + "@" + known.getDomain();
            return Optional.of(new MentionTarget(known.getActorUri(), handle));
        }
        return Optional.of(new MentionTarget(uris.actorUri(identity), "@" + identity.npub() + "@" + uris.domain()));
    }

    /**
     * Delivery inbox of a fediverse actor; empty for bridge actors and unreachable ones.
     */
    private Optional<String> remoteInboxOf(String actorUri) {
        if (actorUri == null || uris.isLocal(actorUri)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(actorResolver.resolve(actorUri).getDeliveryInbox());
        } catch (TransportTransientException | BridgeException e) {
            log.warn("Cannot resolve inbox of {}: {}", actorUri, e.getMessage());
            return Optional.empty();
        }
    }

    private Set<String> followerInboxes(NativeIdentity author) {
        Set<String> inboxes = new LinkedHashSet<>();
        for (FollowerEntry follower : identityMapper.followers(author)) {
            if (follower.getSource() == FollowerEntry.Source.FEDERATION && follower.getFollowerActorUri() != null) {
                remoteInboxOf(follower.getFollowerActorUri()).ifPresent(inboxes::add);
            }
        }
        return inboxes;
    }

    private Optional<String> targetAuthorInbox(Map<String, Object> activity) {
        Map<String, Object> object = ActivityJson.asMap(activity.get("object"));
        String objectId = ActivityJson.idOf(object);
        if (objectId == null || !"Undo".equals(activity.get("type"))) {
            return Optional.empty();
        }
        // Interactions record the event they target as their root
        return store.findNoteByApId(objectId)
            .map(NoteMapping::getRootEventId)
            .flatMap(store::findNoteByEventId)
            .map(target -> NativeIdentity.fromHex(target.getAuthorPubkey()))
            .flatMap(identityMapper::remoteIdentityOf)
            .flatMap(remote -> remoteInboxOf(remote.getActorUri()));
    }

    private void logDegradations(NostrEvent event, List<Degradation> degradations) {
        for (Degradation degradation : degradations) {
            log.warn("Event {} degraded: {} {}", event.getId(), degradation.getReason(), degradation.getDetail());
        }
    }
}
