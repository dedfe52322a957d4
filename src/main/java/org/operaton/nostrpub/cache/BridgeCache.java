package org.operaton.nostrpub.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.model.nostr.ProfileMetadata;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Bounded in-memory caches in front of the store and the network.
 * Entries are only ever copies of durable or re-fetchable state, so eviction never loses data.
 */
@Component
@Slf4j
public class BridgeCache {

    private final Cache<String, RemoteIdentity> remoteActors;
    private final Cache<String, VirtualActor> virtualActors;
    private final Cache<String, Instant> seenIds;
    private final Cache<String, ProfileMetadata> profiles;
    private final Cache<String, NostrEvent> recentEvents;

    public BridgeCache(NostrPubProperties properties) {
        NostrPubProperties.Cache cache = properties.getCache();
        this.remoteActors = Caffeine.newBuilder()
            .maximumSize(cache.getMaxActors())
            .expireAfterWrite(cache.getActorTtl())
            .build();
        this.virtualActors = Caffeine.newBuilder()
            .maximumSize(cache.getMaxActors())
            .build();
        this.seenIds = Caffeine.newBuilder()
            .maximumSize(properties.getDedup().getMaxCachedIds())
            .expireAfterWrite(properties.getDedup().getRetention())
            .build();
        this.profiles = Caffeine.newBuilder()
            .maximumSize(cache.getMaxProfiles())
            .expireAfterWrite(cache.getProfileTtl())
            .build();
        this.recentEvents = Caffeine.newBuilder()
            .maximumSize(cache.getMaxEvents())
            .build();
        log.info("Initialized caches: actors={}, seenIds={}, profiles={}, events={}",
            cache.getMaxActors(), properties.getDedup().getMaxCachedIds(), cache.getMaxProfiles(), cache.getMaxEvents());
    }

    // Remote actors, keyed by actor URI

    public Optional<RemoteIdentity> remoteActor(String actorUri) {
        return Optional.ofNullable(remoteActors.getIfPresent(actorUri));
    }

    public void putRemoteActor(RemoteIdentity identity) {
        remoteActors.put(identity.getActorUri(), identity);
    }

    public void evictRemoteActor(String actorUri) {
        remoteActors.invalidate(actorUri);
    }

    // Virtual actors, keyed by hex public key

    public Optional<VirtualActor> virtualActor(String pubkey) {
        return Optional.ofNullable(virtualActors.getIfPresent(pubkey));
    }

    public void putVirtualActor(VirtualActor actor) {
        virtualActors.put(actor.getPubkey(), actor);
    }

    public void evictVirtualActor(String pubkey) {
        virtualActors.invalidate(pubkey);
    }

    // Dedup index front

    /**
     * Marks an id as seen.
     *
     * @return true if the id was not cached before
     */
    public boolean markSeen(String id, Instant at) {
        return seenIds.asMap().putIfAbsent(id, at) == null;
    }

    public boolean isSeen(String id) {
        return seenIds.getIfPresent(id) != null;
    }

    public void forgetSeen(String id) {
        seenIds.invalidate(id);
    }

    // Profile metadata of native keys, keyed by hex public key

    public Optional<ProfileMetadata> profile(String pubkey) {
        return Optional.ofNullable(profiles.getIfPresent(pubkey));
    }

    public void putProfile(String pubkey, ProfileMetadata metadata) {
        profiles.put(pubkey, metadata);
    }

    // Recently seen native events, keyed by event id

    public Optional<NostrEvent> recentEvent(String eventId) {
        return Optional.ofNullable(recentEvents.getIfPresent(eventId));
    }

    public void putRecentEvent(NostrEvent event) {
        recentEvents.put(event.getId(), event);
    }
}
