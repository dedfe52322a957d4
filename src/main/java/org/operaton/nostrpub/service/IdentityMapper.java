package org.operaton.nostrpub.service;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.model.entity.FollowerEntry;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.ProfileMetadata;
import org.operaton.nostrpub.security.HttpSignatureValidator;
import org.operaton.nostrpub.security.NostrKeys;
import org.operaton.nostrpub.store.BridgeStore;
import org.operaton.nostrpub.util.ActivityJson;
import org.operaton.nostrpub.util.SingleFlight;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps Nostr keys to fediverse actors and back, and owns follower set mutation.
 *
 * Native keys get a virtual actor under the bridge's base URL, created lazily with a fresh RSA key pair.
 * Fediverse actors get a key derived from the bridge secret. Both lookups go cache, then store, then creation,
 * with at most one creation in flight per key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityMapper {

    private static final int MAX_FOLLOWER_WRITE_ATTEMPTS = 8;

    private final BridgeStore store;
    private final BridgeCache cache;
    private final BridgeUris uris;
    private final NostrKeys nostrKeys;
    private final HttpSignatureValidator signatureValidator;
    private final Clock clock;

    private final SingleFlight<String, VirtualActor> actorCreations = new SingleFlight<>();
    private final SingleFlight<String, NativeIdentity> identityCreations = new SingleFlight<>();

    /**
     * Returns the virtual actor of a native key, creating and persisting it on first use.
     *
     * @param identity the native key
     * @return the one virtual actor of this key
     */
    public VirtualActor resolveOrCreate(NativeIdentity identity) {
        String key = identity.hex();
        Optional<VirtualActor> cached = cache.virtualActor(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        return actorCreations.run(key, () -> {
            Optional<VirtualActor> stored = store.findVirtualActor(key);
            if (stored.isPresent()) {
                cache.putVirtualActor(stored.get());
                return stored.get();
            }
            VirtualActor created = store.createVirtualActor(newVirtualActor(identity));
            cache.putVirtualActor(created);
            log.info("Created virtual actor {} for {}", created.getActorUri(), identity.npub());
            return created;
        });
    }

    /**
     * Returns the native key of an actor URI.
     * Bridge URIs decode straight to their key; fediverse actors get a derived key, recorded on first use.
     *
     * @param actorUri the actor URI, a fragment is ignored
     * @return the native key standing for this actor
     */
    public NativeIdentity resolveOrCreate(String actorUri) {
        String normalized = ActivityJson.stripFragment(actorUri);
        Optional<NativeIdentity> local = uris.parseActorUri(normalized);
        if (local.isPresent()) {
            return local.get();
        }
        Optional<RemoteIdentity> cached = cache.remoteActor(normalized);
        if (cached.isPresent()) {
            return NativeIdentity.fromHex(cached.get().getPubkey());
        }
        return identityCreations.run(normalized, () -> {
            Optional<RemoteIdentity> stored = store.findRemoteIdentity(normalized);
            if (stored.isPresent()) {
                return NativeIdentity.fromHex(stored.get().getPubkey());
            }
            NativeIdentity derived = nostrKeys.derivedIdentity(normalized);
            store.saveRemoteIdentity(RemoteIdentity.builder()
                .actorUri(normalized)
                .pubkey(derived.hex())
                .domain(hostOrUnknown(normalized))
                .build());
            log.info("Derived {} for fediverse actor {}", derived.npub(), normalized);
            return derived;
        });
    }

    /**
     * Actor URI of a native key; pure.
     */
    public String actorUri(NativeIdentity identity) {
        return uris.actorUri(identity);
    }

    /**
     * Finds the fediverse actor a derived key belongs to.
     */
    public Optional<RemoteIdentity> remoteIdentityOf(NativeIdentity identity) {
        return store.findRemoteIdentityByPubkey(identity.hex());
    }

    /**
     * Rewrites the display fields of a virtual actor from kind 0 metadata.
     * Keys without a virtual actor only get their profile cached for later materialization.
     */
    public Optional<VirtualActor> updateProfile(NativeIdentity identity, ProfileMetadata metadata) {
        cache.putProfile(identity.hex(), metadata);
        Optional<VirtualActor> existing = store.findVirtualActor(identity.hex());
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        VirtualActor updated = existing.get().toBuilder().build();
        applyProfile(updated, metadata);
        VirtualActor saved = store.updateVirtualActor(updated);
        cache.evictVirtualActor(identity.hex());
        log.info("Updated profile of {}", identity.npub());
        return Optional.of(saved);
    }

    /**
     * Activates a follower entry. A federation source upgrades an existing relay entry.
     * Concurrent writers to the same pair are resolved by re-reading and deciding again.
     *
     * @return true if the follower was not active before
     */
    public boolean addFollower(NativeIdentity followed, NativeIdentity follower, String followerActorUri,
                               String activityId, FollowerEntry.Source source, Instant observedAt) {
        for (int attempt = 1; attempt <= MAX_FOLLOWER_WRITE_ATTEMPTS; attempt++) {
            Optional<FollowerEntry> existing = store.findFollowerEntry(followed.hex(), follower.hex());
            if (existing.isPresent() && isStale(existing.get(), source, observedAt)) {
                log.debug("Ignoring stale follow {} -> {}", follower.npub(), followed.npub());
                return false;
            }
            boolean wasActive = existing.map(FollowerEntry::isActive).orElse(false);
            FollowerEntry entry = existing.orElseGet(() -> FollowerEntry.builder()
                .followedPubkey(followed.hex())
                .followerPubkey(follower.hex())
                .build());
            FollowerEntry.Source effective = wasActive && entry.getSource() == FollowerEntry.Source.FEDERATION
                ? FollowerEntry.Source.FEDERATION : source;
            entry.setSource(effective);
            entry.setActive(true);
            if (followerActorUri != null) {
                entry.setFollowerActorUri(followerActorUri);
            }
            if (activityId != null) {
                entry.setActivityId(activityId);
            }
            entry.setUpdatedAt(observedAt);
            if (store.compareAndSaveFollowerEntry(entry)) {
                if (!wasActive) {
                    log.info("{} now follows {} ({})", follower.npub(), followed.npub(), source);
                }
                return !wasActive;
            }
            log.debug("Follow {} -> {} written concurrently, retrying", follower.npub(), followed.npub());
        }
        throw contended(followed, follower);
    }

    /**
     * Deactivates a follower entry. A relay source never removes a follow that came from the fediverse.
     *
     * @return true if an active entry was deactivated
     */
    public boolean removeFollower(NativeIdentity followed, NativeIdentity follower,
                                  FollowerEntry.Source source, Instant observedAt) {
        for (int attempt = 1; attempt <= MAX_FOLLOWER_WRITE_ATTEMPTS; attempt++) {
            Optional<FollowerEntry> existing = store.findFollowerEntry(followed.hex(), follower.hex());
            if (existing.isEmpty() || !existing.get().isActive()) {
                return false;
            }
            FollowerEntry entry = existing.get();
            if (source == FollowerEntry.Source.RELAY && entry.getSource() == FollowerEntry.Source.FEDERATION) {
                log.debug("Keeping federation follow {} -> {} despite relay removal", follower.npub(), followed.npub());
                return false;
            }
            if (isStale(entry, source, observedAt)) {
                return false;
            }
            entry.setActive(false);
            entry.setSource(source);
            entry.setUpdatedAt(observedAt);
            if (store.compareAndSaveFollowerEntry(entry)) {
                log.info("{} no longer follows {} ({})", follower.npub(), followed.npub(), source);
                return true;
            }
            log.debug("Unfollow {} -> {} written concurrently, retrying", follower.npub(), followed.npub());
        }
        throw contended(followed, follower);
    }

    private static StoreUnavailableException contended(NativeIdentity followed, NativeIdentity follower) {
        return new StoreUnavailableException("Follower entry " + follower.npub() + " -> " + followed.npub()
            + " kept changing after " + MAX_FOLLOWER_WRITE_ATTEMPTS + " attempts", null);
    }

    public List<FollowerEntry> followers(NativeIdentity followed) {
        return store.findActiveFollowers(followed.hex());
    }

    public List<FollowerEntry> following(NativeIdentity follower) {
        return store.findActiveFollowing(follower.hex());
    }

    public long federatedFollowerCount(NativeIdentity followed) {
        return store.countFederatedFollowers(followed.hex());
    }

    /**
     * Applies a relay-observed follow list to the follower sets of the listed keys.
     * Only keys in {@code candidates} are considered, so unrelated native follows are not stored.
     *
     * @param follower author of the follow list
     * @param followed keys currently listed, restricted to bridged fediverse actors
     * @param observedAt created_at of the follow list
     * @return the keys that were added and removed
     */
    public FollowListChange applyFollowList(NativeIdentity follower, Collection<NativeIdentity> followed, Instant observedAt) {
        Set<String> listed = followed.stream().map(NativeIdentity::hex).collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> current = following(follower).stream()
            .map(FollowerEntry::getFollowedPubkey)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        Set<NativeIdentity> added = new LinkedHashSet<>();
        for (String key : listed) {
            if (!current.contains(key)
                && addFollower(NativeIdentity.fromHex(key), follower, null, null, FollowerEntry.Source.RELAY, observedAt)) {
                added.add(NativeIdentity.fromHex(key));
            }
        }
        Set<NativeIdentity> removed = new LinkedHashSet<>();
        for (String key : current) {
            if (!listed.contains(key)
                && removeFollower(NativeIdentity.fromHex(key), follower, FollowerEntry.Source.RELAY, observedAt)) {
                removed.add(NativeIdentity.fromHex(key));
            }
        }
        return new FollowListChange(added, removed);
    }

    /**
     * Follows gained and lost by applying a follow list.
     */
    @Value
    public static class FollowListChange {
        Set<NativeIdentity> added;
        Set<NativeIdentity> removed;

        public boolean isEmpty() {
            return added.isEmpty() && removed.isEmpty();
        }
    }

    private boolean isStale(FollowerEntry entry, FollowerEntry.Source source, Instant observedAt) {
        // Relay follow lists may arrive out of order; federation activities are applied as they come
        return source == FollowerEntry.Source.RELAY
            && entry.getUpdatedAt() != null
            && entry.getUpdatedAt().isAfter(observedAt);
    }

    private VirtualActor newVirtualActor(NativeIdentity identity) {
        HttpSignatureValidator.PemKeyPair keyPair = signatureValidator.generateKeyPair();
        VirtualActor actor = VirtualActor.builder()
            .pubkey(identity.hex())
            .actorUri(uris.actorUri(identity))
            .preferredUsername(identity.npub())
            .publicKey(keyPair.publicKeyPem)
            .privateKey(keyPair.privateKeyPem)
            .createdAt(clock.instant())
            .build();
        cache.profile(identity.hex()).ifPresent(profile -> applyProfile(actor, profile));
        return actor;
    }

    private static void applyProfile(VirtualActor actor, ProfileMetadata metadata) {
        actor.setDisplayName(metadata.bestName());
        actor.setSummary(metadata.getAbout());
        actor.setAvatarUrl(metadata.getPicture());
        actor.setBannerUrl(metadata.getBanner());
    }

    private static String hostOrUnknown(String uri) {
        String host = ActivityJson.host(uri);
        return host != null ? host : "unknown";
    }
}
