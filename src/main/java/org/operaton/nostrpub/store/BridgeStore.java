package org.operaton.nostrpub.store;

import org.operaton.nostrpub.model.entity.FollowerEntry;
import org.operaton.nostrpub.model.entity.NoteMapping;
import org.operaton.nostrpub.model.entity.RelayCursor;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.model.entity.VirtualActor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of the bridge, partitioned by record kind.
 * Every method throws {@link org.operaton.nostrpub.exception.StoreUnavailableException} when the
 * backing store cannot be reached; callers abort the current operation in that case.
 */
public interface BridgeStore {

    Optional<VirtualActor> findVirtualActor(String pubkey);

    /**
     * Persists a new virtual actor. If another writer created the same key first, the stored
     * actor is returned instead so key pairs are never replaced.
     */
    VirtualActor createVirtualActor(VirtualActor actor);

    VirtualActor updateVirtualActor(VirtualActor actor);

    Optional<RemoteIdentity> findRemoteIdentity(String actorUri);

    Optional<RemoteIdentity> findRemoteIdentityByPubkey(String pubkey);

    RemoteIdentity saveRemoteIdentity(RemoteIdentity identity);

    /**
     * Records an id in the dedup index.
     *
     * @return true if the id was not known before
     */
    boolean recordSeen(String id, Instant firstSeenAt);

    /**
     * Removes dedup entries first seen before the cutoff.
     *
     * @return number of removed entries
     */
    int purgeSeenBefore(Instant cutoff);

    Optional<FollowerEntry> findFollowerEntry(String followedPubkey, String followerPubkey);

    /**
     * Saves a follower entry unless the pair was created or changed since the entry was read.
     *
     * @return false if another writer got there first; re-read and decide again
     */
    boolean compareAndSaveFollowerEntry(FollowerEntry entry);

    List<FollowerEntry> findActiveFollowers(String followedPubkey);

    List<FollowerEntry> findActiveFollowing(String followerPubkey);

    long countFederatedFollowers(String followedPubkey);

    Optional<NoteMapping> findNoteByApId(String apId);

    Optional<NoteMapping> findNoteByEventId(String eventId);

    NoteMapping saveNoteMapping(NoteMapping mapping);

    List<RelayCursor> findRelayCursors();

    void saveRelayCursor(String relayUrl, long newestCreatedAt);
}
