package org.operaton.nostrpub.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.model.entity.FollowerEntry;
import org.operaton.nostrpub.model.entity.NoteMapping;
import org.operaton.nostrpub.model.entity.RelayCursor;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.repository.FollowerEntryRepository;
import org.operaton.nostrpub.repository.NoteMappingRepository;
import org.operaton.nostrpub.repository.RelayCursorRepository;
import org.operaton.nostrpub.repository.RemoteIdentityRepository;
import org.operaton.nostrpub.repository.SeenEventRepository;
import org.operaton.nostrpub.repository.VirtualActorRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link BridgeStore} backed by Spring Data JPA repositories.
 * Spring data access failures are rethrown as {@link StoreUnavailableException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaBridgeStore implements BridgeStore {

    private final VirtualActorRepository virtualActorRepository;
    private final RemoteIdentityRepository remoteIdentityRepository;
    private final SeenEventRepository seenEventRepository;
    private final FollowerEntryRepository followerEntryRepository;
    private final NoteMappingRepository noteMappingRepository;
    private final RelayCursorRepository relayCursorRepository;
    private final Clock clock;

    @Override
    public Optional<VirtualActor> findVirtualActor(String pubkey) {
        return call("find virtual actor", () -> virtualActorRepository.findById(pubkey));
    }

    @Override
    public VirtualActor createVirtualActor(VirtualActor actor) {
        return call("create virtual actor", () -> {
            Optional<VirtualActor> existing = virtualActorRepository.findById(actor.getPubkey());
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                return virtualActorRepository.saveAndFlush(actor);
            } catch (DataIntegrityViolationException e) {
                log.debug("Virtual actor {} created concurrently, reloading", actor.getPubkey());
                return virtualActorRepository.findById(actor.getPubkey()).orElseThrow(() -> e);
            }
        });
    }

    @Override
    public VirtualActor updateVirtualActor(VirtualActor actor) {
        return call("update virtual actor", () -> virtualActorRepository.save(actor));
    }

    @Override
    public Optional<RemoteIdentity> findRemoteIdentity(String actorUri) {
        return call("find remote identity", () -> remoteIdentityRepository.findById(actorUri));
    }

    @Override
    public Optional<RemoteIdentity> findRemoteIdentityByPubkey(String pubkey) {
        return call("find remote identity by key", () -> remoteIdentityRepository.findByPubkey(pubkey));
    }

    @Override
    public RemoteIdentity saveRemoteIdentity(RemoteIdentity identity) {
        return call("save remote identity", () -> remoteIdentityRepository.save(identity));
    }

    @Override
    public boolean recordSeen(String id, Instant firstSeenAt) {
        return call("record seen id", () -> seenEventRepository.insertIfAbsent(id, firstSeenAt) > 0);
    }

    @Override
    public int purgeSeenBefore(Instant cutoff) {
        return call("purge seen ids", () -> seenEventRepository.deleteOlderThan(cutoff));
    }

    @Override
    public Optional<FollowerEntry> findFollowerEntry(String followedPubkey, String followerPubkey) {
        return call("find follower entry",
            () -> followerEntryRepository.findByFollowedPubkeyAndFollowerPubkey(followedPubkey, followerPubkey));
    }

    @Override
    public boolean compareAndSaveFollowerEntry(FollowerEntry entry) {
        return call("save follower entry", () -> {
            try {
                followerEntryRepository.saveAndFlush(entry);
                return true;
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
                log.debug("Follower entry {} -> {} changed concurrently",
                    entry.getFollowerPubkey(), entry.getFollowedPubkey());
                return false;
            }
        });
    }

    @Override
    public List<FollowerEntry> findActiveFollowers(String followedPubkey) {
        return call("find followers", () -> followerEntryRepository.findByFollowedPubkeyAndActiveTrue(followedPubkey));
    }

    @Override
    public List<FollowerEntry> findActiveFollowing(String followerPubkey) {
        return call("find following", () -> followerEntryRepository.findByFollowerPubkeyAndActiveTrue(followerPubkey));
    }

    @Override
    public long countFederatedFollowers(String followedPubkey) {
        return call("count followers", () -> followerEntryRepository.countActiveFederatedFollowers(followedPubkey));
    }

    @Override
    public Optional<NoteMapping> findNoteByApId(String apId) {
        return call("find note mapping", () -> noteMappingRepository.findById(apId));
    }

    @Override
    public Optional<NoteMapping> findNoteByEventId(String eventId) {
        return call("find note mapping by event", () -> noteMappingRepository.findByEventId(eventId));
    }

    @Override
    public NoteMapping saveNoteMapping(NoteMapping mapping) {
        return call("save note mapping", () -> noteMappingRepository.save(mapping));
    }

    @Override
    public List<RelayCursor> findRelayCursors() {
        return call("find relay cursors", relayCursorRepository::findAll);
    }

    @Override
    public void saveRelayCursor(String relayUrl, long newestCreatedAt) {
        call("save relay cursor", () -> relayCursorRepository.save(RelayCursor.builder()
            .relayUrl(relayUrl)
            .newestCreatedAt(newestCreatedAt)
            .updatedAt(clock.instant())
            .build()));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Store operation '{}' failed", operation, e);
            throw new StoreUnavailableException("Store unavailable during " + operation, e);
        }
    }
}
