package org.operaton.nostrpub.repository;

import org.operaton.nostrpub.model.entity.FollowerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for follower set operations.
 */
@Repository
public interface FollowerEntryRepository extends JpaRepository<FollowerEntry, UUID> {

    /**
     * Find the entry for a (followed, follower) pair, active or not.
     *
     * @param followedPubkey the followed key
     * @param followerPubkey the follower key
     * @return the entry if it exists
     */
    Optional<FollowerEntry> findByFollowedPubkeyAndFollowerPubkey(String followedPubkey, String followerPubkey);

    /**
     * Find all active followers of a key.
     *
     * @param followedPubkey the followed key
     * @return active entries
     */
    List<FollowerEntry> findByFollowedPubkeyAndActiveTrue(String followedPubkey);

    /**
     * Find every key a follower currently follows.
     *
     * @param followerPubkey the follower key
     * @return active entries
     */
    List<FollowerEntry> findByFollowerPubkeyAndActiveTrue(String followerPubkey);

    /**
     * Count active fediverse followers of a key.
     *
     * @param followedPubkey the followed key
     * @return number of active followers that have an actor URI
     */
    @Query("SELECT COUNT(f) FROM FollowerEntry f WHERE f.followedPubkey = :followedPubkey "
        + "AND f.active = true AND f.followerActorUri IS NOT NULL")
    long countActiveFederatedFollowers(@Param("followedPubkey") String followedPubkey);
}
