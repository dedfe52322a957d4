package org.operaton.nostrpub.repository;

import org.operaton.nostrpub.model.entity.SeenEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Repository for the dedup index.
 */
@Repository
public interface SeenEventRepository extends JpaRepository<SeenEvent, String> {

    /**
     * Inserts an id unless it is already present.
     *
     * @param id event or activity id
     * @param firstSeenAt time of first sighting
     * @return 1 if the id was new, 0 otherwise
     */
    @Modifying
    @Transactional
    @Query(value = "INSERT INTO seen_events (id, first_seen_at) VALUES (:id, :firstSeenAt) ON CONFLICT (id) DO NOTHING",
        nativeQuery = true)
    int insertIfAbsent(@Param("id") String id, @Param("firstSeenAt") Instant firstSeenAt);

    /**
     * Delete entries older than the retention window.
     *
     * @param cutoff entries first seen before this instant are removed
     * @return number of removed entries
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM SeenEvent s WHERE s.firstSeenAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
