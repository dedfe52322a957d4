package org.operaton.nostrpub.repository;

import org.operaton.nostrpub.model.entity.NoteMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for NoteMapping entity operations.
 */
@Repository
public interface NoteMappingRepository extends JpaRepository<NoteMapping, String> {

    /**
     * Find the mapping of a Nostr event.
     *
     * @param eventId lowercase hex event id
     * @return the mapping if the event was bridged
     */
    Optional<NoteMapping> findByEventId(String eventId);
}
