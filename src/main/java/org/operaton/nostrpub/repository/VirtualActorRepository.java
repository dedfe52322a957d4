package org.operaton.nostrpub.repository;

import org.operaton.nostrpub.model.entity.VirtualActor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for VirtualActor entity operations.
 * Keyed by the hex public key of the Nostr author.
 */
@Repository
public interface VirtualActorRepository extends JpaRepository<VirtualActor, String> {
}
