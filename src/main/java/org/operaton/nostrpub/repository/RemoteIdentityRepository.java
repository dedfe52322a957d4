package org.operaton.nostrpub.repository;

import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for RemoteIdentity entity operations.
 */
@Repository
public interface RemoteIdentityRepository extends JpaRepository<RemoteIdentity, String> {

    /**
     * Find a remote actor by the Nostr key derived for it.
     *
     * @param pubkey lowercase hex public key
     * @return the remote identity if known
     */
    Optional<RemoteIdentity> findByPubkey(String pubkey);
}
