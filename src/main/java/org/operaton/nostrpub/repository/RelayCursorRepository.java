package org.operaton.nostrpub.repository;

import org.operaton.nostrpub.model.entity.RelayCursor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for per-relay cursors.
 */
@Repository
public interface RelayCursorRepository extends JpaRepository<RelayCursor, String> {
}
