package org.operaton.nostrpub.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Newest {@code created_at} the bridge has seen from a relay.
 */
@Entity
@Table(name = "relay_cursors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayCursor {

    @Id
    @Column(name = "relay_url", length = 512)
    private String relayUrl;

    @Column(name = "newest_created_at", nullable = false)
    private long newestCreatedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
