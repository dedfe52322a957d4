package org.operaton.nostrpub.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Dedup entry: a Nostr event id or fediverse activity id the bridge has already processed.
 */
@Entity
@Table(name = "seen_events", indexes = {
    @Index(name = "idx_seen_events_first_seen", columnList = "first_seen_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeenEvent {

    @Id
    @Column(name = "id", columnDefinition = "TEXT")
    private String id;

    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;
}
