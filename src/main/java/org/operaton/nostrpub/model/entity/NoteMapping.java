package org.operaton.nostrpub.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Links a fediverse object or activity id to the Nostr event it was bridged to or from.
 * Replies, Undo and Delete use it to find their target on the other side.
 */
@Entity
@Table(name = "note_mappings", indexes = {
    @Index(name = "idx_note_mapping_event", columnList = "event_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteMapping {

    /**
     * Example: https://mastodon.social/users/alice/statuses/1
     */
    @Id
    @Column(name = "ap_id", columnDefinition = "TEXT")
    private String apId;

    /**
     * Lowercase hex Nostr event id.
     */
    @Column(name = "event_id", nullable = false, length = 64)
    private String eventId;

    @Column(name = "author_pubkey", nullable = false, length = 64)
    private String authorPubkey;

    /**
     * Thread root, used for NIP-10 root markers of replies to this event.
     * For reactions and reposts the event they target.
     */
    @Column(name = "root_event_id", length = 64)
    private String rootEventId;

    @Column(nullable = false)
    private int kind;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
