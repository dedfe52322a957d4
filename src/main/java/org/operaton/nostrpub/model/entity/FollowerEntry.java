package org.operaton.nostrpub.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One edge of a follower set: {@code followerPubkey} follows {@code followedPubkey}.
 * Both sides are Nostr keys; for fediverse followers the derived key is stored together with the actor URI.
 * Entries are deactivated rather than deleted so the newest write per pair can win.
 * Writes are optimistic: a stale {@code version} makes the save fail instead of overwriting.
 */
@Entity
@Table(name = "follower_entries",
    uniqueConstraints = @UniqueConstraint(name = "uk_follower_pair", columnNames = {"followed_pubkey", "follower_pubkey"}),
    indexes = {
        @Index(name = "idx_follower_followed", columnList = "followed_pubkey"),
        @Index(name = "idx_follower_follower", columnList = "follower_pubkey")
    })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FollowerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "followed_pubkey", nullable = false, length = 64)
    private String followedPubkey;

    @Column(name = "follower_pubkey", nullable = false, length = 64)
    private String followerPubkey;

    /**
     * Actor URI of the follower when the follower lives on the fediverse, otherwise null.
     */
    @Column(name = "follower_actor_uri", length = 512)
    private String followerActorUri;

    /**
     * Follow activity id, referenced by Accept and Undo.
     */
    @Column(name = "activity_id", columnDefinition = "TEXT")
    private String activityId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Source source;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    /**
     * Where a follow relationship was observed.
     */
    public enum Source {
        /** Follow/Undo activity received from a fediverse server */
        FEDERATION,
        /** Kind 3 follow list seen on a relay */
        RELAY
    }
}
