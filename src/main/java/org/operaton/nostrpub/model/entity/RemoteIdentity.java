package org.operaton.nostrpub.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A fediverse actor known to the bridge, together with the Nostr key derived for it.
 * The derived secret key is not stored; it is recomputed from the bridge secret.
 */
@Entity
@Table(name = "remote_identities", indexes = {
    @Index(name = "idx_remote_identity_pubkey", columnList = "pubkey", unique = true),
    @Index(name = "idx_remote_identity_domain", columnList = "domain")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RemoteIdentity {

    /**
     * The full ActivityPub actor URI without fragment.
     * Example: https://mastodon.social/users/alice
     */
    @Id
    @Column(name = "actor_uri", length = 512)
    private String actorUri;

    /**
     * Lowercase hex public key derived for this actor.
     */
    @Column(name = "pubkey", nullable = false, length = 64)
    private String pubkey;

    @Column(nullable = false, length = 255)
    private String domain;

    @Column(name = "preferred_username", length = 255)
    private String preferredUsername;

    @Column(name = "inbox_url", length = 512)
    private String inboxUrl;

    /**
     * Shared inbox (if available), preferred for fan-out deliveries.
     */
    @Column(name = "shared_inbox_url", length = 512)
    private String sharedInboxUrl;

    @Column(name = "public_key", columnDefinition = "TEXT")
    private String publicKey;

    @Column(name = "public_key_id", length = 512)
    private String publicKeyId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "avatar_url", length = 1024)
    private String avatarUrl;

    @Column(name = "last_fetched_at")
    private Instant lastFetchedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Inbox to deliver to, preferring the shared inbox.
     */
    public String getDeliveryInbox() {
        return sharedInboxUrl != null ? sharedInboxUrl : inboxUrl;
    }
}
