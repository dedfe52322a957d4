package org.operaton.nostrpub.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * The fediverse face of a Nostr key.
 * Created lazily the first time the key needs to appear on the fediverse; the RSA key pair
 * is generated at that point and never rotated.
 */
@Entity
@Table(name = "virtual_actors")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VirtualActor {

    /**
     * Lowercase hex public key of the Nostr author.
     */
    @Id
    @Column(name = "pubkey", length = 64)
    private String pubkey;

    /**
     * Example: https://bridge.example/users/npub1...
     */
    @Column(name = "actor_uri", nullable = false, unique = true, length = 512)
    private String actorUri;

    @Column(name = "display_name", length = 255)
    private String displayName;

    /**
     * Preferred username shown by fediverse servers, normally the npub.
     */
    @Column(name = "preferred_username", length = 255)
    private String preferredUsername;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "avatar_url", length = 1024)
    private String avatarUrl;

    @Column(name = "banner_url", length = 1024)
    private String bannerUrl;

    /**
     * RSA public key in PEM format, published in the actor document.
     */
    @Column(name = "public_key", columnDefinition = "TEXT", nullable = false)
    private String publicKey;

    /**
     * RSA private key in PEM format, used to sign outbound deliveries.
     */
    @Column(name = "private_key", columnDefinition = "TEXT", nullable = false)
    private String privateKey;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public String getInboxUri() {
        return actorUri + "/inbox";
    }

    public String getOutboxUri() {
        return actorUri + "/outbox";
    }

    public String getFollowersUri() {
        return actorUri + "/followers";
    }

    public String getKeyId() {
        return actorUri + "#main-key";
    }
}
