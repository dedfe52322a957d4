package org.operaton.nostrpub.model.activitypub;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.nostrpub.model.entity.VirtualActor;

import java.util.List;

/**
 * ActivityPub Actor document of a bridged Nostr key.
 *
 * Spec: https://www.w3.org/TR/activitypub/#actors
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Actor {

    @JsonProperty("@context")
    private Object context;

    private String type;
    private String id;
    private String preferredUsername;
    private String name;
    private String summary;
    private String inbox;
    private String outbox;
    private String followers;
    private PublicKey publicKey;
    private Endpoints endpoints;
    private Image icon;
    private Image image;
    private String url;
    private Boolean manuallyApprovesFollowers;
    private Boolean discoverable;

    /**
     * Creates an Actor from a VirtualActor entity.
     *
     * @param actor the virtual actor
     * @param sharedInbox the bridge's shared inbox URL
     * @param profileUrl human readable page of the key (a Nostr web client)
     */
    public static Actor fromVirtualActor(VirtualActor actor, String sharedInbox, String profileUrl) {
        String actorUri = actor.getActorUri();

        return Actor.builder()
            .context(List.of(
                "https://www.w3.org/ns/activitystreams",
                "https://w3id.org/security/v1"
            ))
            .type("Person")
            .id(actorUri)
            .preferredUsername(actor.getPreferredUsername())
            .name(actor.getDisplayName() != null ? actor.getDisplayName() : actor.getPreferredUsername())
            .summary(actor.getSummary())
            .inbox(actor.getInboxUri())
            .outbox(actor.getOutboxUri())
            .followers(actor.getFollowersUri())
            .publicKey(PublicKey.builder()
                .id(actor.getKeyId())
                .owner(actorUri)
                .publicKeyPem(actor.getPublicKey())
                .build())
            .endpoints(new Endpoints(sharedInbox))
            .icon(actor.getAvatarUrl() != null ? Image.builder()
                .type("Image")
                .url(actor.getAvatarUrl())
                .build() : null)
            .image(actor.getBannerUrl() != null ? Image.builder()
                .type("Image")
                .url(actor.getBannerUrl())
                .build() : null)
            .url(profileUrl)
            .manuallyApprovesFollowers(false)
            .discoverable(true)
            .build();
    }

    /**
     * Public key object for HTTP signature verification.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PublicKey {
        private String id;
        private String owner;
        private String publicKeyPem;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Endpoints {
        private String sharedInbox;
    }

    /**
     * Image object for avatars and banners.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Image {
        private String type;
        private String mediaType;
        private String url;
    }
}
