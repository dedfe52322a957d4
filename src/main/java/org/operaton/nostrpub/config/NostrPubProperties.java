package org.operaton.nostrpub.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bridge configuration, bound from {@code nostrpub.*}.
 * Loaded once at startup and treated as immutable afterwards.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "nostrpub")
public class NostrPubProperties {

    /**
     * Public host name of the bridge, e.g. {@code bridge.example}.
     */
    @NotBlank
    private String domain;

    /**
     * Base URL all actor and note URIs are derived from, e.g. {@code https://bridge.example}.
     */
    @NotBlank
    private String baseUrl;

    /**
     * Secret used to derive Nostr keys for fediverse actors. Changing it changes every derived key.
     */
    @NotBlank
    private String secret;

    /**
     * Relay WebSocket URLs the bridge subscribes to and publishes on.
     */
    private List<String> relays = new ArrayList<>();

    /**
     * Additional relays that only receive kind 0 profile metadata. Nothing is read from them.
     */
    private List<String> metadataRelays = new ArrayList<>();

    /**
     * Fediverse actor URIs that opted out of being bridged. Their posts, likes and boosts are not published.
     */
    private Set<String> optedOutActors = new HashSet<>();

    /**
     * Follow lists longer than this are not published for bridged fediverse accounts.
     */
    @Min(1)
    private int followListLimit = 500;

    private String userAgent = "NostrPub/0.1";

    @Valid
    @NotNull
    private Relay relay = new Relay();

    @Valid
    @NotNull
    private Delivery delivery = new Delivery();

    @Valid
    @NotNull
    private Dedup dedup = new Dedup();

    @Valid
    @NotNull
    private Cache cache = new Cache();

    @Valid
    @NotNull
    private Inbound inbound = new Inbound();

    /**
     * Strips a trailing slash so URIs can be concatenated safely.
     */
    public String getBaseUrl() {
        return baseUrl != null && baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Data
    public static class Relay {
        /** First reconnect delay after a dropped connection. */
        private Duration initialBackoff = Duration.ofSeconds(1);
        /** Upper bound for the reconnect delay. */
        private Duration maxBackoff = Duration.ofMinutes(5);
        /** How far back the first subscription reaches when no cursor is stored. */
        private Duration initialLookback = Duration.ofMinutes(3);
        /** Hard limit for the lookback derived from stored cursors. */
        private Duration maxLookback = Duration.ofHours(1);
        /** Timeout for one-shot event queries. */
        private Duration queryTimeout = Duration.ofSeconds(10);
        /** Minimum interval between two cursor writes for the same relay. */
        private Duration cursorFlushInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Delivery {
        @Min(1)
        private int maxAttempts = 8;
        private Duration initialBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofHours(2);
        @Min(1)
        private int maxConcurrencyPerDomain = 4;
        private Duration requestTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Dedup {
        /** How long a processed id is remembered. */
        private Duration retention = Duration.ofHours(24);
        @Min(1)
        private long maxCachedIds = 100_000;
    }

    @Data
    public static class Cache {
        @Min(1)
        private long maxActors = 1_000;
        /** Remote actor documents are re-fetched after this age. */
        private Duration actorTtl = Duration.ofHours(1);
        @Min(1)
        private long maxProfiles = 1_000;
        private Duration profileTtl = Duration.ofMinutes(10);
        @Min(1)
        private long maxEvents = 1_000;
    }

    @Data
    public static class Inbound {
        /** Maximum accepted difference between the Date header and the local clock. */
        private Duration maxClockSkew = Duration.ofHours(12);
        /** Maximum number of unknown ancestors fetched when bridging a reply chain. */
        @Min(1)
        private int maxReplyDepth = 16;
    }
}
