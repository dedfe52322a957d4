package org.operaton.nostrpub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.exception.TransportTransientException;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.security.NostrKeys;
import org.operaton.nostrpub.store.BridgeStore;
import org.operaton.nostrpub.util.ActivityJson;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import static org.operaton.nostrpub.util.ActivityJson.string;

/**
 * Fetches actor documents and objects from remote ActivityPub servers.
 *
 * Fetching never persists anything: inbound processing verifies a signature against a freshly
 * fetched key first and only then calls {@link #remember(RemoteIdentity)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RemoteActorResolver {

    private static final String ACTIVITY_JSON = "application/activity+json";
    private static final String LD_JSON = "application/ld+json; profile=\"https://www.w3.org/ns/activitystreams\"";
    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() { };

    private final RestTemplate restTemplate;
    private final BridgeCache cache;
    private final BridgeStore store;
    private final NostrKeys nostrKeys;
    private final NostrPubProperties properties;
    private final Clock clock;

    /**
     * Actor known with its public key, from cache or store. Stale store entries are not returned.
     * A store hit is not cached here; callers cache it once they trust it.
     */
    public Optional<RemoteIdentity> cached(String actorUri) {
        String normalized = ActivityJson.stripFragment(actorUri);
        Optional<RemoteIdentity> cached = cache.remoteActor(normalized);
        if (cached.isPresent() && cached.get().getPublicKey() != null) {
            return cached;
        }
        return store.findRemoteIdentity(normalized)
            .filter(identity -> identity.getPublicKey() != null)
            .filter(identity -> identity.getLastFetchedAt() != null)
            .filter(identity -> identity.getLastFetchedAt()
                .isAfter(clock.instant().minus(properties.getCache().getActorTtl())));
    }

    /**
     * Fetches and parses an actor document without storing it.
     *
     * @throws TransportTransientException if the server cannot be reached or answers with an error
     * @throws BridgeException if the document is no usable actor
     */
    public RemoteIdentity fetch(String actorUri) {
        String normalized = ActivityJson.stripFragment(actorUri);
        log.debug("Fetching remote actor: {}", normalized);
        Map<String, Object> actorData = fetchObject(normalized);

        String id = string(actorData, "id");
        if (id != null && !ActivityJson.stripFragment(id).equals(normalized)) {
            throw new BridgeException("Actor document id " + id + " does not match " + normalized);
        }
        String inboxUrl = string(actorData, "inbox");
        if (inboxUrl == null) {
            throw new BridgeException("Actor has no inbox: " + normalized);
        }

        Optional<RemoteIdentity> known = store.findRemoteIdentity(normalized);
        RemoteIdentity identity = known.map(existing -> existing.toBuilder().build())
            .orElseGet(() -> RemoteIdentity.builder()
                .actorUri(normalized)
                .pubkey(nostrKeys.derivedIdentity(normalized).hex())
                .build());

        identity.setDomain(ActivityJson.host(normalized));
        identity.setPreferredUsername(extractUsername(normalized, actorData));
        identity.setInboxUrl(inboxUrl);
        identity.setSharedInboxUrl(extractSharedInbox(actorData));
        identity.setPublicKey(extractPublicKey(actorData));
        identity.setPublicKeyId(extractPublicKeyId(actorData));
        identity.setDisplayName(string(actorData, "name"));
        identity.setSummary(string(actorData, "summary"));
        identity.setAvatarUrl(extractAvatarUrl(actorData));
        identity.setLastFetchedAt(clock.instant());
        return identity;
    }

    /**
     * Persists a fetched actor and caches it.
     */
    public RemoteIdentity remember(RemoteIdentity identity) {
        RemoteIdentity saved = store.saveRemoteIdentity(identity);
        cache.putRemoteActor(saved);
        return saved;
    }

    /**
     * Puts an already stored actor into the cache.
     */
    public void warm(RemoteIdentity identity) {
        cache.putRemoteActor(identity);
    }

    /**
     * Cached actor, or a freshly fetched and remembered one.
     */
    public RemoteIdentity resolve(String actorUri) {
        Optional<RemoteIdentity> cached = cached(actorUri);
        if (cached.isPresent()) {
            warm(cached.get());
            return cached.get();
        }
        return remember(fetch(actorUri));
    }

    /**
     * GETs an ActivityStreams object.
     *
     * @throws TransportTransientException on I/O errors and non-2xx answers
     */
    public Map<String, Object> fetchObject(String uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, ACTIVITY_JSON + ", " + LD_JSON);
        HttpEntity<Void> entity = new HttpEntity<>(headers);
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(uri, HttpMethod.GET, entity, MAP_TYPE);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new TransportTransientException("GET " + uri + " returned " + response.getStatusCode().value());
            }
            Map<String, Object> body = response.getBody();
            if (body == null) {
                throw new TransportTransientException("Empty response from: " + uri);
            }
            return body;
        } catch (RestClientException e) {
            throw new TransportTransientException("Failed to fetch " + uri, e);
        }
    }

    private static String extractUsername(String actorUri, Map<String, Object> actorData) {
        String preferredUsername = string(actorData, "preferredUsername");
        if (preferredUsername != null) {
            return preferredUsername;
        }
        return actorUri.substring(actorUri.lastIndexOf('/') + 1);
    }

    private static String extractSharedInbox(Map<String, Object> actorData) {
        return string(ActivityJson.asMap(actorData.get("endpoints")), "sharedInbox");
    }

    private static String extractPublicKey(Map<String, Object> actorData) {
        String pem = string(firstPublicKey(actorData), "publicKeyPem");
        if (pem == null) {
            throw new BridgeException("No public key found in actor data");
        }
        return pem;
    }

    private static String extractPublicKeyId(Map<String, Object> actorData) {
        return string(firstPublicKey(actorData), "id");
    }

    private static Map<String, Object> firstPublicKey(Map<String, Object> actorData) {
        return ActivityJson.objects(actorData, "publicKey").stream().findFirst().orElse(null);
    }

    private static String extractAvatarUrl(Map<String, Object> actorData) {
        Map<String, Object> icon = ActivityJson.objects(actorData, "icon").stream().findFirst().orElse(null);
        return icon == null ? null : ActivityJson.idOf(icon.get("url"));
    }
}
