package org.operaton.nostrpub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.exception.SignatureInvalidException;
import org.operaton.nostrpub.exception.TransportTransientException;
import org.operaton.nostrpub.model.activitypub.ActivityType;
import org.operaton.nostrpub.model.bridge.InboundRequest;
import org.operaton.nostrpub.model.entity.RemoteIdentity;
import org.operaton.nostrpub.security.HttpSignatureValidator;
import org.operaton.nostrpub.util.ActivityJson;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies incoming inbox requests before anything is bridged.
 *
 * <p>A request passes when the body digest matches, the Date header is recent, the signing key belongs to the
 * activity's actor and the HTTP signature verifies against that actor's key. A cached key is tried first; on
 * failure the actor is fetched again to pick up rotated keys. Nothing is stored or cached before the signature
 * has been verified.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboxProcessor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final HttpSignatureValidator signatureValidator;
    private final RemoteActorResolver actorResolver;
    private final BridgeUris uris;

    /**
     * An activity whose sender has been authenticated.
     */
    @Value
    public static class VerifiedActivity {
        /** Empty for activity types the bridge does not handle */
        Optional<ActivityType> type;
        Map<String, Object> activity;
        RemoteIdentity actor;
        /** True if the actor document was fetched for this request */
        boolean actorRefreshed;

        public String getId() {
            return ActivityJson.string(activity, "id");
        }
    }

    /**
     * Parses and authenticates an inbox request.
     *
     * @return the verified activity, or empty if the request is harmless but not worth processing
     * @throws BridgeException if the body is no activity
     * @throws SignatureInvalidException if the sender cannot be authenticated
     */
    public Optional<VerifiedActivity> verify(InboundRequest request) {
        Map<String, Object> activity = parse(request.getBody());
        String actorUri = ActivityJson.idOf(activity.get("actor"));
        if (actorUri == null) {
            throw new BridgeException("Activity has no actor");
        }
        actorUri = ActivityJson.stripFragment(actorUri);
        String type = ActivityJson.string(activity, "type");

        // Deleted accounts announce themselves and can no longer be fetched to verify
        if ("Delete".equals(type) && actorUri.equals(ActivityJson.idOf(activity.get("object")))) {
            log.debug("Ignoring account deletion of {}", actorUri);
            return Optional.empty();
        }
        if (uris.isLocal(actorUri)) {
            throw new SignatureInvalidException("Activity claims a bridge actor: " + actorUri);
        }

        HttpSignatureValidator.ParsedSignature signature = signatureValidator.parse(request.header("signature"));
        if (!ActivityJson.stripFragment(signature.keyId).equals(actorUri) && !signature.ownerUri().equals(actorUri)) {
            throw new SignatureInvalidException("Key " + signature.keyId + " does not belong to " + actorUri);
        }
        if (request.getBody() != null && request.getBody().length > 0
            && !signatureValidator.digestMatches(request.header("digest"), request.getBody())) {
            throw new SignatureInvalidException("Digest does not match body");
        }
        if (!signatureValidator.dateWithinSkew(request.header("date"))) {
            throw new SignatureInvalidException("Date header missing or outside the accepted skew");
        }

        String activityId = ActivityJson.string(activity, "id");
        if (activityId != null && !sameHost(activityId, actorUri)) {
            throw new SignatureInvalidException("Activity " + activityId + " is not hosted by " + actorUri);
        }

        Map<String, String> signedHeaders = new HashMap<>(request.getHeaders());
        signedHeaders.put("(request-target)", request.requestTarget());

        RemoteIdentity actor;
        boolean refreshed = false;
        Optional<RemoteIdentity> cached = actorResolver.cached(actorUri);
        if (cached.isPresent() && signatureValidator.verify(signature, signedHeaders, cached.get().getPublicKey())) {
            actor = cached.get();
            actorResolver.warm(actor);
        } else {
            RemoteIdentity fetched = fetchForVerification(actorUri);
            if (!signatureValidator.verify(signature, signedHeaders, fetched.getPublicKey())) {
                throw new SignatureInvalidException("Invalid signature from " + actorUri);
            }
            actor = actorResolver.remember(fetched);
            refreshed = true;
        }

        log.debug("Verified {} from {}", type, actorUri);
        return Optional.of(new VerifiedActivity(ActivityType.fromValue(type), activity, actor, refreshed));
    }

    private RemoteIdentity fetchForVerification(String actorUri) {
        try {
            return actorResolver.fetch(actorUri);
        } catch (TransportTransientException | BridgeException e) {
            throw new SignatureInvalidException("Cannot fetch key of " + actorUri, e);
        }
    }

    private Map<String, Object> parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new BridgeException("Empty request body");
        }
        try {
            Map<String, Object> activity = objectMapper.readValue(body, MAP_TYPE);
            if (activity == null) {
                throw new BridgeException("Request body is no JSON object");
            }
            return activity;
        } catch (JsonProcessingException e) {
            throw new BridgeException("Malformed activity JSON", e);
        } catch (IOException e) {
            throw new BridgeException("Cannot read activity", e);
        }
    }

    private static boolean sameHost(String a, String b) {
        String hostA = ActivityJson.host(a);
        return hostA != null && hostA.equalsIgnoreCase(ActivityJson.host(b));
    }
}
