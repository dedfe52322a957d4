package org.operaton.nostrpub.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.BigIntegers;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.util.Bech32;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

/**
 * Nostr key handling: event ids, event signatures and the keys the bridge derives for fediverse actors.
 *
 * A fediverse actor's secret key is {@code HMAC-SHA256(secret, actorUri)} reduced into the curve order.
 * It is recomputed whenever the bridge publishes on the actor's behalf and never stored.
 */
@Component
@Slf4j
public class NostrKeys {

    // Plain mapper: the id hash depends on the exact serialization, not on the application's Jackson settings
    private static final ObjectMapper CANONICAL = new ObjectMapper();

    private final byte[] secret;

    public NostrKeys(NostrPubProperties properties) {
        this.secret = properties.getSecret().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Derives the secret key the bridge uses for a fediverse actor.
     *
     * @param actorUri the actor URI, without fragment
     * @return 32-byte secret key
     */
    public byte[] deriveSecretKey(String actorUri) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] digest = mac.doFinal(actorUri.getBytes(StandardCharsets.UTF_8));
            BigInteger scalar = new BigInteger(1, digest).mod(SchnorrSigner.order());
            while (scalar.signum() == 0) {
                digest = mac.doFinal(digest);
                scalar = new BigInteger(1, digest).mod(SchnorrSigner.order());
            }
            return BigIntegers.asUnsignedByteArray(32, scalar);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    /**
     * Public key of the derived identity of a fediverse actor.
     */
    public NativeIdentity derivedIdentity(String actorUri) {
        return NativeIdentity.fromHex(Bech32.toHex(SchnorrSigner.publicKey(deriveSecretKey(actorUri))));
    }

    /**
     * Signs an unsigned event on behalf of a fediverse actor.
     * Sets pubkey, id and sig; everything else is taken from the draft.
     */
    public NostrEvent signAs(String actorUri, NostrEvent draft) {
        return sign(draft, deriveSecretKey(actorUri));
    }

    /**
     * Signs an unsigned event with the given secret key.
     */
    public static NostrEvent sign(NostrEvent draft, byte[] secretKey) {
        String pubkey = Bech32.toHex(SchnorrSigner.publicKey(secretKey));
        NostrEvent withKey = draft.toBuilder().pubkey(pubkey).id(null).sig(null).build();
        String id = computeId(withKey);
        byte[] signature = SchnorrSigner.sign(Bech32.fromHex(id), secretKey);
        return withKey.toBuilder().id(id).sig(Bech32.toHex(signature)).build();
    }

    /**
     * Checks that the id is the hash of the event and that the signature over it is valid.
     */
    public static boolean verify(NostrEvent event) {
        if (event.getId() == null || event.getSig() == null || event.getPubkey() == null) {
            return false;
        }
        try {
            String expectedId = computeId(event);
            if (!expectedId.equals(event.getId())) {
                log.debug("Event id mismatch: claimed {}, computed {}", event.getId(), expectedId);
                return false;
            }
            return SchnorrSigner.verify(
                Bech32.fromHex(event.getId()),
                Bech32.fromHex(event.getPubkey()),
                Bech32.fromHex(event.getSig()));
        } catch (RuntimeException e) {
            log.debug("Malformed event {}: {}", event.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * NIP-01 event id: SHA-256 over {@code [0, pubkey, created_at, kind, tags, content]}.
     */
    public static String computeId(NostrEvent event) {
        List<Object> payload = new ArrayList<>(6);
        payload.add(0);
        payload.add(event.getPubkey());
        payload.add(event.getCreatedAt());
        payload.add(event.getKind());
        payload.add(event.getTags() == null ? List.of() : event.getTags());
        payload.add(event.getContent() == null ? "" : event.getContent());
        try {
            byte[] serialized = CANONICAL.writeValueAsBytes(payload);
            return Bech32.toHex(SchnorrSigner.sha256(serialized));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event for hashing", e);
        }
    }
}
