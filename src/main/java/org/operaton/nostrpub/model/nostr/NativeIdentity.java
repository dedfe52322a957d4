package org.operaton.nostrpub.model.nostr;

import lombok.EqualsAndHashCode;
import org.operaton.nostrpub.util.Bech32;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * An immutable Nostr public key (32-byte x-only secp256k1 key).
 * Equality is defined by the normalized lowercase hex form.
 */
@EqualsAndHashCode
public final class NativeIdentity {

    private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-f]{64}$");

    private final String hex;

    private NativeIdentity(String hex) {
        this.hex = hex;
    }

    /**
     * @throws IllegalArgumentException if the value is not a 64 character hex key
     */
    public static NativeIdentity fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Public key cannot be null");
        }
        String normalized = hex.trim().toLowerCase(Locale.ROOT);
        if (!HEX_KEY.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid public key: " + hex);
        }
        return new NativeIdentity(normalized);
    }

    /**
     * Parses an {@code npub1…} or {@code nprofile1…} string, with or without the {@code nostr:} prefix.
     *
     * @throws IllegalArgumentException if the value cannot be decoded
     */
    public static NativeIdentity fromBech32(String value) {
        String stripped = value.startsWith("nostr:") ? value.substring("nostr:".length()) : value;
        Bech32.Decoded decoded = Bech32.decode(stripped);
        switch (decoded.getHrp()) {
            case "npub":
                return fromHex(Bech32.toHex(decoded.getData()));
            case "nprofile":
                return fromHex(Bech32.toHex(Bech32.tlvValue(decoded.getData(), 0)));
            default:
                throw new IllegalArgumentException("Not a public key: " + value);
        }
    }

    public String hex() {
        return hex;
    }

    public String npub() {
        return Bech32.encode("npub", Bech32.fromHex(hex));
    }

    @Override
    public String toString() {
        return npub();
    }
}
