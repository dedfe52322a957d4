package org.operaton.nostrpub.util;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.util.Locale;

/**
 * Bech32 codec (BIP-173) for the NIP-19 entities {@code npub}, {@code nsec}, {@code note} and {@code nprofile}.
 * Unlike BIP-173 no 90 character limit is applied, since TLV entities are longer.
 *
 * Spec: https://github.com/nostr-protocol/nips/blob/master/19.md
 */
public final class Bech32 {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};

    private Bech32() {
    }

    /**
     * Result of decoding: human readable part and 8-bit payload.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Decoded {
        private final String hrp;
        private final byte[] data;
    }

    public static String encode(String hrp, byte[] payload) {
        byte[] values = convertBits(payload, 8, 5, true);
        byte[] checksum = createChecksum(hrp, values);
        StringBuilder sb = new StringBuilder(hrp.length() + 1 + values.length + checksum.length);
        sb.append(hrp).append('1');
        for (byte b : values) {
            sb.append(CHARSET.charAt(b));
        }
        for (byte b : checksum) {
            sb.append(CHARSET.charAt(b));
        }
        return sb.toString();
    }

    /**
     * @throws IllegalArgumentException on malformed input or checksum mismatch
     */
    public static Decoded decode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Bech32 value cannot be empty");
        }
        if (!value.equals(value.toLowerCase(Locale.ROOT)) && !value.equals(value.toUpperCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Mixed case bech32 value");
        }
        String lower = value.toLowerCase(Locale.ROOT);
        int separator = lower.lastIndexOf('1');
        if (separator < 1 || separator + 7 > lower.length()) {
            throw new IllegalArgumentException("Invalid bech32 separator position");
        }
        String hrp = lower.substring(0, separator);
        byte[] values = new byte[lower.length() - separator - 1];
        for (int i = 0; i < values.length; i++) {
            int index = CHARSET.indexOf(lower.charAt(separator + 1 + i));
            if (index < 0) {
                throw new IllegalArgumentException("Invalid bech32 character");
            }
            values[i] = (byte) index;
        }
        if (polymod(concat(expandHrp(hrp), values)) != 1) {
            throw new IllegalArgumentException("Invalid bech32 checksum");
        }
        byte[] data = new byte[values.length - 6];
        System.arraycopy(values, 0, data, 0, data.length);
        return new Decoded(hrp, convertBits(data, 5, 8, false));
    }

    /**
     * Returns the value of the first TLV record of the given type.
     */
    public static byte[] tlvValue(byte[] tlv, int type) {
        int i = 0;
        while (i + 2 <= tlv.length) {
            int t = tlv[i] & 0xff;
            int length = tlv[i + 1] & 0xff;
            if (i + 2 + length > tlv.length) {
                break;
            }
            if (t == type) {
                byte[] value = new byte[length];
                System.arraycopy(tlv, i + 2, value, 0, length);
                return value;
            }
            i += 2 + length;
        }
        throw new IllegalArgumentException("TLV record not found: " + type);
    }

    public static String toHex(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    public static byte[] fromHex(String hex) {
        return Hex.decode(hex);
    }

    private static int polymod(byte[] values) {
        int chk = 1;
        for (byte v : values) {
            int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ (v & 0xff);
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) == 1) {
                    chk ^= GENERATOR[i];
                }
            }
        }
        return chk;
    }

    private static byte[] expandHrp(String hrp) {
        int length = hrp.length();
        byte[] expanded = new byte[length * 2 + 1];
        for (int i = 0; i < length; i++) {
            int c = hrp.charAt(i) & 0x7f;
            expanded[i] = (byte) ((c >>> 5) & 0x07);
            expanded[i + length + 1] = (byte) (c & 0x1f);
        }
        expanded[length] = 0;
        return expanded;
    }

    private static byte[] createChecksum(String hrp, byte[] values) {
        byte[] enc = concat(concat(expandHrp(hrp), values), new byte[6]);
        int mod = polymod(enc) ^ 1;
        byte[] checksum = new byte[6];
        for (int i = 0; i < 6; i++) {
            checksum[i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
        }
        return checksum;
    }

    private static byte[] convertBits(byte[] data, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxValue = (1 << toBits) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * fromBits / toBits + 1);
        for (byte b : data) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new IllegalArgumentException("Invalid data range for bit conversion");
            }
            acc = (acc << fromBits) | value;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxValue);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (toBits - bits)) & maxValue);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxValue) != 0) {
            throw new IllegalArgumentException("Invalid padding in bech32 data");
        }
        return out.toByteArray();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] result = new byte[a.length + b.length];
        System.arraycopy(a, 0, result, 0, a.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
