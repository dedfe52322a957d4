package org.operaton.nostrpub.security;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * BIP-340 Schnorr signatures over secp256k1, as used by Nostr events.
 *
 * Reference: https://github.com/bitcoin/bips/blob/master/bip-0340.mediawiki
 */
public final class SchnorrSigner {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECCurve CURVE = CURVE_PARAMS.getCurve();
    private static final ECPoint G = CURVE_PARAMS.getG();
    private static final BigInteger N = CURVE_PARAMS.getN();
    private static final BigInteger P = CURVE.getField().getCharacteristic();
    private static final SecureRandom RANDOM = new SecureRandom();

    private SchnorrSigner() {
    }

    /**
     * Curve order, the exclusive upper bound for secret keys.
     */
    public static BigInteger order() {
        return N;
    }

    /**
     * Computes the 32-byte x-only public key of a secret key.
     *
     * @throws IllegalArgumentException if the secret key is out of range
     */
    public static byte[] publicKey(byte[] secretKey) {
        BigInteger d = toScalar(secretKey);
        ECPoint point = new FixedPointCombMultiplier().multiply(G, d).normalize();
        return bytes(point.getAffineXCoord().toBigInteger());
    }

    /**
     * Signs a 32-byte message with fresh auxiliary randomness.
     */
    public static byte[] sign(byte[] message, byte[] secretKey) {
        byte[] aux = new byte[32];
        RANDOM.nextBytes(aux);
        return sign(message, secretKey, aux);
    }

    /**
     * Signs a 32-byte message using the given auxiliary randomness.
     */
    public static byte[] sign(byte[] message, byte[] secretKey, byte[] aux) {
        BigInteger d0 = toScalar(secretKey);
        ECPoint publicPoint = new FixedPointCombMultiplier().multiply(G, d0).normalize();
        BigInteger d = hasEvenY(publicPoint) ? d0 : N.subtract(d0);
        byte[] px = bytes(publicPoint.getAffineXCoord().toBigInteger());

        byte[] t = xor(bytes(d), taggedHash("BIP0340/aux", aux));
        BigInteger k0 = new BigInteger(1, taggedHash("BIP0340/nonce", Arrays.concatenate(t, px, message))).mod(N);
        if (k0.signum() == 0) {
            throw new IllegalStateException("Schnorr nonce is zero");
        }
        ECPoint r = new FixedPointCombMultiplier().multiply(G, k0).normalize();
        BigInteger k = hasEvenY(r) ? k0 : N.subtract(k0);
        byte[] rx = bytes(r.getAffineXCoord().toBigInteger());

        BigInteger e = challenge(rx, px, message);
        byte[] s = bytes(k.add(e.multiply(d)).mod(N));
        return Arrays.concatenate(rx, s);
    }

    /**
     * Verifies a 64-byte signature of a 32-byte message against an x-only public key.
     * Malformed keys or signatures verify as {@code false}.
     */
    public static boolean verify(byte[] message, byte[] publicKey, byte[] signature) {
        if (publicKey.length != 32 || signature.length != 64) {
            return false;
        }
        ECPoint pk;
        try {
            pk = liftX(publicKey);
        } catch (IllegalArgumentException e) {
            return false;
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(P) >= 0 || s.compareTo(N) >= 0) {
            return false;
        }
        BigInteger e = challenge(Arrays.copyOfRange(signature, 0, 32), publicKey, message);
        ECPoint point = G.multiply(s).subtract(pk.multiply(e)).normalize();
        if (point.isInfinity() || !hasEvenY(point)) {
            return false;
        }
        return point.getAffineXCoord().toBigInteger().equals(r);
    }

    /**
     * SHA-256 of the given data.
     */
    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static BigInteger challenge(byte[] rx, byte[] px, byte[] message) {
        return new BigInteger(1, taggedHash("BIP0340/challenge", Arrays.concatenate(rx, px, message))).mod(N);
    }

    private static ECPoint liftX(byte[] x) {
        // Compressed encoding with prefix 0x02 selects the even y coordinate
        byte[] encoded = new byte[33];
        encoded[0] = 0x02;
        System.arraycopy(x, 0, encoded, 1, 32);
        return CURVE.decodePoint(encoded).normalize();
    }

    private static BigInteger toScalar(byte[] secretKey) {
        if (secretKey == null || secretKey.length != 32) {
            throw new IllegalArgumentException("Secret key must be 32 bytes");
        }
        BigInteger d = new BigInteger(1, secretKey);
        if (d.signum() == 0 || d.compareTo(N) >= 0) {
            throw new IllegalArgumentException("Secret key out of range");
        }
        return d;
    }

    private static boolean hasEvenY(ECPoint point) {
        return !point.getAffineYCoord().toBigInteger().testBit(0);
    }

    private static byte[] taggedHash(String tag, byte[] message) {
        byte[] tagHash = sha256(tag.getBytes(StandardCharsets.UTF_8));
        return sha256(Arrays.concatenate(tagHash, tagHash, message));
    }

    private static byte[] bytes(BigInteger value) {
        return BigIntegers.asUnsignedByteArray(32, value);
    }

    private static byte[] xor(byte[] a, byte[] b) {
        byte[] result = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (byte) (a[i] ^ b[i]);
        }
        return result;
    }
}
