package com.peerlink.core.identity;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * {@code did:key} encoding of Ed25519 public keys: {@code did:key:z} followed by the base58btc
 * encoding of the multicodec prefix {@code 0xed 0x01} and the raw 32-byte key.
 */
public final class DidKey {
    private DidKey() {
    }

    public static final String PREFIX = "did:key:z";

    private static final byte[] ED25519_MULTICODEC = {(byte) 0xed, 0x01};
    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);

    public static String fromEd25519PublicKey(byte[] rawPublicKey) {
        if (rawPublicKey.length != 32) {
            throw new IllegalArgumentException("Ed25519 public key must be 32 bytes, got " + rawPublicKey.length);
        }
        byte[] prefixed = new byte[ED25519_MULTICODEC.length + rawPublicKey.length];
        System.arraycopy(ED25519_MULTICODEC, 0, prefixed, 0, ED25519_MULTICODEC.length);
        System.arraycopy(rawPublicKey, 0, prefixed, ED25519_MULTICODEC.length, rawPublicKey.length);
        return PREFIX + encodeBase58(prefixed);
    }

    /**
     * Extracts the raw public key from a {@code did:key} Ed25519 DID.
     */
    public static byte[] toEd25519PublicKey(String did) {
        if (did == null || !did.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not a base58btc did:key: " + did);
        }
        byte[] decoded = decodeBase58(did.substring(PREFIX.length()));
        if (decoded.length != 34 || decoded[0] != ED25519_MULTICODEC[0] || decoded[1] != ED25519_MULTICODEC[1]) {
            throw new IllegalArgumentException("Not an Ed25519 did:key: " + did);
        }
        byte[] raw = new byte[32];
        System.arraycopy(decoded, 2, raw, 0, 32);
        return raw;
    }

    static String encodeBase58(byte[] input) {
        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(divRem[1].intValue()));
            value = divRem[0];
        }
        // leading zero bytes map to leading '1's
        for (int i = 0; i < input.length && input[i] == 0; i++) {
            sb.append(ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }

    static byte[] decodeBase58(String input) {
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < input.length(); i++) {
            int digit = ALPHABET.indexOf(input.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base58 character '" + input.charAt(i) + "'");
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }

        byte[] magnitude = value.toByteArray();
        int stripSign = magnitude.length > 1 && magnitude[0] == 0 ? 1 : 0;
        if (value.signum() == 0) {
            magnitude = new byte[0];
            stripSign = 0;
        }
        int leadingZeros = 0;
        while (leadingZeros < input.length() && input.charAt(leadingZeros) == ALPHABET.charAt(0)) {
            leadingZeros++;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < leadingZeros; i++) {
            out.write(0);
        }
        out.write(magnitude, stripSign, magnitude.length - stripSign);
        return out.toByteArray();
    }
}
