package com.custodia.auditchain;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes content hashes and links entries into a chain.
 */
public final class HashChainer {

    /**
     * {@code previousHash} of the first entry of every tenant. Not valid hex, so it can never
     * collide with a real digest.
     */
    public static final String GENESIS = "GENESIS";

    private static final HexFormat HEX = HexFormat.of();

    private HashChainer() {
        // utility class
    }

    /**
     * SHA-256 of the given bytes as 64 lowercase hex characters.
     */
    public static String hash(byte[] canonicalBytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(canonicalBytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String genesisHash() {
        return GENESIS;
    }

    /**
     * Content hash of an entry: {@code hash(CanonicalEncoder.encode(fields))}.
     */
    public static String chain(ChainedFields fields) {
        return hash(CanonicalEncoder.encode(fields));
    }
}
