package com.example.tutor.ragservice.chunking;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-derived identifiers: chunk ids, document ids and dedup fingerprints.
 */
public final class ContentHashing {

    private static final int ID_HEX_LENGTH = 16;
    private static final int FINGERPRINT_PREFIX = 100;

    private ContentHashing() {
    }

    /** First 16 hex chars of SHA-256("documentId:content"). */
    public static String chunkId(String documentId, String content) {
        return sha256Hex(documentId + ":" + content).substring(0, ID_HEX_LENGTH);
    }

    public static String documentId(String source) {
        return "doc_" + sha256Hex(source).substring(0, ID_HEX_LENGTH);
    }

    /** Hash of the first 100 characters, used to drop near-duplicate passages. */
    public static String fingerprint(String content) {
        String c = content == null ? "" : content;
        return sha256Hex(c.length() > FINGERPRINT_PREFIX ? c.substring(0, FINGERPRINT_PREFIX) : c);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
