package com.jreinhal.lectern.partition;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Deterministic partition names: {@code chat_<user>_<session>_<digest>}. The readable
 * parts are sanitized to {@code [A-Za-z0-9_-]} and shortened; the digest over the raw
 * pair keeps names distinct when sanitizing maps two pairs to the same text.
 */
public final class PartitionNames {
    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9_-]");
    private static final int MAX_PART_LENGTH = 24;
    private static final int DIGEST_HEX_LENGTH = 16;

    private PartitionNames() {
    }

    public static String partitionId(String userId, String sessionId) {
        return "chat_" + readable(userId) + "_" + readable(sessionId) + "_" + digest(userId, sessionId);
    }

    static String readable(String value) {
        String safe = UNSAFE.matcher(value).replaceAll("_");
        return safe.length() > MAX_PART_LENGTH ? safe.substring(0, MAX_PART_LENGTH) : safe;
    }

    private static String digest(String userId, String sessionId) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            sha.update(userId.getBytes(StandardCharsets.UTF_8));
            sha.update((byte) 0);
            sha.update(sessionId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(sha.digest()).substring(0, DIGEST_HEX_LENGTH);
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
