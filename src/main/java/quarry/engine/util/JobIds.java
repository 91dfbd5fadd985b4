package quarry.engine.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Job id generation. Child ids are derived from (parent, key) so that a
 * redelivered handler recreates the same children instead of duplicating them.
 */
public final class JobIds {

    private JobIds() {
    }

    public static String generate() {
        return "job-" + UUID.randomUUID();
    }

    public static String step(String managerId, int index) {
        return managerId + "-step-" + index;
    }

    /** Stable id for the child of {@code parentId} identified by {@code key} */
    public static String child(String parentId, String key) {
        return parentId + "-" + digest(key).substring(0, 12);
    }

    public static String digest(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
