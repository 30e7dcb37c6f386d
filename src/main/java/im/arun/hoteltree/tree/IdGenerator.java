package im.arun.hoteltree.tree;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client-side id generation. Ids look like {@code cat-lq2x9k4a-1f-3a7c}: prefix, creation time,
 * process-wide sequence and a random suffix, all base 36.
 */
public final class IdGenerator {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private IdGenerator() {}

    public static String generate() {
        return generate("node");
    }

    public static String generate(String prefix) {
        String safePrefix = prefix == null || prefix.isBlank() ? "node" : prefix;
        return safePrefix
                + "-" + Long.toString(System.currentTimeMillis(), 36)
                + "-" + Long.toString(SEQUENCE.incrementAndGet(), 36)
                + "-" + Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36), 36);
    }

    /**
     * Prefix derived from a node kind: its first three characters, e.g. {@code cat} for category.
     */
    public static String prefixFor(String kind) {
        if (kind == null || kind.isBlank()) {
            return "node";
        }
        return kind.length() <= 3 ? kind : kind.substring(0, 3);
    }
}
