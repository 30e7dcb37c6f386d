package im.arun.hoteltree.model;

import java.util.Locale;

/**
 * Where a moved subtree lands relative to its target node.
 */
public enum MovePosition {
    BEFORE,
    AFTER,
    INSIDE;

    public static MovePosition parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Move position must not be null");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
