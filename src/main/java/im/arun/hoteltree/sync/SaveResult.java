package im.arun.hoteltree.sync;

/**
 * Where a save ended up.
 */
public enum SaveResult {
    /** Committed to the remote document store. */
    REMOTE,
    /** Remote store unreachable; the tree was written to the local cache instead. */
    LOCAL_FALLBACK
}
