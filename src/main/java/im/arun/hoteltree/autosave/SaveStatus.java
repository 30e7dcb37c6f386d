package im.arun.hoteltree.autosave;

public enum SaveStatus {
    /** Nothing to save. */
    IDLE,
    /** Unsaved edits, waiting for the quiet period to pass. */
    DIRTY,
    SAVING,
    SAVED,
    /** Last save did not reach the remote store (or failed outright). */
    ERROR
}
