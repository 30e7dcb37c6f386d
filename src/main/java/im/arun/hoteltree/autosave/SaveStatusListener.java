package im.arun.hoteltree.autosave;

/**
 * Notified on every save status change. Called while the scheduler holds its lock, so
 * implementations must return quickly and must not call back into the scheduler.
 */
@FunctionalInterface
public interface SaveStatusListener {
    void onStatusChange(SaveStatus previous, SaveStatus current);
}
