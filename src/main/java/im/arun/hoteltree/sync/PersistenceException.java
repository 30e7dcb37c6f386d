package im.arun.hoteltree.sync;

/**
 * Local persistence failed (disk full, permissions). Unlike remote failures there is no further
 * fallback, so this is raised to the caller.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
