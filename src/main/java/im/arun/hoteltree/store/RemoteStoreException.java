package im.arun.hoteltree.store;

/**
 * The remote document store could not be reached or refused the request (network, permission,
 * quota, malformed response).
 */
public class RemoteStoreException extends Exception {
    private final int statusCode;

    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public RemoteStoreException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
