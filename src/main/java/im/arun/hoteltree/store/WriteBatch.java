package im.arun.hoteltree.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Group of upserts and deletes committed atomically.
 */
public interface WriteBatch {

    /** Creates or fully replaces the document. */
    WriteBatch set(String collectionPath, String documentId, ObjectNode fields);

    WriteBatch delete(String collectionPath, String documentId);

    int size();

    void commit() throws RemoteStoreException;
}
