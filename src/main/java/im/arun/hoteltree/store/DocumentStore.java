package im.arun.hoteltree.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Remote document database organised in collections of JSON documents. Collection paths may be
 * nested ({@code hotels/abc/nodes}).
 */
public interface DocumentStore {

    Optional<ObjectNode> get(String collectionPath, String documentId) throws RemoteStoreException;

    /**
     * All documents of a collection with all their fields.
     */
    List<StoredDocument> list(String collectionPath) throws RemoteStoreException;

    /**
     * All documents of a collection, each carrying only the fields named in {@code fieldMask}.
     */
    List<StoredDocument> list(String collectionPath, List<String> fieldMask) throws RemoteStoreException;

    List<String> listIds(String collectionPath) throws RemoteStoreException;

    /**
     * Opens a batch whose writes are applied all-or-nothing on {@link WriteBatch#commit()}.
     */
    WriteBatch batch();
}
