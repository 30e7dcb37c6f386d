package im.arun.hoteltree.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

@Value
public class StoredDocument {
    String id;
    ObjectNode fields;
}
