package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Feature-specific payload attached to a node, discriminated by {@code schemaType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "schemaType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = GenericPayload.class, name = GenericPayload.SCHEMA_TYPE),
    @JsonSubTypes.Type(value = ScheduledEventPayload.class, name = ScheduledEventPayload.SCHEMA_TYPE),
    @JsonSubTypes.Type(value = DiningPayload.class, name = DiningPayload.SCHEMA_TYPE),
    @JsonSubTypes.Type(value = RoomPayload.class, name = RoomPayload.SCHEMA_TYPE)
})
public interface NodePayload {

    String schemaType();
}
