package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomPayload implements NodePayload {

    public static final String SCHEMA_TYPE = "room";

    @JsonProperty("capacity")
    Integer capacity;

    @JsonProperty("bedType")
    String bedType;

    @JsonProperty("sizeSquareMeters")
    Integer sizeSquareMeters;

    @JsonProperty("view")
    String view;

    @JsonProperty("amenities")
    @Singular
    List<String> amenities;

    @Override
    public String schemaType() {
        return SCHEMA_TYPE;
    }
}
