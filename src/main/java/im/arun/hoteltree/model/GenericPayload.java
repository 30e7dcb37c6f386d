package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Untyped payload: an open map of JSON values for features that have no dedicated schema yet.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenericPayload implements NodePayload {

    public static final String SCHEMA_TYPE = "generic";

    @JsonProperty("fields")
    @Singular
    Map<String, JsonNode> fields;

    @Override
    public String schemaType() {
        return SCHEMA_TYPE;
    }
}
