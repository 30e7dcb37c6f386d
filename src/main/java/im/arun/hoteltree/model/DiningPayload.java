package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Menu and restaurant data.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiningPayload implements NodePayload {

    public static final String SCHEMA_TYPE = "dining";

    @JsonProperty("price")
    String price;

    @JsonProperty("calories")
    String calories;

    @JsonProperty("isPaid")
    Boolean paid;

    @JsonProperty("tags")
    @Singular
    List<String> tags;

    @Override
    public String schemaType() {
        return SCHEMA_TYPE;
    }
}
