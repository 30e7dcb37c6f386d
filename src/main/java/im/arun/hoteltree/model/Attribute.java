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
 * Ad-hoc structured fact attached to a node, e.g. "Working Hours" = "09:00 - 18:00".
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Attribute {

    @JsonProperty("id")
    String id;

    @JsonProperty("key")
    String key;

    @JsonProperty("value")
    String value;

    /** One of {@code text}, {@code boolean}, {@code number}, {@code select}. */
    @JsonProperty("type")
    String kind;

    /** Allowed values when {@code kind} is {@code select}. */
    @JsonProperty("options")
    @Singular
    List<String> options;
}
