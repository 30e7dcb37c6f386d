package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One edit proposed by the AI architect.
 * <p>
 * {@code targetId} names the parent for {@code add} and the node itself for {@code update} and
 * {@code delete}. {@code data} is a partial node in stored-document JSON form.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StructuralAction {

    public static final String ADD = "add";
    public static final String UPDATE = "update";
    public static final String DELETE = "delete";

    @JsonProperty("type")
    private String type;

    @JsonProperty("targetId")
    private String targetId;

    @JsonProperty("data")
    private JsonNode data;

    @JsonProperty("reason")
    private String reason;
}
