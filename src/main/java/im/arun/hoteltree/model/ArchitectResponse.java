package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchitectResponse {

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("actions")
    private List<StructuralAction> actions = new ArrayList<>();
}
