package im.arun.hoteltree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Index entry used to list hotels without loading their trees.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HotelSummary {

    public static final String UNTITLED = "Untitled Hotel";

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    public static HotelSummary of(String id, String name) {
        return new HotelSummary(id, name == null || name.isBlank() ? UNTITLED : name);
    }
}
