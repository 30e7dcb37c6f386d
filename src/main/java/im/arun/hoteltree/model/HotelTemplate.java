package im.arun.hoteltree.model;

import lombok.Builder;
import lombok.Value;

/**
 * A reusable structural snapshot from which new hotels are seeded.
 */
@Value
@Builder
public class HotelTemplate {
    String id;
    String name;
    String description;
    long createdAt;
    ContentNode data;
}
