package im.arun.hoteltree.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate counters computed in a single traversal of a tree.
 */
@Value
@Builder
public class TreeStats {
    int totalNodes;
    int depth;
    /** Fillable nodes whose primary content is blank. */
    int emptyFieldCount;
    int categories;
    int fillableItems;
    /** Percentage of fillable nodes with content, 100 when there are none. */
    int completionRate;
}
