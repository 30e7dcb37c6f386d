package im.arun.hoteltree.model;

import lombok.Value;

import java.util.List;

/**
 * Result of applying a list of structural actions: the final tree, how many actions took effect
 * and a message for each one that did not.
 */
@Value
public class ApplyOutcome {
    ContentNode tree;
    int applied;
    List<String> failures;
}
