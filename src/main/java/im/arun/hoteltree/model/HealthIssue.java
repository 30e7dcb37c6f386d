package im.arun.hoteltree.model;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory finding about a node. Never blocks an edit; {@code fix} is an optional patch the user
 * may apply to resolve it.
 */
@Value
@Builder
public class HealthIssue {
    String id;
    String nodeId;
    String nodeName;
    IssueSeverity severity;
    String message;
    HealthFix fix;

    @Value
    public static class HealthFix {
        String description;
        NodePatch patch;
    }
}
