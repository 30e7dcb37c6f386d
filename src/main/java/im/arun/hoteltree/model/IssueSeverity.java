package im.arun.hoteltree.model;

public enum IssueSeverity {
    CRITICAL,
    WARNING,
    OPTIMIZATION
}
