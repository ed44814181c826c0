package com.viewsync.generator.model;

/**
 * What a {@link BindingMarker} exports from its node.
 */
public enum TargetKind {

    /**
     * Pick the first interactive or display capability present, else the container, else the node.
     */
    AUTO,

    /**
     * A named capability type, disambiguated by index.
     */
    CAPABILITY,

    /**
     * The node's layout container capability.
     */
    CONTAINER,

    /**
     * The node reference itself.
     */
    NODE_ONLY;

    public static TargetKind fromText(String text) {
        if (text == null || text.isBlank()) {
            return AUTO;
        }
        String normalized = text.trim().toUpperCase().replace('-', '_');
        return switch (normalized) {
            case "CAPABILITY", "COMPONENT" -> CAPABILITY;
            case "CONTAINER" -> CONTAINER;
            case "NODE", "NODE_ONLY", "NODEONLY" -> NODE_ONLY;
            case "AUTO" -> AUTO;
            default -> throw new IllegalArgumentException("Unknown target kind: " + text);
        };
    }
}
