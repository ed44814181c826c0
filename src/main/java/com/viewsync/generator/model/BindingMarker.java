package com.viewsync.generator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional annotation on a template node that controls how (and whether) it is bound.
 */
@Value
@Builder(toBuilder = true)
public class BindingMarker {

    /**
     * Field name to use instead of the node name. Blank means "use the node name".
     */
    @Builder.Default
    String fieldNameOverride = "";

    /**
     * When set, descendants of the marked node are excluded from discovery.
     */
    boolean ignoreSubtree;

    @Builder.Default
    TargetKind targetKind = TargetKind.AUTO;

    /**
     * Capability type used when {@link #targetKind} is {@link TargetKind#CAPABILITY}.
     */
    String capabilityTypeName;

    /**
     * Picks among several same-typed capabilities on the node.
     */
    int capabilityIndex;

    public boolean hasFieldNameOverride() {
        return fieldNameOverride != null && !fieldNameOverride.isBlank();
    }
}
