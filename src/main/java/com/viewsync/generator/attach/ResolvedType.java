package com.viewsync.generator.attach;

import com.viewsync.generator.model.Capability;

/**
 * A loadable type as seen by the {@link TypeRegistry}.
 */
public interface ResolvedType {

    String getName();

    /**
     * Whether instances can be attached to a node as a capability.
     */
    boolean isBehaviour();

    Capability newInstance();
}
