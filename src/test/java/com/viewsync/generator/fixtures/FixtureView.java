package com.viewsync.generator.fixtures;

import com.viewsync.generator.model.Capability;

/**
 * Stands in for a compiled, generated view.
 */
public abstract class FixtureView implements Capability {

    private Object _inheritedSlot;

    @Override
    public String getTypeName() {
        return getClass().getName();
    }

    public Object getInheritedSlot() {
        return _inheritedSlot;
    }
}
