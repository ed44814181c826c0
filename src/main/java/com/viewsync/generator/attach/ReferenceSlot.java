package com.viewsync.generator.attach;

/**
 * A persisted reference field of one attached instance.
 */
public interface ReferenceSlot {

    /**
     * @return false if the slot cannot hold the value
     */
    boolean assign(Object value);
}
