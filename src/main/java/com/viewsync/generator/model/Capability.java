package com.viewsync.generator.model;

/**
 * A typed attachment on a template node (a button-like or text-like behaviour, a layout
 * container, a generated view behaviour, ...). Capabilities are discovered by type name.
 */
public interface Capability {

    /**
     * Fully qualified type name of this capability, e.g. {@code ui.Button}.
     */
    String getTypeName();
}
