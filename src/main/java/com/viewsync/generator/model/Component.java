package com.viewsync.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Plain capability carried by template nodes. Several components of the same type on one
 * node are addressed by their index.
 */
@Value
public class Component implements Capability {

    @NonNull
    String typeName;

    public static Component of(String typeName) {
        return new Component(typeName);
    }
}
