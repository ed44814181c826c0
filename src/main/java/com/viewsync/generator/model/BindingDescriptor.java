package com.viewsync.generator.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * One generated field: what it references (type), what it is called, and where its target
 * lives relative to the root node. Produced fresh on every generation pass.
 */
@Data
@Builder
@AllArgsConstructor
public class BindingDescriptor {

    private String typeName;
    private String fieldName;

    /**
     * Node names from the root; empty for the root itself.
     */
    @Builder.Default
    private List<String> path = List.of();

    private boolean capabilityReference;
    private int capabilityIndex;

    public String getPathString() {
        return String.join("/", path);
    }

    public boolean isRoot() {
        return path.isEmpty();
    }
}
