package com.viewsync.generator.codegen.merge;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Text produced by a merge and what happened to it.
 */
@Value
@Builder
public class MergeOutcome {
    String text;
    boolean changed;
    boolean created;
    boolean classFound;

    /**
     * Regions whose markers were missing and had to be inserted at a fallback position.
     */
    @Builder.Default
    List<Region> recoveredRegions = List.of();

    static MergeOutcome missingClass(String existing) {
        return MergeOutcome.builder()
                .text(existing)
                .changed(false)
                .created(false)
                .classFound(false)
                .build();
    }
}
