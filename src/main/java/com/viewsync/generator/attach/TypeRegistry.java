package com.viewsync.generator.attach;

import java.util.Optional;

import com.viewsync.generator.model.Capability;

/**
 * Live view of the types the host can currently load. Freshly generated types only become
 * visible after the host's reload.
 */
public interface TypeRegistry {

    /**
     * Looks a type up by qualified name, or by simple name across every searched package.
     */
    Optional<ResolvedType> resolveType(String typeName);

    /**
     * Looks a type up through the source file it was compiled from.
     */
    Optional<ResolvedType> resolveArtifact(String artifactPath);

    /**
     * Storage slot named {@code fieldName} on an attached instance, empty if the compiled type
     * has no such field.
     */
    Optional<ReferenceSlot> resolveSlot(Capability instance, String fieldName);
}
