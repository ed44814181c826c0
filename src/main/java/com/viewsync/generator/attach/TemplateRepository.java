package com.viewsync.generator.attach;

import java.util.Optional;

import com.viewsync.generator.model.ObjectNode;

/**
 * Persistent storage of template roots.
 */
public interface TemplateRepository {

    /**
     * Stable key of a root that survives the reload boundary.
     */
    String identityOf(ObjectNode root);

    /**
     * Editable form of a stored root, empty if nothing is stored under the identity.
     */
    Optional<ObjectNode> open(String identity);

    void save(String identity, ObjectNode root);
}
