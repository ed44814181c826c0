package com.viewsync.generator.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.viewsync.generator.model.ObjectNode;

import lombok.Data;

/**
 * Roots parsed from a template outline, plus the problems found on the way.
 */
@Data
public class TemplateDocument {
    private final List<ObjectNode> roots = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void addRoot(ObjectNode root) {
        roots.add(root);
    }

    public Optional<ObjectNode> findRoot(String name) {
        return roots.stream()
                .filter(root -> root.getName().equals(name))
                .findFirst();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }
}
