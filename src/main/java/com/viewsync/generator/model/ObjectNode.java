package com.viewsync.generator.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A node of a hierarchical object template. Each node has a name, ordered children, ordered
 * capabilities and at most one {@link BindingMarker}.
 */
@Getter
@ToString(of = {"name", "capabilities", "marker"})
public class ObjectNode {

    private final String name;
    private final List<ObjectNode> children = new ArrayList<>();
    private final List<Capability> capabilities = new ArrayList<>();

    @Setter
    private BindingMarker marker;

    private ObjectNode parent;

    public ObjectNode(String name) {
        this.name = name;
    }

    public static ObjectNode named(String name) {
        return new ObjectNode(name);
    }

    public ObjectNode addChild(ObjectNode child) {
        children.add(child);
        child.parent = this;
        return this;
    }

    public ObjectNode attach(Capability capability) {
        capabilities.add(capability);
        return this;
    }

    public ObjectNode with(String... capabilityTypeNames) {
        for (String typeName : capabilityTypeNames) {
            attach(Component.of(typeName));
        }
        return this;
    }

    public ObjectNode mark(BindingMarker marker) {
        this.marker = marker;
        return this;
    }

    public List<ObjectNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Capability> getCapabilities() {
        return Collections.unmodifiableList(capabilities);
    }

    public boolean hasMarker() {
        return marker != null;
    }

    /**
     * All capabilities of the given type, in attachment order.
     */
    public List<Capability> getCapabilities(String typeName) {
        List<Capability> matches = new ArrayList<>();
        for (Capability capability : capabilities) {
            if (capability.getTypeName().equals(typeName)) {
                matches.add(capability);
            }
        }
        return matches;
    }

    public boolean hasCapability(String typeName) {
        return capabilities.stream().anyMatch(c -> c.getTypeName().equals(typeName));
    }

    public Optional<Capability> getCapability(String typeName, int index) {
        List<Capability> matches = getCapabilities(typeName);
        if (index < 0 || index >= matches.size()) {
            return Optional.empty();
        }
        return Optional.of(matches.get(index));
    }

    /**
     * Follows child names from this node; the first child with a matching name wins at each
     * level. An empty path resolves to this node.
     */
    public Optional<ObjectNode> find(List<String> path) {
        ObjectNode current = this;
        for (String segment : path) {
            ObjectNode next = null;
            for (ObjectNode child : current.children) {
                if (child.name.equals(segment)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return Optional.empty();
            }
            current = next;
        }
        return Optional.of(current);
    }

    /**
     * Names from {@code root} (exclusive) down to this node (inclusive). Empty for the root.
     */
    public List<String> pathFrom(ObjectNode root) {
        Deque<String> names = new ArrayDeque<>();
        ObjectNode current = this;
        while (current != null && current != root) {
            names.addFirst(current.name);
            current = current.parent;
        }
        return List.copyOf(names);
    }

    /**
     * This node and all descendants, depth first, children in order.
     */
    public List<ObjectNode> preOrder() {
        List<ObjectNode> nodes = new ArrayList<>();
        Deque<ObjectNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            ObjectNode node = stack.pop();
            nodes.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return nodes;
    }
}
