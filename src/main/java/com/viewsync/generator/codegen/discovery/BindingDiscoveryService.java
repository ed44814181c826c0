package com.viewsync.generator.codegen.discovery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.Value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.config.WidgetTypes;
import com.viewsync.generator.codegen.util.NamingUtil;
import com.viewsync.generator.model.BindingDescriptor;
import com.viewsync.generator.model.BindingMarker;
import com.viewsync.generator.model.Capability;
import com.viewsync.generator.model.ObjectNode;

/**
 * Walks a template tree and produces the ordered, deduplicated list of binding descriptors.
 *
 * Two sources contribute, in this order:
 * - the auto-include pass, which binds every capability of a configured type
 * - the marker pass, which binds every node carrying a {@link BindingMarker}
 *
 * The combined list is deduplicated by (path, type, capability index), first occurrence
 * wins, then stable-sorted by (type, field name). Names are provisional; the naming
 * pipeline finalizes them.
 */
public class BindingDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(BindingDiscoveryService.class);

    public List<BindingDescriptor> discover(ObjectNode root, GenerationSettings settings) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(settings, "settings");

        List<ObjectNode> visible = visibleNodes(root);
        List<BindingDescriptor> found = new ArrayList<>();

        collectAutoIncluded(root, visible, settings, found);
        collectMarked(root, visible, settings, found);

        List<BindingDescriptor> result = deduplicate(found);
        result.sort(Comparator.comparing(BindingDescriptor::getTypeName)
                .thenComparing(BindingDescriptor::getFieldName));

        log.debug("Discovered {} bindings under '{}' ({} before deduplication)",
                result.size(), root.getName(), found.size());
        return result;
    }

    private void collectAutoIncluded(ObjectNode root, List<ObjectNode> visible,
                                     GenerationSettings settings, List<BindingDescriptor> out) {
        for (String typeName : settings.getAutoIncludeTypes()) {
            String shortName = WidgetTypes.shortName(typeName);
            for (ObjectNode node : visible) {
                List<Capability> matches = node.getCapabilities(typeName);
                for (int index = 0; index < matches.size(); index++) {
                    out.add(BindingDescriptor.builder()
                            .typeName(typeName)
                            .fieldName(NamingUtil.toSafeFieldName(node.getName(), shortName))
                            .path(node.pathFrom(root))
                            .capabilityReference(true)
                            .capabilityIndex(index)
                            .build());
                }
            }
        }
    }

    private void collectMarked(ObjectNode root, List<ObjectNode> visible,
                               GenerationSettings settings, List<BindingDescriptor> out) {
        for (ObjectNode node : visible) {
            BindingMarker marker = node.getMarker();
            if (marker == null) {
                continue;
            }
            String baseName = marker.hasFieldNameOverride()
                    ? marker.getFieldNameOverride().trim()
                    : node.getName();
            String fieldName = NamingUtil.toSafeIdentifier(baseName);
            List<String> path = node.pathFrom(root);

            out.add(resolveTarget(node, marker, fieldName, path, settings));
        }
    }

    private BindingDescriptor resolveTarget(ObjectNode node, BindingMarker marker, String fieldName,
                                            List<String> path, GenerationSettings settings) {
        return switch (marker.getTargetKind()) {
            case CAPABILITY -> resolveCapability(node, marker, fieldName, path, settings);
            case CONTAINER -> nonCapability(settings.getContainerTypeName(), fieldName, path);
            case NODE_ONLY -> nonCapability(settings.getNodeTypeName(), fieldName, path);
            case AUTO -> resolveAuto(node, fieldName, path, settings);
        };
    }

    private BindingDescriptor resolveCapability(ObjectNode node, BindingMarker marker, String fieldName,
                                                List<String> path, GenerationSettings settings) {
        String typeName = marker.getCapabilityTypeName();
        if (typeName == null || typeName.isBlank()) {
            log.debug("Marker on '{}' names no capability type, selecting automatically", node.getName());
            return resolveAuto(node, fieldName, path, settings);
        }
        typeName = typeName.trim();
        int count = node.getCapabilities(typeName).size();
        if (count == 0) {
            log.debug("Node '{}' has no {}, binding its container or the node", node.getName(), typeName);
            return containerOrNode(node, fieldName, path, settings);
        }
        int index = Math.max(0, Math.min(marker.getCapabilityIndex(), count - 1));
        return capability(typeName, fieldName, path, index);
    }

    private BindingDescriptor resolveAuto(ObjectNode node, String fieldName, List<String> path,
                                          GenerationSettings settings) {
        String typeName = firstPresent(node, WidgetTypes.INTERACTIVE_TIER);
        if (typeName == null) {
            typeName = firstPresent(node, WidgetTypes.DISPLAY_TIER);
        }
        if (typeName != null) {
            return capability(typeName, fieldName, path, 0);
        }
        return containerOrNode(node, fieldName, path, settings);
    }

    private BindingDescriptor containerOrNode(ObjectNode node, String fieldName, List<String> path,
                                              GenerationSettings settings) {
        if (node.hasCapability(settings.getContainerTypeName())) {
            return nonCapability(settings.getContainerTypeName(), fieldName, path);
        }
        return nonCapability(settings.getNodeTypeName(), fieldName, path);
    }

    private String firstPresent(ObjectNode node, List<String> candidates) {
        for (String candidate : candidates) {
            if (node.hasCapability(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private BindingDescriptor capability(String typeName, String fieldName, List<String> path, int index) {
        return BindingDescriptor.builder()
                .typeName(typeName)
                .fieldName(fieldName)
                .path(path)
                .capabilityReference(true)
                .capabilityIndex(index)
                .build();
    }

    private BindingDescriptor nonCapability(String typeName, String fieldName, List<String> path) {
        return BindingDescriptor.builder()
                .typeName(typeName)
                .fieldName(fieldName)
                .path(path)
                .capabilityReference(false)
                .capabilityIndex(0)
                .build();
    }

    /**
     * Pre-order walk that does not descend below a node whose marker ignores its subtree.
     * The ignoring node itself stays visible.
     */
    private List<ObjectNode> visibleNodes(ObjectNode root) {
        List<ObjectNode> nodes = new ArrayList<>();
        collectVisible(root, nodes);
        return nodes;
    }

    private void collectVisible(ObjectNode node, List<ObjectNode> out) {
        out.add(node);
        if (node.hasMarker() && node.getMarker().isIgnoreSubtree()) {
            return;
        }
        for (ObjectNode child : node.getChildren()) {
            collectVisible(child, out);
        }
    }

    private List<BindingDescriptor> deduplicate(List<BindingDescriptor> descriptors) {
        Map<DescriptorKey, BindingDescriptor> unique = new LinkedHashMap<>();
        for (BindingDescriptor descriptor : descriptors) {
            unique.putIfAbsent(DescriptorKey.of(descriptor), descriptor);
        }
        return new ArrayList<>(unique.values());
    }

    @Value
    private static class DescriptorKey {
        List<String> path;
        String typeName;
        int capabilityIndex;

        static DescriptorKey of(BindingDescriptor d) {
            return new DescriptorKey(d.getPath(), d.getTypeName(), d.getCapabilityIndex());
        }
    }
}
