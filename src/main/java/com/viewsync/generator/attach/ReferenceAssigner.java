package com.viewsync.generator.attach;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.model.BindingDescriptor;
import com.viewsync.generator.model.Capability;
import com.viewsync.generator.model.ObjectNode;

/**
 * Writes node and capability references straight into the persisted fields of an attached
 * view, for views generated in declarative reference mode.
 */
public class ReferenceAssigner {
    private static final Logger log = LoggerFactory.getLogger(ReferenceAssigner.class);

    private final TemplateRepository templateRepository;
    private final TypeRegistry typeRegistry;
    private final AssignmentStatsStore statsStore;
    private final GenerationSettings settings;

    public ReferenceAssigner(TemplateRepository templateRepository, TypeRegistry typeRegistry,
                             AssignmentStatsStore statsStore, GenerationSettings settings) {
        this.templateRepository = templateRepository;
        this.typeRegistry = typeRegistry;
        this.statsStore = statsStore;
        this.settings = settings;
    }

    /**
     * Assigns every descriptor whose field still exists on the attached instance of
     * {@code typeName}. The root is saved once at the end and the stats are recorded under
     * its identity, replacing earlier stats.
     *
     * @return all zero if the root cannot be opened or does not carry {@code typeName} yet
     */
    public AssignmentStats assign(ObjectNode root, String typeName, List<BindingDescriptor> descriptors) {
        String identity = templateRepository.identityOf(root);
        AssignmentStats stats = new AssignmentStats();

        Optional<ObjectNode> opened = templateRepository.open(identity);
        Optional<Capability> instance = opened.flatMap(node -> node.getCapability(typeName, 0));
        if (instance.isEmpty()) {
            log.warn("{} is not attached to {} yet, no references assigned", typeName, identity);
            statsStore.record(identity, stats);
            return stats;
        }

        ObjectNode form = opened.get();
        for (BindingDescriptor descriptor : descriptors) {
            stats.setTotal(stats.getTotal() + 1);

            Optional<ReferenceSlot> slot = typeRegistry.resolveSlot(instance.get(), descriptor.getFieldName());
            if (slot.isEmpty()) {
                // Stale field, e.g. renamed since the last compile
                log.debug("No field {} on {}, skipped", descriptor.getFieldName(), typeName);
                continue;
            }

            Optional<ObjectNode> target = form.find(descriptor.getPath());
            if (target.isEmpty()) {
                stats.setMissingPath(stats.getMissingPath() + 1);
                log.warn("Missing node '{}' for {}", descriptor.getPathString(), descriptor.getFieldName());
                continue;
            }

            Optional<Object> value = resolveValue(target.get(), descriptor);
            if (value.isEmpty() || !slot.get().assign(value.get())) {
                stats.setMissingCapability(stats.getMissingCapability() + 1);
                log.warn("Missing {} #{} on '{}' for {}", descriptor.getTypeName(), descriptor.getCapabilityIndex(),
                        descriptor.getPathString(), descriptor.getFieldName());
                continue;
            }
            stats.setSuccess(stats.getSuccess() + 1);
        }

        templateRepository.save(identity, form);
        statsStore.record(identity, stats);
        log.info("Assigned {}/{} reference(s) on {} ({} missing path, {} missing capability)",
                stats.getSuccess(), stats.getTotal(), identity, stats.getMissingPath(), stats.getMissingCapability());
        return stats;
    }

    public Optional<AssignmentStats> tryGetStats(String rootIdentity) {
        return statsStore.find(rootIdentity);
    }

    private Optional<Object> resolveValue(ObjectNode node, BindingDescriptor descriptor) {
        if (descriptor.isCapabilityReference()) {
            return node.getCapability(descriptor.getTypeName(), descriptor.getCapabilityIndex()).map(Object.class::cast);
        }
        if (descriptor.getTypeName().equals(settings.getContainerTypeName())) {
            return node.getCapability(settings.getContainerTypeName(), 0).map(Object.class::cast);
        }
        return Optional.of(node);
    }
}
