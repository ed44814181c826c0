package com.viewsync.generator.attach;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.viewsync.generator.model.Capability;
import com.viewsync.generator.model.Component;

/**
 * Registry whose loadable types are switched on by the test, to simulate a reload.
 */
class StubTypeRegistry implements TypeRegistry {

    private final Map<String, ResolvedType> types = new HashMap<>();
    private final Map<String, ResolvedType> artifacts = new HashMap<>();
    private final Map<String, Map<String, Object>> slots = new HashMap<>();

    void makeBehaviour(String name) {
        makeBehaviour(name, () -> Component.of(name));
    }

    void makeBehaviour(String name, Supplier<Capability> factory) {
        types.put(name, new StubType(name, true, factory));
    }

    void makePlain(String name) {
        types.put(name, new StubType(name, false, () -> {
            throw new IllegalStateException("not a behaviour");
        }));
    }

    void makeArtifact(String path, String name) {
        artifacts.put(path, new StubType(name, true, () -> Component.of(name)));
    }

    /**
     * Declares a field on every instance of {@code typeName}; values land in the returned map.
     */
    Map<String, Object> declareSlots(String typeName, String... fieldNames) {
        Map<String, Object> values = new HashMap<>();
        for (String fieldName : fieldNames) {
            values.put(fieldName, null);
        }
        slots.put(typeName, values);
        return values;
    }

    @Override
    public Optional<ResolvedType> resolveType(String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    @Override
    public Optional<ResolvedType> resolveArtifact(String artifactPath) {
        return Optional.ofNullable(artifacts.get(artifactPath));
    }

    @Override
    public Optional<ReferenceSlot> resolveSlot(Capability instance, String fieldName) {
        Map<String, Object> values = slots.get(instance.getTypeName());
        if (values == null || !values.containsKey(fieldName)) {
            return Optional.empty();
        }
        return Optional.of(value -> {
            values.put(fieldName, value);
            return true;
        });
    }

    private static class StubType implements ResolvedType {
        private final String name;
        private final boolean behaviour;
        private final Supplier<Capability> factory;

        StubType(String name, boolean behaviour, Supplier<Capability> factory) {
            this.name = name;
            this.behaviour = behaviour;
            this.factory = factory;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isBehaviour() {
            return behaviour;
        }

        @Override
        public Capability newInstance() {
            return factory.get();
        }
    }
}
