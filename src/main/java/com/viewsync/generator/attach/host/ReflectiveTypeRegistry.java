package com.viewsync.generator.attach.host;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.attach.ReferenceSlot;
import com.viewsync.generator.attach.ResolvedType;
import com.viewsync.generator.attach.TypeRegistry;
import com.viewsync.generator.model.Capability;

/**
 * Resolves types through a class loader. Behaviours are concrete classes implementing
 * {@link Capability} with a no-arg constructor; their slots are instance fields, looked up
 * through the class hierarchy.
 */
public class ReflectiveTypeRegistry implements TypeRegistry {
    private static final Logger log = LoggerFactory.getLogger(ReflectiveTypeRegistry.class);

    private static final String SOURCE_ROOT = "src/main/java/";
    private static final String SOURCE_SUFFIX = ".java";

    private final ClassLoader classLoader;
    private final List<String> searchPackages;

    /**
     * @param searchPackages packages tried, in order, for simple type names
     */
    public ReflectiveTypeRegistry(ClassLoader classLoader, List<String> searchPackages) {
        this.classLoader = classLoader;
        this.searchPackages = List.copyOf(searchPackages);
    }

    @Override
    public Optional<ResolvedType> resolveType(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return Optional.empty();
        }
        Optional<Class<?>> direct = load(typeName.trim());
        if (direct.isPresent()) {
            return direct.map(ReflectiveType::new);
        }
        if (typeName.contains(".")) {
            return Optional.empty();
        }
        for (String pkg : searchPackages) {
            Optional<Class<?>> found = load(pkg + "." + typeName.trim());
            if (found.isPresent()) {
                return found.map(ReflectiveType::new);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps {@code .../src/main/java/a/b/View.java} to {@code a.b.View}. A path outside a
     * source root is read as relative to one.
     */
    @Override
    public Optional<ResolvedType> resolveArtifact(String artifactPath) {
        if (artifactPath == null || !artifactPath.endsWith(SOURCE_SUFFIX)) {
            return Optional.empty();
        }
        String path = artifactPath.replace('\\', '/');
        int root = path.lastIndexOf(SOURCE_ROOT);
        if (root >= 0) {
            path = path.substring(root + SOURCE_ROOT.length());
        }
        String className = path.substring(0, path.length() - SOURCE_SUFFIX.length())
                .replaceAll("^/+", "")
                .replace('/', '.');
        return load(className).map(ReflectiveType::new);
    }

    @Override
    public Optional<ReferenceSlot> resolveSlot(Capability instance, String fieldName) {
        Class<?> type = instance.getClass();
        while (type != null && type != Object.class) {
            try {
                Field field = type.getDeclaredField(fieldName);
                if (Modifier.isStatic(field.getModifiers()) || Modifier.isFinal(field.getModifiers())) {
                    return Optional.empty();
                }
                field.setAccessible(true);
                return Optional.of(new FieldSlot(instance, field));
            } catch (NoSuchFieldException e) {
                type = type.getSuperclass();
            }
        }
        return Optional.empty();
    }

    private Optional<Class<?>> load(String className) {
        try {
            return Optional.of(Class.forName(className, false, classLoader));
        } catch (ClassNotFoundException | LinkageError e) {
            log.trace("{} not loadable: {}", className, e.toString());
            return Optional.empty();
        }
    }

    private static class ReflectiveType implements ResolvedType {
        private final Class<?> type;

        ReflectiveType(Class<?> type) {
            this.type = type;
        }

        @Override
        public String getName() {
            return type.getName();
        }

        @Override
        public boolean isBehaviour() {
            return Capability.class.isAssignableFrom(type)
                    && !type.isInterface()
                    && !Modifier.isAbstract(type.getModifiers());
        }

        @Override
        public Capability newInstance() {
            try {
                return (Capability) type.getDeclaredConstructor().newInstance();
            } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
                     | InvocationTargetException e) {
                throw new IllegalStateException("Cannot instantiate " + type.getName(), e);
            }
        }
    }

    private static class FieldSlot implements ReferenceSlot {
        private final Object owner;
        private final Field field;

        FieldSlot(Object owner, Field field) {
            this.owner = owner;
            this.field = field;
        }

        @Override
        public boolean assign(Object value) {
            if (field.getType().isPrimitive() || !field.getType().isInstance(value)) {
                return false;
            }
            try {
                field.set(owner, value);
                return true;
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot write " + field, e);
            }
        }
    }
}
