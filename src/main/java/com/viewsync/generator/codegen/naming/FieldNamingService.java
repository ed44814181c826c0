package com.viewsync.generator.codegen.naming;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.config.TypePrefix;
import com.viewsync.generator.codegen.util.NamingUtil;
import com.viewsync.generator.model.BindingDescriptor;

/**
 * Turns provisional descriptor names into final, unique field identifiers.
 *
 * Stages run in a fixed order and each can be switched off:
 * prefixing, underscore camel casing, uniqueness.
 */
public class FieldNamingService {
    private static final Logger log = LoggerFactory.getLogger(FieldNamingService.class);

    /**
     * Used for accessor names when the prefix table is empty.
     */
    static final List<String> DEFAULT_PREFIXES = List.of("btn", "tog", "sld", "input", "txt", "img", "box", "node");

    /**
     * Renames the descriptors in place and returns the same list.
     */
    public List<BindingDescriptor> rename(List<BindingDescriptor> descriptors, GenerationSettings settings) {
        if (settings.isUsePrefixForFields()) {
            applyPrefixes(descriptors, settings);
        }
        if (settings.isUnderscoreCamelCase()) {
            applyUnderscoreCamelCase(descriptors);
        }
        ensureUnique(descriptors);
        return descriptors;
    }

    private void applyPrefixes(List<BindingDescriptor> descriptors, GenerationSettings settings) {
        for (BindingDescriptor descriptor : descriptors) {
            String prefix = settings.findPrefix(descriptor.getTypeName()).orElse("");
            if (prefix.isEmpty()) {
                continue;
            }
            String name = descriptor.getFieldName();
            String lower = name.toLowerCase(Locale.ROOT);
            String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
            // "prefix_" is covered by "prefix"
            if (!lower.startsWith(lowerPrefix)) {
                descriptor.setFieldName(prefix + "_" + name);
            }
        }
    }

    private void applyUnderscoreCamelCase(List<BindingDescriptor> descriptors) {
        for (BindingDescriptor descriptor : descriptors) {
            String camel = NamingUtil.toCamelCase(descriptor.getFieldName());
            descriptor.setFieldName(camel.startsWith("_") ? camel : "_" + camel);
        }
    }

    private void ensureUnique(List<BindingDescriptor> descriptors) {
        Set<String> used = new HashSet<>();
        for (BindingDescriptor descriptor : descriptors) {
            String baseName = descriptor.getFieldName();
            String name = baseName;
            int suffix = 1;
            while (used.contains(name)) {
                name = baseName + "_" + suffix++;
            }
            used.add(name);
            if (!name.equals(baseName)) {
                log.debug("Field name {} already taken, using {}", baseName, name);
                descriptor.setFieldName(name);
            }
        }
    }

    /**
     * Accessor name for a final field name: leading underscores dropped, a known prefix
     * optionally stripped, PascalCase. Collisions are not resolved here.
     */
    public String propertyName(String fieldName, GenerationSettings settings) {
        String baseName = stripLeadingUnderscores(fieldName);
        if (settings.isStripPrefixInPropertyNames()) {
            String stripped = stripKnownPrefix(baseName, settings);
            if (!stripped.isEmpty()) {
                baseName = stripped;
            }
        }
        return NamingUtil.toPascalCase(baseName);
    }

    private String stripLeadingUnderscores(String name) {
        int i = 0;
        while (i < name.length() && name.charAt(i) == '_') {
            i++;
        }
        return name.substring(i);
    }

    private String stripKnownPrefix(String name, GenerationSettings settings) {
        if (name.isEmpty()) {
            return name;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String prefix : knownPrefixes(settings)) {
            String withUnderscore = prefix + "_";
            if (lower.startsWith(withUnderscore)) {
                return name.substring(withUnderscore.length());
            }
            if (lower.startsWith(prefix)) {
                return name.substring(prefix.length());
            }
        }
        return name;
    }

    /**
     * Lower-cased prefixes, longest first, so "input" is tried before "in".
     */
    private List<String> knownPrefixes(GenerationSettings settings) {
        List<String> configured = new ArrayList<>();
        for (TypePrefix row : settings.getTypePrefixes()) {
            String prefix = row.getPrefix().trim().toLowerCase(Locale.ROOT);
            if (!prefix.isEmpty() && !configured.contains(prefix)) {
                configured.add(prefix);
            }
        }
        if (configured.isEmpty()) {
            configured.addAll(DEFAULT_PREFIXES);
        }
        configured.sort(Comparator.comparingInt(String::length).reversed());
        return configured;
    }
}
