package com.viewsync.generator.codegen.merge;

import java.util.List;

import com.viewsync.generator.codegen.config.BindingMode;
import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.naming.FieldNamingService;
import com.viewsync.generator.model.BindingDescriptor;

/**
 * Renders the text of the managed regions. Every rendered region starts with its start marker
 * line, ends with its end marker line and a newline, and is indented for a top-level class body.
 *
 * The explicit initializer relies on the base type offering {@code getNode()},
 * {@code findNode(String)} returning null for a missing path, and {@code warn(String)}; host
 * nodes offer {@code getCapability(Class, int)} and {@code getContainer()}.
 */
public class RegionRenderer {

    private static final String INDENT = "    ";
    private static final String BODY_INDENT = INDENT + INDENT;

    private final FieldNamingService namingService;

    public RegionRenderer(FieldNamingService namingService) {
        this.namingService = namingService;
    }

    public String renderFields(List<BindingDescriptor> fields, GenerationSettings settings) {
        String annotation = settings.getBindingMode() == BindingMode.DECLARATIVE_REFERENCE
                && !settings.getPersistedFieldAnnotation().isBlank()
                ? "@" + settings.getPersistedFieldAnnotation().trim() + " "
                : "";

        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append(Region.FIELDS.getStartMarker()).append('\n');
        for (BindingDescriptor f : fields) {
            sb.append(INDENT).append(annotation)
                    .append("private ").append(f.getTypeName()).append(' ').append(f.getFieldName()).append(";\n");
        }
        sb.append(INDENT).append(Region.FIELDS.getEndMarker()).append('\n');
        return sb.toString();
    }

    /**
     * Read-only accessors, or an empty string when accessor generation is off so that a
     * previously generated region is cleared.
     */
    public String renderProperties(List<BindingDescriptor> fields, GenerationSettings settings) {
        if (!settings.isGenerateProperties()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append(Region.PROPERTIES.getStartMarker()).append('\n');
        for (BindingDescriptor f : fields) {
            String propertyName = namingService.propertyName(f.getFieldName(), settings);
            sb.append(INDENT).append("public ").append(f.getTypeName())
                    .append(" get").append(propertyName).append("() { return ")
                    .append(f.getFieldName()).append("; }\n");
        }
        sb.append(INDENT).append(Region.PROPERTIES.getEndMarker()).append('\n');
        return sb.toString();
    }

    public String renderInit(List<BindingDescriptor> fields, GenerationSettings settings) {
        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append(Region.INIT.getStartMarker()).append('\n');
        if (settings.getBindingMode() == BindingMode.EXPLICIT_INIT) {
            appendInitializer(sb, fields, settings);
        }
        sb.append(INDENT).append(Region.INIT.getEndMarker()).append('\n');
        return sb.toString();
    }

    private void appendInitializer(StringBuilder sb, List<BindingDescriptor> fields, GenerationSettings settings) {
        sb.append(INDENT).append("protected void ").append(settings.getInitMethodName()).append("() {\n");
        if (!fields.isEmpty()) {
            sb.append(BODY_INDENT).append(settings.getNodeTypeName()).append(" node;\n");
        }
        for (BindingDescriptor f : fields) {
            if (f.isRoot()) {
                sb.append(BODY_INDENT).append("node = getNode();\n");
                appendValue(sb, f, settings, BODY_INDENT);
                continue;
            }
            String path = f.getPathString();
            sb.append(BODY_INDENT).append("node = findNode(").append(javaString(path)).append(");\n");
            sb.append(BODY_INDENT).append("if (node == null) {\n");
            sb.append(BODY_INDENT).append(INDENT).append("warn(")
                    .append(javaString("Missing node '" + path + "' for " + f.getFieldName())).append(");\n");
            sb.append(BODY_INDENT).append("} else {\n");
            appendValue(sb, f, settings, BODY_INDENT + INDENT);
            sb.append(BODY_INDENT).append("}\n");
        }
        sb.append(INDENT).append("}\n");
    }

    // qualified with this. so the local node never shadows a field of the same name
    private void appendValue(StringBuilder sb, BindingDescriptor f, GenerationSettings settings, String indent) {
        String target = "this." + f.getFieldName();
        String where = f.isRoot() ? "root" : "'" + f.getPathString() + "'";
        String missing;
        if (f.isCapabilityReference()) {
            sb.append(indent).append(target).append(" = node.getCapability(")
                    .append(f.getTypeName()).append(".class, ").append(f.getCapabilityIndex()).append(");\n");
            missing = "Missing " + f.getTypeName() + " #" + f.getCapabilityIndex() + " on " + where
                    + " for " + f.getFieldName();
        } else if (f.getTypeName().equals(settings.getContainerTypeName())) {
            sb.append(indent).append(target).append(" = node.getContainer();\n");
            missing = "Missing container on " + where + " for " + f.getFieldName();
        } else if (f.getTypeName().equals(settings.getNodeTypeName())) {
            sb.append(indent).append(target).append(" = node;\n");
            return;
        } else {
            sb.append(indent).append("// no lookup for ").append(f.getTypeName()).append('\n');
            return;
        }
        sb.append(indent).append("if (").append(target).append(" == null) {\n");
        sb.append(indent).append(INDENT).append("warn(").append(javaString(missing)).append(");\n");
        sb.append(indent).append("}\n");
    }

    static String javaString(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(ch);
            }
        }
        return sb.append('"').toString();
    }
}
