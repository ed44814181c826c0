package com.viewsync.generator.template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.model.BindingMarker;
import com.viewsync.generator.model.ObjectNode;
import com.viewsync.generator.model.TargetKind;

/**
 * Parser for template outline files.
 *
 * Format, one node per line, two spaces of indentation per level:
 * - Node: OkButton : ui.LayoutBox, ui.Button
 * - Marker: Title : ui.Text @bind(name=heading, target=capability, type=ui.Text, index=0)
 * - Ignored subtree: Decor @bind(ignore=true)
 * - Comments: # comment
 * Every line at level 0 starts a new root.
 */
public class TemplateOutlineParser {
    private static final Logger log = LoggerFactory.getLogger(TemplateOutlineParser.class);

    private static final int INDENT_WIDTH = 2;

    private static final Pattern NODE_PATTERN = Pattern.compile(
            "^([^:@]+?)\\s*(?::\\s*([^@]*?))?\\s*(?:@bind\\((.*)\\))?\\s*$"
    );

    public TemplateDocument parse(Path outlineFile) throws IOException {
        List<String> lines = Files.readAllLines(outlineFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public TemplateDocument parse(List<String> lines) {
        TemplateDocument doc = new TemplateDocument();
        // stack.get(level) is the latest node seen at that level
        List<ObjectNode> stack = new ArrayList<>();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                int level = indentLevel(line);
                if (level > stack.size()) {
                    throw new IllegalArgumentException("Indentation skips a level");
                }
                ObjectNode node = parseNode(trimmed, doc, lineNum);

                while (stack.size() > level) {
                    stack.remove(stack.size() - 1);
                }
                if (level == 0) {
                    doc.addRoot(node);
                } else {
                    stack.get(level - 1).addChild(node);
                }
                stack.add(node);
                log.debug("Parsed node {} at level {}", node.getName(), level);
            } catch (Exception e) {
                doc.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse outline line {}: {}", lineNum, e.getMessage());
            }
        }

        return doc;
    }

    private int indentLevel(String line) {
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') {
            spaces++;
        }
        if (spaces < line.length() && line.charAt(spaces) == '\t') {
            throw new IllegalArgumentException("Tabs are not allowed for indentation");
        }
        if (spaces % INDENT_WIDTH != 0) {
            throw new IllegalArgumentException("Indentation must be a multiple of " + INDENT_WIDTH + " spaces");
        }
        return spaces / INDENT_WIDTH;
    }

    private ObjectNode parseNode(String line, TemplateDocument doc, int lineNum) {
        Matcher matcher = NODE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid node format: " + line);
        }

        ObjectNode node = ObjectNode.named(matcher.group(1).trim());
        String types = matcher.group(2);
        if (types != null && !types.isBlank()) {
            for (String type : types.split(",")) {
                if (!type.isBlank()) {
                    node.with(type.trim());
                }
            }
        }

        String bind = matcher.group(3);
        if (bind != null) {
            // A bad marker keeps the node, so its children still have a parent
            try {
                node.mark(parseMarker(bind));
            } catch (IllegalArgumentException e) {
                doc.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Ignoring marker on line {}: {}", lineNum, e.getMessage());
            }
        }
        return node;
    }

    private BindingMarker parseMarker(String attributes) {
        BindingMarker.BindingMarkerBuilder marker = BindingMarker.builder();
        if (attributes.isBlank()) {
            return marker.build();
        }
        for (String attribute : attributes.split(",")) {
            int eq = attribute.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("Marker attribute needs key=value: " + attribute.trim());
            }
            String key = attribute.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = attribute.substring(eq + 1).trim();
            switch (key) {
                case "name" -> marker.fieldNameOverride(value);
                case "ignore" -> marker.ignoreSubtree(parseBoolean(value));
                case "target" -> marker.targetKind(TargetKind.fromText(value));
                case "type" -> marker.capabilityTypeName(value);
                case "index" -> marker.capabilityIndex(parseIndex(value));
                default -> throw new IllegalArgumentException("Unknown marker attribute: " + key);
            }
        }
        return marker.build();
    }

    private boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Expected true or false: " + value);
    }

    private int parseIndex(String value) {
        try {
            int index = Integer.parseInt(value);
            if (index < 0) {
                throw new IllegalArgumentException("Capability index must not be negative: " + value);
            }
            return index;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Capability index is not a number: " + value);
        }
    }
}
