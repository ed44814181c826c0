package com.viewsync.generator.codegen.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.merge.ClassBodyLocator.ClassLocation;
import com.viewsync.generator.codegen.naming.FieldNamingService;
import com.viewsync.generator.model.BindingDescriptor;

/**
 * Produces the source of a view, either from scratch or by patching an existing file.
 *
 * When patching, only the first class name, the first type of its {@code extends} clause and
 * the three managed regions are touched. Everything else in the file, including the user-code
 * region, is carried over byte for byte. Regions whose markers were removed are re-inserted:
 * Fields right after the opening brace line, Properties after Fields (else before Init, else
 * before the closing brace line), Init before the closing brace line.
 */
public class ArtifactMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(ArtifactMergeEngine.class);

    private static final Pattern EXTENDS = Pattern.compile("\\bextends\\s+");
    private static final Pattern IMPLEMENTS = Pattern.compile("\\bimplements\\b");

    private final RegionRenderer regionRenderer;
    private final SkeletonRenderer skeletonRenderer;

    public ArtifactMergeEngine(FieldNamingService namingService) {
        this(new RegionRenderer(namingService), new SkeletonRenderer());
    }

    public ArtifactMergeEngine(RegionRenderer regionRenderer, SkeletonRenderer skeletonRenderer) {
        this.regionRenderer = regionRenderer;
        this.skeletonRenderer = skeletonRenderer;
    }

    /**
     * @param existing current file content, null or blank when the view is generated for the
     *                 first time
     */
    public MergeOutcome merge(String existing, String className, List<BindingDescriptor> fields,
                              GenerationSettings settings) {
        String fieldsRegion = regionRenderer.renderFields(fields, settings);
        String propertiesRegion = regionRenderer.renderProperties(fields, settings);
        String initRegion = regionRenderer.renderInit(fields, settings);

        if (existing == null || existing.isBlank()) {
            String text = skeletonRenderer.render(className,
                    settings.hasNamespace() ? settings.getNamespace().trim() : "",
                    settings.hasBaseType() ? settings.getBaseType().trim() : "",
                    fieldsRegion, propertiesRegion, initRegion);
            return MergeOutcome.builder()
                    .text(text)
                    .changed(true)
                    .created(true)
                    .classFound(true)
                    .build();
        }

        if (ClassBodyLocator.locate(existing) == null) {
            log.warn("No class declaration with a balanced body found, {} left untouched", className);
            return MergeOutcome.missingClass(existing);
        }

        String newline = existing.contains("\r\n") ? "\r\n" : "\n";
        List<Region> recovered = new ArrayList<>();

        List<UnaryOperator<String>> steps = new ArrayList<>();
        steps.add(source -> renameClass(source, className));
        if (settings.hasBaseType()) {
            steps.add(source -> replaceBaseType(source, settings.getBaseType().trim()));
        }
        steps.add(source -> upsert(source, Region.FIELDS, toNewline(fieldsRegion, newline), recovered));
        steps.add(source -> upsert(source, Region.PROPERTIES, toNewline(propertiesRegion, newline), recovered));
        steps.add(source -> upsert(source, Region.INIT, toNewline(initRegion, newline), recovered));

        String updated = existing;
        for (UnaryOperator<String> step : steps) {
            updated = step.apply(updated);
            if (updated == null) {
                log.warn("Class body of {} no longer balanced after patching, file left untouched", className);
                return MergeOutcome.missingClass(existing);
            }
        }

        if (settings.isLogMarkerRecovery()) {
            for (Region region : recovered) {
                log.info("{} markers missing in {}, region re-inserted", region, className);
            }
        }

        return MergeOutcome.builder()
                .text(updated)
                .changed(!updated.equals(existing))
                .created(false)
                .classFound(true)
                .recoveredRegions(List.copyOf(recovered))
                .build();
    }

    /**
     * Each patch step returns null when the class body can no longer be located.
     */
    private String renameClass(String source, String className) {
        ClassLocation location = ClassBodyLocator.locate(source);
        if (location == null) {
            return null;
        }
        String current = source.substring(location.getNameStart(), location.getNameEnd());
        if (current.equals(className)) {
            return source;
        }
        log.debug("Renaming class {} to {}", current, className);
        return source.substring(0, location.getNameStart()) + className + source.substring(location.getNameEnd());
    }

    /**
     * Swaps the first type of the {@code extends} clause, or adds a clause right after the
     * class name and its type parameters. Bounds inside the type parameters and type arguments
     * of the {@code implements} clause are not inheritance clauses.
     */
    private String replaceBaseType(String source, String baseType) {
        ClassLocation location = ClassBodyLocator.locate(source);
        if (location == null) {
            return null;
        }
        boolean[] code = SourceScanner.codeMask(source);
        int headerStart = location.getNameEnd();
        int headerEnd = location.getBodyOpen();

        int afterName = skipWhitespace(source, headerStart, headerEnd);
        if (afterName < headerEnd && source.charAt(afterName) == '<') {
            headerStart = skipAngleBrackets(source, afterName, headerEnd);
        }
        int clauseEnd = firstCodeMatch(IMPLEMENTS.matcher(source), code, headerStart, headerEnd);

        Matcher matcher = EXTENDS.matcher(source);
        matcher.region(headerStart, clauseEnd < 0 ? headerEnd : clauseEnd);
        while (matcher.find()) {
            if (!code[matcher.start()]) {
                continue;
            }
            int typeStart = matcher.end();
            int typeEnd = endOfTypeReference(source, typeStart, headerEnd);
            if (source.substring(typeStart, typeEnd).equals(baseType)) {
                return source;
            }
            return source.substring(0, typeStart) + baseType + source.substring(typeEnd);
        }

        return source.substring(0, headerStart) + " extends " + baseType + source.substring(headerStart);
    }

    private static int firstCodeMatch(Matcher matcher, boolean[] code, int from, int to) {
        matcher.region(from, to);
        while (matcher.find()) {
            if (code[matcher.start()]) {
                return matcher.start();
            }
        }
        return -1;
    }

    private int endOfTypeReference(String source, int start, int limit) {
        int i = start;
        while (i < limit) {
            char ch = source.charAt(i);
            if (Character.isJavaIdentifierPart(ch) || ch == '.') {
                i++;
            } else {
                break;
            }
        }
        int afterSpaces = skipWhitespace(source, i, limit);
        if (afterSpaces < limit && source.charAt(afterSpaces) == '<') {
            return skipAngleBrackets(source, afterSpaces, limit);
        }
        return i;
    }

    private int skipWhitespace(String source, int from, int limit) {
        int i = from;
        while (i < limit && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * @return index just past the bracket matching the one at {@code open}
     */
    private int skipAngleBrackets(String source, int open, int limit) {
        int depth = 0;
        for (int i = open; i < limit; i++) {
            char ch = source.charAt(i);
            if (ch == '<') {
                depth++;
            } else if (ch == '>') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return limit;
    }

    private String upsert(String source, Region region, String payload, List<Region> recovered) {
        ClassLocation location = ClassBodyLocator.locate(source);
        if (location == null) {
            return null;
        }
        int bodyStart = location.getBodyOpen() + 1;
        int bodyEnd = location.getBodyClose();

        int start = findMarkerLine(source, region.getStartMarker(), bodyStart, bodyEnd);
        int end = start < 0 ? -1 : findMarkerLine(source, region.getEndMarker(), start, bodyEnd);
        if (start >= 0 && end >= 0) {
            int replaceFrom = lineStart(source, start);
            int replaceTo = lineEndInclusive(source, end);
            return source.substring(0, replaceFrom) + payload + source.substring(replaceTo);
        }

        // Nothing to clear
        if (payload.isEmpty()) {
            return source;
        }
        recovered.add(region);
        int insertAt = switch (region) {
            case FIELDS -> afterOpeningBraceLine(source, location);
            case PROPERTIES -> propertiesFallback(source, location);
            case INIT -> beforeClosingBraceLine(source, location);
        };
        String lead = insertAt > 0 && source.charAt(insertAt - 1) != '\n' ? newlineOf(payload) : "";
        return source.substring(0, insertAt) + lead + payload + source.substring(insertAt);
    }

    private int propertiesFallback(String source, ClassLocation location) {
        int bodyStart = location.getBodyOpen() + 1;
        int bodyEnd = location.getBodyClose();
        int fieldsEnd = findMarkerLine(source, Region.FIELDS.getEndMarker(), bodyStart, bodyEnd);
        if (fieldsEnd >= 0) {
            return lineEndInclusive(source, fieldsEnd);
        }
        int initStart = findMarkerLine(source, Region.INIT.getStartMarker(), bodyStart, bodyEnd);
        if (initStart >= 0) {
            return lineStart(source, initStart);
        }
        return beforeClosingBraceLine(source, location);
    }

    private int afterOpeningBraceLine(String source, ClassLocation location) {
        int newline = source.indexOf('\n', location.getBodyOpen());
        if (newline < 0 || newline > location.getBodyClose()) {
            return location.getBodyOpen() + 1;
        }
        return newline + 1;
    }

    private int beforeClosingBraceLine(String source, ClassLocation location) {
        int close = location.getBodyClose();
        int lineStart = lineStart(source, close);
        if (lineStart > location.getBodyOpen() && source.substring(lineStart, close).isBlank()) {
            return lineStart;
        }
        return close;
    }

    /**
     * Finds a marker that is the first non-blank text on its line. Lines that begin inside a
     * block comment or text block are skipped.
     *
     * @return index of the marker, or -1
     */
    static int findMarkerLine(String source, String marker, int from, int to) {
        boolean[] code = SourceScanner.codeMask(source);
        int index = source.indexOf(marker, from);
        while (index >= 0 && index < to) {
            int lineStart = lineStart(source, index);
            boolean lineStartsInCode = lineStart == 0 || code[lineStart - 1];
            if (lineStartsInCode && source.substring(lineStart, index).isBlank()) {
                return index;
            }
            index = source.indexOf(marker, index + marker.length());
        }
        return -1;
    }

    private static int lineStart(String source, int index) {
        return source.lastIndexOf('\n', index - 1) + 1;
    }

    private static int lineEndInclusive(String source, int index) {
        int newline = source.indexOf('\n', index);
        return newline < 0 ? source.length() : newline + 1;
    }

    private static String toNewline(String region, String newline) {
        return "\n".equals(newline) ? region : region.replace("\n", newline);
    }

    private static String newlineOf(String payload) {
        return payload.endsWith("\r\n") ? "\r\n" : "\n";
    }
}
