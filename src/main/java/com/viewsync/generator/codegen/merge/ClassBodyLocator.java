package com.viewsync.generator.codegen.merge;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;

/**
 * Finds the first top-level class declaration of a source and the extent of its body by
 * counting braces from the opening brace to the matching closing brace.
 *
 * Comments and literals are skipped, but nested types are not understood: markers are only
 * looked up inside the first class body, and a nested type that repeats marker text would be
 * patched as if it were the outer class.
 */
final class ClassBodyLocator {

    private static final Pattern CLASS_DECLARATION = Pattern.compile("\\bclass\\s+([A-Za-z_$][A-Za-z0-9_$]*)");

    private ClassBodyLocator() {
        // Utility class
    }

    /**
     * @return the declaration, or null if the source has no class with a balanced body
     */
    static ClassLocation locate(String source) {
        boolean[] code = SourceScanner.codeMask(source);
        Matcher matcher = CLASS_DECLARATION.matcher(source);
        while (matcher.find()) {
            int keyword = matcher.start();
            if (!code[keyword] || (keyword > 0 && source.charAt(keyword - 1) == '.')) {
                continue;
            }
            int open = indexOfCode(source, code, '{', matcher.end(1));
            if (open < 0) {
                return null;
            }
            int close = matchingBrace(source, code, open);
            if (close < 0) {
                return null;
            }
            return new ClassLocation(matcher.start(1), matcher.end(1), open, close);
        }
        return null;
    }

    private static int indexOfCode(String source, boolean[] code, char target, int from) {
        for (int i = from; i < source.length(); i++) {
            if (code[i] && source.charAt(i) == target) {
                return i;
            }
        }
        return -1;
    }

    private static int matchingBrace(String source, boolean[] code, int open) {
        int depth = 0;
        for (int i = open; i < source.length(); i++) {
            if (!code[i]) {
                continue;
            }
            char ch = source.charAt(i);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Offsets into the located source. {@code bodyOpen} and {@code bodyClose} point at the
     * braces themselves.
     */
    @Value
    static class ClassLocation {
        int nameStart;
        int nameEnd;
        int bodyOpen;
        int bodyClose;
    }
}
