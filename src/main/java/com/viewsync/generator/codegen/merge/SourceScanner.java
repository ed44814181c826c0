package com.viewsync.generator.codegen.merge;

/**
 * Marks which characters of a Java source are code, as opposed to comments and string,
 * text block or character literals. Braces and keywords are only honoured at code positions.
 */
final class SourceScanner {

    private SourceScanner() {
        // Utility class
    }

    static boolean[] codeMask(String source) {
        int length = source.length();
        boolean[] code = new boolean[length];
        int i = 0;
        while (i < length) {
            char ch = source.charAt(i);
            char next = i + 1 < length ? source.charAt(i + 1) : '\0';
            if (ch == '/' && next == '/') {
                i = skipLineComment(source, i);
            } else if (ch == '/' && next == '*') {
                i = skipBlockComment(source, i);
            } else if (source.startsWith("\"\"\"", i)) {
                i = skipTextBlock(source, i);
            } else if (ch == '"' || ch == '\'') {
                i = skipQuoted(source, i, ch);
            } else {
                code[i] = true;
                i++;
            }
        }
        return code;
    }

    private static int skipLineComment(String source, int start) {
        int end = source.indexOf('\n', start);
        return end < 0 ? source.length() : end;
    }

    private static int skipBlockComment(String source, int start) {
        int end = source.indexOf("*/", start + 2);
        return end < 0 ? source.length() : end + 2;
    }

    private static int skipTextBlock(String source, int start) {
        int i = start + 3;
        while (i < source.length()) {
            if (source.charAt(i) == '\\') {
                i += 2;
            } else if (source.startsWith("\"\"\"", i)) {
                return i + 3;
            } else {
                i++;
            }
        }
        return source.length();
    }

    // unterminated literals stop at the end of the line
    private static int skipQuoted(String source, int start, char quote) {
        int i = start + 1;
        while (i < source.length()) {
            char ch = source.charAt(i);
            if (ch == '\\') {
                i += 2;
            } else if (ch == quote) {
                return i + 1;
            } else if (ch == '\n') {
                return i;
            } else {
                i++;
            }
        }
        return source.length();
    }
}
