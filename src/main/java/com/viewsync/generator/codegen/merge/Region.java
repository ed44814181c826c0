package com.viewsync.generator.codegen.merge;

/**
 * Machine-owned regions of a generated view. The marker lines are the on-disk format and
 * must not be edited by hand.
 */
public enum Region {

    FIELDS("// <auto-fields>", "// </auto-fields>"),
    PROPERTIES("// <auto-props>", "// </auto-props>"),
    INIT("// <auto-assign>", "// </auto-assign>");

    public static final String USER_CODE_START = "// <user-code>";
    public static final String USER_CODE_END = "// </user-code>";

    private final String startMarker;
    private final String endMarker;

    Region(String startMarker, String endMarker) {
        this.startMarker = startMarker;
        this.endMarker = endMarker;
    }

    public String getStartMarker() {
        return startMarker;
    }

    public String getEndMarker() {
        return endMarker;
    }
}
