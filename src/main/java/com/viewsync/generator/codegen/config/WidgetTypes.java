package com.viewsync.generator.codegen.config;

import java.util.List;

/**
 * Well-known capability type names of the template host and the fixed priority tiers used
 * when a marker asks for automatic target selection.
 */
public final class WidgetTypes {

    public static final String BUTTON = "ui.Button";
    public static final String TOGGLE = "ui.Toggle";
    public static final String SLIDER = "ui.Slider";
    public static final String INPUT_FIELD = "ui.InputField";
    public static final String RICH_INPUT_FIELD = "ui.rich.RichInputField";

    public static final String RICH_TEXT = "ui.rich.RichText";
    public static final String TEXT = "ui.Text";
    public static final String IMAGE = "ui.Image";
    public static final String RAW_IMAGE = "ui.RawImage";

    public static final String SCROLL_VIEW = "ui.ScrollView";
    public static final String SCROLLBAR = "ui.Scrollbar";
    public static final String DROPDOWN = "ui.Dropdown";

    public static final String LAYOUT_BOX = "ui.LayoutBox";
    public static final String NODE = "ui.Node";

    /**
     * Interactive controls win over display types.
     */
    public static final List<String> INTERACTIVE_TIER = List.of(
            BUTTON, TOGGLE, SLIDER, INPUT_FIELD, RICH_INPUT_FIELD);

    public static final List<String> DISPLAY_TIER = List.of(
            RICH_TEXT, TEXT, IMAGE, RAW_IMAGE);

    public static final List<String> BASE_AUTO_INCLUDE = List.of(
            BUTTON, TOGGLE, SLIDER, INPUT_FIELD, RICH_TEXT, RICH_INPUT_FIELD);

    public static final List<String> EXTENDED_AUTO_INCLUDE = List.of(
            SCROLL_VIEW, SCROLLBAR, DROPDOWN);

    private WidgetTypes() {
        // Constants
    }

    /**
     * Last segment of a dotted type name.
     */
    public static String shortName(String typeName) {
        if (typeName == null) {
            return "";
        }
        int lastDot = typeName.lastIndexOf('.');
        return lastDot < 0 ? typeName : typeName.substring(lastDot + 1);
    }
}
