package com.viewsync.generator.codegen.util;

import java.util.regex.Pattern;

/**
 * Utility for consistent identifier naming in generated views.
 */
public class NamingUtil {

    private static final Pattern CLASS_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts ok_button or "ok button" to OkButton. Only the first letter of every part is
     * touched, so btn_OkButton becomes BtnOkButton.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (String part : name.split("[_ ]")) {
            if (part.isEmpty()) {
                continue;
            }
            sb.append(Character.toUpperCase(part.charAt(0)));
            sb.append(part, 1, part.length());
        }
        return sb.length() > 0 ? sb.toString() : name;
    }

    /**
     * Converts btn_OkButton to btnOkButton.
     */
    public static String toCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return name;
        }
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    /**
     * Replaces every character that is not a letter or digit with an underscore and guards
     * a leading digit. Blank input becomes {@code field}.
     */
    public static String toSafeIdentifier(String raw) {
        if (raw == null || raw.isBlank()) {
            return "field";
        }
        StringBuilder sb = new StringBuilder(raw.length() + 1);
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            sb.append(Character.isLetterOrDigit(ch) ? ch : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /**
     * Like {@link #toSafeIdentifier(String)}, but a name equal to the short type name gets a
     * trailing underscore so the field never reads like the type.
     */
    public static String toSafeFieldName(String raw, String typeShortName) {
        String name = toSafeIdentifier(raw);
        if (typeShortName != null && !typeShortName.isEmpty() && name.equals(typeShortName)) {
            return name + "_";
        }
        return name;
    }

    public static boolean isValidClassName(String name, boolean requireUppercase) {
        if (name == null || name.isBlank()) {
            return false;
        }
        if (!CLASS_NAME.matcher(name).matches()) {
            return false;
        }
        return !requireUppercase || Character.isUpperCase(name.charAt(0));
    }
}
