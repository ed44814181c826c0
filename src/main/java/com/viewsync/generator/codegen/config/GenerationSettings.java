package com.viewsync.generator.codegen.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-run configuration for view generation.
 *
 * Groups four kinds of rules:
 * - inclusion: which capability types are picked up without a marker
 * - naming: prefix table, casing and accessor naming
 * - class: naming rules for the generated class
 * - binding: how generated fields are populated, plus namespace and base type
 */
@Value
@Builder(toBuilder = true)
public class GenerationSettings {

    /**
     * Include the base interactive/text types on every node without requiring a marker.
     */
    @Builder.Default
    boolean autoIncludeCommonControls = true;

    /**
     * Additionally include the extended set (scroll views, scrollbars, dropdowns).
     */
    boolean autoIncludeExtendedControls;

    @Builder.Default
    List<String> baseAutoIncludeTypes = WidgetTypes.BASE_AUTO_INCLUDE;

    @Builder.Default
    List<String> extendedAutoIncludeTypes = WidgetTypes.EXTENDED_AUTO_INCLUDE;

    /**
     * Ordered type-to-prefix table. The first row matching a type wins.
     */
    @Builder.Default
    List<TypePrefix> typePrefixes = defaultPrefixes();

    @Builder.Default
    boolean usePrefixForFields = true;

    /**
     * Name fields {@code _camelCase}, e.g. {@code btn_ok -> _btnOk}.
     */
    @Builder.Default
    boolean underscoreCamelCase = true;

    /**
     * Emit a read-only accessor per field.
     */
    boolean generateProperties;

    @Builder.Default
    boolean stripPrefixInPropertyNames = true;

    @Builder.Default
    boolean requireUppercaseClassName = true;

    @Builder.Default
    BindingMode bindingMode = BindingMode.EXPLICIT_INIT;

    /**
     * Package of the generated class. Blank for the default package.
     */
    @Builder.Default
    String namespace = "";

    /**
     * Superclass of the generated class. Blank for none.
     */
    @Builder.Default
    String baseType = "ui.ViewBehaviour";

    @Builder.Default
    String initMethodName = "onBind";

    /**
     * Annotation placed on fields in {@link BindingMode#DECLARATIVE_REFERENCE} mode.
     */
    @Builder.Default
    String persistedFieldAnnotation = "Persisted";

    @Builder.Default
    String containerTypeName = WidgetTypes.LAYOUT_BOX;

    @Builder.Default
    String nodeTypeName = WidgetTypes.NODE;

    /**
     * Log when a managed region had to be re-inserted because its markers were gone.
     */
    @Builder.Default
    boolean logMarkerRecovery = true;

    /**
     * Request the generated type be attached to the template root after writing.
     */
    @Builder.Default
    boolean attachAfterGenerate = true;

    public static GenerationSettings defaults() {
        return GenerationSettings.builder().build();
    }

    public static List<TypePrefix> defaultPrefixes() {
        List<TypePrefix> prefixes = new ArrayList<>();
        prefixes.add(TypePrefix.of(WidgetTypes.BUTTON, "btn"));
        prefixes.add(TypePrefix.of(WidgetTypes.TOGGLE, "tog"));
        prefixes.add(TypePrefix.of(WidgetTypes.SLIDER, "sld"));
        prefixes.add(TypePrefix.of(WidgetTypes.INPUT_FIELD, "input"));
        prefixes.add(TypePrefix.of(WidgetTypes.TEXT, "txt"));
        prefixes.add(TypePrefix.of(WidgetTypes.IMAGE, "img"));
        prefixes.add(TypePrefix.of(WidgetTypes.RAW_IMAGE, "img"));
        prefixes.add(TypePrefix.of(WidgetTypes.RICH_INPUT_FIELD, "input"));
        prefixes.add(TypePrefix.of(WidgetTypes.RICH_TEXT, "txt"));
        prefixes.add(TypePrefix.of(WidgetTypes.LAYOUT_BOX, "box"));
        prefixes.add(TypePrefix.of(WidgetTypes.NODE, "node"));
        return List.copyOf(prefixes);
    }

    /**
     * Every type the auto-include pass scans for, base set first.
     */
    public List<String> getAutoIncludeTypes() {
        List<String> types = new ArrayList<>();
        if (autoIncludeCommonControls) {
            types.addAll(baseAutoIncludeTypes);
        }
        if (autoIncludeExtendedControls) {
            types.addAll(extendedAutoIncludeTypes);
        }
        return types;
    }

    public Optional<String> findPrefix(String typeName) {
        return typePrefixes.stream()
                .filter(p -> p.getTypeName().equals(typeName))
                .map(TypePrefix::getPrefix)
                .findFirst();
    }

    public boolean hasNamespace() {
        return namespace != null && !namespace.isBlank();
    }

    public boolean hasBaseType() {
        return baseType != null && !baseType.isBlank();
    }

    /**
     * Fully qualified name of a generated class.
     */
    public String qualify(String className) {
        return hasNamespace() ? namespace.trim() + "." + className : className;
    }
}
