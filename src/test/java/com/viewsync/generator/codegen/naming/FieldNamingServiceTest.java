package com.viewsync.generator.codegen.naming;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.config.TypePrefix;
import com.viewsync.generator.codegen.config.WidgetTypes;
import com.viewsync.generator.model.BindingDescriptor;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FieldNamingService.
 */
class FieldNamingServiceTest {

    private final FieldNamingService service = new FieldNamingService();
    private final GenerationSettings settings = GenerationSettings.defaults();

    private static BindingDescriptor descriptor(String typeName, String fieldName, String... path) {
        return BindingDescriptor.builder()
                .typeName(typeName)
                .fieldName(fieldName)
                .path(List.of(path))
                .capabilityReference(true)
                .build();
    }

    private static List<String> names(List<BindingDescriptor> descriptors) {
        List<String> names = new ArrayList<>();
        descriptors.forEach(d -> names.add(d.getFieldName()));
        return names;
    }

    @Test
    void testPrefixAndUnderscoreCamelCase() {
        List<BindingDescriptor> descriptors = new ArrayList<>(List.of(
                descriptor(WidgetTypes.BUTTON, "OkButton", "OkButton")));

        service.rename(descriptors, settings);

        assertThat(descriptors.get(0).getFieldName()).isEqualTo("_btnOkButton");
    }

    @Test
    void testExistingPrefixIsNotRepeated() {
        List<BindingDescriptor> descriptors = new ArrayList<>(List.of(
                descriptor(WidgetTypes.BUTTON, "btnClose"),
                descriptor(WidgetTypes.BUTTON, "BTN_Help"),
                descriptor(WidgetTypes.TEXT, "Title")));

        service.rename(descriptors, settings);

        assertThat(names(descriptors)).containsExactly("_btnClose", "_bTNHelp", "_txtTitle");
    }

    @Test
    void testCollisionsGetNumericSuffix() {
        GenerationSettings plain = settings.toBuilder()
                .usePrefixForFields(false)
                .underscoreCamelCase(false)
                .build();
        List<BindingDescriptor> descriptors = new ArrayList<>(List.of(
                descriptor(WidgetTypes.BUTTON, "name", "Left", "name"),
                descriptor(WidgetTypes.BUTTON, "name", "Right", "name"),
                descriptor(WidgetTypes.BUTTON, "name", "Extra", "name")));

        service.rename(descriptors, plain);

        assertThat(names(descriptors)).containsExactly("name", "name_1", "name_2");
    }

    @Test
    void testNamesAreUniqueAfterAllStages() {
        List<BindingDescriptor> descriptors = new ArrayList<>(List.of(
                descriptor(WidgetTypes.BUTTON, "Ok"),
                descriptor(WidgetTypes.BUTTON, "ok"),
                descriptor(WidgetTypes.BUTTON, "btn_ok")));

        service.rename(descriptors, settings);

        assertThat(names(descriptors)).containsExactly("_btnOk", "_btnOk_1", "_btnOk_2");
        assertThat(names(descriptors)).doesNotHaveDuplicates();
    }

    @Test
    void testTypeWithoutPrefixRow() {
        List<BindingDescriptor> descriptors = new ArrayList<>(List.of(
                descriptor(WidgetTypes.SCROLL_VIEW, "Items")));

        service.rename(descriptors, settings);

        assertThat(descriptors.get(0).getFieldName()).isEqualTo("_items");
    }

    @Test
    void testOrderIsPreserved() {
        List<BindingDescriptor> descriptors = new ArrayList<>(List.of(
                descriptor(WidgetTypes.TOGGLE, "Sound"),
                descriptor(WidgetTypes.BUTTON, "Back")));

        List<BindingDescriptor> result = service.rename(descriptors, settings);

        assertThat(result).isSameAs(descriptors);
        assertThat(names(result)).containsExactly("_togSound", "_btnBack");
    }

    @Test
    void testPropertyName() {
        assertThat(service.propertyName("_btnOkButton", settings)).isEqualTo("OkButton");
        assertThat(service.propertyName("_inputUserName", settings)).isEqualTo("UserName");
        assertThat(service.propertyName("_items", settings)).isEqualTo("Items");
    }

    @Test
    void testPropertyNameKeepsPrefixWhenStrippingDisabled() {
        GenerationSettings keep = settings.toBuilder().stripPrefixInPropertyNames(false).build();

        assertThat(service.propertyName("_btnOkButton", keep)).isEqualTo("BtnOkButton");
    }

    @Test
    void testPropertyNameNeverStripsToEmpty() {
        assertThat(service.propertyName("_btn", settings)).isEqualTo("Btn");
    }

    @Test
    void testPropertyNameUsesDefaultPrefixesWhenTableEmpty() {
        GenerationSettings noTable = settings.toBuilder().typePrefixes(List.<TypePrefix>of()).build();

        assertThat(service.propertyName("_sldVolume", noTable)).isEqualTo("Volume");
    }
}
