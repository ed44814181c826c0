package com.viewsync.generator.codegen;

import java.util.List;
import java.util.stream.Collectors;

import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.Test;

import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.config.WidgetTypes;
import com.viewsync.generator.model.BindingDescriptor;
import com.viewsync.generator.model.BindingMarker;
import com.viewsync.generator.model.ObjectNode;
import com.viewsync.generator.model.TargetKind;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ViewGenerator.
 */
class ViewGeneratorTest {

    private final ViewGenerator generator = new ViewGenerator();
    private final GenerationSettings settings = GenerationSettings.defaults();

    private static ObjectNode mainMenu() {
        return ObjectNode.named("MainMenu")
                .addChild(ObjectNode.named("OkButton").with(WidgetTypes.BUTTON))
                .addChild(ObjectNode.named("Title").with(WidgetTypes.TEXT));
    }

    @Test
    void testGenerateNewView() {
        GeneratorResult result = generator.generate(mainMenu(), null, settings);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getClassName()).isEqualTo("MainMenu");
        assertThat(result.isArtifactCreated()).isTrue();
        assertThat(result.getFieldCount()).isEqualTo(1);
        assertThat(result.getFields()).extracting(BindingDescriptor::getFieldName)
                .containsExactly("_btnOkButton");
        assertThat(result.getGeneratedText()).contains("private ui.Button _btnOkButton;");
    }

    @Test
    void testMarkedNodesAreIncluded() {
        ObjectNode root = mainMenu();
        root.find(List.of("Title")).orElseThrow()
                .mark(BindingMarker.builder().targetKind(TargetKind.NODE_ONLY).fieldNameOverride("Heading").build());

        GeneratorResult result = generator.generate(root, null, settings);

        assertThat(result.getFields()).extracting(BindingDescriptor::getFieldName)
                .containsExactly("_btnOkButton", "_nodeHeading");
    }

    @Test
    void testRegenerateWithSameTreeIsUnchanged() {
        String first = generator.generate(mainMenu(), null, settings).getGeneratedText();

        GeneratorResult second = generator.generate(mainMenu(), first, settings);

        assertThat(second.isSuccess()).isTrue();
        assertThat(second.isArtifactChanged()).isFalse();
        assertThat(second.isArtifactCreated()).isFalse();
        assertThat(second.getGeneratedText()).isEqualTo(first);
    }

    @Test
    void testInvalidClassName() {
        GeneratorResult result = generator.generate(ObjectNode.named("Main Menu"), null, settings);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.INVALID_NAME);
        assertThat(result.getGeneratedText()).isNull();
    }

    @Test
    void testLowercaseClassNameIsConfigurable() {
        ObjectNode root = ObjectNode.named("menu");

        assertThat(generator.generate(root, null, settings).getErrorKind()).isEqualTo(ErrorKind.INVALID_NAME);
        assertThat(generator.generate(root, null, settings.toBuilder().requireUppercaseClassName(false).build())
                .isSuccess()).isTrue();
    }

    @Test
    void testExistingFileWithoutClassIsRejected() {
        GeneratorResult result = generator.generate(mainMenu(), "// only a comment\n", settings);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.MISSING_CLASS_DECLARATION);
        assertThat(result.getErrorMessage()).contains("MainMenu");
    }

    @Test
    void testCollectFieldsDoesNotGenerate() {
        assertThat(generator.collectFields(mainMenu(), settings))
                .extracting(BindingDescriptor::getPathString)
                .containsExactly("OkButton");
    }

    @Test
    void testCollectFieldsMatchesGeneratedFields() {
        ObjectNode root = ObjectNode.named("MainMenu")
                .addChild(ObjectNode.named("Left").addChild(ObjectNode.named("Ok").with(WidgetTypes.BUTTON)))
                .addChild(ObjectNode.named("Right").addChild(ObjectNode.named("Ok").with(WidgetTypes.BUTTON)))
                .addChild(ObjectNode.named("Gallery").with(WidgetTypes.IMAGE, WidgetTypes.IMAGE)
                        .mark(BindingMarker.builder()
                                .targetKind(TargetKind.CAPABILITY)
                                .capabilityTypeName(WidgetTypes.IMAGE)
                                .capabilityIndex(1)
                                .build()))
                .addChild(ObjectNode.named("Title").with(WidgetTypes.TEXT)
                        .mark(BindingMarker.builder().fieldNameOverride("Heading").build()));

        List<BindingDescriptor> collected = generator.collectFields(root, settings);
        List<BindingDescriptor> generated = generator.generate(root, null, settings).getFields();

        assertThat(collected)
                .extracting(BindingDescriptor::getTypeName, BindingDescriptor::getFieldName,
                        BindingDescriptor::getPathString, BindingDescriptor::isCapabilityReference,
                        BindingDescriptor::getCapabilityIndex)
                .containsExactlyElementsOf(extractTuples(generated));
        assertThat(collected).extracting(BindingDescriptor::getFieldName)
                .contains("_btnOk", "_btnOk_1", "_imgGallery", "_txtHeading");
        assertThat(collected).filteredOn(d -> d.getFieldName().equals("_imgGallery"))
                .extracting(BindingDescriptor::getCapabilityIndex)
                .containsExactly(1);
    }

    private static List<Tuple> extractTuples(List<BindingDescriptor> descriptors) {
        return descriptors.stream()
                .map(d -> tuple(d.getTypeName(), d.getFieldName(), d.getPathString(),
                        d.isCapabilityReference(), d.getCapabilityIndex()))
                .collect(Collectors.toList());
    }
}
