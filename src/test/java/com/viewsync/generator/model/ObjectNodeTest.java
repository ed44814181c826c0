package com.viewsync.generator.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ObjectNodeTest {

    private ObjectNode buildTree() {
        ObjectNode root = ObjectNode.named("Root");
        ObjectNode panel = ObjectNode.named("Panel").with("ui.LayoutBox");
        panel.addChild(ObjectNode.named("Ok").with("ui.Button", "ui.Text"));
        panel.addChild(ObjectNode.named("Ok").with("ui.Toggle"));
        root.addChild(panel);
        root.addChild(ObjectNode.named("Footer"));
        return root;
    }

    @Test
    void testFindFollowsFirstMatchingChild() {
        ObjectNode root = buildTree();

        ObjectNode ok = root.find(List.of("Panel", "Ok")).orElseThrow();

        assertThat(ok.hasCapability("ui.Button")).isTrue();
        assertThat(ok.hasCapability("ui.Toggle")).isFalse();
    }

    @Test
    void testFindEmptyPathIsSelf() {
        ObjectNode root = buildTree();

        assertThat(root.find(List.of())).contains(root);
        assertThat(root.find(List.of("Panel", "Missing"))).isEmpty();
    }

    @Test
    void testPathFromRoot() {
        ObjectNode root = buildTree();
        ObjectNode ok = root.find(List.of("Panel", "Ok")).orElseThrow();

        assertThat(ok.pathFrom(root)).containsExactly("Panel", "Ok");
        assertThat(root.pathFrom(root)).isEmpty();
        assertThat(ok.getParent().getName()).isEqualTo("Panel");
    }

    @Test
    void testPreOrder() {
        ObjectNode root = buildTree();

        assertThat(root.preOrder())
                .extracting(ObjectNode::getName)
                .containsExactly("Root", "Panel", "Ok", "Ok", "Footer");
    }

    @Test
    void testCapabilityByTypeAndIndex() {
        ObjectNode node = ObjectNode.named("Icons").with("ui.Image", "ui.Text", "ui.Image");

        assertThat(node.getCapabilities("ui.Image")).hasSize(2);
        assertThat(node.getCapability("ui.Image", 1)).isPresent();
        assertThat(node.getCapability("ui.Image", 2)).isEmpty();
        assertThat(node.getCapability("ui.Button", 0)).isEmpty();
    }

    @Test
    void testTargetKindFromText() {
        assertThat(TargetKind.fromText("component")).isEqualTo(TargetKind.CAPABILITY);
        assertThat(TargetKind.fromText("node-only")).isEqualTo(TargetKind.NODE_ONLY);
        assertThat(TargetKind.fromText(" ")).isEqualTo(TargetKind.AUTO);
        assertThatThrownBy(() -> TargetKind.fromText("widget"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
