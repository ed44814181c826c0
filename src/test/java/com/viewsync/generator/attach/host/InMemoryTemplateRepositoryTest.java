package com.viewsync.generator.attach.host;

import org.junit.jupiter.api.Test;

import com.viewsync.generator.model.ObjectNode;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InMemoryTemplateRepository.
 */
class InMemoryTemplateRepositoryTest {

    private final InMemoryTemplateRepository repository = new InMemoryTemplateRepository();

    @Test
    void testRegisteredIdentityIsStable() {
        ObjectNode root = ObjectNode.named("MainMenu");
        repository.register("menus.outline#MainMenu", root);

        assertThat(repository.identityOf(root)).isEqualTo("menus.outline#MainMenu");
        assertThat(repository.open("menus.outline#MainMenu")).containsSame(root);
    }

    @Test
    void testUnregisteredRootsGetDistinctIdentities() {
        ObjectNode first = ObjectNode.named("MainMenu");
        ObjectNode second = ObjectNode.named("MainMenu");

        assertThat(repository.identityOf(first)).isEqualTo("template:MainMenu");
        assertThat(repository.identityOf(second)).isEqualTo("template:MainMenu#1");
        assertThat(repository.identityOf(first)).isEqualTo("template:MainMenu");
    }

    @Test
    void testIdentityCannotBeReused() {
        repository.register("id", ObjectNode.named("A"));

        assertThatThrownBy(() -> repository.register("id", ObjectNode.named("B")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("id");
    }

    @Test
    void testSaveIsCounted() {
        ObjectNode root = ObjectNode.named("MainMenu");
        String identity = repository.identityOf(root);

        repository.save(identity, root);
        repository.save(identity, root);

        assertThat(repository.getSaveCount(identity)).isEqualTo(2);
        assertThat(repository.open("template:Other")).isEmpty();
    }
}
