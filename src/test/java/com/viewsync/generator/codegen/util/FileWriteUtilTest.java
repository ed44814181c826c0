package com.viewsync.generator.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class FileWriteUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteIfChangedOnlyWritesDifferences() throws IOException {
        Path file = tempDir.resolve("a/b/View.java");

        assertThat(FileWriteUtil.readIfExists(file)).isNull();
        assertThat(FileWriteUtil.writeIfChanged(file, "class View {}\n")).isTrue();
        assertThat(FileWriteUtil.writeIfChanged(file, "class View {}\n")).isFalse();
        assertThat(FileWriteUtil.writeIfChanged(file, "class View { }\n")).isTrue();
        assertThat(Files.readString(file)).isEqualTo("class View { }\n");
    }
}
