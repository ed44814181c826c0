package com.viewsync.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for artifact file access with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Writes content only if it differs from what is on disk, so an unchanged artifact never
     * re-triggers the host's recompilation.
     *
     * @return true if the file was written
     */
    public static boolean writeIfChanged(Path filePath, String content) throws IOException {
        String existing = readIfExists(filePath);
        if (content.equals(existing)) {
            return false;
        }
        safeWriteString(filePath, content);
        return true;
    }

    /**
     * @return file content, or null if the file does not exist
     */
    public static String readIfExists(Path filePath) throws IOException {
        if (!Files.isRegularFile(filePath)) {
            return null;
        }
        return Files.readString(filePath, StandardCharsets.UTF_8);
    }
}
