package com.apidoc.generator.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Returns true if the directory does not exist or has no entries.
     */
    public static boolean isEmptyDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return true;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.findAny().isEmpty();
        }
    }

    /**
     * Recursively deletes everything inside a directory, keeping the
     * directory itself.
     */
    public static void deleteDirectoryContents(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder())
                .filter(path -> !path.equals(directory))
                .forEach(path -> {
                    try {
                        Files.delete(path);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to delete: " + path, e);
                    }
                });
        }
    }
}
