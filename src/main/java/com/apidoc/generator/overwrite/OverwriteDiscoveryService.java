package com.apidoc.generator.overwrite;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public class OverwriteDiscoveryService {

    /**
     * All Markdown files below the directory, in path order.
     */
    public List<Path> discoverOverwriteFiles(Path overwriteDir) throws IOException {
        try (Stream<Path> stream = Files.walk(overwriteDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isOverwriteFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isOverwriteFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".md");
    }
}
