package com.apidoc.generator.output;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.path.OutputPathRegistry;
import com.apidoc.generator.util.FileWriteUtil;

/**
 * Writes generated documents below the output directory.
 *
 * Each path is claimed in the {@link OutputPathRegistry} before anything is
 * written, so a colliding document aborts the run without touching the file
 * written earlier.
 */
public class DocumentWriter {
    private static final Logger log = LoggerFactory.getLogger(DocumentWriter.class);

    private final Path outputDir;
    private final OutputPathRegistry registry;
    private int filesWritten;

    public DocumentWriter(Path outputDir, OutputPathRegistry registry) {
        this.outputDir = outputDir;
        this.registry = registry;
    }

    public Path write(GeneratedFile file) throws IOException {
        registry.register(file.getPath());

        Path target = outputDir.resolve(file.getPath() + GeneratedFile.EXTENSION);
        FileWriteUtil.safeWriteString(target, file.getContents());
        filesWritten++;

        log.info("Writing {}", outputDir.relativize(target));
        return target;
    }

    public int getFilesWritten() {
        return filesWritten;
    }
}
