package com.apidoc.generator.overwrite;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.exception.OverwriteFormatException;
import com.apidoc.generator.exception.OverwriteValidationException;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.util.MarkdownTextUtil;
import com.apidoc.generator.util.YamlMappers;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Parser for overwrite files.
 *
 * Format:
 * <pre>
 * ---
 * uid: Example.Namespace.Widget
 * summary: *content
 * ---
 * Markdown body, used wherever the header says *content.
 * </pre>
 *
 * The header is YAML. {@code *content} would be read as an undefined YAML
 * alias, so it is swapped for {@value #CONTENT_PLACEHOLDER} before parsing.
 */
public class OverwriteParser {
    private static final Logger log = LoggerFactory.getLogger(OverwriteParser.class);

    public static final String HEADER_DELIMITER = "---";
    public static final String CONTENT_MARKER = "*content";
    public static final String CONTENT_PLACEHOLDER = "__content__";

    public OverwriteDocument parse(Path overwriteFile) throws IOException {
        List<String> lines = Files.readAllLines(overwriteFile, StandardCharsets.UTF_8);
        return parse(overwriteFile.toString(), lines);
    }

    public OverwriteDocument parse(String source, List<String> lines) {
        Deque<String> remaining = new ArrayDeque<>(lines);

        if (remaining.isEmpty() || !HEADER_DELIMITER.equals(remaining.poll())) {
            throw new OverwriteFormatException("Expected overwrite file " + source + " to start with '"
                    + HEADER_DELIMITER + "'");
        }

        StringBuilder header = new StringBuilder();
        while (!HEADER_DELIMITER.equals(remaining.peek())) {
            if (remaining.isEmpty()) {
                throw new OverwriteFormatException("Unexpected end of file in overwrite file " + source);
            }
            header.append(remaining.poll().replace(CONTENT_MARKER, CONTENT_PLACEHOLDER)).append('\n');
        }
        remaining.poll();

        String body = String.join("\n", remaining);

        Item partial = parseHeader(source, header.toString());
        if (MarkdownTextUtil.isBlank(partial.getUid())) {
            throw new OverwriteValidationException("Overwrite file " + source + " does not specify a UID");
        }

        applyBody(partial, body);
        log.debug("Parsed overwrite file {} for {}", source, partial.getUid());
        return new OverwriteDocument(source, partial);
    }

    private Item parseHeader(String source, String header) {
        if (header.isBlank()) {
            return new Item();
        }
        try {
            Item item = YamlMappers.getYamlMapper().readValue(header, Item.class);
            return item != null ? item : new Item();
        } catch (JsonProcessingException e) {
            throw new OverwriteFormatException("Malformed header in overwrite file " + source + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    private void applyBody(Item partial, String body) {
        for (OverwriteField field : OverwriteField.values()) {
            if (CONTENT_PLACEHOLDER.equals(field.get(partial))) {
                field.set(partial, body);
            }
        }
    }
}
