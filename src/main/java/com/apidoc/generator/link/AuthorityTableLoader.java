package com.apidoc.generator.link;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.exception.StructuralException;
import com.apidoc.generator.util.YamlMappers;
import com.fasterxml.jackson.core.JsonProcessingException;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reads the authority table from YAML:
 *
 * <pre>
 * authorities:
 *   - name: dotnet
 *     prefix: "System."
 *     segmentsToStrip: 0
 *     urlTemplate: "https://docs.microsoft.com/dotnet/api/{id}"
 *     aliases:
 *       System.String: string
 * </pre>
 */
public class AuthorityTableLoader {
    private static final Logger log = LoggerFactory.getLogger(AuthorityTableLoader.class);

    public static final String DEFAULT_RESOURCE = "/authorities.yml";

    public AuthorityTable loadDefault() throws IOException {
        try (InputStream in = AuthorityTableLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new StructuralException("Default authority table " + DEFAULT_RESOURCE + " is missing from the classpath");
            }
            return toTable(read(in, DEFAULT_RESOURCE), DEFAULT_RESOURCE);
        }
    }

    public AuthorityTable load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new StructuralException("Authority table not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return toTable(read(in, file.toString()), file.toString());
        }
    }

    private AuthorityFile read(InputStream in, String source) throws IOException {
        try {
            AuthorityFile file = YamlMappers.getYamlMapper().readValue(in, AuthorityFile.class);
            return file == null ? new AuthorityFile() : file;
        } catch (JsonProcessingException e) {
            throw new StructuralException("Malformed authority table " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    private AuthorityTable toTable(AuthorityFile file, String source) {
        List<ExternalAuthority> authorities = file.getAuthorities() == null ? List.of() : file.getAuthorities();
        for (ExternalAuthority authority : authorities) {
            if (authority.getPrefix() == null || authority.getPrefix().isEmpty()) {
                throw new StructuralException("Authority " + authority.getName() + " in " + source + " has no prefix");
            }
            if (authority.getUrlTemplate() == null) {
                throw new StructuralException("Authority " + authority.getName() + " in " + source + " has no urlTemplate");
            }
            if (authority.getSegmentsToStrip() < 0) {
                throw new StructuralException("Authority " + authority.getName() + " in " + source
                        + " has a negative segmentsToStrip");
            }
        }
        log.debug("Loaded {} external authorities from {}", authorities.size(), source);
        return new AuthorityTable(authorities);
    }

    @Data
    @NoArgsConstructor
    static class AuthorityFile {
        private List<ExternalAuthority> authorities = new ArrayList<>();
    }
}
