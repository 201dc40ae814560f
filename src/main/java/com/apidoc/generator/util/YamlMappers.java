package com.apidoc.generator.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Shared Jackson mapper for the metadata, overwrite headers and
 * configuration files, all of which are YAML.
 */
public class YamlMappers {

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
            // metadata files carry many fields that are never rendered
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            // item types are written "Class", "Namespace", ...
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private YamlMappers() {
        // Utility class
    }

    public static ObjectMapper getYamlMapper() {
        return YAML_MAPPER;
    }
}
