package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Reads OpenAPI documents from JSON or YAML files into a Jackson tree.
 */
public class SpecReader {
    private static final Logger logger = LoggerFactory.getLogger(SpecReader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * @param specPath a {@code .json}, {@code .yaml} or {@code .yml} file
     * @throws IOException if the file cannot be read, cannot be parsed, or has another extension
     */
    public JsonNode read(Path specPath) throws IOException {
        if (!Files.isRegularFile(specPath)) {
            throw new IOException("Specification file does not exist: " + specPath);
        }
        String fileName = specPath.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (fileName.endsWith(".json")) {
            mapper = jsonMapper;
        } else if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            mapper = yamlMapper;
        } else {
            throw new IOException("Unsupported specification file type: " + specPath);
        }
        logger.debug("Reading specification {}", specPath);
        JsonNode document = mapper.readTree(Files.readString(specPath));
        if (document == null || document.isMissingNode() || document.isNull()) {
            throw new IOException("Specification file is empty: " + specPath);
        }
        return document;
    }

    /** Converts an already decoded document of maps and lists. */
    public JsonNode fromMap(Map<String, ?> document) {
        return jsonMapper.valueToTree(document);
    }
}
