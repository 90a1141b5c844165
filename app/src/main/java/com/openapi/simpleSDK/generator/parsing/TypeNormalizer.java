package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Normalizes the {@code type} field of a schema node. OpenAPI 3.0 uses a single string,
 * OpenAPI 3.1 allows an array that may contain "null".
 */
public final class TypeNormalizer {

    private TypeNormalizer() {
    }

    /**
     * @param primaryType the chosen type, or null when absent or only "null"
     * @param nullable true when "null" was declared
     * @param warnings messages for lossy or unexpected declarations
     */
    public record NormalizedType(String primaryType, boolean nullable, List<String> warnings) {
        public NormalizedType {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * Several non-null types collapse to the first one with a warning.
     *
     * @param typeField the raw {@code type} value, may be null or missing
     * @param schemaName used in warning messages, may be null
     */
    public static NormalizedType normalize(JsonNode typeField, String schemaName) {
        List<String> warnings = new ArrayList<>();
        if (typeField == null || typeField.isNull() || typeField.isMissingNode()) {
            return new NormalizedType(null, false, warnings);
        }
        if (typeField.isTextual()) {
            String type = typeField.asText();
            if ("null".equals(type)) {
                return new NormalizedType(null, true, warnings);
            }
            return new NormalizedType(type, false, warnings);
        }
        if (typeField.isArray()) {
            boolean hasNull = false;
            List<String> nonNull = new ArrayList<>();
            for (JsonNode element : typeField) {
                String type = element.asText();
                if ("null".equals(type)) {
                    hasNull = true;
                } else {
                    nonNull.add(type);
                }
            }
            if (nonNull.isEmpty()) {
                return new NormalizedType(null, hasNull, warnings);
            }
            if (nonNull.size() > 1) {
                warnings.add(String.format("%s has multiple types: %s. Using '%s'.",
                    display(schemaName),
                    nonNull.stream().map(t -> "'" + t + "'").collect(Collectors.joining(", ")),
                    nonNull.get(0)));
            }
            return new NormalizedType(nonNull.get(0), hasNull, warnings);
        }
        warnings.add(String.format("%s has unexpected 'type' field: %s. Ignoring.", display(schemaName), typeField));
        return new NormalizedType(null, false, warnings);
    }

    private static String display(String schemaName) {
        return schemaName == null ? "Schema" : "'" + schemaName + "'";
    }
}
