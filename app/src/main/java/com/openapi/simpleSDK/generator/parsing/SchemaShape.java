package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Structural kind of a raw schema node, decided once when the resolver enters the node.
 */
public enum SchemaShape {
    REF,
    ALL_OF,
    ANY_OF,
    ONE_OF,
    ENUM,
    ARRAY,
    OBJECT,
    SCALAR;

    /**
     * @param node a non-null schema object
     * @param primaryType the normalized {@code type}, may be null
     */
    public static SchemaShape of(JsonNode node, String primaryType) {
        if (node.hasNonNull("$ref")) {
            return REF;
        }
        if (isNonEmptyArray(node.get("allOf"))) {
            return ALL_OF;
        }
        if (isNonEmptyArray(node.get("anyOf"))) {
            return ANY_OF;
        }
        if (isNonEmptyArray(node.get("oneOf"))) {
            return ONE_OF;
        }
        if (node.has("enum") && node.get("enum").isArray()) {
            return ENUM;
        }
        if ("array".equals(primaryType) || (primaryType == null && node.has("items"))) {
            return ARRAY;
        }
        if ("object".equals(primaryType)
            || (primaryType == null && (node.has("properties") || node.has("additionalProperties")))) {
            return OBJECT;
        }
        return SCALAR;
    }

    private static boolean isNonEmptyArray(JsonNode node) {
        return node != null && node.isArray() && !node.isEmpty();
    }
}
