package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code anyOf} and {@code oneOf} unions. An explicit {@code {"type": "null"}} member is
 * removed from the list and marks the union nullable. A single remaining member is still kept as
 * a one-element union.
 */
public class CompositionParser {
    private static final Logger logger = LoggerFactory.getLogger(CompositionParser.class);

    private final SchemaParser parser;

    public CompositionParser(SchemaParser parser) {
        this.parser = parser;
    }

    public IRSchema parseUnion(String registryName, JsonNode node, JsonNode membersNode, boolean anyOf) {
        IRSchema union = new IRSchema(registryName);
        List<IRSchema> members = new ArrayList<>();
        for (JsonNode memberNode : membersNode) {
            if (isNullMember(memberNode)) {
                union.setNullable(true);
                continue;
            }
            members.add(parser.parseSchema(null, memberNode, false));
        }
        if (anyOf) {
            union.setAnyOf(members);
        } else {
            union.setOneOf(members);
        }
        if (node.has("properties")) {
            parser.parsePropertiesInto(union, registryName, node);
        }
        logger.debug("Parsed {} of '{}' with {} members (nullable={})",
            anyOf ? "anyOf" : "oneOf", registryName, members.size(), union.isNullable());
        return union;
    }

    private static boolean isNullMember(JsonNode memberNode) {
        if (memberNode == null || !memberNode.isObject() || memberNode.has("$ref")) {
            return false;
        }
        TypeNormalizer.NormalizedType normalized = TypeNormalizer.normalize(memberNode.get("type"), null);
        return normalized.primaryType() == null && normalized.nullable()
            && !memberNode.has("properties") && !memberNode.has("enum");
    }
}
