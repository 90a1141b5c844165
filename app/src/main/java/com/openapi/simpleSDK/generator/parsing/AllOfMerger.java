package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Flattens an {@code allOf} composition into one object schema.
 *
 * Properties are taken from the members in order and the first member defining a name wins.
 * Required names are the union of all members. Sibling {@code properties} and
 * {@code required} next to the {@code allOf} override the merged result. The member schemas
 * are kept on {@link IRSchema#getAllOf()}.
 */
public class AllOfMerger {
    private static final Logger logger = LoggerFactory.getLogger(AllOfMerger.class);

    private final SchemaParser parser;

    public AllOfMerger(SchemaParser parser) {
        this.parser = parser;
    }

    public IRSchema merge(String registryName, String label, JsonNode node) {
        List<IRSchema> members = new ArrayList<>();
        for (JsonNode memberNode : node.get("allOf")) {
            members.add(parser.parseSchema(label, memberNode, false));
        }

        IRSchema merged = new IRSchema(registryName);
        TreeSet<String> required = new TreeSet<>();
        for (IRSchema member : members) {
            member.getProperties().forEach((key, property) -> {
                if (merged.getProperties().putIfAbsent(key, property) != null) {
                    logger.debug("allOf of '{}': keeping first definition of property '{}'", label, key);
                }
            });
            required.addAll(member.getRequired());
            if (merged.getDescription() == null && member.getDescription() != null) {
                merged.setDescription(member.getDescription());
            }
        }
        merged.setRequired(required);

        parser.parsePropertiesInto(merged, label, node);
        merged.getRequired().retainAll(merged.getProperties().keySet());
        merged.setAllOf(members);

        if (!merged.getProperties().isEmpty() || node.has("properties")) {
            merged.setType("object");
        } else {
            members.stream()
                .map(IRSchema::getType)
                .filter(type -> type != null)
                .findFirst()
                .ifPresent(merged::setType);
        }
        return merged;
    }
}
