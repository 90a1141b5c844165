package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Assigns the final class name and module stem to every arena schema that does not have one
 * yet. Two different schemas never share a class name or a module stem; collisions get an
 * increasing integer suffix in arena order.
 */
public class SchemaIdentityAssigner {
    private static final Logger logger = LoggerFactory.getLogger(SchemaIdentityAssigner.class);

    private final ParsingContext context;

    public SchemaIdentityAssigner(ParsingContext context) {
        this.context = context;
    }

    /** @return the number of schemas that received an identity */
    public int assign() {
        Set<String> usedNames = new HashSet<>();
        Set<String> usedStems = new HashSet<>();
        for (IRSchema schema : context.getSchemas().values()) {
            if (schema.getGenerationName() != null) {
                usedNames.add(schema.getGenerationName());
                if (schema.getFinalModuleStem() != null) {
                    usedStems.add(schema.getFinalModuleStem());
                }
            }
        }

        int assigned = 0;
        for (Map.Entry<String, IRSchema> entry : context.getSchemas().entrySet()) {
            IRSchema schema = entry.getValue();
            if (schema.getGenerationName() == null) {
                String base = NameSanitizer.sanitizeClassName(entry.getKey());
                String className = base;
                int counter = 2;
                while (usedNames.contains(className)
                    || usedStems.contains(NameSanitizer.sanitizeModuleName(className))) {
                    className = base + counter++;
                }
                schema.setGenerationName(className);
                usedNames.add(className);
                assigned++;
                if (!className.equals(entry.getKey())) {
                    logger.debug("Schema '{}' will be generated as '{}'", entry.getKey(), className);
                }
            }
            if (schema.getFinalModuleStem() == null) {
                String stem = NameSanitizer.sanitizeModuleName(schema.getGenerationName());
                String candidate = stem;
                int counter = 2;
                while (usedStems.contains(candidate)) {
                    candidate = stem + "_" + counter++;
                }
                schema.setFinalModuleStem(candidate);
                usedStems.add(candidate);
            }
        }
        return assigned;
    }
}
