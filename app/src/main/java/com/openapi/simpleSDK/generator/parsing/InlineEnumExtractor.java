package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hoists inline enum properties of arena schemas to named enum schemas called
 * {@code {Schema}{Property}Enum} and replaces the property slot with a reference to it.
 * Properties marked as discriminators by
 * {@link DiscriminatorEnumCollector#identifyDiscriminatorProperties()} are left inline; they
 * are unified afterwards.
 */
public class InlineEnumExtractor {
    private static final Logger logger = LoggerFactory.getLogger(InlineEnumExtractor.class);

    private final ParsingContext context;

    public InlineEnumExtractor(ParsingContext context) {
        this.context = context;
    }

    /** @return the number of extracted enum schemas */
    public int extract() {
        int extracted = 0;
        List<String> schemaNames = new ArrayList<>(context.getSchemas().keySet());
        for (String schemaName : schemaNames) {
            IRSchema schema = context.getSchema(schemaName);
            if (schema == null || schema.isEnum()) {
                continue;
            }
            for (Map.Entry<String, IRSchema> entry : schema.getProperties().entrySet()) {
                String key = entry.getKey();
                IRSchema property = entry.getValue();
                if (context.isDiscriminatorProperty(schemaName, key)) {
                    logger.debug("Skipping discriminator property {}.{}", schemaName, key);
                    continue;
                }
                if (isInlineEnum(property)) {
                    entry.setValue(register(schemaName, key, property));
                    extracted++;
                } else if ("array".equals(property.getType()) && isInlineEnum(property.getItems())) {
                    property.setItems(register(schemaName, key, property.getItems()));
                    extracted++;
                }
            }
        }
        return extracted;
    }

    private boolean isInlineEnum(IRSchema schema) {
        return schema != null && schema.isEnum() && !context.isRegistered(schema);
    }

    /** Registers the enum and returns the reference slot that replaces it. */
    private IRSchema register(String schemaName, String propertyKey, IRSchema enumSchema) {
        String base = NameSanitizer.sanitizeClassName(schemaName + NameSanitizer.capitalize(propertyKey) + "Enum");
        String enumName = context.uniqueSchemaName(base, enumSchema);
        enumSchema.setName(enumName);
        context.registerSchema(enumName, enumSchema);
        logger.debug("Extracted inline enum {}.{} as '{}'", schemaName, propertyKey, enumName);

        IRSchema slot = new IRSchema(null, enumName);
        slot.setDescription(enumSchema.getDescription());
        slot.setNullable(enumSchema.isNullable());
        slot.setRefersToSchema(enumSchema);
        return slot;
    }
}
