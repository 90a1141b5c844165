package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;

/**
 * Registers anonymous complex array items of arena schema properties as named schemas so that
 * emitters can generate a class for them.
 *
 * Items are named {@code {Schema}{Property}Item}. Wrapper properties of a {@code *Response}
 * schema ({@code data}, {@code items}, {@code results}, {@code content}) use
 * {@code {Base}Item} instead, e.g. {@code UserListResponse.data} items become
 * {@code UserListItem}.
 */
public class InlineArrayItemExtractor {
    private static final Logger logger = LoggerFactory.getLogger(InlineArrayItemExtractor.class);

    private static final Set<String> WRAPPER_PROPERTIES = Set.of("data", "items", "results", "content");
    private static final String RESPONSE_SUFFIX = "Response";

    private final ParsingContext context;

    public InlineArrayItemExtractor(ParsingContext context) {
        this.context = context;
    }

    /** @return the number of extracted item schemas */
    public int extract() {
        Deque<String> pending = new ArrayDeque<>(context.getSchemas().keySet());
        int extracted = 0;
        while (!pending.isEmpty()) {
            String schemaName = pending.poll();
            IRSchema schema = context.getSchema(schemaName);
            if (schema == null) {
                continue;
            }
            for (Map.Entry<String, IRSchema> entry : schema.getProperties().entrySet()) {
                IRSchema property = entry.getValue();
                if (!"array".equals(property.getType()) || !isExtractable(property.getItems())) {
                    continue;
                }
                IRSchema items = property.getItems();
                String itemName = context.uniqueSchemaName(itemName(schemaName, entry.getKey()), items);
                items.setName(itemName);
                context.registerSchema(itemName, items);
                pending.add(itemName);
                extracted++;
                logger.debug("Extracted array items of {}.{} as '{}'", schemaName, entry.getKey(), itemName);
            }
        }
        return extracted;
    }

    private boolean isExtractable(IRSchema items) {
        if (items == null || context.isRegistered(items) || items.isFromUnresolvedRef() || items.isCircularRef()) {
            return false;
        }
        boolean objectWithProperties = "object".equals(items.getType()) && !items.getProperties().isEmpty();
        return objectWithProperties || items.isComposition();
    }

    static String itemName(String schemaName, String propertyKey) {
        if (schemaName.endsWith(RESPONSE_SUFFIX) && schemaName.length() > RESPONSE_SUFFIX.length()
            && WRAPPER_PROPERTIES.contains(propertyKey)) {
            String base = schemaName.substring(0, schemaName.length() - RESPONSE_SUFFIX.length());
            return NameSanitizer.sanitizeClassName(base + "Item");
        }
        return NameSanitizer.sanitizeClassName(schemaName + NameSanitizer.capitalize(propertyKey) + "Item");
    }
}
