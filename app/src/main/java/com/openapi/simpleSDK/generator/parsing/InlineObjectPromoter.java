package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Promotes inline object properties to named arena schemas.
 *
 * The chosen name is tried in order: the singularized property name with a semantic suffix,
 * the parent name joined with that, and finally the joined name with a counter. The parent's
 * property slot is replaced by a lightweight schema whose type is the promoted name.
 */
public class InlineObjectPromoter {
    private static final Logger logger = LoggerFactory.getLogger(InlineObjectPromoter.class);

    private static final List<String> ENTITY_SUFFIXES = List.of("Item", "Data", "Info", "Object", "Record", "Entry");

    private final ParsingContext context;

    public InlineObjectPromoter(ParsingContext context) {
        this.context = context;
    }

    /**
     * @return the replacement property slot, or null when {@code property} is not promoted
     */
    public IRSchema promote(String parentName, String propertyKey, IRSchema property) {
        if (!isPromotable(property)) {
            return null;
        }

        String propertyClassName = propertyClassName(propertyKey, property);
        String parentPlusProperty = parentName == null
            ? propertyClassName
            : NameSanitizer.sanitizeClassName(parentName + propertyClassName);

        String chosen;
        if (isFreeFor(propertyClassName, property)) {
            chosen = propertyClassName;
        } else if (isFreeFor(parentPlusProperty, property)) {
            chosen = parentPlusProperty;
        } else {
            int counter = 1;
            chosen = parentPlusProperty + counter;
            while (!isFreeFor(chosen, property)) {
                counter++;
                chosen = parentPlusProperty + counter;
            }
        }

        property.setName(chosen);
        context.registerSchema(chosen, property);
        logger.info("Promoted inline object {}.{} to schema '{}'",
            parentName == null ? "<anonymous>" : parentName, propertyKey, chosen);

        IRSchema slot = new IRSchema(null, chosen);
        slot.setDescription(property.getDescription());
        slot.setNullable(property.isNullable());
        slot.setRefersToSchema(property);
        return slot;
    }

    private boolean isPromotable(IRSchema property) {
        if (!"object".equals(property.getType()) || property.getEnumValues() != null) {
            return false;
        }
        if (property.isFromUnresolvedRef() || property.isCircularRef()) {
            return false;
        }
        if (context.isRegistered(property)) {
            return false;
        }
        // free-form maps and empty objects stay inline, they resolve to a dictionary
        return !property.getProperties().isEmpty();
    }

    private boolean isFreeFor(String name, IRSchema property) {
        IRSchema existing = context.getSchema(name);
        if (existing == null) {
            // components parsed later still own their names
            return context.getRawSchema(name) == null;
        }
        return existing == property;
    }

    static String propertyClassName(String propertyKey, IRSchema property) {
        String name = NameSanitizer.sanitizeClassName(propertyKey);
        if (name.endsWith("s") && !name.endsWith("ss") && name.length() > 2) {
            name = name.substring(0, name.length() - 1);
        }
        boolean hasEntitySuffix = ENTITY_SUFFIXES.stream().anyMatch(name::endsWith);
        boolean hasIdProperty = property.getProperties().keySet().stream()
            .anyMatch(key -> key.equals("id") || key.endsWith("Id"));
        if (!hasEntitySuffix && !hasIdProperty) {
            name += "Data";
        }
        return name;
    }
}
