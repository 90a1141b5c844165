package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.Discriminator;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Unifies the per-variant discriminator enums of every discriminated union into one enum per
 * union.
 *
 * <ul>
 *   <li>Pass A, {@link #identifyDiscriminatorProperties()}: marks variant discriminator
 *   properties so inline enum extraction leaves them alone.</li>
 *   <li>Pass B, {@link #collectUnifiedEnums()}: builds one enum per union and rebinds each
 *   variant's discriminator property to it.</li>
 * </ul>
 *
 * Rebinding replaces the variant's property slot with a new object. The old object may be
 * shared with unrelated schemas through the reference cache and is never mutated.
 */
public class DiscriminatorEnumCollector {
    private static final Logger logger = LoggerFactory.getLogger(DiscriminatorEnumCollector.class);

    private final ParsingContext context;
    private final Map<String, UnifiedDiscriminatorEnum> unifiedEnums = new LinkedHashMap<>();
    private final Set<String> skipList = new TreeSet<>();

    public DiscriminatorEnumCollector(ParsingContext context) {
        this.context = context;
    }

    /**
     * Pass A.
     *
     * @return the marked properties as {@code Variant.property}
     */
    public Set<String> identifyDiscriminatorProperties() {
        Set<String> marked = new LinkedHashSet<>();
        for (IRSchema union : context.getSchemas().values()) {
            Discriminator discriminator = union.getDiscriminator();
            if (discriminator == null || union.getUnionVariants().isEmpty()) {
                continue;
            }
            for (IRSchema variant : union.getUnionVariants()) {
                if (variant.getName() != null) {
                    context.markDiscriminatorProperty(variant.getName(), discriminator.propertyName());
                    marked.add(variant.getName() + "." + discriminator.propertyName());
                }
            }
        }
        logger.debug("Marked {} discriminator properties", marked.size());
        return marked;
    }

    /**
     * Pass B. The unified enum schemas are registered in the arena. Replaced per-variant enum
     * schemas that nothing else references are removed from the arena and added to
     * {@link #getSkipList()}.
     */
    public Map<String, UnifiedDiscriminatorEnum> collectUnifiedEnums() {
        List<IRSchema> unions = new ArrayList<>();
        for (IRSchema schema : context.getSchemas().values()) {
            if (schema.getDiscriminator() != null && !schema.getUnionVariants().isEmpty()) {
                unions.add(schema);
            }
        }
        for (IRSchema union : unions) {
            try {
                unify(union);
            } catch (CycleLimitExceededException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.debug("Discriminator unification failed for '{}'", union.getName(), e);
                context.addWarning(ParseWarning.Kind.COMPOSITION_PROCESSING_FAILURE, String.format(
                    "Failed to unify discriminator enum of '%s': %s", union.getName(), e.getMessage()));
            }
        }
        return Collections.unmodifiableMap(unifiedEnums);
    }

    public Map<String, UnifiedDiscriminatorEnum> getUnifiedEnums() {
        return Collections.unmodifiableMap(unifiedEnums);
    }

    public Set<String> getSkipList() {
        return Collections.unmodifiableSet(skipList);
    }

    /** {@code Pet} with property {@code petType} yields {@code PetPetTypeEnum}. */
    public static String unifiedEnumName(String unionName, String propertyName) {
        String base = unionName.endsWith("Enum") ? unionName.substring(0, unionName.length() - 4) : unionName;
        return NameSanitizer.sanitizeClassName(base) + NameSanitizer.sanitizeClassName(propertyName) + "Enum";
    }

    private void unify(IRSchema union) {
        String unionName = union.getName();
        Discriminator discriminator = union.getDiscriminator();
        String propertyName = discriminator.propertyName();

        List<UnifiedDiscriminatorEnum.Member> members = new ArrayList<>();
        for (IRSchema variant : union.getUnionVariants()) {
            for (Object value : discriminatorValues(variant, discriminator)) {
                members.add(new UnifiedDiscriminatorEnum.Member(NameSanitizer.sanitizeEnumMemberName(value), value));
            }
        }
        if (members.isEmpty()) {
            logger.info("Union '{}' has no resolvable values for discriminator '{}'", unionName, propertyName);
            return;
        }

        IRSchema enumSchema = new IRSchema();
        String enumName = context.uniqueSchemaName(unifiedEnumName(unionName, propertyName), enumSchema);
        Object first = members.get(0).value();
        enumSchema.setName(enumName);
        enumSchema.setType(first instanceof Integer || first instanceof Long ? "integer" : "string");
        enumSchema.setEnumValues(members.stream().map(UnifiedDiscriminatorEnum.Member::value).toList());
        enumSchema.setDescription(String.format("Discriminator values for %s.%s", unionName, propertyName));
        enumSchema.setGenerationName(enumName);
        enumSchema.setFinalModuleStem(NameSanitizer.sanitizeModuleName(enumName));
        context.registerSchema(enumName, enumSchema);

        Set<IRSchema> replacedEnums = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IRSchema variant : union.getUnionVariants()) {
            IRSchema old = variant.getProperties().get(propertyName);
            if (old == null) {
                continue;
            }
            IRSchema previousEnum = namedEnumBehind(old);
            if (previousEnum != null && previousEnum != enumSchema) {
                replacedEnums.add(previousEnum);
            }
            variant.getProperties().put(propertyName, boundSlot(enumName, enumSchema, old));
        }

        Set<String> skipped = new TreeSet<>();
        for (IRSchema replaced : replacedEnums) {
            if (!isReferencedInArena(replaced)) {
                context.removeSchema(replaced.getName());
                skipped.add(replaced.getName());
            }
        }
        skipList.addAll(skipped);

        unifiedEnums.put(enumName, new UnifiedDiscriminatorEnum(enumName, propertyName, unionName, members, skipped,
            enumSchema.getDescription()));
        logger.info("Created discriminator enum '{}' with {} values for union '{}'", enumName, members.size(), unionName);
    }

    private List<Object> discriminatorValues(IRSchema variant, Discriminator discriminator) {
        IRSchema property = variant.getProperties().get(discriminator.propertyName());
        if (property != null) {
            if (property.isEnum()) {
                return property.getEnumValues();
            }
            IRSchema referenced = referencedSchema(property);
            if (referenced != null && referenced.isEnum() && !unifiedEnums.containsKey(referenced.getName())) {
                return referenced.getEnumValues();
            }
        }
        if (variant.getName() != null) {
            String mapped = discriminator.valueFor(variant.getName());
            if (mapped != null) {
                return List.of(mapped);
            }
        }
        return List.of();
    }

    private IRSchema referencedSchema(IRSchema property) {
        if (property.getRefersToSchema() != null) {
            return property.getRefersToSchema();
        }
        if (property.getType() != null && !property.hasBasicType()) {
            return context.getSchema(property.getType());
        }
        return null;
    }

    /** The registered enum schema that a property slot is or points to, if any. */
    private IRSchema namedEnumBehind(IRSchema property) {
        if (property.isEnum() && context.isRegistered(property)) {
            return property;
        }
        IRSchema referenced = referencedSchema(property);
        if (referenced != null && referenced.isEnum() && context.isRegistered(referenced)
            && !unifiedEnums.containsKey(referenced.getName())) {
            return referenced;
        }
        return null;
    }

    private static IRSchema boundSlot(String enumName, IRSchema enumSchema, IRSchema old) {
        IRSchema slot = new IRSchema(enumName, old.hasBasicType() ? old.getType() : enumSchema.getType());
        slot.setGenerationName(enumName);
        slot.setFinalModuleStem(enumSchema.getFinalModuleStem());
        slot.setRefersToSchema(enumSchema);
        slot.setDescription(old.getDescription());
        slot.setNullable(old.isNullable());
        return slot;
    }

    private boolean isReferencedInArena(IRSchema target) {
        Set<IRSchema> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IRSchema owner : context.getSchemas().values()) {
            if (owner != target && references(owner, target, visited)) {
                return true;
            }
        }
        return false;
    }

    private boolean references(IRSchema schema, IRSchema target, Set<IRSchema> visited) {
        if (!visited.add(schema)) {
            return false;
        }
        List<IRSchema> children = new ArrayList<>(schema.getProperties().values());
        if (schema.getItems() != null) {
            children.add(schema.getItems());
        }
        if (schema.getAdditionalPropertiesSchema() != null) {
            children.add(schema.getAdditionalPropertiesSchema());
        }
        for (List<IRSchema> members : List.of(nonNull(schema.getAnyOf()), nonNull(schema.getOneOf()), nonNull(schema.getAllOf()))) {
            children.addAll(members);
        }
        for (IRSchema child : children) {
            if (child == target || child.getRefersToSchema() == target
                || (!child.hasBasicType() && target.getName() != null && target.getName().equals(child.getType()))) {
                return true;
            }
            if (!context.isRegistered(child) && references(child, target, visited)) {
                return true;
            }
        }
        return false;
    }

    private static List<IRSchema> nonNull(List<IRSchema> members) {
        return members == null ? List.of() : members;
    }
}
