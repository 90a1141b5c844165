package com.openapi.simpleSDK.generator.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Language-agnostic representation of one OpenAPI schema node.
 *
 * An IRSchema is created the first time the schema resolver visits its node. After that it is
 * only mutated by the documented post-passes (allOf merge, inline promotion, inline enum and
 * array item extraction, discriminator enum unification and identity assignment).
 *
 * The {@code type} field holds either a primitive tag ("string", "integer", "number",
 * "boolean", "null"), "object", "array", or the name of another registered schema when this
 * instance is a lightweight reference slot created by promotion.
 */
public class IRSchema {
    private static final Set<String> BASIC_TYPES = Set.of(
        "object", "array", "string", "integer", "number", "boolean", "null");

    private String name;
    private String type;
    private String format;
    private String description;
    private String title;
    private final Map<String, IRSchema> properties = new LinkedHashMap<>();
    private final Set<String> required = new TreeSet<>();
    private IRSchema items;
    private List<Object> enumValues;
    private Object defaultValue;
    private Object example;
    private Boolean additionalPropertiesAllowed;
    private IRSchema additionalPropertiesSchema;
    private boolean nullable;
    private List<IRSchema> anyOf;
    private List<IRSchema> oneOf;
    private List<IRSchema> allOf;
    private Discriminator discriminator;
    private boolean dataWrapper;
    private String ref;

    /** True if this instance stands in for a $ref that could not be resolved. */
    private boolean fromUnresolvedRef;
    /** Non-owning back-reference from a promoted property slot to the schema it names. */
    private IRSchema refersToSchema;
    private boolean circularRef;
    private String circularRefPath;
    private boolean maxDepthExceeded;

    private String generationName;
    private String finalModuleStem;

    public IRSchema() {
    }

    public IRSchema(String name) {
        this.name = name;
    }

    public IRSchema(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    /**
     * @return true if {@code type} is one of the OpenAPI basic type tags rather than the name of
     *         another schema
     */
    public boolean hasBasicType() {
        return type != null && BASIC_TYPES.contains(type);
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    /** Ordered property map, live view. */
    public Map<String, IRSchema> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, IRSchema> newProperties) {
        properties.clear();
        if (newProperties != null) {
            properties.putAll(newProperties);
        }
    }

    /** Required property names in sorted order, live view. */
    public Set<String> getRequired() {
        return required;
    }

    public void setRequired(Iterable<String> names) {
        required.clear();
        if (names != null) {
            names.forEach(required::add);
        }
    }

    public boolean isRequired(String propertyName) {
        return required.contains(propertyName);
    }

    public IRSchema getItems() {
        return items;
    }

    public void setItems(IRSchema items) {
        this.items = items;
    }

    /** @return the enum values, or null when this schema is not an enum */
    public List<Object> getEnumValues() {
        return enumValues;
    }

    public void setEnumValues(List<Object> enumValues) {
        this.enumValues = enumValues == null ? null : new ArrayList<>(enumValues);
    }

    public boolean isEnum() {
        return enumValues != null && !enumValues.isEmpty();
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
    }

    public Object getExample() {
        return example;
    }

    public void setExample(Object example) {
        this.example = example;
    }

    /** @return the boolean form of additionalProperties, or null when absent or given as a schema */
    public Boolean getAdditionalPropertiesAllowed() {
        return additionalPropertiesAllowed;
    }

    public void setAdditionalPropertiesAllowed(Boolean additionalPropertiesAllowed) {
        this.additionalPropertiesAllowed = additionalPropertiesAllowed;
    }

    public IRSchema getAdditionalPropertiesSchema() {
        return additionalPropertiesSchema;
    }

    public void setAdditionalPropertiesSchema(IRSchema additionalPropertiesSchema) {
        this.additionalPropertiesSchema = additionalPropertiesSchema;
    }

    public boolean hasAdditionalProperties() {
        return additionalPropertiesSchema != null || Boolean.TRUE.equals(additionalPropertiesAllowed);
    }

    public boolean isNullable() {
        return nullable;
    }

    public void setNullable(boolean nullable) {
        this.nullable = nullable;
    }

    public List<IRSchema> getAnyOf() {
        return anyOf;
    }

    public void setAnyOf(List<IRSchema> anyOf) {
        this.anyOf = anyOf;
    }

    public List<IRSchema> getOneOf() {
        return oneOf;
    }

    public void setOneOf(List<IRSchema> oneOf) {
        this.oneOf = oneOf;
    }

    public List<IRSchema> getAllOf() {
        return allOf;
    }

    public void setAllOf(List<IRSchema> allOf) {
        this.allOf = allOf;
    }

    public boolean isComposition() {
        return (anyOf != null && !anyOf.isEmpty())
            || (oneOf != null && !oneOf.isEmpty())
            || (allOf != null && !allOf.isEmpty());
    }

    /** @return the oneOf members if present, else the anyOf members, else an empty list */
    public List<IRSchema> getUnionVariants() {
        if (oneOf != null && !oneOf.isEmpty()) {
            return oneOf;
        }
        if (anyOf != null && !anyOf.isEmpty()) {
            return anyOf;
        }
        return List.of();
    }

    public Discriminator getDiscriminator() {
        return discriminator;
    }

    public void setDiscriminator(Discriminator discriminator) {
        this.discriminator = discriminator;
    }

    public boolean isDataWrapper() {
        return dataWrapper;
    }

    public void setDataWrapper(boolean dataWrapper) {
        this.dataWrapper = dataWrapper;
    }

    /** Explicit reference string for synthetic schemas built outside the resolver. */
    public String getRef() {
        return ref;
    }

    public void setRef(String ref) {
        this.ref = ref;
    }

    public boolean isFromUnresolvedRef() {
        return fromUnresolvedRef;
    }

    public void setFromUnresolvedRef(boolean fromUnresolvedRef) {
        this.fromUnresolvedRef = fromUnresolvedRef;
    }

    public IRSchema getRefersToSchema() {
        return refersToSchema;
    }

    public void setRefersToSchema(IRSchema refersToSchema) {
        this.refersToSchema = refersToSchema;
    }

    public boolean isCircularRef() {
        return circularRef;
    }

    public void setCircularRef(boolean circularRef) {
        this.circularRef = circularRef;
    }

    public String getCircularRefPath() {
        return circularRefPath;
    }

    public void setCircularRefPath(String circularRefPath) {
        this.circularRefPath = circularRefPath;
    }

    /** Distinguishes a depth-limit placeholder from a genuine cycle placeholder. */
    public boolean isMaxDepthExceeded() {
        return maxDepthExceeded;
    }

    public void setMaxDepthExceeded(boolean maxDepthExceeded) {
        this.maxDepthExceeded = maxDepthExceeded;
    }

    public String getGenerationName() {
        return generationName;
    }

    /**
     * Sets the final class name used by emitters. Once set it cannot be changed.
     *
     * @throws IllegalStateException if a different generation name was already assigned
     */
    public void setGenerationName(String generationName) {
        if (this.generationName != null && !this.generationName.equals(generationName)) {
            throw new IllegalStateException(String.format(
                "generation_name of schema '%s' is already '%s', cannot change it to '%s'",
                name, this.generationName, generationName));
        }
        this.generationName = generationName;
    }

    public String getFinalModuleStem() {
        return finalModuleStem;
    }

    public void setFinalModuleStem(String finalModuleStem) {
        this.finalModuleStem = finalModuleStem;
    }

    public boolean hasFinalizedIdentity() {
        return name != null && generationName != null;
    }

    /**
     * Copies the parsed content of {@code source} into this instance so that every holder of a
     * reference to this object observes the finished schema. Circular flags already present on
     * this instance are kept.
     */
    public void adoptContentOf(IRSchema source) {
        Objects.requireNonNull(source, "source");
        if (source == this) {
            return;
        }
        this.type = source.type;
        this.format = source.format;
        this.description = source.description;
        this.title = source.title;
        setProperties(source.properties);
        setRequired(source.required);
        this.items = source.items;
        this.enumValues = source.enumValues;
        this.defaultValue = source.defaultValue;
        this.example = source.example;
        this.additionalPropertiesAllowed = source.additionalPropertiesAllowed;
        this.additionalPropertiesSchema = source.additionalPropertiesSchema;
        this.nullable = source.nullable;
        this.anyOf = source.anyOf;
        this.oneOf = source.oneOf;
        this.allOf = source.allOf;
        this.discriminator = source.discriminator;
        this.dataWrapper = source.dataWrapper;
        this.fromUnresolvedRef = source.fromUnresolvedRef;
        this.refersToSchema = source.refersToSchema;
        this.circularRef = this.circularRef || source.circularRef;
        if (this.circularRefPath == null) {
            this.circularRefPath = source.circularRefPath;
        }
        this.maxDepthExceeded = this.maxDepthExceeded || source.maxDepthExceeded;
        if (source.name != null) {
            this.name = source.name;
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("IRSchema{");
        builder.append("name=").append(name);
        builder.append(", type=").append(type);
        if (!properties.isEmpty()) {
            builder.append(", properties=").append(properties.keySet());
        }
        if (enumValues != null) {
            builder.append(", enum=").append(enumValues);
        }
        if (circularRef) {
            builder.append(", circular=").append(circularRefPath);
        }
        if (fromUnresolvedRef) {
            builder.append(", unresolved");
        }
        return builder.append('}').toString();
    }
}
