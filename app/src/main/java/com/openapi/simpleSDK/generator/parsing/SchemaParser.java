package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openapi.simpleSDK.generator.ir.Discriminator;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Recursive-descent resolver turning raw schema nodes into {@link IRSchema} instances.
 *
 * Named registry schemas are registered in the arena before their children are visited, so
 * a reference back to a schema still being parsed resolves to the same instance. Cycles,
 * excessive depth and unresolvable references never raise: they produce placeholders and
 * warnings on the {@link ParsingContext}.
 */
public class SchemaParser {
    private static final Logger logger = LoggerFactory.getLogger(SchemaParser.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ParsingContext context;
    private final CycleGuard cycleGuard;
    private final RefResolver refResolver;
    private final AllOfMerger allOfMerger;
    private final CompositionParser compositionParser;
    private final InlineObjectPromoter objectPromoter;

    public SchemaParser(ParsingContext context) {
        this.context = context;
        this.cycleGuard = new CycleGuard(context);
        this.refResolver = new RefResolver(this, context);
        this.allOfMerger = new AllOfMerger(this);
        this.compositionParser = new CompositionParser(this);
        this.objectPromoter = new InlineObjectPromoter(context);
    }

    public ParsingContext getContext() {
        return context;
    }

    /**
     * Resolves a schema of {@code components.schemas} by name, returning the cached instance
     * when it has already been parsed.
     */
    public IRSchema resolveNamed(String name) {
        return refResolver.resolveSchemaName(name);
    }

    /**
     * Parses one schema node.
     *
     * @param name registry name when {@code register} is true, otherwise an optional label
     * @param node the raw node; null yields an empty stub
     * @param register true for registry schemas: the result is tracked for cycles and stored
     *        in the arena under {@code name}
     */
    public IRSchema parseSchema(String name, JsonNode node, boolean register) {
        boolean tracked = register && name != null;
        if (tracked) {
            IRSchema cached = context.getSchema(name);
            if (cached != null && !context.isInRecursionStack(name)) {
                logger.debug("Cache hit for schema '{}'", name);
                return cached;
            }
        }

        GuardResult guard = cycleGuard.enter(name, tracked);
        switch (guard.outcome()) {
            case CYCLE_HIT, DEPTH_EXCEEDED -> {
                return guard.placeholder();
            }
            case ENTERED -> {
            }
        }

        IRSchema canonical = null;
        try {
            if (tracked) {
                canonical = new IRSchema(name);
                context.registerSchema(name, canonical);
            }
            if (node == null || node.isNull() || node.isMissingNode()) {
                return tracked ? canonical : new IRSchema();
            }
            IRSchema result = dispatch(tracked ? name : null, name, node);
            if (!tracked) {
                return result;
            }
            canonical.adoptContentOf(result);
            canonical.setName(name);
            logger.debug("Parsed schema '{}' as {}", name, canonical.getType());
            return canonical;
        } finally {
            cycleGuard.exit(name, tracked);
        }
    }

    private IRSchema dispatch(String registryName, String label, JsonNode node) {
        TypeNormalizer.NormalizedType normalized = TypeNormalizer.normalize(node.get("type"), label);
        normalized.warnings().forEach(w -> context.addWarning(ParseWarning.Kind.AMBIGUOUS_TYPE_DECLARATION, w));

        SchemaShape shape = SchemaShape.of(node, normalized.primaryType());
        IRSchema schema = switch (shape) {
            case REF -> refResolver.resolve(node.get("$ref").asText());
            case ALL_OF -> allOfMerger.merge(registryName, label, node);
            case ANY_OF -> compositionParser.parseUnion(registryName, node, node.get("anyOf"), true);
            case ONE_OF -> compositionParser.parseUnion(registryName, node, node.get("oneOf"), false);
            case ENUM -> parseEnum(registryName, node, normalized.primaryType());
            case ARRAY -> parseArray(registryName, label, node);
            case OBJECT -> parseObject(registryName, label, node);
            case SCALAR -> new IRSchema(registryName, normalized.primaryType());
        };

        if (shape != SchemaShape.REF) {
            applyCommonAttributes(schema, node, normalized);
        }
        return schema;
    }

    private void applyCommonAttributes(IRSchema schema, JsonNode node, TypeNormalizer.NormalizedType normalized) {
        if (schema.getType() == null && normalized.primaryType() != null) {
            schema.setType(normalized.primaryType());
        }
        if (normalized.nullable() || node.path("nullable").asBoolean(false)) {
            schema.setNullable(true);
        }
        if (node.hasNonNull("description")) {
            schema.setDescription(node.get("description").asText());
        }
        if (node.hasNonNull("title")) {
            schema.setTitle(node.get("title").asText());
        }
        if (node.hasNonNull("format")) {
            schema.setFormat(node.get("format").asText());
        }
        if (node.has("default")) {
            schema.setDefaultValue(toJava(node.get("default")));
        }
        if (node.has("example")) {
            schema.setExample(toJava(node.get("example")));
        }
        JsonNode discriminatorNode = node.get("discriminator");
        if (discriminatorNode != null && discriminatorNode.hasNonNull("propertyName")) {
            Map<String, String> mapping = new LinkedHashMap<>();
            discriminatorNode.path("mapping").fields()
                .forEachRemaining(entry -> mapping.put(entry.getKey(), entry.getValue().asText()));
            schema.setDiscriminator(new Discriminator(discriminatorNode.get("propertyName").asText(), mapping));
        }
    }

    IRSchema parseObject(String registryName, String label, JsonNode node) {
        IRSchema schema = new IRSchema(registryName, "object");
        parsePropertiesInto(schema, label, node);

        JsonNode additional = node.get("additionalProperties");
        if (additional != null) {
            if (additional.isBoolean()) {
                schema.setAdditionalPropertiesAllowed(additional.asBoolean());
            } else if (additional.isObject()) {
                schema.setAdditionalPropertiesSchema(parseSchema(null, additional, false));
            }
        }

        schema.setDataWrapper(schema.getProperties().size() == 1
            && schema.getProperties().containsKey("data")
            && schema.isRequired("data"));
        return schema;
    }

    /**
     * Parses {@code properties} and {@code required} of {@code node} into {@code schema},
     * promoting inline objects. Existing entries with the same name are replaced.
     */
    void parsePropertiesInto(IRSchema schema, String parentLabel, JsonNode node) {
        JsonNode propertiesNode = node.get("properties");
        if (propertiesNode != null && propertiesNode.isObject()) {
            propertiesNode.fields().forEachRemaining(entry -> {
                String key = entry.getKey();
                String hint = parentLabel == null ? null : parentLabel + NameSanitizer.capitalize(key);
                IRSchema property = parseSchema(hint, entry.getValue(), false);
                IRSchema slot = objectPromoter.promote(parentLabel, key, property);
                schema.getProperties().put(key, slot != null ? slot : property);
            });
        }
        JsonNode requiredNode = node.get("required");
        if (requiredNode != null && requiredNode.isArray()) {
            TreeSet<String> required = new TreeSet<>(schema.getRequired());
            for (JsonNode element : requiredNode) {
                String requiredName = element.asText();
                if (schema.getProperties().containsKey(requiredName)) {
                    required.add(requiredName);
                } else {
                    logger.debug("Ignoring required '{}' of '{}': no such property", requiredName, parentLabel);
                }
            }
            schema.setRequired(required);
        }
    }

    private IRSchema parseArray(String registryName, String label, JsonNode node) {
        IRSchema schema = new IRSchema(registryName, "array");
        JsonNode itemsNode = node.get("items");
        if (itemsNode != null) {
            schema.setItems(parseSchema(null, itemsNode, false));
        } else {
            logger.debug("Array schema '{}' has no items", label);
        }
        return schema;
    }

    private IRSchema parseEnum(String registryName, JsonNode node, String primaryType) {
        List<Object> values = new ArrayList<>();
        boolean nullValue = false;
        for (JsonNode value : node.get("enum")) {
            if (value.isNull()) {
                nullValue = true;
            } else {
                values.add(toJava(value));
            }
        }
        String type = primaryType;
        if (type == null && !values.isEmpty()) {
            Object first = values.get(0);
            if (first instanceof Integer || first instanceof Long) {
                type = "integer";
            } else if (first instanceof Number) {
                type = "number";
            } else if (first instanceof Boolean) {
                type = "boolean";
            } else {
                type = "string";
            }
        }
        IRSchema schema = new IRSchema(registryName, type);
        schema.setEnumValues(values);
        if (nullValue) {
            schema.setNullable(true);
        }
        return schema;
    }

    static Object toJava(JsonNode node) {
        return objectMapper.convertValue(node, Object.class);
    }
}
