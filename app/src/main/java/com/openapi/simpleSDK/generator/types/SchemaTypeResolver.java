package com.openapi.simpleSDK.generator.types;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import com.openapi.simpleSDK.generator.parsing.NameSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Maps finished {@link IRSchema} instances to Python type expressions and records the imports
 * they need on a {@link ModuleContext}.
 *
 * Resolution order: explicit reference, named schema with a final identity, promoted
 * reference slot, composition, the schema's own registry entry, declared primitive type, and
 * finally {@code Any}. Unions are sorted and de-duplicated so the output is deterministic.
 */
public class SchemaTypeResolver {
    private static final Logger logger = LoggerFactory.getLogger(SchemaTypeResolver.class);

    public static final String MODELS_PACKAGE = "models";

    private final Map<String, IRSchema> registry;

    public SchemaTypeResolver(Map<String, IRSchema> registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @param schema the schema to resolve, null resolves to {@code Any}
     * @param required whether the slot holding the schema is required
     * @param resolveUnderlying unwrap named primitive aliases to their primitive type
     * @throws TypeResolutionException if {@code schema} has an explicit reference to an unknown schema
     */
    public ResolvedType resolve(IRSchema schema, ModuleContext context, boolean required, boolean resolveUnderlying) {
        ResolvedType resolved = resolveInner(schema, context, resolveUnderlying);
        boolean optional = !required || (schema != null && schema.isNullable());
        if (optional) {
            context.addTypingImport("Optional");
        }
        return resolved.withOptional(optional);
    }

    public ResolvedType resolve(IRSchema schema, ModuleContext context, boolean required) {
        return resolve(schema, context, required, false);
    }

    private ResolvedType resolveInner(IRSchema schema, ModuleContext context, boolean resolveUnderlying) {
        if (schema == null) {
            return any(context);
        }

        if (schema.getRef() != null) {
            String refName = schema.getRef().substring(schema.getRef().lastIndexOf('/') + 1);
            IRSchema target = registry.get(refName);
            if (target == null) {
                throw new TypeResolutionException(String.format(
                    "Schema '%s' references unknown schema '%s'", schema.getName(), schema.getRef()));
            }
            return resolveNamedOrUnderlying(target, context, resolveUnderlying);
        }

        if (schema.hasFinalizedIdentity() && !schema.isFromUnresolvedRef()) {
            return resolveNamedOrUnderlying(schema, context, resolveUnderlying);
        }

        if (schema.getType() != null && !schema.hasBasicType() && registry.containsKey(schema.getType())) {
            return resolveNamedOrUnderlying(registry.get(schema.getType()), context, resolveUnderlying);
        }

        if (schema.isComposition()) {
            return resolveComposition(schema, context);
        }

        if (schema.getName() != null && !schema.isFromUnresolvedRef()) {
            IRSchema registered = registry.get(schema.getName());
            if (registered != null) {
                return resolveNamedOrUnderlying(registered, context, resolveUnderlying);
            }
        }

        return resolvePrimitive(schema, context);
    }

    private ResolvedType resolveNamedOrUnderlying(IRSchema target, ModuleContext context, boolean resolveUnderlying) {
        if (resolveUnderlying && isPrimitiveAlias(target)) {
            return resolvePrimitive(target, context);
        }
        return resolveNamed(target, context);
    }

    /** A named schema that is nothing but a scalar, e.g. {@code Identifier: {type: string}}. */
    private static boolean isPrimitiveAlias(IRSchema schema) {
        return schema.getType() != null
            && !"object".equals(schema.getType())
            && !"array".equals(schema.getType())
            && schema.hasBasicType()
            && !schema.isEnum()
            && !schema.isComposition()
            && schema.getProperties().isEmpty();
    }

    private ResolvedType resolveNamed(IRSchema target, ModuleContext context) {
        String className = target.getGenerationName() != null
            ? target.getGenerationName()
            : NameSanitizer.sanitizeClassName(target.getName());
        String stem = target.getFinalModuleStem() != null
            ? target.getFinalModuleStem()
            : NameSanitizer.sanitizeModuleName(className);
        String targetModule = MODELS_PACKAGE + "." + stem;

        if (targetModule.equals(context.currentModule())) {
            logger.debug("Self reference to {} in {}, using a forward reference", className, targetModule);
            return ResolvedType.forward(className);
        }
        ModuleReference reference = context.resolveRelativeOrForward(targetModule);
        if (reference.forwardRef()) {
            logger.debug("Import of {} from {} would create a cycle, using a forward reference", className, targetModule);
            return ResolvedType.forward(className);
        }
        context.addImport(reference.path(), className);
        return ResolvedType.imported(className, reference.path());
    }

    private ResolvedType resolveComposition(IRSchema schema, ModuleContext context) {
        List<IRSchema> union = schema.getUnionVariants();
        if (!union.isEmpty()) {
            TreeMap<String, ResolvedType> memberTypes = new TreeMap<>();
            for (IRSchema member : union) {
                ResolvedType resolved = resolveInner(member, context, true);
                memberTypes.putIfAbsent(resolved.nestedForm(), resolved);
            }
            if (memberTypes.size() == 1) {
                return memberTypes.firstEntry().getValue();
            }
            context.addTypingImport("Union");
            return ResolvedType.of("Union[" + String.join(", ", memberTypes.keySet()) + "]");
        }

        List<IRSchema> allOf = schema.getAllOf();
        for (IRSchema member : allOf) {
            if (member.getType() != null) {
                return resolveInner(member, context, false);
            }
        }
        return allOf.isEmpty() ? any(context) : resolveInner(allOf.get(0), context, false);
    }

    private ResolvedType resolvePrimitive(IRSchema schema, ModuleContext context) {
        String type = schema.getType();
        if (type == null) {
            return any(context);
        }
        return switch (type) {
            case "string" -> resolveString(schema.getFormat(), context);
            case "integer" -> ResolvedType.of("int");
            case "number" -> ResolvedType.of("float");
            case "boolean" -> ResolvedType.of("bool");
            case "null" -> ResolvedType.of("None");
            case "array" -> resolveArray(schema, context);
            case "object" -> resolveObject(schema, context);
            default -> any(context);
        };
    }

    private ResolvedType resolveString(String format, ModuleContext context) {
        if (format == null) {
            return ResolvedType.of("str");
        }
        return switch (format) {
            case "date" -> importedFrom("datetime", "date", context);
            case "date-time" -> importedFrom("datetime", "datetime", context);
            case "time" -> importedFrom("datetime", "time", context);
            case "uuid" -> importedFrom("uuid", "UUID", context);
            case "binary" -> ResolvedType.of("bytes");
            default -> ResolvedType.of("str");
        };
    }

    private static ResolvedType importedFrom(String module, String name, ModuleContext context) {
        context.addImport(module, name);
        return ResolvedType.imported(name, module);
    }

    private ResolvedType resolveArray(IRSchema schema, ModuleContext context) {
        context.addTypingImport("List");
        if (schema.getItems() == null) {
            context.addTypingImport("Any");
            return ResolvedType.of("List[Any]");
        }
        ResolvedType item = resolveInner(schema.getItems(), context, true);
        String itemType = item.nestedForm();
        if (schema.getItems().isNullable()) {
            context.addTypingImport("Optional");
            itemType = "Optional[" + itemType + "]";
        }
        return ResolvedType.of("List[" + itemType + "]");
    }

    private ResolvedType resolveObject(IRSchema schema, ModuleContext context) {
        context.addTypingImport("Dict");
        if (schema.getAdditionalPropertiesSchema() != null) {
            ResolvedType value = resolveInner(schema.getAdditionalPropertiesSchema(), context, true);
            return ResolvedType.of("Dict[str, " + value.nestedForm() + "]");
        }
        context.addTypingImport("Any");
        return ResolvedType.of("Dict[str, Any]");
    }

    private static ResolvedType any(ModuleContext context) {
        context.addTypingImport("Any");
        return ResolvedType.of("Any");
    }
}
