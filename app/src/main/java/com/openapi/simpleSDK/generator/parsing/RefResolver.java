package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves {@code $ref} strings to arena schemas.
 *
 * Only local references into {@code #/components/schemas/} are supported. A missing target is
 * recovered where a related schema exists: {@code XListResponse} becomes a list of {@code X},
 * and a name with a common suffix such as {@code XResponse} becomes a copy of {@code X}.
 * Anything else yields an unresolved placeholder.
 */
public class RefResolver {
    private static final Logger logger = LoggerFactory.getLogger(RefResolver.class);

    static final String SCHEMA_REF_PREFIX = "#/components/schemas/";
    private static final String LIST_RESPONSE_SUFFIX = "ListResponse";
    private static final List<String> STRIPPABLE_SUFFIXES = List.of(
        "Response", "Create", "Update", "Request", "Input", "Output", "Data");

    private final SchemaParser parser;
    private final ParsingContext context;

    public RefResolver(SchemaParser parser, ParsingContext context) {
        this.parser = parser;
        this.context = context;
    }

    public IRSchema resolve(String ref) {
        if (ref == null || !ref.startsWith(SCHEMA_REF_PREFIX)) {
            return unresolved(ref, refName(ref), "unsupported reference format");
        }
        return resolveSchemaName(decodePointerSegment(ref.substring(SCHEMA_REF_PREFIX.length())));
    }

    public IRSchema resolveSchemaName(String name) {
        JsonNode raw = context.getRawSchema(name);
        if (raw != null || context.hasSchema(name)) {
            return parser.parseSchema(name, raw, true);
        }
        return resolveMissing(name);
    }

    private IRSchema resolveMissing(String name) {
        if (name.endsWith(LIST_RESPONSE_SUFFIX) && name.length() > LIST_RESPONSE_SUFFIX.length()) {
            String base = name.substring(0, name.length() - LIST_RESPONSE_SUFFIX.length());
            if (context.getRawSchema(base) != null) {
                IRSchema list = new IRSchema(name, "array");
                context.registerSchema(name, list);
                list.setItems(parser.parseSchema(base, context.getRawSchema(base), true));
                list.setDescription("List of " + base);
                context.addWarning(ParseWarning.Kind.UNRESOLVABLE_REFERENCE, String.format(
                    "Schema '%s' not found, resolved as a list of '%s'", name, base));
                return list;
            }
        }

        for (String suffix : STRIPPABLE_SUFFIXES) {
            if (name.endsWith(suffix) && name.length() > suffix.length()) {
                String base = name.substring(0, name.length() - suffix.length());
                JsonNode baseNode = context.getRawSchema(base);
                if (baseNode != null) {
                    context.addWarning(ParseWarning.Kind.UNRESOLVABLE_REFERENCE, String.format(
                        "Schema '%s' not found, resolved as a copy of '%s'", name, base));
                    return parser.parseSchema(name, baseNode, true);
                }
            }
        }

        return unresolved("#/components/schemas/" + name, name, "schema not found");
    }

    private IRSchema unresolved(String ref, String name, String reason) {
        context.addWarning(ParseWarning.Kind.UNRESOLVABLE_REFERENCE,
            String.format("Could not resolve reference '%s': %s", ref, reason));
        logger.debug("Unresolved reference {} at path {}", ref, context.currentPath());
        IRSchema placeholder = new IRSchema(name);
        placeholder.setFromUnresolvedRef(true);
        placeholder.setDescription("Unresolved reference: " + ref);
        return placeholder;
    }

    private static String refName(String ref) {
        if (ref == null) {
            return null;
        }
        return decodePointerSegment(ref.substring(ref.lastIndexOf('/') + 1));
    }

    /** Decodes the JSON pointer escapes {@code ~1} and {@code ~0}. */
    static String decodePointerSegment(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }
}
