package com.openapi.simpleSDK.generator.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleSDK.generator.ir.HttpMethod;
import com.openapi.simpleSDK.generator.ir.IROperation;
import com.openapi.simpleSDK.generator.ir.IRParameter;
import com.openapi.simpleSDK.generator.ir.IRRequestBody;
import com.openapi.simpleSDK.generator.ir.IRResponse;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import com.openapi.simpleSDK.generator.parsing.CycleLimitExceededException;
import com.openapi.simpleSDK.generator.parsing.NameSanitizer;
import com.openapi.simpleSDK.generator.parsing.ParseWarning;
import com.openapi.simpleSDK.generator.parsing.ParsingContext;
import com.openapi.simpleSDK.generator.parsing.SchemaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the {@code paths} section into {@link IROperation}s.
 *
 * Inline object request bodies and responses are registered as named schemas
 * ({@code {OperationId}Request}, {@code {OperationId}Response}). An operation that fails to
 * parse is skipped with a warning; the remaining operations are still returned.
 */
public class OperationParser {
    private static final Logger logger = LoggerFactory.getLogger(OperationParser.class);

    static final Set<String> STREAMING_MEDIA_TYPES = Set.of(
        "application/octet-stream",
        "text/event-stream",
        "application/x-ndjson",
        "application/json-seq",
        "multipart/mixed");

    private final ParsingContext context;
    private final SchemaParser schemaParser;

    public OperationParser(ParsingContext context, SchemaParser schemaParser) {
        this.context = context;
        this.schemaParser = schemaParser;
    }

    public List<IROperation> parseOperations(JsonNode pathsNode) {
        List<IROperation> operations = new ArrayList<>();
        if (pathsNode == null || !pathsNode.isObject()) {
            return operations;
        }

        for (Iterator<Map.Entry<String, JsonNode>> pathIterator = pathsNode.fields(); pathIterator.hasNext(); ) {
            Map.Entry<String, JsonNode> pathEntry = pathIterator.next();
            String path = pathEntry.getKey();
            JsonNode pathItem = resolveReference(pathEntry.getValue());
            if (pathItem == null || !pathItem.isObject()) {
                continue;
            }
            JsonNode pathParameters = pathItem.get("parameters");

            for (Iterator<Map.Entry<String, JsonNode>> methodIterator = pathItem.fields(); methodIterator.hasNext(); ) {
                Map.Entry<String, JsonNode> methodEntry = methodIterator.next();
                Optional<HttpMethod> method = HttpMethod.fromPathItemKey(methodEntry.getKey());
                if (method.isEmpty()) {
                    continue;
                }
                try {
                    operations.add(parseOperation(path, method.get(), methodEntry.getValue(), pathParameters));
                } catch (CycleLimitExceededException e) {
                    throw e;
                } catch (RuntimeException e) {
                    logger.debug("Failed to parse operation {} {}", method.get(), path, e);
                    context.addWarning(ParseWarning.Kind.OPERATION_SKIPPED, String.format(
                        "Skipping operation %s %s: %s", method.get(), path, e.getMessage()));
                }
            }
        }

        logger.debug("Parsed {} operations", operations.size());
        return operations;
    }

    private IROperation parseOperation(String path, HttpMethod method, JsonNode operationNode, JsonNode pathParameters) {
        if (!operationNode.isObject()) {
            throw new IllegalArgumentException("operation must be an object, found " + operationNode.getNodeType());
        }
        String operationId = operationNode.hasNonNull("operationId")
            ? operationNode.get("operationId").asText()
            : NameSanitizer.sanitizeMethodName(method.name() + "_" + path);
        String summary = textOrNull(operationNode, "summary");
        String description = textOrNull(operationNode, "description");

        List<IRParameter> parameters = parseParameters(pathParameters, operationNode.get("parameters"));
        IRRequestBody requestBody = parseRequestBody(operationId, operationNode.get("requestBody"));
        List<IRResponse> responses = parseResponses(operationId, operationNode.get("responses"));

        List<String> tags = new ArrayList<>();
        operationNode.path("tags").forEach(tag -> tags.add(tag.asText()));

        return new IROperation(operationId, method, path, summary, description,
            List.copyOf(parameters), requestBody, List.copyOf(responses), List.copyOf(tags));
    }

    /** Operation level parameters override path level ones with the same name and location. */
    private List<IRParameter> parseParameters(JsonNode pathParameters, JsonNode operationParameters) {
        Map<String, IRParameter> byKey = new LinkedHashMap<>();
        for (JsonNode parametersNode : new JsonNode[] {pathParameters, operationParameters}) {
            if (parametersNode == null || !parametersNode.isArray()) {
                continue;
            }
            for (JsonNode paramNode : parametersNode) {
                JsonNode resolved = resolveReference(paramNode);
                if (resolved == null || !resolved.hasNonNull("name") || !resolved.hasNonNull("in")) {
                    context.addWarning(ParseWarning.Kind.UNRESOLVABLE_REFERENCE,
                        "Ignoring parameter without name or location: " + paramNode);
                    continue;
                }
                String name = resolved.get("name").asText();
                String in = resolved.get("in").asText();
                boolean required = "path".equals(in) || resolved.path("required").asBoolean(false);
                IRSchema schema = schemaParser.parseSchema(null, parameterSchemaNode(resolved), false);
                byKey.put(in + ":" + name, new IRParameter(name, in, required, schema, textOrNull(resolved, "description")));
            }
        }
        return new ArrayList<>(byKey.values());
    }

    /** Swagger 2 style parameters carry their type inline instead of in a schema. */
    private static JsonNode parameterSchemaNode(JsonNode parameter) {
        if (parameter.has("schema")) {
            return parameter.get("schema");
        }
        ObjectNode inline = JsonNodeFactory.instance.objectNode();
        for (String key : List.of("type", "format", "items", "enum", "default")) {
            if (parameter.has(key)) {
                inline.set(key, parameter.get(key));
            }
        }
        if (!inline.has("type")) {
            inline.put("type", "string");
        }
        return inline;
    }

    private IRRequestBody parseRequestBody(String operationId, JsonNode requestBodyNode) {
        if (requestBodyNode == null) {
            return null;
        }
        JsonNode resolved = resolveReference(requestBodyNode);
        if (resolved == null) {
            context.addWarning(ParseWarning.Kind.UNRESOLVABLE_REFERENCE,
                "Could not resolve request body of operation " + operationId);
            return null;
        }
        Map<String, IRSchema> content = parseContent(resolved.get("content"), operationId + "Request");
        return new IRRequestBody(resolved.path("required").asBoolean(false), content, textOrNull(resolved, "description"));
    }

    private List<IRResponse> parseResponses(String operationId, JsonNode responsesNode) {
        List<IRResponse> responses = new ArrayList<>();
        if (responsesNode == null || !responsesNode.isObject()) {
            return responses;
        }
        for (Iterator<Map.Entry<String, JsonNode>> iterator = responsesNode.fields(); iterator.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            String statusCode = entry.getKey();
            JsonNode responseNode = resolveReference(entry.getValue());
            if (responseNode == null) {
                context.addWarning(ParseWarning.Kind.UNRESOLVABLE_REFERENCE, String.format(
                    "Could not resolve response %s of operation %s", statusCode, operationId));
                continue;
            }

            Map<String, IRSchema> content = parseContent(responseNode.get("content"), operationId + "Response");
            String streamFormat = null;
            for (Map.Entry<String, IRSchema> media : content.entrySet()) {
                if (STREAMING_MEDIA_TYPES.contains(media.getKey()) || isBinary(media.getValue())) {
                    streamFormat = media.getKey();
                    break;
                }
            }
            responses.add(new IRResponse(statusCode, textOrNull(responseNode, "description"), content,
                streamFormat != null, streamFormat));
        }
        return responses;
    }

    private Map<String, IRSchema> parseContent(JsonNode contentNode, String inlineName) {
        Map<String, IRSchema> content = new LinkedHashMap<>();
        if (contentNode == null || !contentNode.isObject()) {
            return content;
        }
        Map<JsonNode, IRSchema> inlineSchemas = new LinkedHashMap<>();
        contentNode.fields().forEachRemaining(media -> {
            JsonNode schemaNode = media.getValue().get("schema");
            if (schemaNode == null) {
                content.put(media.getKey(), null);
            } else if (isInlineObject(schemaNode)) {
                IRSchema schema = inlineSchemas.computeIfAbsent(schemaNode, node -> schemaParser.parseSchema(
                    context.uniqueSchemaName(NameSanitizer.sanitizeClassName(inlineName), null), node, true));
                content.put(media.getKey(), schema);
            } else {
                content.put(media.getKey(), schemaParser.parseSchema(null, schemaNode, false));
            }
        });
        return content;
    }

    private static boolean isInlineObject(JsonNode schemaNode) {
        if (schemaNode.has("$ref")) {
            return false;
        }
        return "object".equals(schemaNode.path("type").asText(null))
            || (!schemaNode.has("type") && schemaNode.has("properties"));
    }

    private static boolean isBinary(IRSchema schema) {
        return schema != null && "string".equals(schema.getType()) && "binary".equals(schema.getFormat());
    }

    /** Follows a local {@code $ref}; returns null when the target does not exist. */
    private JsonNode resolveReference(JsonNode node) {
        if (node != null && node.has("$ref")) {
            String ref = node.get("$ref").asText();
            if (!ref.startsWith("#/")) {
                logger.warn("Unsupported reference format: {}", ref);
                return null;
            }
            return resolveInternalReference(ref, context.getDocument());
        }
        return node;
    }

    private static JsonNode resolveInternalReference(String ref, JsonNode root) {
        JsonNode current = root;
        for (String part : ref.substring(2).split("/")) {
            if (current == null) {
                return null;
            }
            current = current.get(part.replace("~1", "/").replace("~0", "~"));
        }
        return current;
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
