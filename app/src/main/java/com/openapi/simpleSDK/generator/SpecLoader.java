package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.ir.IROperation;
import com.openapi.simpleSDK.generator.ir.IRSpec;
import com.openapi.simpleSDK.generator.parser.OperationParser;
import com.openapi.simpleSDK.generator.parsing.DiscriminatorEnumCollector;
import com.openapi.simpleSDK.generator.parsing.InlineArrayItemExtractor;
import com.openapi.simpleSDK.generator.parsing.InlineEnumExtractor;
import com.openapi.simpleSDK.generator.parsing.ParseWarning;
import com.openapi.simpleSDK.generator.parsing.ParsingContext;
import com.openapi.simpleSDK.generator.parsing.ParsingOptions;
import com.openapi.simpleSDK.generator.parsing.SchemaIdentityAssigner;
import com.openapi.simpleSDK.generator.parsing.SchemaParser;
import com.openapi.simpleSDK.generator.parsing.SpecStructureException;
import com.openapi.simpleSDK.generator.validation.SpecValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Turns one decoded OpenAPI document into a {@link SpecResult}.
 *
 * The load runs these phases in order:
 * 1. Structural check: the document must be an object with {@code openapi} and {@code paths}
 * 2. Optional validation, messages become warnings
 * 3. Every {@code components.schemas} entry is resolved into the schema arena
 * 4. Operations are parsed, registering inline request and response schemas
 * 5. Discriminator properties are marked (Pass A)
 * 6. Inline array items, then inline enums, are hoisted to named schemas
 * 7. Discriminator enums are unified per union (Pass B)
 * 8. Every arena schema receives its final class name and module stem
 *
 * Only a structurally invalid document aborts the load. Everything else is recovered and
 * reported through {@link SpecResult#warnings()}.
 */
public class SpecLoader {
    private static final Logger logger = LoggerFactory.getLogger(SpecLoader.class);

    private final JsonNode document;
    private final ParsingOptions options;
    private final SpecValidator validator;

    public SpecLoader(JsonNode document) {
        this(document, ParsingOptions.defaults(), null);
    }

    /**
     * @param document the decoded document
     * @param options tuning options for this run
     * @param validator optional external validator, may be null
     */
    public SpecLoader(JsonNode document, ParsingOptions options, SpecValidator validator) {
        this.document = document;
        this.options = options;
        this.validator = validator;
    }

    /**
     * Runs the full pipeline.
     *
     * @throws SpecStructureException if the top-level document is malformed
     * @throws com.openapi.simpleSDK.generator.parsing.CycleLimitExceededException if a positive
     *         cycle limit is configured and exceeded
     */
    public SpecResult load() {
        checkStructure();

        ParsingContext context = new ParsingContext(document, options);
        if (validator != null) {
            List<String> messages = validator.validate(document);
            messages.forEach(message -> context.addWarning(ParseWarning.Kind.VALIDATION, "Validation: " + message));
            logger.info("Validation reported {} messages", messages.size());
        }

        SchemaParser schemaParser = new SchemaParser(context);
        buildSchemas(context, schemaParser);
        logger.info("Resolved {} component schemas", context.getSchemas().size());

        List<IROperation> operations = new OperationParser(context, schemaParser).parseOperations(document.get("paths"));
        logger.info("Parsed {} operations", operations.size());

        DiscriminatorEnumCollector discriminators = new DiscriminatorEnumCollector(context);
        discriminators.identifyDiscriminatorProperties();

        int items = new InlineArrayItemExtractor(context).extract();
        int enums = new InlineEnumExtractor(context).extract();
        logger.info("Extracted {} inline array item schemas and {} inline enums", items, enums);

        discriminators.collectUnifiedEnums();
        new SchemaIdentityAssigner(context).assign();

        IRSpec spec = new IRSpec(
            document.path("info").path("title").asText("API Client"),
            document.path("info").path("version").asText("0.0.0"),
            document.path("info").hasNonNull("description") ? document.path("info").get("description").asText() : null,
            new LinkedHashMap<>(context.getSchemas()),
            List.copyOf(operations),
            servers(),
            new LinkedHashSet<>(discriminators.getSkipList()));

        logger.info("Loaded '{}' {}: {} schemas, {} operations, {} warnings",
            spec.title(), spec.version(), spec.schemas().size(), operations.size(), context.getWarnings().size());
        return new SpecResult(spec, context.getWarningMessages());
    }

    private void checkStructure() {
        if (document == null || !document.isObject()) {
            throw new SpecStructureException("OpenAPI document must be a JSON object");
        }
        if (!document.has("openapi")) {
            throw new SpecStructureException("Missing 'openapi' field in the specification");
        }
        if (!document.has("paths")) {
            throw new SpecStructureException("Missing 'paths' section in the specification");
        }
        if (!document.get("paths").isObject()) {
            throw new SpecStructureException("'paths' must be an object");
        }
        JsonNode components = document.get("components");
        if (components != null && components.has("schemas") && !components.get("schemas").isObject()) {
            throw new SpecStructureException("'components.schemas' must be an object");
        }
    }

    private void buildSchemas(ParsingContext context, SchemaParser schemaParser) {
        JsonNode rawSchemas = context.getRawSchemas();
        for (Iterator<Map.Entry<String, JsonNode>> iterator = rawSchemas.fields(); iterator.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            if (!context.hasSchema(entry.getKey())) {
                schemaParser.parseSchema(entry.getKey(), entry.getValue(), true);
            }
        }
    }

    private List<String> servers() {
        List<String> servers = new ArrayList<>();
        document.path("servers").forEach(server -> {
            if (server.hasNonNull("url")) {
                servers.add(server.get("url").asText());
            }
        });
        return List.copyOf(servers);
    }
}
