package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable state of one parsing run: the raw document, the schema arena, the recursion stack,
 * the depth counter and the collected warnings.
 *
 * One instance is created per run and passed explicitly to every component. It may be
 * {@link #reset() reset} and reused for a later run but must never be shared by two runs at
 * the same time.
 */
public class ParsingContext {
    private static final Logger logger = LoggerFactory.getLogger(ParsingContext.class);

    private final JsonNode document;
    private final ParsingOptions options;

    private final Map<String, IRSchema> schemas = new LinkedHashMap<>();
    private final List<String> recursionStack = new ArrayList<>();
    private final Set<ParseWarning> warnings = new LinkedHashSet<>();
    /** Variant schema name to the discriminator property that enum extraction must skip. */
    private final Set<String> discriminatorProperties = new HashSet<>();

    private boolean cycleDetected;
    private int cycleCount;
    private int currentDepth;
    private int maxDepthReached;

    public ParsingContext(JsonNode document, ParsingOptions options) {
        this.document = document == null ? MissingNode.getInstance() : document;
        this.options = Objects.requireNonNull(options, "options");
    }

    public JsonNode getDocument() {
        return document;
    }

    public ParsingOptions getOptions() {
        return options;
    }

    /** @return the raw {@code components.schemas} node, or a missing node */
    public JsonNode getRawSchemas() {
        return document.path("components").path("schemas");
    }

    public JsonNode getRawSchema(String name) {
        JsonNode node = getRawSchemas().get(name);
        return node == null || node.isNull() ? null : node;
    }

    // Arena

    /** The schema arena, live view in registration order. */
    public Map<String, IRSchema> getSchemas() {
        return schemas;
    }

    public IRSchema getSchema(String name) {
        return name == null ? null : schemas.get(name);
    }

    public boolean hasSchema(String name) {
        return name != null && schemas.containsKey(name);
    }

    public void registerSchema(String name, IRSchema schema) {
        IRSchema previous = schemas.put(name, schema);
        if (previous != null && previous != schema) {
            logger.debug("Schema '{}' re-registered with a different instance", name);
        }
    }

    public IRSchema removeSchema(String name) {
        return schemas.remove(name);
    }

    /** @return true if {@code schema} is the canonical arena instance for its own name */
    public boolean isRegistered(IRSchema schema) {
        return schema != null && schema.getName() != null && schemas.get(schema.getName()) == schema;
    }

    /**
     * Finds a name not yet used by a different arena instance: {@code base}, then {@code base1},
     * {@code base2} and so on.
     */
    public String uniqueSchemaName(String base, IRSchema candidate) {
        if (!schemas.containsKey(base) || schemas.get(base) == candidate) {
            return base;
        }
        int counter = 1;
        String name = base + counter;
        while (schemas.containsKey(name) && schemas.get(name) != candidate) {
            counter++;
            name = base + counter;
        }
        return name;
    }

    // Recursion stack

    /**
     * Pushes {@code name} on the recursion stack unless it is already there.
     *
     * @return whether entering {@code name} closes a cycle, with the arrow joined cycle path
     */
    public CycleCheck enterSchema(String name) {
        int index = recursionStack.indexOf(name);
        if (index >= 0) {
            cycleDetected = true;
            List<String> cycle = new ArrayList<>(recursionStack.subList(index, recursionStack.size()));
            cycle.add(name);
            return new CycleCheck(true, String.join(" -> ", cycle));
        }
        recursionStack.add(name);
        return new CycleCheck(false, null);
    }

    /** Pops {@code name}; does nothing when it is not on the stack. */
    public void exitSchema(String name) {
        int index = recursionStack.lastIndexOf(name);
        if (index >= 0) {
            recursionStack.remove(index);
        }
    }

    public boolean isInRecursionStack(String name) {
        return name != null && recursionStack.contains(name);
    }

    public List<String> getRecursionStack() {
        return Collections.unmodifiableList(recursionStack);
    }

    public String currentPath() {
        return String.join(" -> ", recursionStack);
    }

    public boolean isCycleDetected() {
        return cycleDetected;
    }

    /**
     * Counts a detected cycle and enforces {@link ParsingOptions#maxCycles()}.
     *
     * @throws CycleLimitExceededException when the configured limit is exceeded
     */
    public void recordCycle(String cyclePath) {
        cycleCount++;
        if (options.maxCycles() > 0 && cycleCount > options.maxCycles()) {
            throw new CycleLimitExceededException(cycleCount, options.maxCycles(), cyclePath);
        }
    }

    public int getCycleCount() {
        return cycleCount;
    }

    // Depth

    public int enterDepth() {
        currentDepth++;
        maxDepthReached = Math.max(maxDepthReached, currentDepth);
        return currentDepth;
    }

    public void exitDepth() {
        if (currentDepth > 0) {
            currentDepth--;
        }
    }

    public int getCurrentDepth() {
        return currentDepth;
    }

    public int getMaxDepthReached() {
        return maxDepthReached;
    }

    // Discriminator skip set

    public void markDiscriminatorProperty(String variantName, String propertyName) {
        discriminatorProperties.add(variantName + "." + propertyName);
    }

    public boolean isDiscriminatorProperty(String schemaName, String propertyName) {
        return discriminatorProperties.contains(schemaName + "." + propertyName);
    }

    // Warnings

    /** Records a warning once; repeated identical warnings are dropped. */
    public void addWarning(ParseWarning.Kind kind, String message) {
        if (warnings.add(new ParseWarning(kind, message))) {
            logger.warn(message);
        }
    }

    public List<ParseWarning> getWarnings() {
        return List.copyOf(warnings);
    }

    public List<String> getWarningMessages() {
        return warnings.stream().map(ParseWarning::message).collect(Collectors.toList());
    }

    /** Clears all per-run state so the context can be reused for another run. */
    public void reset() {
        schemas.clear();
        recursionStack.clear();
        warnings.clear();
        discriminatorProperties.clear();
        cycleDetected = false;
        cycleCount = 0;
        currentDepth = 0;
        maxDepthReached = 0;
    }

    /**
     * @param cycle true if the entered name was already on the recursion stack
     * @param path the cycle path, e.g. {@code A -> B -> A}, or null
     */
    public record CycleCheck(boolean cycle, String path) {}
}
