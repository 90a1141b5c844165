package com.openapi.simpleSDK.generator.types;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import com.openapi.simpleSDK.generator.parsing.NameSanitizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Import graph between generated model modules, with its strongly connected components
 * computed by Tarjan's algorithm. Two modules in the same component import each other
 * directly or indirectly, so a reference between them must be a forward reference.
 */
public class ModuleDependencyGraph {
    private final Map<String, Set<String>> edges = new LinkedHashMap<>();
    private final Map<String, Integer> componentOf = new HashMap<>();
    private final List<Set<String>> components = new ArrayList<>();

    private ModuleDependencyGraph() {
    }

    /** Builds the graph of {@code models.<stem>} modules over every schema of the arena. */
    public static ModuleDependencyGraph fromSchemas(Map<String, IRSchema> schemas) {
        ModuleDependencyGraph graph = new ModuleDependencyGraph();
        for (IRSchema schema : schemas.values()) {
            String from = moduleOf(schema);
            Set<String> targets = graph.edges.computeIfAbsent(from, key -> new LinkedHashSet<>());
            Set<IRSchema> visited = Collections.newSetFromMap(new IdentityHashMap<>());
            visited.add(schema);
            for (IRSchema child : children(schema)) {
                collectTargets(child, schemas, targets, visited);
            }
            targets.remove(from);
        }
        graph.computeComponents();
        return graph;
    }

    /** Builds a graph from explicit module edges. */
    public static ModuleDependencyGraph fromEdges(Map<String, Set<String>> moduleEdges) {
        ModuleDependencyGraph graph = new ModuleDependencyGraph();
        moduleEdges.forEach((from, targets) -> {
            graph.edges.computeIfAbsent(from, key -> new LinkedHashSet<>()).addAll(targets);
            targets.forEach(target -> graph.edges.computeIfAbsent(target, key -> new LinkedHashSet<>()));
        });
        graph.computeComponents();
        return graph;
    }

    public static String moduleOf(IRSchema schema) {
        String stem = schema.getFinalModuleStem();
        if (stem == null) {
            String className = schema.getGenerationName() != null
                ? schema.getGenerationName()
                : NameSanitizer.sanitizeClassName(schema.getName());
            stem = NameSanitizer.sanitizeModuleName(className);
        }
        return SchemaTypeResolver.MODELS_PACKAGE + "." + stem;
    }

    public Set<String> dependenciesOf(String module) {
        return Collections.unmodifiableSet(edges.getOrDefault(module, Set.of()));
    }

    /** @return true if both modules are the same or lie on a common import cycle */
    public boolean inSameComponent(String first, String second) {
        if (first.equals(second)) {
            return true;
        }
        Integer a = componentOf.get(first);
        Integer b = componentOf.get(second);
        return a != null && a.equals(b);
    }

    /** Components with more than one module, i.e. actual import cycles. */
    public List<Set<String>> cycles() {
        List<Set<String>> cycles = new ArrayList<>();
        for (Set<String> component : components) {
            if (component.size() > 1) {
                cycles.add(Collections.unmodifiableSet(component));
            }
        }
        return cycles;
    }

    private static void collectTargets(IRSchema schema, Map<String, IRSchema> schemas, Set<String> targets,
                                       Set<IRSchema> visited) {
        if (!visited.add(schema)) {
            return;
        }
        IRSchema named = namedTarget(schema, schemas);
        if (named != null) {
            targets.add(moduleOf(named));
            return;
        }
        for (IRSchema child : children(schema)) {
            collectTargets(child, schemas, targets, visited);
        }
    }

    private static IRSchema namedTarget(IRSchema schema, Map<String, IRSchema> schemas) {
        if (schema.isFromUnresolvedRef()) {
            return null;
        }
        if (schema.getGenerationName() != null && schema.getName() != null) {
            return schema;
        }
        if (schema.getType() != null && !schema.hasBasicType() && schemas.containsKey(schema.getType())) {
            return schemas.get(schema.getType());
        }
        if (schema.getName() != null && schemas.get(schema.getName()) == schema) {
            return schema;
        }
        return null;
    }

    private static List<IRSchema> children(IRSchema schema) {
        List<IRSchema> children = new ArrayList<>(schema.getProperties().values());
        if (schema.getItems() != null) {
            children.add(schema.getItems());
        }
        if (schema.getAdditionalPropertiesSchema() != null) {
            children.add(schema.getAdditionalPropertiesSchema());
        }
        if (schema.getAnyOf() != null) {
            children.addAll(schema.getAnyOf());
        }
        if (schema.getOneOf() != null) {
            children.addAll(schema.getOneOf());
        }
        return children;
    }

    // Tarjan's strongly connected components

    private int index;
    private final Map<String, Integer> indices = new HashMap<>();
    private final Map<String, Integer> lowLinks = new HashMap<>();
    private final List<String> stack = new ArrayList<>();
    private final Set<String> onStack = new LinkedHashSet<>();

    private void computeComponents() {
        for (String module : edges.keySet()) {
            if (!indices.containsKey(module)) {
                strongConnect(module);
            }
        }
    }

    private void strongConnect(String module) {
        indices.put(module, index);
        lowLinks.put(module, index);
        index++;
        stack.add(module);
        onStack.add(module);

        for (String target : edges.getOrDefault(module, Set.of())) {
            if (!indices.containsKey(target)) {
                strongConnect(target);
                lowLinks.put(module, Math.min(lowLinks.get(module), lowLinks.get(target)));
            } else if (onStack.contains(target)) {
                lowLinks.put(module, Math.min(lowLinks.get(module), indices.get(target)));
            }
        }

        if (lowLinks.get(module).equals(indices.get(module))) {
            Set<String> component = new LinkedHashSet<>();
            String member;
            do {
                member = stack.remove(stack.size() - 1);
                onStack.remove(member);
                component.add(member);
                componentOf.put(member, components.size());
            } while (!member.equals(module));
            components.add(component);
        }
    }
}
