package com.openapi.simpleSDK.generator.types;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@link ModuleContext} for one module of a generated Python package.
 *
 * Imports between modules are relative. A target that shares an import cycle with the
 * current module, according to the {@link ModuleDependencyGraph}, is returned as a forward
 * reference and no import is recorded for it.
 */
public class ModelModuleContext implements ModuleContext {
    private final String currentModule;
    private final ModuleDependencyGraph graph;
    private final ImportCollector imports = new ImportCollector();

    public ModelModuleContext(String currentModule, ModuleDependencyGraph graph) {
        this.currentModule = Objects.requireNonNull(currentModule, "currentModule");
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    @Override
    public String currentModule() {
        return currentModule;
    }

    @Override
    public void addImport(String module, String name) {
        imports.addImport(module, name);
    }

    @Override
    public void addTypingImport(String name) {
        imports.addTypingImport(name);
    }

    @Override
    public ModuleReference resolveRelativeOrForward(String targetModule) {
        String path = relativePath(currentModule, targetModule);
        return new ModuleReference(path, graph.inSameComponent(currentModule, targetModule));
    }

    public ImportCollector getImports() {
        return imports;
    }

    /**
     * Computes the relative import path of {@code target} as seen from {@code current}.
     * {@code models.pet} seen from {@code models.owner} is {@code .pet}; {@code models.pet}
     * seen from {@code endpoints.pets} is {@code ..models.pet}.
     */
    public static String relativePath(String current, String target) {
        List<String> currentParts = Arrays.asList(current.split("\\."));
        List<String> targetParts = Arrays.asList(target.split("\\."));
        List<String> currentPackage = currentParts.subList(0, currentParts.size() - 1);

        int common = 0;
        while (common < currentPackage.size() && common < targetParts.size() - 1
            && currentPackage.get(common).equals(targetParts.get(common))) {
            common++;
        }
        int dots = 1 + currentPackage.size() - common;
        return ".".repeat(dots) + String.join(".", targetParts.subList(common, targetParts.size()));
    }
}
