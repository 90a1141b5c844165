package com.openapi.simpleSDK.generator.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collects the imports of one generated module. Output is sorted so repeated runs produce
 * identical files.
 */
public class ImportCollector {
    private final SortedSet<String> typingImports = new TreeSet<>();
    private final Map<String, SortedSet<String>> imports = new TreeMap<>();

    public void addImport(String module, String name) {
        imports.computeIfAbsent(module, key -> new TreeSet<>()).add(name);
    }

    public void addTypingImport(String name) {
        typingImports.add(name);
    }

    public boolean hasImport(String module, String name) {
        SortedSet<String> names = imports.get(module);
        return names != null && names.contains(name);
    }

    public boolean hasTypingImport(String name) {
        return typingImports.contains(name);
    }

    public Map<String, SortedSet<String>> getImports() {
        return imports;
    }

    public SortedSet<String> getTypingImports() {
        return typingImports;
    }

    public boolean isEmpty() {
        return typingImports.isEmpty() && imports.isEmpty();
    }

    /**
     * Renders {@code from ... import ...} lines: typing first, then absolute modules, then
     * relative modules.
     */
    public List<String> renderLines() {
        List<String> lines = new ArrayList<>();
        if (!typingImports.isEmpty()) {
            lines.add("from typing import " + String.join(", ", typingImports));
        }
        List<String> relative = new ArrayList<>();
        imports.forEach((module, names) -> {
            String line = "from " + module + " import " + String.join(", ", names);
            if (module.startsWith(".")) {
                relative.add(line);
            } else {
                lines.add(line);
            }
        });
        lines.addAll(relative);
        return lines;
    }
}
