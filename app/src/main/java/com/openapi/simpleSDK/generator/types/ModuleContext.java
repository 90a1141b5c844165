package com.openapi.simpleSDK.generator.types;

/**
 * Import bookkeeping for the module currently being generated. The type resolver only talks
 * to this interface and knows nothing about files or package layout.
 */
public interface ModuleContext {

    /** Fully qualified name of the module being generated, e.g. {@code models.pet}. */
    String currentModule();

    void addImport(String module, String name);

    void addTypingImport(String name);

    /**
     * Decides how {@code targetModule} is reached from the current module.
     */
    ModuleReference resolveRelativeOrForward(String targetModule);
}
