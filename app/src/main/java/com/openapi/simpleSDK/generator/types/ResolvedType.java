package com.openapi.simpleSDK.generator.types;

/**
 * Result of resolving a schema to a target type expression.
 *
 * @param pythonType the type expression without an Optional wrapper, e.g. {@code List[Pet]}
 * @param needsImport true if an import was recorded for a named model
 * @param importModule module of the recorded import, or null
 * @param importName name imported from {@code importModule}, or null
 * @param optional true if the slot is not required or the schema is nullable
 * @param forwardRef true if the type names a model that must be referenced lazily
 */
public record ResolvedType(
    String pythonType,
    boolean needsImport,
    String importModule,
    String importName,
    boolean optional,
    boolean forwardRef
) {
    public static ResolvedType of(String pythonType) {
        return new ResolvedType(pythonType, false, null, null, false, false);
    }

    public static ResolvedType imported(String pythonType, String module) {
        return new ResolvedType(pythonType, true, module, pythonType, false, false);
    }

    public static ResolvedType forward(String pythonType) {
        return new ResolvedType(pythonType, false, null, null, false, true);
    }

    public ResolvedType withOptional(boolean newOptional) {
        return new ResolvedType(pythonType, needsImport, importModule, importName, newOptional, forwardRef);
    }

    /** The type as used inside a container: forward references are quoted. */
    public String nestedForm() {
        return forwardRef ? "\"" + pythonType + "\"" : pythonType;
    }

    /** The full annotation, e.g. {@code Optional[Pet]}; forward references are quoted. */
    public String annotation() {
        return optional ? "Optional[" + nestedForm() + "]" : nestedForm();
    }
}
