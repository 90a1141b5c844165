package com.openapi.simpleSDK.generator;

import com.openapi.simpleSDK.generator.ir.IRSpec;

import java.util.List;

/**
 * Immutable outcome of one {@link SpecLoader#load()} run.
 *
 * The result contains everything an emitter needs:
 * - every named schema of the run, cycles broken by shared placeholder instances
 * - operations with their parameters, bodies and responses
 * - the discriminator skip list of per-variant enums that must not be emitted
 *
 * Typical usage:
 * ```java
 * SpecLoader loader = new SpecLoader(new SpecReader().read(Path.of("petstore.yaml")));
 * SpecResult result = loader.load();
 *
 * // result.spec().schemas() contains the schema arena
 * // result.warnings() lists every recovered problem
 * ```
 *
 * @param spec the resolved intermediate representation
 * @param warnings recovered problems in the order they were found, without duplicates
 */
public record SpecResult(
    IRSpec spec,
    List<String> warnings
) {
    public SpecResult {
        warnings = List.copyOf(warnings);
    }
}
