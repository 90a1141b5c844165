package com.openapi.simpleSDK.generator.ir;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fully resolved intermediate representation of one OpenAPI document.
 *
 * @param title document title from {@code info.title}
 * @param version document version from {@code info.version}
 * @param description document description, may be null
 * @param schemas the schema arena: every named schema of the run, keyed by its unique name
 * @param operations operations in path and method order
 * @param servers server URLs in document order
 * @param discriminatorSkipList names of per-variant enum schemas replaced by a unified
 *        discriminator enum; emitters must not generate these
 */
public record IRSpec(
    String title,
    String version,
    String description,
    Map<String, IRSchema> schemas,
    List<IROperation> operations,
    List<String> servers,
    Set<String> discriminatorSkipList
) {}
