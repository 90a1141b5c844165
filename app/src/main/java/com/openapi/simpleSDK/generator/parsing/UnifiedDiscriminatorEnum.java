package com.openapi.simpleSDK.generator.parsing;

import java.util.List;
import java.util.Set;

/**
 * One enum combining the discriminator values of every variant of a union.
 *
 * @param name enum schema name, {@code {Union}{Property}Enum}
 * @param propertyName the discriminator property
 * @param unionSchemaName the oneOf/anyOf schema the enum belongs to
 * @param values members in variant order; duplicate values are kept
 * @param variantEnumsToSkip per-variant enum schemas replaced by this enum
 */
public record UnifiedDiscriminatorEnum(
    String name,
    String propertyName,
    String unionSchemaName,
    List<Member> values,
    Set<String> variantEnumsToSkip,
    String description
) {
    public UnifiedDiscriminatorEnum {
        values = List.copyOf(values);
        variantEnumsToSkip = Set.copyOf(variantEnumsToSkip);
    }

    public record Member(String memberName, Object value) {}
}
