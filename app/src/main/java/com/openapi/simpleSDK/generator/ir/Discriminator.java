package com.openapi.simpleSDK.generator.ir;

import java.util.Map;

/**
 * Discriminator of a oneOf/anyOf union.
 *
 * @param propertyName the property whose value selects the active variant
 * @param mapping discriminator value to schema reference, in document order
 */
public record Discriminator(String propertyName, Map<String, String> mapping) {
    public Discriminator {
        mapping = mapping == null ? Map.of() : Map.copyOf(mapping);
    }

    /**
     * Finds the discriminator value mapped to a variant schema. Mapping targets may be full
     * references ({@code #/components/schemas/Cat}) or bare schema names.
     *
     * @return the mapped value, or null when no entry targets the variant
     */
    public String valueFor(String variantName) {
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            String target = entry.getValue();
            String targetName = target.substring(target.lastIndexOf('/') + 1);
            if (targetName.equals(variantName)) {
                return entry.getKey();
            }
        }
        return null;
    }
}
