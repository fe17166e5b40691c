package com.lucidityplatform.common.flux;

import java.util.Map;
import java.util.Set;

/**
 * Resolved environmental context for one actor in one cadence.
 *
 * @param baseFlux per-cadence flux before companion and resistance modifiers
 * @param source   which rule produced {@code baseFlux}, e.g. {@code "sub_zone:sanitarium"}
 */
public record FluxContext(
    double baseFlux,
    String source,
    Set<String> tags,
    Map<String, Object> metadata
) {
    public FluxContext {
        tags     = tags == null ? Set.of() : Set.copyOf(tags);
        metadata = metadata == null ? Map.of() : metadata;
    }
}
