package io.coordhub.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open string-keyed metadata maps. Merges are shallow: keys in the patch overwrite, nested maps are not merged.
 */
public final class Metadata {
    private Metadata() {
    }

    public static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            return copyOf(base);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        if (base != null) {
            out.putAll(base);
        }
        out.putAll(patch);
        return Collections.unmodifiableMap(out);
    }
}
