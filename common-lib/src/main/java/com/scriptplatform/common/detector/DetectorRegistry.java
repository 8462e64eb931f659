package com.scriptplatform.common.detector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of {@link DetectorDefinition}s keyed by detector key.
 * New detectors are added with {@link #plus(DetectorDefinition)}, never by subclassing.
 */
public final class DetectorRegistry {

    private final Map<String, DetectorDefinition> definitions;

    private DetectorRegistry(Map<String, DetectorDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    public static DetectorRegistry of(Collection<DetectorDefinition> definitions) {
        Map<String, DetectorDefinition> map = new LinkedHashMap<>();
        for (DetectorDefinition definition : definitions) {
            if (map.putIfAbsent(definition.key(), definition) != null) {
                throw new IllegalArgumentException("duplicate detector key: " + definition.key());
            }
        }
        return new DetectorRegistry(map);
    }

    /** The seven standard detectors in priority order. */
    public static DetectorRegistry standard() {
        return of(ScriptDetectors.standardDefinitions());
    }

    public DetectorRegistry plus(DetectorDefinition definition) {
        Map<String, DetectorDefinition> map = new LinkedHashMap<>(definitions);
        map.put(definition.key(), definition);
        return new DetectorRegistry(map);
    }

    /** Returns a copy with the given action thresholds applied; unknown keys are ignored. */
    public DetectorRegistry withActionThresholds(Map<String, Double> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            return this;
        }
        Map<String, DetectorDefinition> map = new LinkedHashMap<>();
        definitions.forEach((key, definition) -> {
            Double threshold = thresholds.get(key);
            map.put(key, threshold == null ? definition : definition.withActionThreshold(threshold));
        });
        return new DetectorRegistry(map);
    }

    public Optional<DetectorDefinition> find(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    public Collection<DetectorDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }

    public int size() {
        return definitions.size();
    }
}
