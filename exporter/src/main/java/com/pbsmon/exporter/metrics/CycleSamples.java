package com.pbsmon.exporter.metrics;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instrument values staged by one collection cycle.
 * <p>
 * Starts empty: every scalar reads 0 and every family has no series. Not thread-safe;
 * a cycle owns its instance until publication.
 * </p>
 */
public class CycleSamples {
    private final PbsMetrics metrics;
    private final Map<String, Double> scalars = new HashMap<>();
    private final Map<String, Map<List<String>, Double>> series = new HashMap<>();

    CycleSamples(PbsMetrics metrics) {
        this.metrics = metrics;
    }

    public void setScalar(String name, double value) {
        if (!metrics.isScalar(name)) {
            throw new IllegalArgumentException("Unknown scalar metric: " + name);
        }
        scalars.put(name, value);
    }

    /**
     * Sets one series. A later write to the same label values wins.
     *
     * @throws IllegalArgumentException on an unknown family or a label count mismatch
     */
    public void set(String family, double value, String... labelValues) {
        List<String> key = key(family, labelValues);
        series.computeIfAbsent(family, f -> new LinkedHashMap<>()).put(key, value);
    }

    /**
     * Adds 1 to one series, starting from 0.
     */
    public void increment(String family, String... labelValues) {
        List<String> key = key(family, labelValues);
        series.computeIfAbsent(family, f -> new LinkedHashMap<>()).merge(key, 1.0, Double::sum);
    }

    public double scalar(String name) {
        return scalars.getOrDefault(name, 0.0);
    }

    public Map<List<String>, Double> series(String family) {
        return Collections.unmodifiableMap(series.getOrDefault(family, Collections.emptyMap()));
    }

    private List<String> key(String family, String... labelValues) {
        List<String> key = Arrays.asList(labelValues.clone());
        metrics.family(family).checkArity(key);
        return key;
    }
}
