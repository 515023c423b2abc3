package com.pbsmon.exporter.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Gauge family keyed by a fixed, ordered list of label names.
 * <p>
 * Each {@link #publish} replaces the whole family: series absent from the new map are
 * removed from the registry.
 * </p>
 */
class GaugeFamily {
    private static final Pattern NAME_PATTERN = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    @Getter
    private final String name;
    private final List<String> labelNames;
    private final MultiGauge gauge;

    GaugeFamily(MeterRegistry registry, String name, String help, String... labelNames) {
        checkName(name, "metric");
        Set<String> seen = new HashSet<>();
        for (String label : labelNames) {
            checkName(label, "label");
            if (!seen.add(label)) {
                throw new IllegalArgumentException("Duplicate label '" + label + "' in metric " + name);
            }
        }
        this.name = name;
        this.labelNames = List.of(labelNames);
        this.gauge = MultiGauge.builder(name)
            .description(help)
            .register(registry);
    }

    /**
     * @throws IllegalArgumentException when the value count differs from the label count
     */
    void checkArity(List<String> labelValues) {
        if (labelValues.size() != labelNames.size()) {
            throw new IllegalArgumentException("Metric " + name + " expects " + labelNames.size()
                + " label values " + labelNames + ", got " + labelValues.size());
        }
    }

    /**
     * Replaces every series of the family with {@code series}.
     */
    void publish(Map<List<String>, Double> series) {
        List<MultiGauge.Row<?>> rows = new ArrayList<>(series.size());
        for (Map.Entry<List<String>, Double> entry : series.entrySet()) {
            checkArity(entry.getKey());
            rows.add(MultiGauge.Row.of(toTags(entry.getKey()), entry.getValue()));
        }
        gauge.register(rows, true);
    }

    private Tags toTags(List<String> labelValues) {
        List<Tag> tags = new ArrayList<>(labelNames.size());
        for (int i = 0; i < labelNames.size(); i++) {
            String value = labelValues.get(i);
            tags.add(Tag.of(labelNames.get(i), value == null ? "" : value));
        }
        return Tags.of(tags);
    }

    static void checkName(String name, String what) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " name: " + name);
        }
    }
}
