package com.pbsmon.exporter.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;

/**
 * Unlabeled gauge backed by an {@link AtomicDouble}. Always exposed, 0 until first set.
 */
class ScalarGauge {
    @Getter
    private final String name;
    private final AtomicDouble value = new AtomicDouble();

    ScalarGauge(MeterRegistry registry, String name, String help) {
        GaugeFamily.checkName(name, "metric");
        this.name = name;
        Gauge.builder(name, value, AtomicDouble::get)
            .description(help)
            .strongReference(true)
            .register(registry);
    }

    void set(double newValue) {
        value.set(newValue);
    }
}
