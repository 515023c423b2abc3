package com.pbsmon.exporter.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the Prometheus registry the PBS instruments live in and encodes it
 * in the text exposition format (0.0.4).
 * <p>
 * The registry is private to the exporter rather than the global composite:
 * the scrape output carries only PBS metrics.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusMeterRegistry prometheusRegistry;

    @Getter
    private final MeterRegistry registry;

    public PrometheusMetricsExporter() {
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.registry = prometheusRegistry;
        log.info("Metrics exporter initialized with a dedicated Prometheus registry");
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
