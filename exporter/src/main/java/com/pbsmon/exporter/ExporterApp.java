package com.pbsmon.exporter;

import com.pbsmon.exporter.client.PbsClient;
import com.pbsmon.exporter.config.ExporterConfig;
import com.pbsmon.exporter.http.HttpServer;
import com.pbsmon.exporter.logging.LogLevelConfigurator;
import com.pbsmon.exporter.metrics.PbsMetricsCollector;
import com.pbsmon.exporter.metrics.PrometheusMetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

public class ExporterApp {
    private static final Logger log = LoggerFactory.getLogger(ExporterApp.class);

    public static void main(String[] args) {
        ExporterConfig config = ExporterConfig.fromEnv().validate();
        LogLevelConfigurator.apply(config.getLogLevel());

        log.info("Starting PBS exporter");
        log.info("  PBS endpoint: {}", config.getEndpoint());
        log.info("  Snapshot history limit: {}", config.getSnapshotHistoryLimit());
        log.info("  Task limit: {}", config.getTaskLimit());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter();
        PbsClient pbsClient = new PbsClient(config);
        PbsMetricsCollector collector = new PbsMetricsCollector(
            pbsClient,
            metricsExporter,
            config.getSnapshotHistoryLimit(),
            config.getTaskLimit()
        );

        HttpServer httpServer = new HttpServer(config, collector);
        DisposableServer disposableServer = httpServer.start();

        log.info("PBS exporter is ready on {}", config.getListenAddress());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            httpServer.stop();
            log.info("Shutdown complete");
        }));

        disposableServer.onDispose().block();
    }
}
