package com.pbsmon.exporter.http;

import com.pbsmon.exporter.config.ExporterConfig;
import com.pbsmon.exporter.metrics.PbsMetricsCollector;
import com.pbsmon.exporter.metrics.PrometheusMetricsExporter;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;

/**
 * HTTP listener for Prometheus scrapes.
 * <p>
 * Every {@code GET /metrics} runs a full collection cycle before rendering. A failed cycle
 * still returns the rendered state, with {@code pbs_up 0}.
 * </p>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String LANDING_PAGE = "<html>\n"
        + "<head><title>PBS Exporter</title></head>\n"
        + "<body>\n"
        + "<h1>PBS Exporter</h1>\n"
        + "<p><a href=\"/metrics\">Metrics</a></p>\n"
        + "<p><a href=\"/health\">Health</a></p>\n"
        + "</body>\n"
        + "</html>\n";

    private final ExporterConfig config;
    private final PbsMetricsCollector collector;

    private DisposableServer server;

    public HttpServer(ExporterConfig config, PbsMetricsCollector collector) {
        this.config = config;
        this.collector = collector;
    }

    /**
     * Binds the listener on the configured address.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .host(config.getListenHost())
            .port(config.getListenPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server listening on {}:{}", config.getListenHost(), bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/metrics", (req, res) ->
                collector.collect()
                    .onErrorResume(err -> {
                        log.warn("Collection failed: {}", err.getMessage());
                        return Mono.empty();
                    })
                    .then(Mono.fromCallable(collector::render))
                    .flatMap(body -> sendMetrics(res, body))
                    .onErrorResume(err -> {
                        log.error("Failed to encode metrics", err);
                        return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                            .sendString(Mono.just("Failed to encode metrics: " + err.getMessage()))
                            .then();
                    })
            )
            .get("/health", (req, res) ->
                res.status(HttpResponseStatus.OK).sendString(Mono.just("OK"))
            )
            .get("/", (req, res) ->
                res.header(HttpHeaderNames.CONTENT_TYPE, "text/html; charset=utf-8")
                    .sendString(Mono.just(LANDING_PAGE))
            );
    }

    private static Mono<Void> sendMetrics(HttpServerResponse res, String body) {
        return res.status(HttpResponseStatus.OK)
            .header(HttpHeaderNames.CONTENT_TYPE, PrometheusMetricsExporter.CONTENT_TYPE)
            .sendString(Mono.just(body))
            .then();
    }
}
