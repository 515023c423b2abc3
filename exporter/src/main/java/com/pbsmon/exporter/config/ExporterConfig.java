package com.pbsmon.exporter.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the exporter, loaded from environment variables.
 * <p>
 * Variables use the {@code PBS_EXPORTER_} prefix with {@code __} separating the section
 * from the key, e.g. {@code PBS_EXPORTER_PBS__ENDPOINT}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ExporterConfig {

    // PBS connection
    String endpoint;
    String tokenId;
    @ToString.Exclude
    String tokenSecret;
    boolean verifyTls;
    Duration timeout;

    // Collection
    int snapshotHistoryLimit;  // 0 = every snapshot, N = N most recent per group
    int taskLimit;

    // HTTP listener
    String listenHost;
    int listenPort;

    String logLevel;

    public static ExporterConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static ExporterConfig fromMap(Map<String, String> env) {
        String listenAddress = getEnv(env, "PBS_EXPORTER_EXPORTER__LISTEN_ADDRESS", "0.0.0.0:9101");
        int separator = listenAddress.lastIndexOf(':');
        if (separator <= 0 || separator == listenAddress.length() - 1) {
            throw new IllegalStateException("Listen address must be host:port, got '" + listenAddress + "'");
        }

        return ExporterConfig.builder()
            .endpoint(stripTrailingSlash(getEnv(env, "PBS_EXPORTER_PBS__ENDPOINT", "https://localhost:8007")))
            .tokenId(getEnv(env, "PBS_EXPORTER_PBS__TOKEN_ID", ""))
            .tokenSecret(getEnv(env, "PBS_EXPORTER_PBS__TOKEN_SECRET", ""))
            .verifyTls(Boolean.parseBoolean(getEnv(env, "PBS_EXPORTER_PBS__VERIFY_TLS", "false")))
            .timeout(Duration.ofSeconds(Long.parseLong(getEnv(env, "PBS_EXPORTER_PBS__TIMEOUT_SECONDS", "5"))))
            .snapshotHistoryLimit(Integer.parseInt(getEnv(env, "PBS_EXPORTER_PBS__SNAPSHOT_HISTORY_LIMIT", "0")))
            .taskLimit(Integer.parseInt(getEnv(env, "PBS_EXPORTER_PBS__TASK_LIMIT", "50")))
            .listenHost(listenAddress.substring(0, separator))
            .listenPort(Integer.parseInt(listenAddress.substring(separator + 1)))
            .logLevel(getEnv(env, "PBS_EXPORTER_EXPORTER__LOG_LEVEL", "info"))
            .build();
    }

    /**
     * Checks the settings the exporter cannot start without.
     *
     * @return this config
     * @throws IllegalStateException if the endpoint or the API token is missing
     */
    public ExporterConfig validate() {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("PBS endpoint cannot be empty");
        }
        if (tokenId == null || tokenId.isBlank() || tokenSecret == null || tokenSecret.isBlank()) {
            throw new IllegalStateException("PBS API token credentials are required");
        }
        if (snapshotHistoryLimit < 0) {
            throw new IllegalStateException("Snapshot history limit must be >= 0, got " + snapshotHistoryLimit);
        }
        if (taskLimit <= 0) {
            throw new IllegalStateException("Task limit must be > 0, got " + taskLimit);
        }
        return this;
    }

    public String getListenAddress() {
        return listenHost + ":" + listenPort;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
