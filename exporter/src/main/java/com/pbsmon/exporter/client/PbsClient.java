package com.pbsmon.exporter.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pbsmon.core.model.ApiResponse;
import com.pbsmon.core.model.BackupGroup;
import com.pbsmon.core.model.DatastoreUsage;
import com.pbsmon.core.model.GcStatus;
import com.pbsmon.core.model.NodeStatus;
import com.pbsmon.core.model.Snapshot;
import com.pbsmon.core.model.TapeDrive;
import com.pbsmon.core.model.Task;
import com.pbsmon.core.model.VersionInfo;
import com.pbsmon.core.util.JsonUtils;
import com.pbsmon.exporter.config.ExporterConfig;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * PBS API client built on reactor-netty {@link HttpClient}.
 * <p>
 * Authenticates every request with an API token
 * ({@code Authorization: PBSAPIToken=<id>:<secret>}) and unwraps the {@code data} envelope.
 * </p>
 */
public class PbsClient implements IPbsClient {
    private static final Logger log = LoggerFactory.getLogger(PbsClient.class);

    private static final String API_PREFIX = "/api2/json";

    private final HttpClient httpClient;

    public PbsClient(ExporterConfig config) {
        String authHeader = "PBSAPIToken=" + config.getTokenId() + ":" + config.getTokenSecret();

        HttpClient client = HttpClient.create()
            .baseUrl(config.getEndpoint())
            .headers(h -> h
                .set(HttpHeaderNames.AUTHORIZATION, authHeader)
                .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(config.getTimeout());

        if (!config.isVerifyTls() && config.getEndpoint().startsWith("https")) {
            SslContext insecure = insecureSslContext();
            client = client.secure(spec -> spec.sslContext(insecure));
            log.warn("TLS certificate verification is disabled for {}", config.getEndpoint());
        }
        this.httpClient = client;

        log.info("PbsClient initialized for {} (token {})", config.getEndpoint(), config.getTokenId());
    }

    @Override
    public Mono<NodeStatus> fetchNodeStatus() {
        return get("/nodes/localhost/status", new TypeReference<ApiResponse<NodeStatus>>() {
        });
    }

    @Override
    public Mono<List<DatastoreUsage>> fetchDatastoreUsage() {
        return get("/status/datastore-usage", new TypeReference<ApiResponse<List<DatastoreUsage>>>() {
        });
    }

    @Override
    public Mono<List<BackupGroup>> fetchBackupGroups(String datastore) {
        return get("/admin/datastore/" + encode(datastore) + "/groups",
            new TypeReference<ApiResponse<List<BackupGroup>>>() {
            });
    }

    @Override
    public Mono<List<Snapshot>> fetchSnapshots(String datastore) {
        return get("/admin/datastore/" + encode(datastore) + "/snapshots",
            new TypeReference<ApiResponse<List<Snapshot>>>() {
            });
    }

    @Override
    public Mono<List<Task>> fetchTasks(int limit) {
        return get("/nodes/localhost/tasks?limit=" + limit, new TypeReference<ApiResponse<List<Task>>>() {
        });
    }

    @Override
    public Mono<GcStatus> fetchGcStatus(String datastore) {
        return get("/admin/datastore/" + encode(datastore) + "/gc", new TypeReference<ApiResponse<GcStatus>>() {
        });
    }

    @Override
    public Mono<List<TapeDrive>> fetchTapeDrives() {
        return get("/tape/drive", new TypeReference<ApiResponse<List<TapeDrive>>>() {
        });
    }

    @Override
    public Mono<VersionInfo> fetchVersion() {
        return get("/version", new TypeReference<ApiResponse<VersionInfo>>() {
        });
    }

    /**
     * Issues a GET and unwraps the {@code data} field.
     * <p>
     * Non-2xx answers become {@link PbsApiException.Kind#HTTP_STATUS}, connection problems
     * {@link PbsApiException.Kind#TRANSPORT} and unreadable bodies {@link PbsApiException.Kind#PARSE}.
     * </p>
     */
    private <T> Mono<T> get(String path, TypeReference<ApiResponse<T>> type) {
        String uri = API_PREFIX + path;
        log.debug("Fetching {}", uri);

        return httpClient.get()
            .uri(uri)
            .responseSingle((response, body) -> {
                int status = response.status().code();
                if (status < 200 || status >= 300) {
                    log.debug("PBS request {} failed with HTTP {}", uri, status);
                    return Mono.error(PbsApiException.httpStatus(uri, status));
                }
                return body.asString(StandardCharsets.UTF_8)
                    .defaultIfEmpty("")
                    .map(json -> unwrap(uri, json, type));
            })
            .onErrorMap(err -> !(err instanceof PbsApiException), err -> PbsApiException.transport(uri, err));
    }

    private static <T> T unwrap(String uri, String json, TypeReference<ApiResponse<T>> type) {
        ApiResponse<T> response;
        try {
            response = JsonUtils.readValue(json, type);
        } catch (IllegalArgumentException e) {
            throw PbsApiException.parse(uri, preview(json), e);
        }
        if (response == null || response.getData() == null) {
            throw PbsApiException.parse(uri, "missing 'data' field", null);
        }
        log.debug("Fetched {} ({} bytes)", uri, json.length());
        return response.getData();
    }

    private static String preview(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    private static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static SslContext insecureSslContext() {
        try {
            return SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }
    }
}
