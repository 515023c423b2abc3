package com.pbsmon.exporter.metrics;

import com.pbsmon.core.metrics.MetricsNames;
import com.pbsmon.exporter.client.IPbsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Runs collection cycles against PBS and publishes their result into {@link PbsMetrics}.
 * <p>
 * A cycle stages everything into a private {@link CycleSamples} and publishes it in one step
 * under the write lock once it terminates, whether it succeeded, failed or was cancelled.
 * {@link #render()} holds the read lock, so a scrape sees either the previous cycle or the new
 * one in full.
 * </p>
 * <p>
 * Node status, datastore usage and version are foundational: their failure sets {@code pbs_up}
 * to 0 and errors the cycle with a {@link CollectionException}. Every other fetch degrades to
 * "no data" and is logged.
 * </p>
 */
public class PbsMetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(PbsMetricsCollector.class);

    public static final int DEFAULT_TASK_LIMIT = 50;

    private final IPbsClient client;
    private final PrometheusMetricsExporter exporter;
    private final PbsMetrics metrics;
    private final int snapshotHistoryLimit;
    private final int taskLimit;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @param snapshotHistoryLimit newest snapshots exposed per backup group, 0 for all
     * @param taskLimit            number of tasks requested from PBS
     */
    public PbsMetricsCollector(IPbsClient client, PrometheusMetricsExporter exporter,
                               int snapshotHistoryLimit, int taskLimit) {
        if (snapshotHistoryLimit < 0) {
            throw new IllegalArgumentException("Snapshot history limit cannot be negative: " + snapshotHistoryLimit);
        }
        if (taskLimit <= 0) {
            throw new IllegalArgumentException("Task limit must be positive: " + taskLimit);
        }
        this.client = client;
        this.exporter = exporter;
        this.metrics = new PbsMetrics(exporter.getRegistry());
        this.snapshotHistoryLimit = snapshotHistoryLimit;
        this.taskLimit = taskLimit;
    }

    /**
     * Runs one collection cycle. Fetches are strictly sequential.
     *
     * @return completes when the new state is published, errors with {@link CollectionException}
     * on a foundational failure
     */
    public Mono<Void> collect() {
        return Mono.defer(() -> {
            CycleSamples samples = metrics.newCycle();
            AtomicBoolean published = new AtomicBoolean();
            Runnable publishOnce = () -> {
                if (published.compareAndSet(false, true)) {
                    publish(samples);
                }
            };
            long started = System.currentTimeMillis();
            log.info("Starting PBS collection cycle");

            return runCycle(samples)
                .doOnTerminate(publishOnce)
                .doOnCancel(publishOnce)
                .doOnSuccess(v -> log.info("PBS collection cycle finished in {} ms",
                    System.currentTimeMillis() - started))
                .doOnError(e -> log.info("PBS collection cycle failed after {} ms: {}",
                    System.currentTimeMillis() - started, e.getMessage()));
        });
    }

    /**
     * Encodes the current state. Safe before the first cycle and after a failed one.
     */
    public String render() {
        lock.readLock().lock();
        try {
            return exporter.scrape();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Mono<Void> runCycle(CycleSamples samples) {
        Map<String, String> taskComments = new LinkedHashMap<>();

        return foundational(CollectionException.Stage.NODE_STATUS, client::fetchNodeStatus)
            .doOnNext(node -> StatusProjector.projectNode(node, samples))
            .then(foundational(CollectionException.Stage.DATASTORE_USAGE, client::fetchDatastoreUsage))
            .flatMap(datastores -> {
                StatusProjector.projectDatastores(datastores, samples);
                return Flux.fromIterable(datastores)
                    .concatMap(usage -> collectDatastore(usage.getStore(), samples, taskComments))
                    .then(collectTasks(samples, taskComments))
                    .thenMany(Flux.fromIterable(datastores))
                    .concatMap(usage -> collectGc(usage.getStore(), samples))
                    .then(collectTapeDrives(samples));
            })
            .then(foundational(CollectionException.Stage.VERSION, client::fetchVersion))
            .doOnNext(version -> {
                StatusProjector.projectVersion(version, samples);
                samples.setScalar(MetricsNames.UP, 1);
            })
            .then();
    }

    private Mono<Void> collectDatastore(String datastore, CycleSamples samples, Map<String, String> taskComments) {
        return auxiliary(() -> client.fetchSnapshots(datastore), "snapshots", datastore)
            .defaultIfEmpty(List.of())
            .flatMap(snapshots -> {
                CommentIndex comments = CommentIndex.fromSnapshots(snapshots);
                taskComments.putAll(comments.taskComments(datastore));

                SnapshotProjector.Result result = SnapshotProjector.projectSnapshots(
                    datastore, snapshots, comments, snapshotHistoryLimit, samples);
                log.debug("Datastore {}: exposed {} of {} snapshots", datastore, result.getExposed(), result.getTotal());

                return auxiliary(() -> client.fetchBackupGroups(datastore), "backup groups", datastore)
                    .doOnNext(groups -> {
                        SnapshotProjector.projectBackupGroups(datastore, groups, comments, samples);
                        log.debug("Datastore {}: projected {} backup groups", datastore, groups.size());
                    });
            })
            .then();
    }

    private Mono<Void> collectTasks(CycleSamples samples, Map<String, String> taskComments) {
        return auxiliary(() -> client.fetchTasks(taskLimit), "tasks", null)
            .doOnNext(tasks -> {
                TaskProjector.project(tasks, taskComments, samples);
                log.debug("Projected {} tasks", tasks.size());
            })
            .then();
    }

    private Mono<Void> collectGc(String datastore, CycleSamples samples) {
        return auxiliary(() -> client.fetchGcStatus(datastore), "GC status", datastore)
            .doOnNext(gc -> StatusProjector.projectGc(datastore, gc, samples))
            .then();
    }

    private Mono<Void> collectTapeDrives(CycleSamples samples) {
        return auxiliary(client::fetchTapeDrives, "tape drives", null)
            .doOnNext(drives -> StatusProjector.projectTapeDrives(drives, samples))
            .then();
    }

    private static <T> Mono<T> foundational(CollectionException.Stage stage, Supplier<Mono<T>> fetch) {
        return Mono.defer(fetch)
            .onErrorMap(e -> !(e instanceof CollectionException), e -> new CollectionException(stage, e));
    }

    /**
     * Failed fetches complete empty. Only the fetch is guarded: projection errors downstream
     * still propagate.
     */
    private static <T> Mono<T> auxiliary(Supplier<Mono<T>> fetch, String what, String datastore) {
        return Mono.defer(fetch)
            .onErrorResume(e -> {
                if (datastore == null) {
                    log.error("Failed to fetch {}: {}", what, e.getMessage());
                } else {
                    log.error("Failed to fetch {} for datastore {}: {}", what, datastore, e.getMessage());
                }
                return Mono.empty();
            });
    }

    private void publish(CycleSamples samples) {
        lock.writeLock().lock();
        try {
            metrics.publish(samples);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
