package com.pbsmon.exporter.metrics;

import com.pbsmon.core.model.BackupGroup;
import com.pbsmon.core.model.DatastoreUsage;
import com.pbsmon.core.model.GcStatus;
import com.pbsmon.core.model.Snapshot;
import com.pbsmon.core.model.TapeDrive;
import com.pbsmon.core.model.Task;
import com.pbsmon.core.model.VerificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Collection cycle tests against an in-memory PBS (without Mockito).
 */
class PbsMetricsCollectorTest {

    private static final long TIB = 1024L * 1024 * 1024 * 1024;
    private static final long GIB = 1024L * 1024 * 1024;

    private StubPbsClient client;

    @BeforeEach
    void setUp() {
        client = new StubPbsClient();
    }

    private PbsMetricsCollector collector(int historyLimit) {
        return new PbsMetricsCollector(client, new PrometheusMetricsExporter(), historyLimit,
            PbsMetricsCollector.DEFAULT_TASK_LIMIT);
    }

    private static Exposition collectAndParse(PbsMetricsCollector collector) {
        StepVerifier.create(collector.collect()).verifyComplete();
        return Exposition.parse(collector.render());
    }

    private static Snapshot snapshot(String type, String id, long time, String comment) {
        return Snapshot.builder().backupType(type).backupId(id).backupTime(time).comment(comment).build();
    }

    private static BackupGroup group(String type, String id, long count, long lastBackup) {
        return BackupGroup.builder().backupType(type).backupId(id).backupCount(count).lastBackup(lastBackup).build();
    }

    @Test
    @DisplayName("End to end: one datastore, one group, all foundational endpoints up")
    void testEndToEnd_SingleDatastoreAndGroup() {
        client.withDatastore("backup", TIB, 512 * GIB);
        client.groups.put("backup", List.of(group("vm", "100", 3, 1703635200L)));

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(1.0, exposition.value("pbs_up"));
        assertEquals((double) TIB, exposition.value("pbs_datastore_total_bytes", "datastore", "backup"));
        assertEquals((double) (512 * GIB), exposition.value("pbs_datastore_used_bytes", "datastore", "backup"));
        assertEquals((double) (TIB - 512 * GIB), exposition.value("pbs_datastore_available_bytes", "datastore", "backup"));
        assertEquals(3.0, exposition.value("pbs_snapshot_count",
            "datastore", "backup", "backup_type", "vm", "backup_id", "100", "comment", ""));
        assertEquals(1703635200.0, exposition.value("pbs_snapshot_last_timestamp_seconds",
            "datastore", "backup", "backup_type", "vm", "backup_id", "100"));
        assertEquals(1.0, exposition.value("pbs_version", "version", "3.2", "release", "7", "repoid", "abcdef"));

        assertEquals(0.5, exposition.value("pbs_host_cpu_usage"));
        assertEquals(0.25, exposition.value("pbs_host_load15"));
        assertEquals(4096.0, exposition.value("pbs_host_memory_total_bytes"));
        assertEquals(900.0, exposition.value("pbs_host_rootfs_avail_bytes"));
        assertEquals(86400.0, exposition.value("pbs_host_uptime_seconds"));
    }

    @Test
    void testCycle_FetchesInOrderWithConfiguredTaskLimit() {
        client.withDatastore("a", 10, 5).withDatastore("b", 10, 5);
        PbsMetricsCollector collector = new PbsMetricsCollector(client, new PrometheusMetricsExporter(), 0, 20);

        StepVerifier.create(collector.collect()).verifyComplete();

        assertEquals(List.of("node", "datastores",
            "snapshots:a", "groups:a", "snapshots:b", "groups:b",
            "tasks", "gc:a", "gc:b", "tape", "version"), client.calls);
        assertEquals(20, client.lastTaskLimit);
    }

    @Test
    @DisplayName("Entities gone from PBS disappear from the next render")
    void testStaleEntries_Eliminated() {
        client.withDatastore("store1", 100, 50);
        client.snapshots.put("store1", List.of(snapshot("vm", "100", 1000, "")));
        client.groups.put("store1", List.of(group("vm", "100", 1, 1000)));
        client.tasks.add(Task.builder().upid("u1").workerType("backup").starttime(10).endtime(20L).status("OK").build());
        PbsMetricsCollector collector = collector(0);

        Exposition first = collectAndParse(collector);
        assertTrue(first.has("pbs_snapshot_info", "backup_id", "100"));
        assertTrue(first.has("pbs_snapshot_count", "backup_id", "100"));
        assertTrue(first.has("pbs_task_total", "worker_type", "backup"));

        client.snapshots.put("store1", List.of());
        client.groups.put("store1", List.of());
        client.tasks.clear();

        Exposition second = collectAndParse(collector);
        assertTrue(second.samples("pbs_snapshot_info").isEmpty());
        assertTrue(second.samples("pbs_snapshot_count").isEmpty());
        assertTrue(second.samples("pbs_task_total").isEmpty());
        assertTrue(second.samples("pbs_task_duration_seconds").isEmpty());
        assertTrue(second.has("pbs_datastore_total_bytes", "datastore", "store1"));
    }

    @Test
    void testStaleEntries_DatastoreRemoved() {
        client.withDatastore("a", 100, 50).withDatastore("b", 200, 10);
        PbsMetricsCollector collector = collector(0);
        assertEquals(2, collectAndParse(collector).samples("pbs_datastore_total_bytes").size());

        client.datastores.remove(1);

        Exposition second = collectAndParse(collector);
        assertEquals(1, second.samples("pbs_datastore_total_bytes").size());
        assertFalse(second.has("pbs_datastore_total_bytes", "datastore", "b"));
    }

    @Test
    @DisplayName("History limit keeps the N newest snapshots per group")
    void testHistoryLimit() {
        client.withDatastore("store1", 100, 50);
        client.snapshots.put("store1", List.of(
            snapshot("vm", "100", 80, null),
            snapshot("vm", "100", 100, null),
            snapshot("vm", "100", 70, null),
            snapshot("vm", "100", 90, null),
            snapshot("ct", "200", 50, null)));

        Exposition limited = collectAndParse(collector(2));
        assertEquals(List.of("100", "90"), timestamps(limited, "100"));
        assertEquals(List.of("50"), timestamps(limited, "200"));
        assertEquals(100.0, limited.value("pbs_snapshot_info", "backup_id", "100", "timestamp", "100"));

        Exposition unlimited = collectAndParse(collector(0));
        assertEquals(List.of("100", "70", "80", "90"), timestamps(unlimited, "100"));
    }

    private static List<String> timestamps(Exposition exposition, String backupId) {
        return exposition.samples("pbs_snapshot_info").stream()
            .filter(s -> backupId.equals(s.label("backup_id")))
            .map(s -> s.label("timestamp"))
            .sorted()
            .collect(Collectors.toList());
    }

    @Test
    void testSnapshotVerificationSizeAndProtection() {
        client.withDatastore("store1", 100, 50);
        client.snapshots.put("store1", List.of(
            Snapshot.builder().backupType("vm").backupId("100").backupTime(300).size(4096L).protectedFlag(true)
                .verification(VerificationStatus.builder().state("ok").lastVerify(400L).build()).build(),
            Snapshot.builder().backupType("vm").backupId("100").backupTime(200)
                .verification(VerificationStatus.builder().state("failed").lastVerify(250L).build()).build(),
            Snapshot.builder().backupType("vm").backupId("100").backupTime(100).build()));

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(1.0, exposition.value("pbs_snapshot_verified", "timestamp", "300"));
        assertEquals(0.0, exposition.value("pbs_snapshot_verified", "timestamp", "200"));
        assertEquals(0.0, exposition.value("pbs_snapshot_verified", "timestamp", "100"));

        assertEquals(400.0, exposition.value("pbs_snapshot_verification_timestamp_seconds", "timestamp", "300"));
        assertEquals(1, exposition.samples("pbs_snapshot_verification_timestamp_seconds").size());

        assertEquals(4096.0, exposition.value("pbs_snapshot_size_bytes", "timestamp", "300", "verified", "true"));
        assertEquals(0.0, exposition.value("pbs_snapshot_size_bytes", "timestamp", "200", "verified", "false"));

        assertEquals(1.0, exposition.value("pbs_snapshot_protected", "timestamp", "300"));
        assertEquals(0.0, exposition.value("pbs_snapshot_protected", "timestamp", "100"));
    }

    @Test
    @DisplayName("Latest snapshot comment labels group, snapshot and task metrics")
    void testCommentPropagation() {
        client.withDatastore("store1", 100, 50);
        client.snapshots.put("store1", List.of(
            snapshot("vm", "100", 100, ""),
            snapshot("vm", "100", 200, "nightly")));
        client.groups.put("store1", List.of(group("vm", "100", 2, 200)));
        client.tasks.add(Task.builder().upid("u1").workerType("backup").workerId("store1:vm/100")
            .starttime(100).endtime(160L).status("OK").build());

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(2.0, exposition.value("pbs_snapshot_count", "backup_id", "100", "comment", "nightly"));
        assertEquals(2, exposition.samples("pbs_snapshot_info").stream()
            .filter(s -> "nightly".equals(s.label("comment"))).count());
        assertEquals(1.0, exposition.value("pbs_task_total",
            "worker_type", "backup", "status", "OK", "comment", "nightly"));
        assertEquals(60.0, exposition.value("pbs_task_duration_seconds",
            "worker_id", "store1:vm/100", "comment", "nightly"));
    }

    @Test
    void testCommentPropagation_TaskOwnCommentWins() {
        client.withDatastore("store1", 100, 50);
        client.snapshots.put("store1", List.of(snapshot("vm", "100", 200, "nightly")));
        client.tasks.add(Task.builder().upid("u1").workerType("backup").workerId("store1:vm/100")
            .starttime(100).endtime(160L).status("OK").comment("manual run").build());

        Exposition exposition = collectAndParse(collector(0));

        assertTrue(exposition.has("pbs_task_total", "comment", "manual run"));
        assertFalse(exposition.has("pbs_task_total", "comment", "nightly"));
    }

    @Test
    @DisplayName("Comments over 50 characters are cut to 47")
    void testCommentTruncation() {
        String longComment = "x".repeat(60);
        client.withDatastore("store1", 100, 50);
        client.snapshots.put("store1", List.of(snapshot("vm", "100", 200, longComment)));
        client.groups.put("store1", List.of(group("vm", "100", 1, 200)));
        client.tasks.add(Task.builder().upid("u1").workerType("backup").workerId("store1:vm/100")
            .starttime(100).build());

        Exposition exposition = collectAndParse(collector(0));

        String expected = "x".repeat(47);
        assertEquals(expected, exposition.samples("pbs_snapshot_count").get(0).label("comment"));
        assertEquals(expected, exposition.samples("pbs_snapshot_info").get(0).label("comment"));
        assertEquals(expected, exposition.samples("pbs_task_running").get(0).label("comment"));
    }

    @Test
    @DisplayName("Finished tasks get duration and last run, running tasks are tallied")
    void testTaskClassification() {
        client.withDatastore("store1", 100, 50);
        client.tasks.addAll(List.of(
            Task.builder().upid("u1").workerType("garbage_collection").workerId("store1")
                .starttime(900).endtime(1000L).status("OK").build(),
            Task.builder().upid("u2").workerType("verify").starttime(950).build(),
            Task.builder().upid("u3").workerType("verify").starttime(960).endtime(990L).status("running").build(),
            Task.builder().upid("u4").workerType("prune").starttime(100).endtime(150L).build()));

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(100.0, exposition.value("pbs_task_duration_seconds",
            "worker_type", "garbage_collection", "status", "OK", "worker_id", "store1"));
        assertEquals(1000.0, exposition.value("pbs_task_last_run_timestamp", "worker_type", "garbage_collection"));

        assertEquals(2.0, exposition.value("pbs_task_running", "worker_type", "verify"));
        assertFalse(exposition.has("pbs_task_duration_seconds", "worker_type", "verify"));
        assertFalse(exposition.has("pbs_task_last_run_timestamp", "worker_type", "verify"));

        assertEquals(1.0, exposition.value("pbs_task_total", "worker_type", "verify", "status", "unknown"));
        assertEquals(1.0, exposition.value("pbs_task_total", "worker_type", "verify", "status", "running"));
        assertEquals(50.0, exposition.value("pbs_task_duration_seconds",
            "worker_type", "prune", "status", "unknown", "worker_id", "unknown"));
    }

    @Test
    void testTaskDuration_LastOfSharedLabelsWins() {
        client.withDatastore("store1", 100, 50);
        client.tasks.addAll(List.of(
            Task.builder().upid("u1").workerType("sync").workerId("job1").starttime(0).endtime(30L).status("OK").build(),
            Task.builder().upid("u2").workerType("sync").workerId("job1").starttime(100).endtime(110L).status("OK").build()));

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(10.0, exposition.value("pbs_task_duration_seconds", "worker_type", "sync"));
        assertEquals(110.0, exposition.value("pbs_task_last_run_timestamp", "worker_type", "sync"));
        assertEquals(2.0, exposition.value("pbs_task_total", "worker_type", "sync"));
    }

    @Test
    void testTaskDuration_NegativeDurationNotClamped() {
        client.withDatastore("store1", 100, 50);
        client.tasks.add(Task.builder().upid("u1").workerType("sync").workerId("job1")
            .starttime(1000).endtime(900L).status("OK").build());

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(-100.0, exposition.value("pbs_task_duration_seconds",
            "worker_type", "sync", "status", "OK", "worker_id", "job1"));
        assertEquals(900.0, exposition.value("pbs_task_last_run_timestamp", "worker_type", "sync"));
    }

    @Test
    @DisplayName("A failing auxiliary endpoint only loses its own data")
    void testPartialFailure_IsolatedToDatastore() {
        client.withDatastore("a", 100, 50).withDatastore("b", 200, 100);
        client.groups.put("a", List.of(group("vm", "1", 1, 10)));
        client.groups.put("b", List.of(group("vm", "2", 1, 20)));
        client.snapshots.put("b", List.of(snapshot("vm", "2", 20, "kept")));
        client.failing.add("groups:b");

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(1.0, exposition.value("pbs_up"));
        assertTrue(exposition.has("pbs_snapshot_count", "datastore", "a", "backup_id", "1"));
        assertFalse(exposition.has("pbs_snapshot_count", "datastore", "b"));
        assertTrue(exposition.has("pbs_snapshot_info", "datastore", "b", "comment", "kept"));
        assertTrue(exposition.has("pbs_datastore_total_bytes", "datastore", "b"));
    }

    @Test
    void testPartialFailure_SnapshotsTasksGcAndTape() {
        client.withDatastore("a", 100, 50);
        client.groups.put("a", List.of(group("vm", "1", 4, 10)));
        client.snapshots.put("a", List.of(snapshot("vm", "1", 10, "lost")));
        client.tasks.add(Task.builder().upid("u1").workerType("backup").starttime(0).build());
        client.failing.addAll(List.of("snapshots:a", "tasks", "gc:a", "tape"));

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(1.0, exposition.value("pbs_up"));
        assertEquals(4.0, exposition.value("pbs_snapshot_count", "datastore", "a", "comment", ""));
        assertTrue(exposition.samples("pbs_snapshot_info").isEmpty());
        assertTrue(exposition.samples("pbs_task_total").isEmpty());
        assertTrue(exposition.samples("pbs_gc_status").isEmpty());
        assertEquals(0.0, exposition.value("pbs_tape_drive_available"));
    }

    @Test
    @DisplayName("Node status failure aborts the cycle with pbs_up 0")
    void testFoundationalFailure_NodeStatus() {
        client.withDatastore("store1", 100, 50);
        client.failing.add("node");
        PbsMetricsCollector collector = collector(0);

        StepVerifier.create(collector.collect())
            .expectErrorSatisfies(err -> {
                assertTrue(err instanceof CollectionException);
                assertEquals(CollectionException.Stage.NODE_STATUS, ((CollectionException) err).getStage());
            })
            .verify();

        Exposition exposition = Exposition.parse(collector.render());
        assertEquals(0.0, exposition.value("pbs_up"));
        assertTrue(exposition.samples("pbs_datastore_total_bytes").isEmpty());
        assertEquals(List.of("node"), client.calls);
    }

    @Test
    void testFoundationalFailure_PreviousStateReplaced() {
        client.withDatastore("store1", 100, 50);
        PbsMetricsCollector collector = collector(0);
        assertEquals(1.0, collectAndParse(collector).value("pbs_up"));

        client.failing.add("datastores");
        StepVerifier.create(collector.collect())
            .expectErrorSatisfies(err ->
                assertEquals(CollectionException.Stage.DATASTORE_USAGE, ((CollectionException) err).getStage()))
            .verify();

        Exposition exposition = Exposition.parse(collector.render());
        assertEquals(0.0, exposition.value("pbs_up"));
        assertEquals(0.5, exposition.value("pbs_host_cpu_usage"));
        assertTrue(exposition.samples("pbs_datastore_total_bytes").isEmpty());
        assertTrue(exposition.samples("pbs_version").isEmpty());
    }

    @Test
    void testFoundationalFailure_VersionKeepsEarlierProjections() {
        client.withDatastore("store1", 100, 50);
        client.failing.add("version");
        PbsMetricsCollector collector = collector(0);

        StepVerifier.create(collector.collect())
            .expectErrorSatisfies(err ->
                assertEquals(CollectionException.Stage.VERSION, ((CollectionException) err).getStage()))
            .verify();

        Exposition exposition = Exposition.parse(collector.render());
        assertEquals(0.0, exposition.value("pbs_up"));
        assertTrue(exposition.has("pbs_datastore_total_bytes", "datastore", "store1"));
        assertTrue(exposition.samples("pbs_version").isEmpty());
    }

    @Test
    void testCancelledCycle_PublishesWhatWasStaged() {
        client.withDatastore("store1", 100, 50);
        client.hanging.add("version");
        PbsMetricsCollector collector = collector(0);

        Disposable cycle = collector.collect().subscribe();
        cycle.dispose();

        Exposition exposition = Exposition.parse(collector.render());
        assertEquals(0.0, exposition.value("pbs_up"));
        assertTrue(exposition.has("pbs_datastore_total_bytes", "datastore", "store1"));
    }

    @Test
    @DisplayName("Render twice without a cycle in between gives identical output")
    void testRender_Idempotent() {
        PbsMetricsCollector collector = collector(0);
        String beforeFirstCycle = collector.render();
        assertEquals(beforeFirstCycle, collector.render());
        assertEquals(0.0, Exposition.parse(beforeFirstCycle).value("pbs_up"));

        client.withDatastore("store1", 100, 50);
        client.snapshots.put("store1", List.of(snapshot("vm", "100", 1, "c")));
        StepVerifier.create(collector.collect()).verifyComplete();

        assertEquals(collector.render(), collector.render());
    }

    @Test
    void testGcProjection() {
        client.withDatastore("a", 100, 50).withDatastore("b", 100, 50).withDatastore("c", 100, 50);
        client.gc.put("a", GcStatus.builder().diskBytes(10L).removedBytes(20L).pendingBytes(30L)
            .lastRunEndtime(1700000000L).lastRunState("OK").duration(12.5).build());
        client.gc.put("b", GcStatus.builder().lastRunState("TASK ERROR: disk full").build());

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(10.0, exposition.value("pbs_gc_disk_bytes", "datastore", "a"));
        assertEquals(20.0, exposition.value("pbs_gc_removed_bytes", "datastore", "a"));
        assertEquals(30.0, exposition.value("pbs_gc_pending_bytes", "datastore", "a"));
        assertEquals(1700000000.0, exposition.value("pbs_gc_last_run_timestamp", "datastore", "a"));
        assertEquals(12.5, exposition.value("pbs_gc_duration_seconds", "datastore", "a"));
        assertEquals(1.0, exposition.value("pbs_gc_status", "datastore", "a"));

        assertEquals(0.0, exposition.value("pbs_gc_status", "datastore", "b"));
        assertFalse(exposition.has("pbs_gc_removed_bytes", "datastore", "b"));
        assertFalse(exposition.has("pbs_gc_status", "datastore", "c"));
    }

    @Test
    void testTapeDrives() {
        client.withDatastore("store1", 100, 50);
        client.tapeDrives = new ArrayList<>(List.of(
            TapeDrive.builder().name("drive0").vendor("IBM").model("ULT3580").serial("123").build(),
            TapeDrive.builder().name("drive1").build()));

        Exposition exposition = collectAndParse(collector(0));

        assertEquals(2.0, exposition.value("pbs_tape_drive_available"));
        assertEquals(1.0, exposition.value("pbs_tape_drive_info", "name", "drive0", "vendor", "IBM"));
        assertEquals(1.0, exposition.value("pbs_tape_drive_info",
            "name", "drive1", "vendor", "unknown", "model", "unknown", "serial", "unknown"));
    }

    @Test
    @DisplayName("Concurrent cycles never expose a half-published state to render")
    void testConcurrentCollect_RenderSeesConsistentFamilies() throws InterruptedException {
        AtomicInteger cycles = new AtomicInteger();
        StubPbsClient alternating = new StubPbsClient() {
            @Override
            public Mono<List<DatastoreUsage>> fetchDatastoreUsage() {
                return Mono.fromSupplier(() -> cycles.getAndIncrement() % 2 == 0
                    ? List.of(usage("a"))
                    : List.of(usage("b"), usage("c")));
            }
        };
        for (String store : List.of("a", "b", "c")) {
            alternating.snapshots.put(store, List.of(snapshot("vm", store, 100, "")));
        }
        PbsMetricsCollector collector = new PbsMetricsCollector(alternating, new PrometheusMetricsExporter(), 0,
            PbsMetricsCollector.DEFAULT_TASK_LIMIT);

        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger renders = new AtomicInteger();
        Queue<String> torn = new ConcurrentLinkedQueue<>();
        Thread renderer = new Thread(() -> {
            while (!done.get()) {
                Exposition exposition = Exposition.parse(collector.render());
                Set<String> capacity = datastores(exposition, "pbs_datastore_total_bytes");
                Set<String> snapshots = datastores(exposition, "pbs_snapshot_info");
                if (!capacity.equals(snapshots)) {
                    torn.add(capacity + " vs " + snapshots);
                }
                renders.incrementAndGet();
            }
        });
        renderer.start();

        try {
            Flux.range(0, 200)
                .flatMap(i -> collector.collect().subscribeOn(Schedulers.parallel()), 8)
                .blockLast(Duration.ofSeconds(60));
        } finally {
            done.set(true);
            renderer.join(10_000);
        }

        assertTrue(renders.get() > 0);
        assertTrue(torn.isEmpty(), "Inconsistent renders: " + torn);
        assertEquals(200, cycles.get());
        Set<String> last = datastores(Exposition.parse(collector.render()), "pbs_datastore_total_bytes");
        assertTrue(last.equals(Set.of("a")) || last.equals(Set.of("b", "c")));
    }

    private static DatastoreUsage usage(String store) {
        return DatastoreUsage.builder().store(store).total(100).used(10).avail(90).build();
    }

    private static Set<String> datastores(Exposition exposition, String family) {
        return exposition.samples(family).stream()
            .map(s -> s.label("datastore"))
            .collect(Collectors.toSet());
    }

    @Test
    void testConstructor_RejectsInvalidLimits() {
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter();
        assertThrows(IllegalArgumentException.class, () -> new PbsMetricsCollector(client, exporter, -1, 50));
        assertThrows(IllegalArgumentException.class, () -> new PbsMetricsCollector(client, exporter, 0, 0));
    }
}
