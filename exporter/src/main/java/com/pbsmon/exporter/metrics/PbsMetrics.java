package com.pbsmon.exporter.metrics;

import com.pbsmon.core.metrics.MetricsNames;
import com.pbsmon.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declares every PBS instrument once, in a supplied registry.
 * <p>
 * Families are replaced wholesale on {@link #publish}. All per-datastore families carry the
 * {@code datastore} label, so the series of different datastores never share a key and one
 * datastore's projection can never overwrite or clear another's.
 * </p>
 */
public class PbsMetrics {
    private final Map<String, ScalarGauge> scalars = new LinkedHashMap<>();
    private final Map<String, GaugeFamily> families = new LinkedHashMap<>();

    public PbsMetrics(MeterRegistry registry) {
        scalar(registry, MetricsNames.UP, "Whether the last collection reached every foundational PBS endpoint (1 = yes)");

        scalar(registry, MetricsNames.HOST_CPU_USAGE, "CPU usage of the PBS host (0.0 to 1.0)");
        scalar(registry, MetricsNames.HOST_IO_WAIT, "I/O wait of the PBS host (0.0 to 1.0)");
        scalar(registry, MetricsNames.HOST_LOAD1, "1 minute load average");
        scalar(registry, MetricsNames.HOST_LOAD5, "5 minute load average");
        scalar(registry, MetricsNames.HOST_LOAD15, "15 minute load average");
        scalar(registry, MetricsNames.HOST_MEMORY_USED_BYTES, "Used memory in bytes");
        scalar(registry, MetricsNames.HOST_MEMORY_TOTAL_BYTES, "Total memory in bytes");
        scalar(registry, MetricsNames.HOST_MEMORY_FREE_BYTES, "Free memory in bytes");
        scalar(registry, MetricsNames.HOST_SWAP_USED_BYTES, "Used swap in bytes");
        scalar(registry, MetricsNames.HOST_SWAP_TOTAL_BYTES, "Total swap in bytes");
        scalar(registry, MetricsNames.HOST_SWAP_FREE_BYTES, "Free swap in bytes");
        scalar(registry, MetricsNames.HOST_ROOTFS_USED_BYTES, "Used root filesystem space in bytes");
        scalar(registry, MetricsNames.HOST_ROOTFS_TOTAL_BYTES, "Total root filesystem space in bytes");
        scalar(registry, MetricsNames.HOST_ROOTFS_AVAIL_BYTES, "Available root filesystem space in bytes");
        scalar(registry, MetricsNames.HOST_UPTIME_SECONDS, "Host uptime in seconds");

        // Per-datastore: keyed by datastore first
        family(registry, MetricsNames.DATASTORE_TOTAL_BYTES, "Total datastore capacity in bytes",
            MetricsTags.DATASTORE);
        family(registry, MetricsNames.DATASTORE_USED_BYTES, "Used datastore capacity in bytes",
            MetricsTags.DATASTORE);
        family(registry, MetricsNames.DATASTORE_AVAILABLE_BYTES, "Available datastore capacity in bytes",
            MetricsTags.DATASTORE);

        family(registry, MetricsNames.SNAPSHOT_COUNT, "Number of snapshots in the backup group",
            MetricsTags.DATASTORE, MetricsTags.BACKUP_TYPE, MetricsTags.BACKUP_ID, MetricsTags.COMMENT);
        family(registry, MetricsNames.SNAPSHOT_LAST_TIMESTAMP_SECONDS, "Unix time of the latest snapshot in the backup group",
            MetricsTags.DATASTORE, MetricsTags.BACKUP_TYPE, MetricsTags.BACKUP_ID, MetricsTags.COMMENT);
        family(registry, MetricsNames.SNAPSHOT_INFO, "Snapshot backup time, one series per exposed snapshot",
            MetricsTags.DATASTORE, MetricsTags.BACKUP_TYPE, MetricsTags.BACKUP_ID, MetricsTags.COMMENT,
            MetricsTags.TIMESTAMP);
        family(registry, MetricsNames.SNAPSHOT_SIZE_BYTES, "Snapshot size in bytes",
            MetricsTags.DATASTORE, MetricsTags.BACKUP_TYPE, MetricsTags.BACKUP_ID, MetricsTags.COMMENT,
            MetricsTags.TIMESTAMP, MetricsTags.VERIFIED);
        family(registry, MetricsNames.SNAPSHOT_VERIFIED, "Whether the last verification of the snapshot succeeded",
            MetricsTags.DATASTORE, MetricsTags.BACKUP_TYPE, MetricsTags.BACKUP_ID, MetricsTags.COMMENT,
            MetricsTags.TIMESTAMP);
        family(registry, MetricsNames.SNAPSHOT_VERIFICATION_TIMESTAMP_SECONDS, "Unix time of the last successful verification",
            MetricsTags.DATASTORE, MetricsTags.BACKUP_TYPE, MetricsTags.BACKUP_ID, MetricsTags.COMMENT,
            MetricsTags.TIMESTAMP);
        family(registry, MetricsNames.SNAPSHOT_PROTECTED, "Whether the snapshot is protected from pruning",
            MetricsTags.DATASTORE, MetricsTags.BACKUP_TYPE, MetricsTags.BACKUP_ID, MetricsTags.COMMENT,
            MetricsTags.TIMESTAMP);

        // Tasks are node-wide
        family(registry, MetricsNames.TASK_TOTAL, "Tasks in the fetched window",
            MetricsTags.WORKER_TYPE, MetricsTags.STATUS, MetricsTags.COMMENT);
        family(registry, MetricsNames.TASK_DURATION_SECONDS, "Duration of finished tasks in seconds",
            MetricsTags.WORKER_TYPE, MetricsTags.STATUS, MetricsTags.WORKER_ID, MetricsTags.COMMENT);
        family(registry, MetricsNames.TASK_LAST_RUN_TIMESTAMP, "End time of the last finished task per worker type",
            MetricsTags.WORKER_TYPE);
        family(registry, MetricsNames.TASK_RUNNING, "Currently running tasks",
            MetricsTags.WORKER_TYPE, MetricsTags.COMMENT);

        family(registry, MetricsNames.GC_DISK_BYTES, "Disk bytes referenced after the last garbage collection",
            MetricsTags.DATASTORE);
        family(registry, MetricsNames.GC_REMOVED_BYTES, "Bytes removed by the last garbage collection",
            MetricsTags.DATASTORE);
        family(registry, MetricsNames.GC_PENDING_BYTES, "Bytes pending removal",
            MetricsTags.DATASTORE);
        family(registry, MetricsNames.GC_LAST_RUN_TIMESTAMP, "End time of the last garbage collection",
            MetricsTags.DATASTORE);
        family(registry, MetricsNames.GC_DURATION_SECONDS, "Duration of the last garbage collection in seconds",
            MetricsTags.DATASTORE);
        family(registry, MetricsNames.GC_STATUS, "Whether the last garbage collection succeeded",
            MetricsTags.DATASTORE);

        family(registry, MetricsNames.TAPE_DRIVE_INFO, "Configured tape drive",
            MetricsTags.NAME, MetricsTags.VENDOR, MetricsTags.MODEL, MetricsTags.SERIAL);
        scalar(registry, MetricsNames.TAPE_DRIVE_AVAILABLE, "Number of configured tape drives");

        family(registry, MetricsNames.VERSION, "PBS version information",
            MetricsTags.VERSION, MetricsTags.RELEASE, MetricsTags.REPOID);
    }

    /**
     * @return an empty staging area for one collection cycle
     */
    public CycleSamples newCycle() {
        return new CycleSamples(this);
    }

    /**
     * Overwrites every scalar and replaces every family with the staged state.
     * Callers serialize this against scraping.
     */
    void publish(CycleSamples samples) {
        for (ScalarGauge scalar : scalars.values()) {
            scalar.set(samples.scalar(scalar.getName()));
        }
        for (GaugeFamily family : families.values()) {
            family.publish(samples.series(family.getName()));
        }
    }

    boolean isScalar(String name) {
        return scalars.containsKey(name);
    }

    GaugeFamily family(String name) {
        GaugeFamily family = families.get(name);
        if (family == null) {
            throw new IllegalArgumentException("Unknown metric family: " + name);
        }
        return family;
    }

    private void scalar(MeterRegistry registry, String name, String help) {
        checkUnique(name);
        scalars.put(name, new ScalarGauge(registry, name, help));
    }

    private void family(MeterRegistry registry, String name, String help, String... labelNames) {
        checkUnique(name);
        families.put(name, new GaugeFamily(registry, name, help, labelNames));
    }

    private void checkUnique(String name) {
        if (scalars.containsKey(name) || families.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate metric name: " + name);
        }
    }
}
