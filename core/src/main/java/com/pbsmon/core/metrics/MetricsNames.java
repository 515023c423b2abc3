package com.pbsmon.core.metrics;

/**
 * Metric names exposed by the PBS exporter.
 * <p>
 * <b>Naming convention:</b> {@code pbs_<area>_<metric>[_<unit>]}, written in the final
 * Prometheus form so that the registry naming convention leaves them untouched.
 * All metrics are gauges; names ending in {@code _total} or {@code _info} are gauges too
 * and keep those suffixes for compatibility with existing dashboards.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: 1 when the last collection reached every foundational endpoint, else 0.
     */
    public static final String UP = "pbs_up";

    // Host metrics, from /nodes/localhost/status
    public static final String HOST_CPU_USAGE = "pbs_host_cpu_usage";
    public static final String HOST_IO_WAIT = "pbs_host_io_wait";
    public static final String HOST_LOAD1 = "pbs_host_load1";
    public static final String HOST_LOAD5 = "pbs_host_load5";
    public static final String HOST_LOAD15 = "pbs_host_load15";
    public static final String HOST_MEMORY_USED_BYTES = "pbs_host_memory_used_bytes";
    public static final String HOST_MEMORY_TOTAL_BYTES = "pbs_host_memory_total_bytes";
    public static final String HOST_MEMORY_FREE_BYTES = "pbs_host_memory_free_bytes";
    public static final String HOST_SWAP_USED_BYTES = "pbs_host_swap_used_bytes";
    public static final String HOST_SWAP_TOTAL_BYTES = "pbs_host_swap_total_bytes";
    public static final String HOST_SWAP_FREE_BYTES = "pbs_host_swap_free_bytes";
    public static final String HOST_ROOTFS_USED_BYTES = "pbs_host_rootfs_used_bytes";
    public static final String HOST_ROOTFS_TOTAL_BYTES = "pbs_host_rootfs_total_bytes";
    public static final String HOST_ROOTFS_AVAIL_BYTES = "pbs_host_rootfs_avail_bytes";
    public static final String HOST_UPTIME_SECONDS = "pbs_host_uptime_seconds";

    /**
     * Gauge family: datastore capacity.
     * <p>
     * Tags: datastore
     * </p>
     */
    public static final String DATASTORE_TOTAL_BYTES = "pbs_datastore_total_bytes";
    public static final String DATASTORE_USED_BYTES = "pbs_datastore_used_bytes";
    public static final String DATASTORE_AVAILABLE_BYTES = "pbs_datastore_available_bytes";

    /**
     * Gauge family: snapshots per backup group.
     * <p>
     * Tags: datastore, backup_type, backup_id, comment
     * </p>
     */
    public static final String SNAPSHOT_COUNT = "pbs_snapshot_count";
    public static final String SNAPSHOT_LAST_TIMESTAMP_SECONDS = "pbs_snapshot_last_timestamp_seconds";

    /**
     * Gauge family: one series per exposed snapshot, valued at its backup time.
     * <p>
     * Tags: datastore, backup_type, backup_id, comment, timestamp
     * </p>
     */
    public static final String SNAPSHOT_INFO = "pbs_snapshot_info";

    /**
     * Gauge family: snapshot size.
     * <p>
     * Tags: datastore, backup_type, backup_id, comment, timestamp, verified
     * </p>
     */
    public static final String SNAPSHOT_SIZE_BYTES = "pbs_snapshot_size_bytes";
    public static final String SNAPSHOT_VERIFIED = "pbs_snapshot_verified";
    public static final String SNAPSHOT_VERIFICATION_TIMESTAMP_SECONDS = "pbs_snapshot_verification_timestamp_seconds";
    public static final String SNAPSHOT_PROTECTED = "pbs_snapshot_protected";

    /**
     * Gauge family: tasks in the fetch window.
     * <p>
     * Tags: worker_type, status, comment
     * </p>
     */
    public static final String TASK_TOTAL = "pbs_task_total";

    /**
     * Gauge family: duration of finished tasks.
     * <p>
     * Tags: worker_type, status, worker_id, comment
     * </p>
     */
    public static final String TASK_DURATION_SECONDS = "pbs_task_duration_seconds";
    public static final String TASK_LAST_RUN_TIMESTAMP = "pbs_task_last_run_timestamp";
    public static final String TASK_RUNNING = "pbs_task_running";

    // Garbage collection, tags: datastore
    public static final String GC_DISK_BYTES = "pbs_gc_disk_bytes";
    public static final String GC_REMOVED_BYTES = "pbs_gc_removed_bytes";
    public static final String GC_PENDING_BYTES = "pbs_gc_pending_bytes";
    public static final String GC_LAST_RUN_TIMESTAMP = "pbs_gc_last_run_timestamp";
    public static final String GC_DURATION_SECONDS = "pbs_gc_duration_seconds";
    public static final String GC_STATUS = "pbs_gc_status";

    // Tape
    public static final String TAPE_DRIVE_INFO = "pbs_tape_drive_info";
    public static final String TAPE_DRIVE_AVAILABLE = "pbs_tape_drive_available";

    /**
     * Gauge family: constant 1, labeled with the PBS version.
     * <p>
     * Tags: version, release, repoid
     * </p>
     */
    public static final String VERSION = "pbs_version";
}
