package com.pbsmon.core.metrics;

/**
 * Label names attached to PBS metrics.
 * <p>
 * These are part of the exporter's public contract: dashboards and alert rules
 * select on them, so they must never be renamed.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Datastore name as reported by {@code /status/datastore-usage}.
     */
    public static final String DATASTORE = "datastore";

    /**
     * Backup type (vm, ct, host).
     */
    public static final String BACKUP_TYPE = "backup_type";

    /**
     * Backup id (VM id, CT id or hostname).
     */
    public static final String BACKUP_ID = "backup_id";

    /**
     * Comment of the latest snapshot in a backup group, truncated.
     */
    public static final String COMMENT = "comment";

    /**
     * Snapshot backup time in unix seconds, rendered as a decimal string.
     */
    public static final String TIMESTAMP = "timestamp";

    /**
     * Snapshot verification outcome ("true"/"false").
     */
    public static final String VERIFIED = "verified";

    public static final String WORKER_TYPE = "worker_type";
    public static final String WORKER_ID = "worker_id";
    public static final String STATUS = "status";

    // Tape drive labels
    public static final String NAME = "name";
    public static final String VENDOR = "vendor";
    public static final String MODEL = "model";
    public static final String SERIAL = "serial";

    // Version labels
    public static final String VERSION = "version";
    public static final String RELEASE = "release";
    public static final String REPOID = "repoid";
}
