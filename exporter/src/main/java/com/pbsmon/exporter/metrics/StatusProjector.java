package com.pbsmon.exporter.metrics;

import com.pbsmon.core.metrics.MetricsNames;
import com.pbsmon.core.model.DatastoreUsage;
import com.pbsmon.core.model.GcStatus;
import com.pbsmon.core.model.NodeStatus;
import com.pbsmon.core.model.TapeDrive;
import com.pbsmon.core.model.VersionInfo;

import java.util.List;

/**
 * Projects host, datastore capacity, garbage collection, tape and version payloads.
 */
final class StatusProjector {
    static final String GC_STATE_OK = "ok";

    private StatusProjector() {
    }

    static void projectNode(NodeStatus node, CycleSamples samples) {
        samples.setScalar(MetricsNames.HOST_CPU_USAGE, node.getCpu());
        samples.setScalar(MetricsNames.HOST_IO_WAIT, node.getWait());
        samples.setScalar(MetricsNames.HOST_LOAD1, node.loadAverage(0));
        samples.setScalar(MetricsNames.HOST_LOAD5, node.loadAverage(1));
        samples.setScalar(MetricsNames.HOST_LOAD15, node.loadAverage(2));

        if (node.getMemory() != null) {
            samples.setScalar(MetricsNames.HOST_MEMORY_USED_BYTES, node.getMemory().getUsed());
            samples.setScalar(MetricsNames.HOST_MEMORY_TOTAL_BYTES, node.getMemory().getTotal());
            samples.setScalar(MetricsNames.HOST_MEMORY_FREE_BYTES, node.getMemory().getFree());
        }
        if (node.getSwap() != null) {
            samples.setScalar(MetricsNames.HOST_SWAP_USED_BYTES, node.getSwap().getUsed());
            samples.setScalar(MetricsNames.HOST_SWAP_TOTAL_BYTES, node.getSwap().getTotal());
            samples.setScalar(MetricsNames.HOST_SWAP_FREE_BYTES, node.getSwap().getFree());
        }
        if (node.getRoot() != null) {
            samples.setScalar(MetricsNames.HOST_ROOTFS_USED_BYTES, node.getRoot().getUsed());
            samples.setScalar(MetricsNames.HOST_ROOTFS_TOTAL_BYTES, node.getRoot().getTotal());
            samples.setScalar(MetricsNames.HOST_ROOTFS_AVAIL_BYTES, node.getRoot().getAvail());
        }
        samples.setScalar(MetricsNames.HOST_UPTIME_SECONDS, node.getUptime());
    }

    static void projectDatastores(List<DatastoreUsage> datastores, CycleSamples samples) {
        for (DatastoreUsage usage : datastores) {
            samples.set(MetricsNames.DATASTORE_TOTAL_BYTES, usage.getTotal(), usage.getStore());
            samples.set(MetricsNames.DATASTORE_USED_BYTES, usage.getUsed(), usage.getStore());
            samples.set(MetricsNames.DATASTORE_AVAILABLE_BYTES, usage.getAvail(), usage.getStore());
        }
    }

    /**
     * Writes only the fields PBS reported; a datastore that never ran GC gets no series.
     */
    static void projectGc(String datastore, GcStatus gc, CycleSamples samples) {
        gc.getDiskBytes().ifPresent(v -> samples.set(MetricsNames.GC_DISK_BYTES, v, datastore));
        gc.getRemovedBytes().ifPresent(v -> samples.set(MetricsNames.GC_REMOVED_BYTES, v, datastore));
        gc.getPendingBytes().ifPresent(v -> samples.set(MetricsNames.GC_PENDING_BYTES, v, datastore));
        gc.getLastRunEndtime().ifPresent(v -> samples.set(MetricsNames.GC_LAST_RUN_TIMESTAMP, v, datastore));
        gc.getDuration().ifPresent(v -> samples.set(MetricsNames.GC_DURATION_SECONDS, v, datastore));
        gc.getLastRunState().ifPresent(state ->
            samples.set(MetricsNames.GC_STATUS, GC_STATE_OK.equalsIgnoreCase(state) ? 1 : 0, datastore));
    }

    static void projectTapeDrives(List<TapeDrive> drives, CycleSamples samples) {
        samples.setScalar(MetricsNames.TAPE_DRIVE_AVAILABLE, drives.size());
        for (TapeDrive drive : drives) {
            samples.set(MetricsNames.TAPE_DRIVE_INFO, 1,
                drive.getName(),
                drive.getVendor().orElse("unknown"),
                drive.getModel().orElse("unknown"),
                drive.getSerial().orElse("unknown"));
        }
    }

    static void projectVersion(VersionInfo version, CycleSamples samples) {
        samples.set(MetricsNames.VERSION, 1, version.getVersion(), version.getRelease(), version.getRepoid());
    }
}
