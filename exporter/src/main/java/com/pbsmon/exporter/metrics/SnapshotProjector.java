package com.pbsmon.exporter.metrics;

import com.pbsmon.core.metrics.MetricsNames;
import com.pbsmon.core.model.BackupGroup;
import com.pbsmon.core.model.Snapshot;
import com.pbsmon.core.model.VerificationStatus;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Projects the snapshots and backup groups of one datastore.
 */
final class SnapshotProjector {
    private static final Comparator<Snapshot> NEWEST_FIRST_PER_GROUP = Comparator
        .comparing(Snapshot::getBackupType, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Snapshot::getBackupId, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Comparator.comparingLong(Snapshot::getBackupTime).reversed());

    private SnapshotProjector() {
    }

    @Value
    static class Result {
        int exposed;
        int total;
    }

    /**
     * Emits the per-snapshot families, at most {@code historyLimit} newest snapshots per group
     * (0 = all of them).
     */
    static Result projectSnapshots(String datastore, List<Snapshot> snapshots, CommentIndex comments,
                                   int historyLimit, CycleSamples samples) {
        List<Snapshot> sorted = new ArrayList<>(snapshots);
        sorted.sort(NEWEST_FIRST_PER_GROUP);

        int exposed = 0;
        int inGroup = 0;
        Snapshot previous = null;
        for (Snapshot snapshot : sorted) {
            if (previous == null || !sameGroup(previous, snapshot)) {
                inGroup = 0;
            }
            previous = snapshot;
            if (historyLimit > 0 && inGroup >= historyLimit) {
                continue;
            }
            inGroup++;
            exposed++;
            project(datastore, snapshot, comments, samples);
        }
        return new Result(exposed, snapshots.size());
    }

    private static void project(String datastore, Snapshot snapshot, CommentIndex comments, CycleSamples samples) {
        String type = snapshot.getBackupType();
        String id = snapshot.getBackupId();
        String comment = CommentIndex.truncate(comments.commentFor(type, id));
        String timestamp = Long.toString(snapshot.getBackupTime());

        boolean verified = snapshot.getVerification().map(VerificationStatus::isOk).orElse(false);

        samples.set(MetricsNames.SNAPSHOT_INFO, snapshot.getBackupTime(),
            datastore, type, id, comment, timestamp);
        samples.set(MetricsNames.SNAPSHOT_VERIFIED, verified ? 1 : 0,
            datastore, type, id, comment, timestamp);
        if (verified) {
            snapshot.getVerification()
                .flatMap(VerificationStatus::getLastVerify)
                .ifPresent(lastVerify -> samples.set(MetricsNames.SNAPSHOT_VERIFICATION_TIMESTAMP_SECONDS,
                    lastVerify, datastore, type, id, comment, timestamp));
        }
        samples.set(MetricsNames.SNAPSHOT_SIZE_BYTES, snapshot.getSize().orElse(0L),
            datastore, type, id, comment, timestamp, Boolean.toString(verified));
        samples.set(MetricsNames.SNAPSHOT_PROTECTED, snapshot.getProtectedFlag().orElse(false) ? 1 : 0,
            datastore, type, id, comment, timestamp);
    }

    /**
     * Emits snapshot count and latest backup time per group, labeled with the comment of the
     * group's latest snapshot.
     */
    static void projectBackupGroups(String datastore, List<BackupGroup> groups, CommentIndex comments,
                                    CycleSamples samples) {
        for (BackupGroup group : groups) {
            String type = group.getBackupType();
            String id = group.getBackupId();
            String comment = CommentIndex.truncate(comments.commentFor(type, id));

            samples.set(MetricsNames.SNAPSHOT_COUNT, group.getBackupCount(), datastore, type, id, comment);
            samples.set(MetricsNames.SNAPSHOT_LAST_TIMESTAMP_SECONDS, group.getLastBackup(),
                datastore, type, id, comment);
        }
    }

    private static boolean sameGroup(Snapshot a, Snapshot b) {
        return Objects.equals(a.getBackupType(), b.getBackupType())
            && Objects.equals(a.getBackupId(), b.getBackupId());
    }
}
