package com.pbsmon.exporter.metrics;

import com.pbsmon.core.model.Snapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest-snapshot comment per backup group of one datastore.
 * <p>
 * For each (backup_type, backup_id) the snapshot with the greatest backup time provides the
 * comment. On equal backup times the first snapshot seen is kept.
 * </p>
 */
public final class CommentIndex {
    static final int MAX_COMMENT_LENGTH = 50;
    static final int TRUNCATED_LENGTH = 47;

    private final Map<String, Entry> latest = new LinkedHashMap<>();

    private CommentIndex() {
    }

    public static CommentIndex fromSnapshots(List<Snapshot> snapshots) {
        CommentIndex index = new CommentIndex();
        for (Snapshot snapshot : snapshots) {
            String group = groupKey(snapshot.getBackupType(), snapshot.getBackupId());
            Entry current = index.latest.get(group);
            if (current == null || snapshot.getBackupTime() > current.time) {
                index.latest.put(group, new Entry(snapshot.getBackupType(), snapshot.getBackupId(),
                    snapshot.getBackupTime(), snapshot.getComment().orElse("")));
            }
        }
        return index;
    }

    /**
     * @return the comment of the group's latest snapshot, or "" when unknown
     */
    public String commentFor(String backupType, String backupId) {
        Entry entry = latest.get(groupKey(backupType, backupId));
        return entry == null ? "" : entry.comment;
    }

    /**
     * Non-empty comments keyed the way PBS names backup workers: {@code "{datastore}:{type}/{id}"}.
     */
    public Map<String, String> taskComments(String datastore) {
        Map<String, String> comments = new LinkedHashMap<>();
        for (Entry entry : latest.values()) {
            if (!entry.comment.isEmpty()) {
                comments.put(datastore + ":" + entry.backupType + "/" + entry.backupId, entry.comment);
            }
        }
        return comments;
    }

    /**
     * Cuts comments longer than 50 code points down to their first 47, without ellipsis.
     */
    public static String truncate(String comment) {
        if (comment == null) {
            return "";
        }
        int length = comment.codePointCount(0, comment.length());
        if (length <= MAX_COMMENT_LENGTH) {
            return comment;
        }
        return comment.substring(0, comment.offsetByCodePoints(0, TRUNCATED_LENGTH));
    }

    private static String groupKey(String backupType, String backupId) {
        return backupType + "/" + backupId;
    }

    private static final class Entry {
        final String backupType;
        final String backupId;
        final long time;
        final String comment;

        Entry(String backupType, String backupId, long time, String comment) {
            this.backupType = backupType;
            this.backupId = backupId;
            this.time = time;
            this.comment = comment;
        }
    }
}
