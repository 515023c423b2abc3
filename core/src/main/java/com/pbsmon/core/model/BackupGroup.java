package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * A backup group: every snapshot sharing one (backup-type, backup-id) pair in a datastore.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackupGroup {
    /**
     * Backup type (vm, ct, host).
     */
    @JsonProperty("backup-type")
    String backupType;

    /**
     * VM id, CT id or hostname.
     */
    @JsonProperty("backup-id")
    String backupId;

    /**
     * Number of snapshots in this group.
     */
    @JsonProperty("backup-count")
    long backupCount;

    /**
     * Unix timestamp of the most recent snapshot.
     */
    @JsonProperty("last-backup")
    long lastBackup;

    String comment;

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }
}
