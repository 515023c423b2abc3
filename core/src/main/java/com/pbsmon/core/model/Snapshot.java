package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * One point-in-time backup inside a backup group.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Snapshot {
    @JsonProperty("backup-type")
    String backupType;

    @JsonProperty("backup-id")
    String backupId;

    /**
     * Backup timestamp (unix seconds).
     */
    @JsonProperty("backup-time")
    long backupTime;

    String comment;

    /**
     * Total snapshot size in bytes.
     */
    Long size;

    /**
     * Whether the snapshot is protected from pruning.
     */
    @JsonProperty("protected")
    Boolean protectedFlag;

    VerificationStatus verification;

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }

    public Optional<Long> getSize() {
        return Optional.ofNullable(size);
    }

    public Optional<Boolean> getProtectedFlag() {
        return Optional.ofNullable(protectedFlag);
    }

    public Optional<VerificationStatus> getVerification() {
        return Optional.ofNullable(verification);
    }
}
