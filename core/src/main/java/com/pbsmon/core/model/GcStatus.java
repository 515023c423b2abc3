package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * Garbage collection status of one datastore. Every field is optional:
 * a datastore that never ran GC reports none of them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GcStatus {
    @JsonProperty("disk-bytes")
    Long diskBytes;

    @JsonProperty("removed-bytes")
    Long removedBytes;

    @JsonProperty("pending-bytes")
    Long pendingBytes;

    @JsonProperty("last-run-endtime")
    Long lastRunEndtime;

    @JsonProperty("last-run-state")
    String lastRunState;

    /**
     * Duration of the last run in seconds.
     */
    Double duration;

    public Optional<Long> getDiskBytes() {
        return Optional.ofNullable(diskBytes);
    }

    public Optional<Long> getRemovedBytes() {
        return Optional.ofNullable(removedBytes);
    }

    public Optional<Long> getPendingBytes() {
        return Optional.ofNullable(pendingBytes);
    }

    public Optional<Long> getLastRunEndtime() {
        return Optional.ofNullable(lastRunEndtime);
    }

    public Optional<String> getLastRunState() {
        return Optional.ofNullable(lastRunState);
    }

    public Optional<Double> getDuration() {
        return Optional.ofNullable(duration);
    }
}
