package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * A worker task from {@code /nodes/localhost/tasks}.
 * <p>
 * A task without {@code endtime} is still running.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Task {
    /**
     * Unique process id.
     */
    String upid;

    /**
     * Worker type (backup, verify, prune, sync, garbage_collection, ...).
     */
    @JsonProperty("worker_type")
    String workerType;

    /**
     * Worker id, for backup jobs in the form {@code datastore:type/id}.
     */
    @JsonProperty("worker_id")
    String workerId;

    long starttime;

    Long endtime;

    String status;

    String comment;

    public Optional<String> getWorkerId() {
        return Optional.ofNullable(workerId);
    }

    public Optional<Long> getEndtime() {
        return Optional.ofNullable(endtime);
    }

    public Optional<String> getStatus() {
        return Optional.ofNullable(status);
    }

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }
}
