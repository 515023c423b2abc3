package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Capacity of one datastore, from {@code /status/datastore-usage}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatastoreUsage {
    /**
     * Datastore name.
     */
    String store;

    long total;
    long used;
    long avail;
}
