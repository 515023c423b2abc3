package com.pbsmon.exporter.metrics;

import lombok.Getter;

/**
 * A collection cycle aborted because a foundational PBS endpoint failed.
 */
@Getter
public class CollectionException extends RuntimeException {

    public enum Stage {
        NODE_STATUS,
        DATASTORE_USAGE,
        VERSION
    }

    private final Stage stage;

    public CollectionException(Stage stage, Throwable cause) {
        super("Collection failed at " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }
}
