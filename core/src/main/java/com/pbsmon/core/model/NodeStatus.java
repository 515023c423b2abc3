package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Host status of the PBS node, from {@code /nodes/localhost/status}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeStatus {
    /**
     * CPU usage (0.0 to 1.0).
     */
    double cpu;

    /**
     * I/O wait (0.0 to 1.0).
     */
    double wait;

    /**
     * Load averages [1min, 5min, 15min].
     */
    List<Double> loadavg;

    MemoryUsage memory;

    MemoryUsage swap;

    /**
     * Root filesystem usage. PBS calls it "root", not "rootfs".
     */
    DiskUsage root;

    /**
     * Uptime in seconds.
     */
    long uptime;

    /**
     * Returns the load average at {@code index}, or 0 when PBS reported fewer values.
     *
     * @param index 0 = 1min, 1 = 5min, 2 = 15min
     * @return load average
     */
    public double loadAverage(int index) {
        if (loadavg == null || index >= loadavg.size() || loadavg.get(index) == null) {
            return 0.0;
        }
        return loadavg.get(index);
    }
}
