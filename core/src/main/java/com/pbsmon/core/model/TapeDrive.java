package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * A configured tape drive.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TapeDrive {
    String name;
    String vendor;
    String model;
    String serial;

    public Optional<String> getVendor() {
        return Optional.ofNullable(vendor);
    }

    public Optional<String> getModel() {
        return Optional.ofNullable(model);
    }

    public Optional<String> getSerial() {
        return Optional.ofNullable(serial);
    }
}
