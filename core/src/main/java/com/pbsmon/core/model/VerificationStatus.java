package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * Outcome of the last verification job run against a snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerificationStatus {
    public static final String STATE_OK = "ok";

    /**
     * Verification state (ok, failed, ...).
     */
    String state;

    /**
     * Unix timestamp of the last verification, when PBS reports it.
     */
    @JsonProperty("last-verify")
    Long lastVerify;

    public Optional<Long> getLastVerify() {
        return Optional.ofNullable(lastVerify);
    }

    /**
     * @return true only for the exact state {@code "ok"}
     */
    public boolean isOk() {
        return STATE_OK.equals(state);
    }
}
