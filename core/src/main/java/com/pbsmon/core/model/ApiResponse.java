package com.pbsmon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Envelope wrapping every PBS API response: {@code {"data": ...}}.
 *
 * @param <T> payload type
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiResponse<T> {
    private T data;
}
