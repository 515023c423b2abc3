package com.pbsmon.exporter.client;

import lombok.Getter;

/**
 * Classified failure of a PBS API call.
 */
@Getter
public class PbsApiException extends RuntimeException {

    public enum Kind {
        /**
         * PBS answered with a non-2xx status.
         */
        HTTP_STATUS,
        /**
         * Connection refused, reset, TLS or timeout.
         */
        TRANSPORT,
        /**
         * Body is not the expected JSON envelope.
         */
        PARSE
    }

    private final Kind kind;
    private final String endpoint;
    private final int statusCode;

    private PbsApiException(Kind kind, String endpoint, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public static PbsApiException httpStatus(String endpoint, int statusCode) {
        return new PbsApiException(Kind.HTTP_STATUS, endpoint, statusCode,
            "PBS API error: " + endpoint + " returned HTTP " + statusCode, null);
    }

    public static PbsApiException transport(String endpoint, Throwable cause) {
        return new PbsApiException(Kind.TRANSPORT, endpoint, 0,
            "PBS API error: " + endpoint + " failed: " + cause.getMessage(), cause);
    }

    public static PbsApiException parse(String endpoint, String detail, Throwable cause) {
        return new PbsApiException(Kind.PARSE, endpoint, 0,
            "Failed to parse PBS API response from " + endpoint + ": " + detail, cause);
    }
}
