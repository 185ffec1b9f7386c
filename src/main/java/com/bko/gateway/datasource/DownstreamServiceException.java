package com.bko.gateway.datasource;

/**
 * A typed failure of a service call that carries its own error code, such as an
 * authentication or authorization rejection.
 */
public class DownstreamServiceException extends RuntimeException {

    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";
    public static final String FORBIDDEN = "FORBIDDEN";

    private final String code;

    public DownstreamServiceException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DownstreamServiceException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static DownstreamServiceException unauthenticated(String message) {
        return new DownstreamServiceException(UNAUTHENTICATED, message);
    }

    public static DownstreamServiceException forbidden(String message) {
        return new DownstreamServiceException(FORBIDDEN, message);
    }

    public String getCode() {
        return code;
    }
}
