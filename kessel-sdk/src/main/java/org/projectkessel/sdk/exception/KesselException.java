package org.projectkessel.sdk.exception;

import io.grpc.Status;

/**
 * Base exception for Kessel SDK errors
 */
public class KesselException extends RuntimeException {

    private final ErrorKind kind;
    private final int statusCode;
    private final Status.Code grpcCode;

    public KesselException(ErrorKind kind, String message) {
        this(kind, message, 0, Status.Code.UNKNOWN, null);
    }

    public KesselException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, codeOf(cause), cause);
    }

    public KesselException(ErrorKind kind, String message, Status.Code grpcCode) {
        this(kind, message, 0, grpcCode, null);
    }

    public KesselException(ErrorKind kind, String message, int statusCode, Status.Code grpcCode, Throwable cause) {
        super(cause != null ? message + ": " + cause.getMessage() : message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.grpcCode = grpcCode;
    }

    /**
     * Non-2xx HTTP response.
     */
    public static KesselException unexpectedStatus(String message, int statusCode) {
        return new KesselException(ErrorKind.UNEXPECTED_STATUS,
                message + ": status code " + statusCode,
                statusCode,
                Status.Code.INVALID_ARGUMENT,
                null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * HTTP status code of the failed exchange, or 0 when none applies.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Status.Code getGrpcCode() {
        return grpcCode;
    }

    public Status toGrpcStatus() {
        return Status.fromCode(grpcCode).withDescription(getMessage()).withCause(this);
    }

    private static Status.Code codeOf(Throwable cause) {
        if (cause == null) {
            return Status.Code.UNKNOWN;
        }
        if (cause instanceof KesselException kessel) {
            return kessel.getGrpcCode();
        }
        Status status = Status.fromThrowable(cause);
        return status.getCode();
    }
}
