package org.projectkessel.sdk.exception;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class KesselErrorsTest {

    @Test
    void matchesKindOfTopLevelException() {
        KesselException error = new KesselException(ErrorKind.CLIENT_CREATION_FAILED, "target is required");

        assertTrue(KesselErrors.isClientCreationError(error));
        assertFalse(KesselErrors.isConnectionError(error));
        assertFalse(KesselErrors.isTokenError(error));
    }

    @Test
    void matchesKindAnywhereInCauseChain() {
        KesselException status = KesselException.unexpectedStatus("discovery document unavailable", 404);
        KesselException connection = new KesselException(ErrorKind.CONNECTION_FAILED, "discovery failed", status);
        KesselException token = new KesselException(ErrorKind.TOKEN_RETRIEVAL_FAILED, "token failed", connection);
        RuntimeException wrapped = new RuntimeException("outer", token);

        assertTrue(KesselErrors.isTokenError(wrapped));
        assertTrue(KesselErrors.isConnectionError(wrapped));
        assertTrue(KesselErrors.isStatusError(wrapped));
        assertFalse(KesselErrors.isTokenCacheError(wrapped));
        assertFalse(KesselErrors.isResourceCloseError(wrapped));
    }

    @Test
    void nonKesselErrorsMatchNothing() {
        IOException error = new IOException("boom");

        for (ErrorKind kind : ErrorKind.values()) {
            assertFalse(KesselErrors.is(error, kind));
        }
        assertFalse(KesselErrors.is(null, ErrorKind.CONNECTION_FAILED));
    }

    @Test
    void unexpectedStatusCarriesStatusCodeAndInvalidArgument() {
        KesselException error = KesselException.unexpectedStatus("token endpoint rejected the request", 401);

        assertEquals(ErrorKind.UNEXPECTED_STATUS, error.getKind());
        assertEquals(401, error.getStatusCode());
        assertEquals(Status.Code.INVALID_ARGUMENT, error.getGrpcCode());
        assertTrue(error.getMessage().contains("status code 401"));
    }

    @Test
    void grpcCodeIsTakenFromCause() {
        StatusRuntimeException cause = Status.UNAVAILABLE.withDescription("no route").asRuntimeException();

        KesselException error = new KesselException(ErrorKind.CONNECTION_FAILED, "error receiving from stream", cause);

        assertEquals(Status.Code.UNAVAILABLE, error.getGrpcCode());
        assertEquals(Status.Code.UNAVAILABLE, error.toGrpcStatus().getCode());
        assertTrue(error.getMessage().startsWith("error receiving from stream: "));
        assertSame(cause, error.getCause());
    }

    @Test
    void grpcCodeDefaultsToUnknown() {
        KesselException error = new KesselException(ErrorKind.TOKEN_CACHE_NOT_FOUND, "no token cached");

        assertEquals(Status.Code.UNKNOWN, error.getGrpcCode());
        assertEquals(0, error.getStatusCode());
        assertEquals("no token cached", error.getMessage());
    }

    @Test
    void everyKindHasDescription() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertNotNull(kind.getDescription());
            assertFalse(kind.getDescription().isBlank());
        }
    }
}
