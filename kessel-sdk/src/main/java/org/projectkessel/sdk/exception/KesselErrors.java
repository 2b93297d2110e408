package org.projectkessel.sdk.exception;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Predicates for classifying SDK failures independently of their message text.
 *
 * <pre>{@code
 * try {
 *     credentials.getToken(false);
 * } catch (KesselException e) {
 *     if (KesselErrors.isTokenError(e)) {
 *         // re-authenticate
 *     }
 * }
 * }</pre>
 */
public final class KesselErrors {

    private KesselErrors() {
    }

    /**
     * True when {@code error} or any of its causes is a {@link KesselException} of the given kind.
     */
    public static boolean is(Throwable error, ErrorKind kind) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && seen.add(current)) {
            if (current instanceof KesselException kessel && kessel.getKind() == kind) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isConnectionError(Throwable error) {
        return is(error, ErrorKind.CONNECTION_FAILED);
    }

    public static boolean isTokenError(Throwable error) {
        return is(error, ErrorKind.TOKEN_RETRIEVAL_FAILED);
    }

    public static boolean isTokenCacheError(Throwable error) {
        return is(error, ErrorKind.TOKEN_CACHE_NOT_FOUND);
    }

    public static boolean isStatusError(Throwable error) {
        return is(error, ErrorKind.UNEXPECTED_STATUS);
    }

    public static boolean isClientCreationError(Throwable error) {
        return is(error, ErrorKind.CLIENT_CREATION_FAILED);
    }

    public static boolean isResourceCloseError(Throwable error) {
        return is(error, ErrorKind.RESOURCE_CLOSE_FAILED);
    }
}
