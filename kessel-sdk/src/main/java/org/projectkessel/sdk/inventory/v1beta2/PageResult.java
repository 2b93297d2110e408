package org.projectkessel.sdk.inventory.v1beta2;

import org.projectkessel.sdk.exception.KesselException;

import java.util.Objects;

/**
 * One item of a paged listing: a response, or the error that ended the listing.
 */
public record PageResult<T>(T response, KesselException error) {

    public PageResult {
        if ((response == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of response and error must be set");
        }
    }

    public static <T> PageResult<T> of(T response) {
        return new PageResult<>(Objects.requireNonNull(response, "response"), null);
    }

    public static <T> PageResult<T> failed(KesselException error) {
        return new PageResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * The response, or the error thrown.
     */
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return response;
    }
}
