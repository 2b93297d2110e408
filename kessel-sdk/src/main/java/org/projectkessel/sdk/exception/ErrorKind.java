package org.projectkessel.sdk.exception;

/**
 * Stable categories for SDK failures.
 *
 * <p>Messages get wrapped with extra context at every layer; the kind does not.
 * Use {@link KesselErrors} to test for a kind anywhere in a cause chain.</p>
 */
public enum ErrorKind {
    CONNECTION_FAILED("connection failed"),
    TOKEN_RETRIEVAL_FAILED("token retrieval failed"),
    TOKEN_CACHE_NOT_FOUND("cached token not found"),
    UNEXPECTED_STATUS("unexpected status code"),
    CLIENT_CREATION_FAILED("client creation failed"),
    RESOURCE_CLOSE_FAILED("resource close failed");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
