package org.projectkessel.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A bearer token and the instant it stops being accepted.
 *
 * @param accessToken token value, empty when no token has been issued
 * @param expiresAt   expiry computed from {@code expires_in} at refresh time
 */
public record AccessToken(String accessToken, Instant expiresAt) {

    /**
     * Safety margin subtracted from the expiry so a token never expires mid-flight.
     */
    public static final Duration EXPIRATION_WINDOW = Duration.ofSeconds(300);

    public AccessToken {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isValid(Instant now) {
        return !accessToken.isEmpty() && now.plus(EXPIRATION_WINDOW).isBefore(expiresAt);
    }

    public long expiresInSeconds(Instant now) {
        return Duration.between(now, expiresAt).toSeconds();
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
