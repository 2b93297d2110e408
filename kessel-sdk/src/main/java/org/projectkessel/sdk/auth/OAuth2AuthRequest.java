package org.projectkessel.sdk.auth;

import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * Sets {@code Authorization: Bearer <token>} on each request.
 */
public class OAuth2AuthRequest implements AuthRequest {

    private final TokenProvider tokenProvider;
    private final boolean requireTransportSecurity;

    public OAuth2AuthRequest(TokenProvider tokenProvider) {
        this(tokenProvider, true);
    }

    public OAuth2AuthRequest(TokenProvider tokenProvider, boolean requireTransportSecurity) {
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
        this.requireTransportSecurity = requireTransportSecurity;
    }

    @Override
    public void configureRequest(HttpRequest.Builder builder) {
        builder.header("Authorization", "Bearer " + tokenProvider.getToken());
    }

    @Override
    public boolean requiresTransportSecurity() {
        return requireTransportSecurity;
    }
}
