package org.projectkessel.sdk.auth;

import java.net.http.HttpRequest;

/**
 * Adds authentication to an outgoing HTTP request.
 *
 * <p>Used by the HTTP inventory client and the RBAC workspace client.</p>
 */
public interface AuthRequest extends TransportSecurityAware {

    /**
     * Add the authentication headers to {@code builder}.
     *
     * @throws org.projectkessel.sdk.exception.KesselException when the credential cannot be obtained
     */
    void configureRequest(HttpRequest.Builder builder);

    @Override
    default boolean requiresTransportSecurity() {
        return true;
    }

    /**
     * Bearer authentication with tokens from an OAuth2 client credentials identity.
     */
    static AuthRequest oauth2(OAuth2ClientCredentials credentials) {
        return new OAuth2AuthRequest(credentials);
    }

    /**
     * Bearer authentication with tokens from any provider.
     */
    static AuthRequest bearer(TokenProvider tokenProvider) {
        return new OAuth2AuthRequest(tokenProvider);
    }
}
