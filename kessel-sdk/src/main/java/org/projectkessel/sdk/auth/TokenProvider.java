package org.projectkessel.sdk.auth;

/**
 * Interface for providing bearer tokens to Kessel clients
 *
 * <p>The SDK provides two built-in implementations:</p>
 *
 * <ul>
 *   <li>{@link OAuth2ClientCredentials} - OAuth 2.0 client credentials flow</li>
 *   <li>{@link StaticTokenProvider} - Static token (for development/testing)</li>
 * </ul>
 */
@FunctionalInterface
public interface TokenProvider {

    /**
     * Get a valid bearer token
     *
     * <p>Called once per request or RPC; implementations should cache.</p>
     *
     * @return A valid bearer token (without "Bearer " prefix)
     * @throws RuntimeException if token cannot be obtained
     */
    String getToken();

    /**
     * Create a static token provider (for pre-issued tokens or testing)
     */
    static TokenProvider of(String token) {
        return new StaticTokenProvider(token);
    }
}
