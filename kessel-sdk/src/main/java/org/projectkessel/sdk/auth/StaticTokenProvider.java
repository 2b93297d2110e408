package org.projectkessel.sdk.auth;

import java.util.Locale;

/**
 * Serves one pre-issued bearer token to every Kessel request and RPC.
 *
 * <p>The token never expires from the SDK's point of view; rotate it by building a new client.
 * A value copied together with its {@code Bearer } scheme is accepted and the scheme is dropped,
 * since {@link org.projectkessel.sdk.grpc.BearerTokenCallCredentials} and {@link OAuth2AuthRequest} add it themselves.</p>
 *
 * <pre>{@code
 * StubConnection<KesselInventoryServiceBlockingStub> connection = InventoryClientBuilder
 *     .forTarget("kessel-inventory.example.com:443")
 *     .authenticated(new BearerTokenCallCredentials(TokenProvider.of(System.getenv("KESSEL_TOKEN"))))
 *     .build();
 * }</pre>
 *
 * @see org.projectkessel.sdk.grpc.BearerTokenCallCredentials
 */
public class StaticTokenProvider implements TokenProvider {

    private static final String BEARER_PREFIX = "bearer ";

    private final String bearerToken;

    public StaticTokenProvider(String bearerToken) {
        String value = bearerToken == null ? "" : bearerToken.strip();
        if (value.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            value = value.substring(BEARER_PREFIX.length()).strip();
        }
        if (value.isEmpty()) {
            throw new IllegalArgumentException("bearer token is required");
        }
        this.bearerToken = value;
    }

    @Override
    public String getToken() {
        return bearerToken;
    }

    @Override
    public String toString() {
        return "StaticTokenProvider{token=***}";
    }
}
