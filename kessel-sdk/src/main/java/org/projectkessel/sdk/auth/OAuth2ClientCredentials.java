package org.projectkessel.sdk.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.exception.KesselException;
import org.projectkessel.sdk.http.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OAuth 2.0 client credentials identity with a cached, automatically refreshed token
 *
 * <p>Acquires tokens with the client credentials grant and caches them until they come within
 * {@link AccessToken#EXPIRATION_WINDOW} of expiring.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * OAuth2ClientCredentials credentials = OAuth2ClientCredentials.builder()
 *     .clientId("svc-inventory")
 *     .clientSecret("secret")
 *     .tokenEndpoint("https://sso.example.com/realms/redhat-external/protocol/openid-connect/token")
 *     .build();
 *
 * // or let OpenID Connect discovery find the token endpoint on first use
 * OAuth2ClientCredentials discovered = OAuth2ClientCredentials.builder()
 *     .clientId("svc-inventory")
 *     .clientSecret("secret")
 *     .issuerUrl("https://sso.example.com/realms/redhat-external")
 *     .build();
 * }</pre>
 *
 * <h2>Thread Safety:</h2>
 * <p>Fully thread-safe. Concurrent callers that find the cache expired wait for a single refresh
 * and share its result.</p>
 */
public class OAuth2ClientCredentials implements TokenProvider {

    private static final Logger log = LoggerFactory.getLogger(OAuth2ClientCredentials.class);

    static final int DEFAULT_EXPIRES_IN_SECONDS = 3600;
    private static final String GRANT_TYPE = "client_credentials";

    private final String clientId;
    private final String clientSecret;
    private final String issuerUrl;
    private final List<String> scopes;
    private final ClientAuthenticationMethod authenticationMethod;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OidcDiscovery discovery;
    private final Duration requestTimeout;
    private final Clock clock;
    private final TokenCache cache;

    // resolved through discovery on first refresh when only an issuer was given
    private volatile String tokenEndpoint;

    private OAuth2ClientCredentials(Builder builder) {
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.tokenEndpoint = builder.tokenEndpoint;
        this.issuerUrl = builder.issuerUrl;
        this.scopes = List.copyOf(builder.scopes);
        this.authenticationMethod = builder.authenticationMethod;
        this.requestTimeout = builder.requestTimeout;
        this.clock = builder.clock;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpExchange.defaultClient(builder.connectTimeout);
        this.discovery = builder.discovery != null
                ? builder.discovery
                : OidcDiscovery.builder()
                    .httpClient(this.httpClient)
                    .objectMapper(this.objectMapper)
                    .requestTimeout(builder.requestTimeout)
                    .discoveryPath(builder.discoveryPath)
                    .build();
        this.cache = new TokenCache(clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Token access
    // ========================================================================

    /**
     * Get a valid access token for this identity.
     *
     * <p>A cached token outside the expiration window is returned without any network call.
     * Otherwise one refresh runs while other callers of this instance wait for it.</p>
     *
     * @param forceRefresh discard the cached token and always ask the token endpoint
     * @throws KesselException {@link ErrorKind#TOKEN_RETRIEVAL_FAILED} wrapping the underlying cause;
     *                         the failure is not retried
     */
    public AccessToken getToken(boolean forceRefresh) {
        return cache.getOrRefresh(forceRefresh, this::refreshToken);
    }

    @Override
    public String getToken() {
        return getToken(false).accessToken();
    }

    /**
     * The currently cached token, valid or not, without contacting the token endpoint.
     *
     * @throws KesselException {@link ErrorKind#TOKEN_CACHE_NOT_FOUND} when nothing has been cached yet
     */
    public AccessToken getCachedToken() {
        return cache.peek().orElseThrow(() -> new KesselException(ErrorKind.TOKEN_CACHE_NOT_FOUND,
                "no token cached for client " + clientId));
    }

    /**
     * Drop the cached token (useful after an UNAUTHENTICATED response).
     */
    public void invalidateToken() {
        cache.clear();
        log.debug("OAuth2 token invalidated for client {}", clientId);
    }

    public String getClientId() {
        return clientId;
    }

    /**
     * The token endpoint, or {@code null} while it is still to be discovered from the issuer.
     */
    public String getTokenEndpoint() {
        return tokenEndpoint;
    }

    public String getIssuerUrl() {
        return issuerUrl;
    }

    // ========================================================================
    // Token fetching
    // ========================================================================

    private AccessToken refreshToken() {
        try {
            String endpoint = resolveTokenEndpoint();
            log.debug("Refreshing OAuth2 token for client {} from {}", clientId, endpoint);

            HttpResponse<String> response = HttpExchange.send(httpClient, buildTokenRequest(endpoint), "token request");
            if (!HttpExchange.isSuccess(response.statusCode())) {
                throw KesselException.unexpectedStatus("token endpoint rejected the request", response.statusCode());
            }

            TokenResponse tokenResponse = objectMapper.readValue(response.body(), TokenResponse.class);
            if (tokenResponse == null || tokenResponse.accessToken == null || tokenResponse.accessToken.isBlank()) {
                throw new KesselException(ErrorKind.TOKEN_RETRIEVAL_FAILED, "token response missing access_token");
            }

            int expiresIn = tokenResponse.expiresIn != null && tokenResponse.expiresIn > 0
                    ? tokenResponse.expiresIn
                    : DEFAULT_EXPIRES_IN_SECONDS;
            AccessToken token = new AccessToken(tokenResponse.accessToken, clock.instant().plusSeconds(expiresIn));
            log.info("OAuth2 token refreshed for client {}, expires in {} seconds", clientId, expiresIn);
            return token;
        } catch (KesselException e) {
            if (e.getKind() == ErrorKind.TOKEN_RETRIEVAL_FAILED) {
                throw e;
            }
            throw new KesselException(ErrorKind.TOKEN_RETRIEVAL_FAILED, "failed to retrieve OAuth2 token", e);
        } catch (JsonProcessingException e) {
            throw new KesselException(ErrorKind.TOKEN_RETRIEVAL_FAILED, "failed to decode token response", e);
        } catch (IllegalArgumentException e) {
            throw new KesselException(ErrorKind.TOKEN_RETRIEVAL_FAILED, "invalid token endpoint", e);
        }
    }

    private String resolveTokenEndpoint() {
        String endpoint = tokenEndpoint;
        if (endpoint != null) {
            return endpoint;
        }
        // only reached under the cache's write lock, so at most one discovery runs
        DiscoveryDocument document = discovery.fetchDiscovery(issuerUrl);
        log.info("Discovered token endpoint {} for issuer {}", document.tokenEndpoint(), issuerUrl);
        tokenEndpoint = document.tokenEndpoint();
        return document.tokenEndpoint();
    }

    private HttpRequest buildTokenRequest(String endpoint) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", GRANT_TYPE);
        if (authenticationMethod == ClientAuthenticationMethod.CLIENT_SECRET_POST) {
            form.put("client_id", clientId);
            form.put("client_secret", clientSecret);
        }
        if (!scopes.isEmpty()) {
            form.put("scope", String.join(" ", scopes));
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(endpoint))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .header("User-Agent", HttpExchange.userAgent())
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)));

        if (authenticationMethod == ClientAuthenticationMethod.CLIENT_SECRET_BASIC) {
            String credentials = Base64.getEncoder().encodeToString(
                    (encode(clientId) + ":" + encode(clientSecret)).getBytes(StandardCharsets.UTF_8));
            builder.header("Authorization", "Basic " + credentials);
        }
        return builder.build();
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class TokenResponse {
        @JsonProperty("access_token")
        String accessToken;

        @JsonProperty("token_type")
        String tokenType;

        @JsonProperty("expires_in")
        Integer expiresIn;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private String clientId;
        private String clientSecret;
        private String tokenEndpoint;
        private String issuerUrl;
        private final List<String> scopes = new ArrayList<>();
        private ClientAuthenticationMethod authenticationMethod = ClientAuthenticationMethod.CLIENT_SECRET_POST;
        private DiscoveryPath discoveryPath = DiscoveryPath.OPENID_CONFIGURATION;
        private Duration connectTimeout = HttpExchange.DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = HttpExchange.DEFAULT_REQUEST_TIMEOUT;
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper;
        private HttpClient httpClient;
        private OidcDiscovery discovery;

        /**
         * OAuth client ID (required)
         */
        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        /**
         * OAuth client secret (required)
         */
        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        /**
         * Token endpoint URL (required unless issuerUrl is set)
         */
        public Builder tokenEndpoint(String tokenEndpoint) {
            this.tokenEndpoint = tokenEndpoint;
            return this;
        }

        /**
         * Issuer URL used to discover the token endpoint when none is set directly
         */
        public Builder issuerUrl(String issuerUrl) {
            this.issuerUrl = issuerUrl;
            return this;
        }

        public Builder discoveryPath(DiscoveryPath discoveryPath) {
            this.discoveryPath = discoveryPath;
            return this;
        }

        /**
         * Scopes to request (optional, sent space-separated)
         */
        public Builder scope(String... scopes) {
            this.scopes.addAll(Arrays.asList(scopes));
            return this;
        }

        public Builder scopes(List<String> scopes) {
            if (scopes != null) {
                this.scopes.addAll(scopes);
            }
            return this;
        }

        /**
         * How the client secret is presented (default: form fields)
         */
        public Builder authenticationMethod(ClientAuthenticationMethod authenticationMethod) {
            this.authenticationMethod = authenticationMethod;
            return this;
        }

        /**
         * Connection timeout for token and discovery requests (default: 10 seconds)
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Per-request timeout for token and discovery requests (default: 30 seconds)
         */
        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Provide a pre-configured HttpClient (connectTimeout will be ignored if set)
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Provide the discovery client used when only an issuer is configured
         */
        public Builder discovery(OidcDiscovery discovery) {
            this.discovery = discovery;
            return this;
        }

        public OAuth2ClientCredentials build() {
            if (clientId == null || clientId.isBlank()) {
                throw new IllegalStateException("clientId is required");
            }
            if (clientSecret == null || clientSecret.isBlank()) {
                throw new IllegalStateException("clientSecret is required");
            }
            boolean hasEndpoint = tokenEndpoint != null && !tokenEndpoint.isBlank();
            boolean hasIssuer = issuerUrl != null && !issuerUrl.isBlank();
            if (!hasEndpoint && !hasIssuer) {
                throw new IllegalStateException("either tokenEndpoint or issuerUrl is required");
            }
            if (!hasEndpoint) {
                tokenEndpoint = null;
            }
            if (authenticationMethod == null || clock == null || requestTimeout == null) {
                throw new IllegalStateException("authenticationMethod, clock and requestTimeout must not be null");
            }
            return new OAuth2ClientCredentials(this);
        }
    }
}
