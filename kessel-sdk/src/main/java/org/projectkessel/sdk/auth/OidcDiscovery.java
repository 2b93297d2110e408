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
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Resolves an OAuth2 token endpoint from an issuer URL using OpenID Connect discovery.
 *
 * <pre>{@code
 * DiscoveryDocument document = OidcDiscovery.builder()
 *     .discoveryPath(DiscoveryPath.OPENID_CONFIGURATION)
 *     .build()
 *     .fetchDiscovery("https://sso.example.com/realms/redhat-external");
 * }</pre>
 *
 * <p>Documents are not cached here; {@link OAuth2ClientCredentials} remembers the endpoint it
 * resolved.</p>
 */
public class OidcDiscovery {

    private static final Logger log = LoggerFactory.getLogger(OidcDiscovery.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final DiscoveryPath discoveryPath;

    private OidcDiscovery(Builder builder) {
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpExchange.defaultClient(builder.connectTimeout);
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.requestTimeout = builder.requestTimeout;
        this.discoveryPath = builder.discoveryPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OidcDiscovery create() {
        return builder().build();
    }

    public DiscoveryPath getDiscoveryPath() {
        return discoveryPath;
    }

    /**
     * Fetch the metadata document published under the configured {@link DiscoveryPath}.
     *
     * @throws KesselException {@link ErrorKind#CONNECTION_FAILED} when the request cannot be built or
     *                         sent, the provider answers with anything but 200 (the cause is then an
     *                         {@link ErrorKind#UNEXPECTED_STATUS} error), or the document is unusable
     */
    public DiscoveryDocument fetchDiscovery(String issuerUrl) {
        return fetchDiscovery(issuerUrl, discoveryPath);
    }

    public DiscoveryDocument fetchDiscovery(String issuerUrl, DiscoveryPath path) {
        if (issuerUrl == null || issuerUrl.isBlank()) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED, "issuer URL is required for discovery");
        }

        String normalized = issuerUrl.endsWith("/")
                ? issuerUrl.substring(0, issuerUrl.length() - 1)
                : issuerUrl;

        HttpRequest request;
        try {
            URI uri = URI.create(normalized + path.getPath());
            if (!uri.isAbsolute()) {
                throw new IllegalArgumentException("not an absolute URL: " + uri);
            }
            request = HttpRequest.newBuilder(uri)
                    .header("User-Agent", HttpExchange.userAgent())
                    .header("Accept", "*/*")
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED,
                    "failed to create discovery request for issuer " + issuerUrl, e);
        }

        log.debug("Fetching OIDC discovery document from {}", request.uri());
        HttpResponse<String> response = HttpExchange.send(httpClient, request, "discovery request");

        if (response.statusCode() != 200) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED,
                    "discovery request failed for issuer " + issuerUrl,
                    KesselException.unexpectedStatus("discovery document unavailable", response.statusCode()));
        }

        MetadataResponse metadata;
        try {
            metadata = objectMapper.readValue(response.body(), MetadataResponse.class);
        } catch (JsonProcessingException e) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED, "failed to decode discovery document", e);
        }

        if (metadata == null || metadata.tokenEndpoint == null || metadata.tokenEndpoint.isBlank()) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED, "token_endpoint not found in discovery document");
        }

        try {
            URI tokenUri = new URI(metadata.tokenEndpoint);
            if (!tokenUri.isAbsolute()) {
                throw new URISyntaxException(metadata.tokenEndpoint, "token endpoint must be absolute");
            }
        } catch (URISyntaxException e) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED, "invalid token_endpoint URL", e);
        }

        return new DiscoveryDocument(metadata.tokenEndpoint, metadata.issuer);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class MetadataResponse {
        @JsonProperty("token_endpoint")
        String tokenEndpoint;

        @JsonProperty("issuer")
        String issuer;
    }

    public static class Builder {
        private HttpClient httpClient;
        private ObjectMapper objectMapper;
        private Duration connectTimeout = HttpExchange.DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = HttpExchange.DEFAULT_REQUEST_TIMEOUT;
        private DiscoveryPath discoveryPath = DiscoveryPath.OPENID_CONFIGURATION;

        /**
         * Provide a pre-configured HttpClient (connectTimeout will be ignored if set)
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Per-request timeout (default: 30 seconds)
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Well-known path convention of the provider (default: {@code openid-configuration})
         */
        public Builder discoveryPath(DiscoveryPath discoveryPath) {
            this.discoveryPath = discoveryPath;
            return this;
        }

        public OidcDiscovery build() {
            if (discoveryPath == null) {
                throw new IllegalStateException("discoveryPath is required");
            }
            if (requestTimeout == null) {
                throw new IllegalStateException("requestTimeout is required");
            }
            return new OidcDiscovery(this);
        }
    }
}
