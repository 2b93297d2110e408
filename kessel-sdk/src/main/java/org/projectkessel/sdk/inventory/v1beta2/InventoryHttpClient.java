package org.projectkessel.sdk.inventory.v1beta2;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import org.projectkessel.api.inventory.v1beta2.CheckRequest;
import org.projectkessel.api.inventory.v1beta2.CheckResponse;
import org.projectkessel.sdk.auth.AuthRequest;
import org.projectkessel.sdk.auth.OAuth2ClientCredentials;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.exception.KesselException;
import org.projectkessel.sdk.http.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Inventory client over the REST gateway, for environments where gRPC is not reachable.
 *
 * <pre>{@code
 * InventoryHttpClient client = InventoryHttpClient.builder()
 *     .baseUrl("https://kessel-inventory.example.com")
 *     .oauth2ClientAuthenticated(credentials)
 *     .build();
 *
 * CheckResponse response = client.check(request);
 * }</pre>
 *
 * <p>Bodies are the protobuf JSON mapping of the inventory messages.</p>
 */
public class InventoryHttpClient {

    private static final Logger log = LoggerFactory.getLogger(InventoryHttpClient.class);

    static final String CHECK_PATH = "/api/kessel/v1beta2/check";

    private final String baseUrl;
    private final AuthRequest authRequest;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final JsonFormat.Printer printer = JsonFormat.printer().omittingInsignificantWhitespace();
    private final JsonFormat.Parser parser = JsonFormat.parser().ignoringUnknownFields();

    private InventoryHttpClient(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.authRequest = builder.authRequest;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpExchange.defaultClient(builder.connectTimeout);
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check whether the subject has the relation on the object.
     *
     * @throws KesselException {@link ErrorKind#UNEXPECTED_STATUS} for a non-2xx response,
     *                         {@link ErrorKind#CONNECTION_FAILED} for transport or decoding failures
     */
    public CheckResponse check(CheckRequest request) {
        String body;
        try {
            body = printer.print(request);
        } catch (InvalidProtocolBufferException e) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED, "failed to encode check request", e);
        }

        HttpRequest.Builder httpRequest = HttpRequest.newBuilder(URI.create(baseUrl + CHECK_PATH))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", HttpExchange.userAgent())
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (authRequest != null) {
            authRequest.configureRequest(httpRequest);
        }

        log.debug("Sending check for {} {}", request.getObject().getResourceType(), request.getRelation());
        HttpResponse<String> response = HttpExchange.send(httpClient, httpRequest.build(), "check request");
        if (!HttpExchange.isSuccess(response.statusCode())) {
            throw KesselException.unexpectedStatus("check request failed", response.statusCode());
        }

        try {
            CheckResponse.Builder result = CheckResponse.newBuilder();
            parser.merge(response.body(), result);
            return result.build();
        } catch (InvalidProtocolBufferException e) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED, "failed to decode check response", e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public static class Builder {
        private String baseUrl;
        private AuthRequest authRequest;
        private boolean insecure;
        private HttpClient httpClient;
        private Duration connectTimeout = HttpExchange.DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = HttpExchange.DEFAULT_REQUEST_TIMEOUT;

        /**
         * Inventory base URL, e.g. {@code https://kessel-inventory.example.com} (required)
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder authenticated(AuthRequest authRequest) {
            this.authRequest = authRequest;
            return this;
        }

        public Builder oauth2ClientAuthenticated(OAuth2ClientCredentials credentials) {
            return authenticated(AuthRequest.oauth2(credentials));
        }

        public Builder unauthenticated() {
            this.authRequest = null;
            return this;
        }

        /**
         * Allow a plain {@code http://} base URL.
         */
        public Builder insecure() {
            this.insecure = true;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * @throws KesselException {@link ErrorKind#CLIENT_CREATION_FAILED} when the base URL is missing
         *                         or invalid, or plaintext is combined with credentials that require
         *                         transport security
         */
        public InventoryHttpClient build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED, "baseUrl is required");
            }
            URI uri;
            try {
                uri = URI.create(baseUrl);
            } catch (IllegalArgumentException e) {
                throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED, "invalid baseUrl " + baseUrl, e);
            }
            String scheme = uri.getScheme();
            if (!"https".equalsIgnoreCase(scheme) && !"http".equalsIgnoreCase(scheme)) {
                throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED,
                        "baseUrl must use http or https: " + baseUrl);
            }
            boolean plaintext = "http".equalsIgnoreCase(scheme);
            if (plaintext && !insecure) {
                throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED,
                        "http:// baseUrl requires insecure() to be set");
            }
            if (plaintext && authRequest != null && authRequest.requiresTransportSecurity()) {
                throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED,
                        "cannot use insecure transport with credentials that require transport security");
            }
            if (requestTimeout == null) {
                throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED, "requestTimeout is required");
            }
            return new InventoryHttpClient(this);
        }
    }
}
