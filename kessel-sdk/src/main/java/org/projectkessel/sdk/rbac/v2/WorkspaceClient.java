package org.projectkessel.sdk.rbac.v2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.projectkessel.sdk.auth.AuthRequest;
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
import java.time.Duration;
import java.util.List;

/**
 * Looks up an organization's root and default workspaces in RBAC.
 *
 * <pre>{@code
 * WorkspaceClient workspaces = WorkspaceClient.builder()
 *     .baseUrl("https://console.example.com")
 *     .authRequest(AuthRequest.oauth2(credentials))
 *     .build();
 *
 * Workspace root = workspaces.fetchRootWorkspace("12345");
 * }</pre>
 */
public class WorkspaceClient {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceClient.class);

    static final String WORKSPACE_ENDPOINT = "/api/rbac/v2/workspaces/";
    static final String ORG_ID_HEADER = "x-rh-rbac-org-id";

    private final String baseUrl;
    private final AuthRequest authRequest;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    private WorkspaceClient(Builder builder) {
        String url = builder.baseUrl;
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.baseUrl = url;
        this.authRequest = builder.authRequest;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpExchange.defaultClient(builder.connectTimeout);
        this.objectMapper = builder.objectMapper != null
                ? builder.objectMapper
                : new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Workspace fetchRootWorkspace(String orgId) {
        return fetchWorkspace(orgId, "root");
    }

    public Workspace fetchDefaultWorkspace(String orgId) {
        return fetchWorkspace(orgId, "default");
    }

    /**
     * @throws KesselException {@link ErrorKind#UNEXPECTED_STATUS} for a non-200 response,
     *                         {@link ErrorKind#CONNECTION_FAILED} for transport failures, undecodable
     *                         bodies, or any number of workspaces other than one
     */
    private Workspace fetchWorkspace(String orgId, String workspaceType) {
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalArgumentException("orgId is required");
        }

        URI uri = URI.create(baseUrl + WORKSPACE_ENDPOINT + "?type="
                + URLEncoder.encode(workspaceType, StandardCharsets.UTF_8));
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .header(ORG_ID_HEADER, orgId)
                .header("Accept", "application/json")
                .header("User-Agent", HttpExchange.userAgent())
                .timeout(requestTimeout)
                .GET();
        if (authRequest != null) {
            authRequest.configureRequest(request);
        }

        log.debug("Fetching {} workspace for org {}", workspaceType, orgId);
        HttpResponse<String> response = HttpExchange.send(httpClient, request.build(), workspaceType + " workspace request");
        if (response.statusCode() != 200) {
            throw KesselException.unexpectedStatus("error fetching " + workspaceType + " workspace",
                    response.statusCode());
        }

        WorkspaceListResponse body;
        try {
            body = objectMapper.readValue(response.body(), WorkspaceListResponse.class);
        } catch (JsonProcessingException e) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED, "error decoding " + workspaceType + " workspace response", e);
        }

        List<Workspace> data = body == null || body.data == null ? List.of() : body.data;
        if (data.size() != 1) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED,
                    "unexpected number of " + workspaceType + " workspaces: " + data.size());
        }
        return data.get(0);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class WorkspaceListResponse {
        @JsonProperty("data")
        List<Workspace> data;
    }

    public static class Builder {
        private String baseUrl;
        private AuthRequest authRequest;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;
        private boolean insecure;
        private Duration connectTimeout = HttpExchange.DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = HttpExchange.DEFAULT_REQUEST_TIMEOUT;

        /**
         * RBAC base URL (required)
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Authentication for workspace requests (optional)
         */
        public Builder authRequest(AuthRequest authRequest) {
            this.authRequest = authRequest;
            return this;
        }

        /**
         * Allow an {@code http://} base URL. Still refused for auth requests that require transport security.
         */
        public Builder insecure() {
            this.insecure = true;
            return this;
        }

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

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * @throws KesselException {@link ErrorKind#CLIENT_CREATION_FAILED} when the base URL is invalid,
         *                         or plaintext is combined with an auth request that requires transport security
         */
        public WorkspaceClient build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalStateException("baseUrl is required");
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
                throw new IllegalStateException("requestTimeout is required");
            }
            return new WorkspaceClient(this);
        }
    }
}
