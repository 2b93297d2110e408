package org.projectkessel.sdk.autoconfigure;

import jakarta.validation.constraints.AssertTrue;
import org.projectkessel.sdk.auth.DiscoveryPath;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "kessel")
@Validated
public class KesselProperties {

    private static final int DEFAULT_MAX_MESSAGE_SIZE = 4 * 1024 * 1024;

    private final boolean enabled;
    private final String endpoint;
    private final boolean insecure;
    private final int maxReceiveMessageSize;
    private final int maxSendMessageSize;

    @NestedConfigurationProperty
    private final OAuth oauth;

    @NestedConfigurationProperty
    private final Rbac rbac;

    public KesselProperties(
            Boolean enabled,
            String endpoint,
            Boolean insecure,
            Integer maxReceiveMessageSize,
            Integer maxSendMessageSize,
            OAuth oauth,
            Rbac rbac) {
        this.enabled = enabled != null && enabled;
        this.endpoint = endpoint;
        this.insecure = insecure != null && insecure;
        this.maxReceiveMessageSize = maxReceiveMessageSize != null ? maxReceiveMessageSize : DEFAULT_MAX_MESSAGE_SIZE;
        this.maxSendMessageSize = maxSendMessageSize != null ? maxSendMessageSize : DEFAULT_MAX_MESSAGE_SIZE;
        this.oauth = oauth != null ? oauth : new OAuth(null, null, null, null, null, null, null);
        this.rbac = rbac != null ? rbac : new Rbac(null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public boolean isInsecure() {
        return insecure;
    }

    public int getMaxReceiveMessageSize() {
        return maxReceiveMessageSize;
    }

    public int getMaxSendMessageSize() {
        return maxSendMessageSize;
    }

    public OAuth getOauth() {
        return oauth;
    }

    public Rbac getRbac() {
        return rbac;
    }

    @AssertTrue(message = "kessel.endpoint or kessel.rbac.base-url is required when kessel.enabled=true")
    public boolean isTargetValid() {
        return !enabled || hasText(endpoint) || hasText(rbac.baseUrl);
    }

    @AssertTrue(message = "kessel.oauth requires client-id, client-secret, and token-url or issuer-url when any oauth field is set")
    public boolean isOAuthValid() {
        if (!enabled || !oauth.isConfigured()) {
            return true;
        }
        return hasText(oauth.clientId) && hasText(oauth.clientSecret)
                && (hasText(oauth.tokenUrl) || hasText(oauth.issuerUrl));
    }

    @AssertTrue(message = "kessel.oauth.discovery-path must be one of: hyphen, underscore")
    public boolean isDiscoveryPathValid() {
        if (!hasText(oauth.discoveryPath)) {
            return true;
        }
        String value = oauth.discoveryPath.trim().toLowerCase(Locale.ROOT);
        return value.equals("hyphen") || value.equals("underscore");
    }

    @AssertTrue(message = "kessel.max-receive-message-size and kessel.max-send-message-size must be positive")
    public boolean isMessageSizeValid() {
        return maxReceiveMessageSize > 0 && maxSendMessageSize > 0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static class OAuth {
        private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

        private final String clientId;
        private final String clientSecret;
        private final String tokenUrl;
        private final String issuerUrl;
        private final List<String> scopes;
        private final String discoveryPath;
        private final Duration requestTimeout;

        public OAuth(
                String clientId,
                String clientSecret,
                String tokenUrl,
                String issuerUrl,
                List<String> scopes,
                String discoveryPath,
                Duration requestTimeout) {
            this.clientId = clientId;
            this.clientSecret = clientSecret;
            this.tokenUrl = tokenUrl;
            this.issuerUrl = issuerUrl;
            this.scopes = scopes != null ? List.copyOf(scopes) : List.of();
            this.discoveryPath = discoveryPath;
            this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        }

        public String getClientId() {
            return clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public String getTokenUrl() {
            return tokenUrl;
        }

        public String getIssuerUrl() {
            return issuerUrl;
        }

        public List<String> getScopes() {
            return scopes;
        }

        public String getDiscoveryPath() {
            return discoveryPath;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public boolean isConfigured() {
            return hasText(clientId) || hasText(clientSecret) || hasText(tokenUrl) || hasText(issuerUrl);
        }

        /**
         * {@code underscore} selects {@code /.well-known/openid_configuration}; anything else the hyphenated path.
         */
        public DiscoveryPath resolveDiscoveryPath() {
            if (hasText(discoveryPath) && discoveryPath.trim().equalsIgnoreCase("underscore")) {
                return DiscoveryPath.OPENID_CONFIGURATION_UNDERSCORE;
            }
            return DiscoveryPath.OPENID_CONFIGURATION;
        }
    }

    public static class Rbac {
        private final String baseUrl;

        public Rbac(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBaseUrl() {
            return baseUrl;
        }
    }
}
