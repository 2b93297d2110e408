package org.projectkessel.sdk.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.projectkessel.api.inventory.v1beta2.KesselInventoryServiceGrpc.KesselInventoryServiceBlockingStub;
import org.projectkessel.sdk.auth.AuthRequest;
import org.projectkessel.sdk.auth.OAuth2ClientCredentials;
import org.projectkessel.sdk.grpc.ClientBuilder;
import org.projectkessel.sdk.grpc.StubConnection;
import org.projectkessel.sdk.inventory.v1beta2.InventoryClientBuilder;
import org.projectkessel.sdk.rbac.v2.WorkspaceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.net.http.HttpClient;

@AutoConfiguration
@EnableConfigurationProperties(KesselProperties.class)
@ConditionalOnClass(ClientBuilder.class)
@ConditionalOnProperty(prefix = "kessel", name = "enabled", havingValue = "true")
public class KesselAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(KesselAutoConfiguration.class);

    static final String INVENTORY_CONNECTION_BEAN = "kesselInventoryConnection";

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "kessel.oauth", name = {"client-id", "client-secret"})
    public OAuth2ClientCredentials kesselOAuth2ClientCredentials(
            KesselProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<HttpClient> httpClientProvider) {
        KesselProperties.OAuth oauth = properties.getOauth();

        OAuth2ClientCredentials.Builder builder = OAuth2ClientCredentials.builder()
                .clientId(oauth.getClientId())
                .clientSecret(oauth.getClientSecret())
                .scopes(oauth.getScopes())
                .discoveryPath(oauth.resolveDiscoveryPath())
                .requestTimeout(oauth.getRequestTimeout());

        if (hasText(oauth.getTokenUrl())) {
            builder.tokenEndpoint(oauth.getTokenUrl());
        } else {
            builder.issuerUrl(oauth.getIssuerUrl());
        }

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient != null) {
            builder.httpClient(httpClient);
        }

        return builder.build();
    }

    // closed by KesselConnectionShutdown rather than the inferred close() destroy method
    @Bean(name = INVENTORY_CONNECTION_BEAN, destroyMethod = "")
    @ConditionalOnMissingBean(name = INVENTORY_CONNECTION_BEAN)
    @ConditionalOnProperty(prefix = "kessel", name = "endpoint")
    public StubConnection<KesselInventoryServiceBlockingStub> kesselInventoryConnection(
            KesselProperties properties,
            ObjectProvider<OAuth2ClientCredentials> credentialsProvider) {
        ClientBuilder<KesselInventoryServiceBlockingStub> builder = InventoryClientBuilder
                .forTarget(properties.getEndpoint())
                .maxInboundMessageSize(properties.getMaxReceiveMessageSize())
                .maxOutboundMessageSize(properties.getMaxSendMessageSize());

        if (properties.isInsecure()) {
            builder.insecure();
        }

        OAuth2ClientCredentials credentials = credentialsProvider.getIfUnique();
        if (credentials != null) {
            builder.oauth2ClientAuthenticated(credentials);
        } else {
            builder.unauthenticated();
        }

        log.info("Kessel inventory client configured for {} (insecure={}, authenticated={})",
                properties.getEndpoint(), properties.isInsecure(), credentials != null);
        return builder.build();
    }

    @Bean
    @ConditionalOnBean(name = INVENTORY_CONNECTION_BEAN)
    public KesselConnectionShutdown kesselConnectionShutdown(
            @Qualifier(INVENTORY_CONNECTION_BEAN) StubConnection<?> connection) {
        return new KesselConnectionShutdown(connection);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "kessel.rbac", name = "base-url")
    public WorkspaceClient kesselWorkspaceClient(
            KesselProperties properties,
            ObjectProvider<OAuth2ClientCredentials> credentialsProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<HttpClient> httpClientProvider) {
        WorkspaceClient.Builder builder = WorkspaceClient.builder()
                .baseUrl(properties.getRbac().getBaseUrl());

        if (properties.isInsecure()) {
            builder.insecure();
        }

        OAuth2ClientCredentials credentials = credentialsProvider.getIfUnique();
        if (credentials != null) {
            builder.authRequest(AuthRequest.oauth2(credentials));
        }

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient != null) {
            builder.httpClient(httpClient);
        }

        return builder.build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
