package org.projectkessel.sdk.auth;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.exception.KesselErrors;
import org.projectkessel.sdk.exception.KesselException;
import org.projectkessel.sdk.http.HttpTestSupport;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class OidcDiscoveryTest {

    private static final String ISSUER = "https://sso.test/realms/redhat-external";
    private static final String DOCUMENT = "{\"issuer\":\"" + ISSUER + "\","
            + "\"token_endpoint\":\"" + ISSUER + "/protocol/openid-connect/token\","
            + "\"jwks_uri\":\"" + ISSUER + "/protocol/openid-connect/certs\"}";

    private static OidcDiscovery discovery(HttpClient httpClient) {
        return OidcDiscovery.builder().httpClient(httpClient).build();
    }

    @SuppressWarnings("unchecked")
    private static HttpRequest sentRequest(HttpClient httpClient) throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        return captor.getValue();
    }

    @Test
    void fetchesTokenEndpoint() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(200, DOCUMENT);

        DiscoveryDocument document = discovery(httpClient).fetchDiscovery(ISSUER);

        assertEquals(ISSUER + "/protocol/openid-connect/token", document.tokenEndpoint());
        assertEquals(ISSUER, document.issuer());

        HttpRequest request = sentRequest(httpClient);
        assertEquals("GET", request.method());
        assertEquals(ISSUER + "/.well-known/openid-configuration", request.uri().toString());
        assertTrue(request.headers().firstValue("User-Agent").isPresent());
        assertEquals("*/*", request.headers().firstValue("Accept").orElseThrow());
    }

    @Test
    void trailingSlashIsTrimmed() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(200, DOCUMENT);

        discovery(httpClient).fetchDiscovery(ISSUER + "/");

        assertEquals(ISSUER + "/.well-known/openid-configuration", sentRequest(httpClient).uri().toString());
    }

    @Test
    void underscoreConventionIsSelectable() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(200, DOCUMENT);
        OidcDiscovery discovery = OidcDiscovery.builder()
                .httpClient(httpClient)
                .discoveryPath(DiscoveryPath.OPENID_CONFIGURATION_UNDERSCORE)
                .build();

        discovery.fetchDiscovery(ISSUER);

        assertEquals(ISSUER + "/.well-known/openid_configuration", sentRequest(httpClient).uri().toString());
    }

    @Test
    void notFoundIsConnectionErrorWithStatusCause() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(404, "not found");

        KesselException ex = assertThrows(KesselException.class, () -> discovery(httpClient).fetchDiscovery(ISSUER));

        assertEquals(ErrorKind.CONNECTION_FAILED, ex.getKind());
        assertTrue(KesselErrors.isStatusError(ex));
        KesselException cause = (KesselException) ex.getCause();
        assertEquals(404, cause.getStatusCode());
    }

    @Test
    void malformedDocumentIsConnectionError() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(200, "<html>");

        KesselException ex = assertThrows(KesselException.class, () -> discovery(httpClient).fetchDiscovery(ISSUER));

        assertEquals(ErrorKind.CONNECTION_FAILED, ex.getKind());
        assertTrue(ex.getMessage().contains("failed to decode discovery document"));
    }

    @Test
    void missingTokenEndpointIsConnectionError() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(200, "{\"issuer\":\"" + ISSUER + "\"}");

        KesselException ex = assertThrows(KesselException.class, () -> discovery(httpClient).fetchDiscovery(ISSUER));

        assertTrue(ex.getMessage().contains("token_endpoint not found"));
    }

    @Test
    void relativeTokenEndpointIsRejected() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(200, "{\"token_endpoint\":\"/protocol/token\"}");

        KesselException ex = assertThrows(KesselException.class, () -> discovery(httpClient).fetchDiscovery(ISSUER));

        assertTrue(ex.getMessage().contains("invalid token_endpoint URL"));
    }

    @Test
    void unusableIssuerFailsBeforeSending() throws Exception {
        HttpClient httpClient = HttpTestSupport.mockHttpClient(200, DOCUMENT);
        OidcDiscovery discovery = discovery(httpClient);

        assertThrows(KesselException.class, () -> discovery.fetchDiscovery(""));
        KesselException ex = assertThrows(KesselException.class, () -> discovery.fetchDiscovery("sso.test/realm"));
        assertTrue(ex.getMessage().contains("failed to create discovery request"));

        verifyNoInteractions(httpClient);
    }
}
