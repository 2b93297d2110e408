package org.projectkessel.sdk.http;

import io.grpc.Status;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.exception.KesselException;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Blocking HTTP exchange shared by the token, discovery, workspace and inventory HTTP clients.
 */
public final class HttpExchange {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    static final String USER_AGENT = "kessel-sdk-java/1.0";

    private HttpExchange() {
    }

    public static HttpClient defaultClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                .build();
    }

    public static String userAgent() {
        return USER_AGENT;
    }

    /**
     * Send {@code request} and buffer the body as a string.
     *
     * @param description what is being sent, used in error messages
     * @throws KesselException {@link ErrorKind#CONNECTION_FAILED} on I/O failure or interruption
     */
    public static HttpResponse<String> send(HttpClient httpClient, HttpRequest request, String description) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new KesselException(ErrorKind.CONNECTION_FAILED,
                    "failed to send " + description + " to " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KesselException(ErrorKind.CONNECTION_FAILED,
                    description + " to " + request.uri() + " was interrupted",
                    0, Status.Code.CANCELLED, e);
        }
    }

    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
