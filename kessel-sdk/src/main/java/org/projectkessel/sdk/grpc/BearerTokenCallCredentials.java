package org.projectkessel.sdk.grpc;

import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.SecurityLevel;
import io.grpc.Status;
import org.projectkessel.sdk.auth.TokenProvider;
import org.projectkessel.sdk.auth.TransportSecurityAware;
import org.projectkessel.sdk.exception.KesselException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Per-call credentials that send {@code authorization: Bearer <token>} with every RPC.
 *
 * <p>The token is fetched on the application executor, so a blocking refresh inside
 * {@link org.projectkessel.sdk.auth.OAuth2ClientCredentials} never runs on a transport thread.
 * By default the token is only attached to calls on channels with privacy and integrity;
 * other calls fail with {@code UNAUTHENTICATED}.</p>
 */
public class BearerTokenCallCredentials extends CallCredentials implements TransportSecurityAware {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenCallCredentials.class);

    static final Metadata.Key<String> AUTHORIZATION_METADATA_KEY =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);
    static final String BEARER_TYPE = "Bearer";

    private final TokenProvider tokenProvider;
    private final boolean requireTransportSecurity;

    public BearerTokenCallCredentials(TokenProvider tokenProvider) {
        this(tokenProvider, true);
    }

    private BearerTokenCallCredentials(TokenProvider tokenProvider, boolean requireTransportSecurity) {
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
        this.requireTransportSecurity = requireTransportSecurity;
    }

    /**
     * Credentials that are also sent over plaintext channels. Only meant for loopback
     * connections and tests.
     */
    public static BearerTokenCallCredentials allowingPlaintext(TokenProvider tokenProvider) {
        return new BearerTokenCallCredentials(tokenProvider, false);
    }

    @Override
    public boolean requiresTransportSecurity() {
        return requireTransportSecurity;
    }

    @Override
    public void applyRequestMetadata(RequestInfo requestInfo, Executor appExecutor, MetadataApplier applier) {
        if (requireTransportSecurity && requestInfo.getSecurityLevel() != SecurityLevel.PRIVACY_AND_INTEGRITY) {
            applier.fail(Status.UNAUTHENTICATED.withDescription(
                    "bearer token requires a channel with privacy and integrity, got "
                            + requestInfo.getSecurityLevel()));
            return;
        }

        appExecutor.execute(() -> {
            try {
                Metadata headers = new Metadata();
                headers.put(AUTHORIZATION_METADATA_KEY, BEARER_TYPE + " " + tokenProvider.getToken());
                applier.apply(headers);
            } catch (KesselException e) {
                log.debug("Could not obtain token for {}: {}", requestInfo.getMethodDescriptor().getFullMethodName(),
                        e.getMessage());
                applier.fail(Status.UNAUTHENTICATED.withDescription(e.getMessage()).withCause(e));
            } catch (RuntimeException e) {
                applier.fail(Status.UNAUTHENTICATED.withDescription("token provider failed").withCause(e));
            }
        });
    }
}
