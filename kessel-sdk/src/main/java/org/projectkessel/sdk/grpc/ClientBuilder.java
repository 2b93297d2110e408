package org.projectkessel.sdk.grpc;

import io.grpc.CallCredentials;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ChannelCredentials;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ClientInterceptors;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.MethodDescriptor;
import io.grpc.TlsChannelCredentials;
import org.projectkessel.sdk.auth.OAuth2ClientCredentials;
import org.projectkessel.sdk.auth.TransportSecurityAware;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.exception.KesselException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Builds an authenticated gRPC client for any generated stub type.
 *
 * <pre>{@code
 * try (StubConnection<KesselInventoryServiceBlockingStub> connection =
 *         ClientBuilder.forTarget("kessel-inventory.example.com:443", KesselInventoryServiceGrpc::newBlockingStub)
 *             .oauth2ClientAuthenticated(credentials)
 *             .build()) {
 *     CheckResponse response = connection.stub().check(request);
 * }
 * }</pre>
 *
 * <p>Channels connect lazily; a successful {@link #build()} does not prove the target is reachable.
 * A builder is meant for one thread and one {@code build()} call.</p>
 *
 * @param <S> the stub type produced by the stub factory
 */
public class ClientBuilder<S> {

    private static final Logger log = LoggerFactory.getLogger(ClientBuilder.class);

    public static final int DEFAULT_MAX_MESSAGE_SIZE = 4 * 1024 * 1024;

    private final String target;
    private final Function<Channel, S> stubFactory;

    private ChannelCredentials channelCredentials = TlsChannelCredentials.create();
    private CallCredentials callCredentials;
    private int maxInboundMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
    private int maxOutboundMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
    private Duration shutdownTimeout = StubConnection.DEFAULT_SHUTDOWN_TIMEOUT;
    private final List<Consumer<ManagedChannelBuilder<?>>> channelOptions = new ArrayList<>();
    private final List<UnaryOperator<CallOptions>> callOptions = new ArrayList<>();
    private final List<ClientInterceptor> interceptors = new ArrayList<>();

    protected ClientBuilder(String target, Function<Channel, S> stubFactory) {
        this.target = target;
        this.stubFactory = Objects.requireNonNull(stubFactory, "stubFactory");
    }

    /**
     * @param target      gRPC target, e.g. {@code host:port} or {@code dns:///host:port}
     * @param stubFactory turns a channel into a stub, e.g. {@code XxxGrpc::newBlockingStub}
     */
    public static <S> ClientBuilder<S> forTarget(String target, Function<Channel, S> stubFactory) {
        return new ClientBuilder<>(target, stubFactory);
    }

    // ========================================================================
    // Transport security
    // ========================================================================

    /**
     * TLS with the platform trust store (the default).
     */
    public ClientBuilder<S> tls() {
        return tls(TlsChannelCredentials.create());
    }

    public ClientBuilder<S> tls(ChannelCredentials channelCredentials) {
        this.channelCredentials = Objects.requireNonNull(channelCredentials, "channelCredentials");
        return this;
    }

    /**
     * Plaintext transport. Cannot be combined with credentials that require transport security.
     */
    public ClientBuilder<S> insecure() {
        this.channelCredentials = InsecureChannelCredentials.create();
        return this;
    }

    // ========================================================================
    // Call credentials
    // ========================================================================

    public ClientBuilder<S> unauthenticated() {
        this.callCredentials = null;
        return this;
    }

    public ClientBuilder<S> authenticated(CallCredentials callCredentials) {
        this.callCredentials = Objects.requireNonNull(callCredentials, "callCredentials");
        return this;
    }

    /**
     * Bearer tokens from an OAuth2 client credentials identity, refreshed as they expire.
     */
    public ClientBuilder<S> oauth2ClientAuthenticated(OAuth2ClientCredentials credentials) {
        return authenticated(new BearerTokenCallCredentials(credentials));
    }

    // ========================================================================
    // Options
    // ========================================================================

    public ClientBuilder<S> maxInboundMessageSize(int bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("maxInboundMessageSize must be positive");
        }
        this.maxInboundMessageSize = bytes;
        return this;
    }

    public ClientBuilder<S> maxOutboundMessageSize(int bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("maxOutboundMessageSize must be positive");
        }
        this.maxOutboundMessageSize = bytes;
        return this;
    }

    /**
     * Apply an arbitrary channel setting, e.g. {@code b -> b.keepAliveTime(30, TimeUnit.SECONDS)}.
     */
    public ClientBuilder<S> channelOption(Consumer<ManagedChannelBuilder<?>> option) {
        channelOptions.add(Objects.requireNonNull(option, "option"));
        return this;
    }

    /**
     * Apply an arbitrary per-call setting to every call, e.g. {@code o -> o.withWaitForReady()}.
     */
    public ClientBuilder<S> callOption(UnaryOperator<CallOptions> option) {
        callOptions.add(Objects.requireNonNull(option, "option"));
        return this;
    }

    public ClientBuilder<S> interceptor(ClientInterceptor interceptor) {
        interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
        return this;
    }

    public ClientBuilder<S> shutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        return this;
    }

    // ========================================================================
    // Build
    // ========================================================================

    /**
     * Create the channel and the stub.
     *
     * @throws KesselException {@link ErrorKind#CLIENT_CREATION_FAILED} when the target is missing,
     *                         when insecure transport is combined with credentials that require
     *                         transport security, or when the channel cannot be created
     */
    public StubConnection<S> build() {
        if (target == null || target.isBlank()) {
            throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED, "target is required");
        }
        boolean insecure = channelCredentials instanceof InsecureChannelCredentials;
        if (insecure && callCredentials != null && requiresTransportSecurity(callCredentials)) {
            throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED,
                    "cannot use insecure transport with call credentials that require transport security");
        }

        ManagedChannel managedChannel;
        try {
            ManagedChannelBuilder<?> channelBuilder = Grpc.newChannelBuilder(target, channelCredentials)
                    .maxInboundMessageSize(maxInboundMessageSize);
            channelOptions.forEach(option -> option.accept(channelBuilder));
            managedChannel = channelBuilder.build();
        } catch (RuntimeException e) {
            throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED, "failed to create channel for " + target, e);
        }

        try {
            List<ClientInterceptor> chain = new ArrayList<>(interceptors);
            chain.add(new CallOptionsInterceptor(maxOutboundMessageSize, callCredentials, List.copyOf(callOptions)));
            Channel channel = ClientInterceptors.intercept(managedChannel, chain);
            S stub = stubFactory.apply(channel);
            log.debug("Created client for {} (insecure={}, authenticated={})",
                    target, insecure, callCredentials != null);
            return new StubConnection<>(stub, managedChannel, shutdownTimeout);
        } catch (RuntimeException e) {
            managedChannel.shutdownNow();
            throw new KesselException(ErrorKind.CLIENT_CREATION_FAILED, "failed to create stub for " + target, e);
        }
    }

    private static boolean requiresTransportSecurity(CallCredentials credentials) {
        // credentials that do not say otherwise are assumed to carry secrets
        if (credentials instanceof TransportSecurityAware aware) {
            return aware.requiresTransportSecurity();
        }
        return true;
    }

    private static final class CallOptionsInterceptor implements ClientInterceptor {
        private final int maxOutboundMessageSize;
        private final CallCredentials callCredentials;
        private final List<UnaryOperator<CallOptions>> callOptions;

        CallOptionsInterceptor(int maxOutboundMessageSize, CallCredentials callCredentials,
                               List<UnaryOperator<CallOptions>> callOptions) {
            this.maxOutboundMessageSize = maxOutboundMessageSize;
            this.callCredentials = callCredentials;
            this.callOptions = callOptions;
        }

        @Override
        public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
                MethodDescriptor<ReqT, RespT> method, CallOptions options, Channel next) {
            CallOptions effective = options.withMaxOutboundMessageSize(maxOutboundMessageSize);
            if (callCredentials != null) {
                effective = effective.withCallCredentials(callCredentials);
            }
            for (UnaryOperator<CallOptions> option : callOptions) {
                effective = option.apply(effective);
            }
            return next.newCall(method, effective);
        }
    }
}
