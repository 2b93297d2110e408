package org.projectkessel.sdk.grpc;

import io.grpc.ManagedChannel;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.exception.KesselException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A typed stub together with the channel it runs on.
 *
 * <p>The stub is safe for concurrent use. {@link #close()} shuts the channel down once; later
 * calls do nothing.</p>
 *
 * @param <S> the stub type
 */
public class StubConnection<S> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StubConnection.class);

    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final S stub;
    private final ManagedChannel channel;
    private final Duration shutdownTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    StubConnection(S stub, ManagedChannel channel, Duration shutdownTimeout) {
        this.stub = stub;
        this.channel = channel;
        this.shutdownTimeout = shutdownTimeout;
    }

    public S stub() {
        return stub;
    }

    public ManagedChannel channel() {
        return channel;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Shut the channel down, waiting briefly for in-flight calls before forcing it.
     *
     * @throws KesselException {@link ErrorKind#RESOURCE_CLOSE_FAILED} if interrupted while waiting;
     *                         the channel has still been forced down
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        channel.shutdown();
        try {
            if (!channel.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Channel {} did not terminate within {}, forcing shutdown", channel, shutdownTimeout);
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
            throw new KesselException(ErrorKind.RESOURCE_CLOSE_FAILED, "interrupted while closing channel", e);
        }
        log.debug("Channel {} closed", channel);
    }
}
