package org.projectkessel.sdk.autoconfigure;

import org.projectkessel.sdk.exception.KesselException;
import org.projectkessel.sdk.grpc.StubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

final class KesselConnectionShutdown implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(KesselConnectionShutdown.class);

    private final StubConnection<?> connection;
    private volatile boolean running = true;

    KesselConnectionShutdown(StubConnection<?> connection) {
        this.connection = connection;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        if (running) {
            running = false;
            try {
                connection.close();
            } catch (KesselException e) {
                log.warn("Failed to close Kessel connection cleanly: {}", e.getMessage());
            }
        }
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
