package org.projectkessel.sdk.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Single-writer cache for one identity's {@link AccessToken}.
 *
 * <p>Valid tokens are served under the read lock. Refreshes run under the write lock and
 * re-check validity once it is held, so callers that queued behind an in-flight refresh reuse
 * its result instead of issuing their own. A forced refresh always runs the refresher.</p>
 */
public final class TokenCache {

    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);

    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private AccessToken token;

    public TokenCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * The cached token if it is still outside the expiration window.
     */
    public Optional<AccessToken> getIfValid() {
        lock.readLock().lock();
        try {
            if (token != null && token.isValid(clock.instant())) {
                return Optional.of(token);
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The cached token regardless of validity.
     */
    public Optional<AccessToken> peek() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(token);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Return a valid token, running {@code refresher} at most once per expired state.
     *
     * <p>If the refresher throws, the cache keeps what it held before the call (empty after a
     * forced refresh) and the exception propagates.</p>
     */
    public AccessToken getOrRefresh(boolean forceRefresh, Supplier<AccessToken> refresher) {
        if (!forceRefresh) {
            Optional<AccessToken> cached = getIfValid();
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        lock.writeLock().lock();
        try {
            if (forceRefresh) {
                token = null;
            } else if (token != null && token.isValid(clock.instant())) {
                log.debug("Token refreshed by a concurrent caller, skipping refresh");
                return token;
            }

            AccessToken fresh = refresher.get();
            token = fresh;
            return fresh;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            token = null;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
