package com.phillippitts.scriberelay.service.audio.capture;

import com.phillippitts.scriberelay.util.RelayTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single owner of the microphone device.
 *
 * <p>Acquiring a token revokes the previous holder's token and waits (bounded) until that
 * holder has released the device, so two capture pipelines never read the line at once.
 */
@Component
public class MicrophoneManager {

    private static final Logger LOG = LogManager.getLogger(MicrophoneManager.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private final AtomicLong ids = new AtomicLong();
    private final Duration releaseTimeout;
    private MicrophoneToken current;

    public MicrophoneManager() {
        this(RelayTimeouts.MICROPHONE_RELEASE_TIMEOUT);
    }

    // Package-private for tests
    MicrophoneManager(Duration releaseTimeout) {
        this.releaseTimeout = Objects.requireNonNull(releaseTimeout);
    }

    /**
     * Takes ownership of the microphone.
     *
     * @param owner    name used in logs
     * @param onRevoke called (on the acquiring thread) when a later owner takes the device;
     *                 must stop capture and release the token
     */
    public MicrophoneToken acquire(String owner, Runnable onRevoke) {
        MicrophoneToken previous;
        lock.lock();
        try {
            previous = current;
        } finally {
            lock.unlock();
        }
        if (previous != null) {
            previous.revoke();
        }

        lock.lock();
        try {
            long remainingNanos = releaseTimeout.toNanos();
            while (current != null && remainingNanos > 0) {
                remainingNanos = released.awaitNanos(remainingNanos);
            }
            if (current != null) {
                LOG.warn("Microphone holder '{}' did not release within {} ms; taking over",
                        current.owner(), releaseTimeout.toMillis());
                current.invalidate();
            }
            MicrophoneToken token = new MicrophoneToken(ids.incrementAndGet(), owner, onRevoke);
            current = token;
            LOG.debug("Microphone acquired by '{}' (token {})", owner, token.id());
            return token;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the microphone", e);
        } finally {
            lock.unlock();
        }
    }

    /** Releases {@code token}; a no-op for tokens that no longer own the device. */
    public void release(MicrophoneToken token) {
        if (token == null) {
            return;
        }
        lock.lock();
        try {
            token.invalidate();
            if (current == token) {
                current = null;
                released.signalAll();
                LOG.debug("Microphone released by '{}' (token {})", token.owner(), token.id());
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> currentOwner() {
        lock.lock();
        try {
            return Optional.ofNullable(current).map(MicrophoneToken::owner);
        } finally {
            lock.unlock();
        }
    }
}
