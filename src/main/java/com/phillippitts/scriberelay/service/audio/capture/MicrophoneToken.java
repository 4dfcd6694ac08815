package com.phillippitts.scriberelay.service.audio.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof of exclusive microphone ownership issued by {@link MicrophoneManager}.
 *
 * <p>A token stays valid until its holder releases it or a newer owner revokes it.
 */
public final class MicrophoneToken {

    private static final Logger LOG = LogManager.getLogger(MicrophoneToken.class);

    private final long id;
    private final String owner;
    private final Runnable onRevoke;
    private final AtomicBoolean valid = new AtomicBoolean(true);
    private final AtomicBoolean revoked = new AtomicBoolean(false);

    MicrophoneToken(long id, String owner, Runnable onRevoke) {
        this.id = id;
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.onRevoke = Objects.requireNonNull(onRevoke, "onRevoke must not be null");
    }

    public long id() {
        return id;
    }

    public String owner() {
        return owner;
    }

    public boolean isValid() {
        return valid.get();
    }

    void invalidate() {
        valid.set(false);
    }

    /** Asks the holder to stop capturing; runs its revoke hook at most once. */
    void revoke() {
        if (valid.get() && revoked.compareAndSet(false, true)) {
            LOG.info("Revoking microphone from '{}' (token {})", owner, id);
            try {
                onRevoke.run();
            } catch (RuntimeException e) {
                LOG.warn("Revoke hook of '{}' failed: {}", owner, e.toString());
            }
        }
    }

    @Override
    public String toString() {
        return "MicrophoneToken[" + id + ", owner=" + owner + ", valid=" + valid.get() + "]";
    }
}
