package com.phillippitts.scriberelay.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-guarded holder for an enum state whose legal moves are declared by the enum itself.
 *
 * @param <S> state enum
 */
public final class StateMachine<S extends Enum<S> & StateMachine.Transitions<S>> {

    private static final Logger LOG = LogManager.getLogger(StateMachine.class);

    /** Implemented by state enums to declare their transition table. */
    public interface Transitions<S> {
        boolean canTransitionTo(S target);
    }

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private S current;

    public StateMachine(String name, S initial) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.current = Objects.requireNonNull(initial, "initial must not be null");
    }

    public S current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    public boolean is(S state) {
        return current() == state;
    }

    /**
     * Moves to {@code target} if the table allows it from the current state.
     *
     * @return true if the state changed
     */
    public boolean transitionTo(S target) {
        lock.lock();
        try {
            if (!current.canTransitionTo(target)) {
                LOG.debug("{}: rejected transition {} -> {}", name, current, target);
                return false;
            }
            LOG.debug("{}: {} -> {}", name, current, target);
            current = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to {@code target} only if the machine is currently in {@code expected}.
     */
    public boolean transition(S expected, S target) {
        lock.lock();
        try {
            if (current != expected) {
                return false;
            }
            return transitionTo(target);
        } finally {
            lock.unlock();
        }
    }

    /** Like {@link #transitionTo} but fails loudly; used where an illegal move is a bug. */
    public void require(S target) {
        if (!transitionTo(target)) {
            throw new IllegalStateException(name + ": illegal transition " + current() + " -> " + target);
        }
    }
}
