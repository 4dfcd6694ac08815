package com.phillippitts.scriberelay.relay;

import com.phillippitts.scriberelay.util.StateMachine;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of one client connection on the relay.
 *
 * <pre>
 * NEW -> AWAITING_AUTH -> AUTHENTICATED -> STREAMING -> FINALIZING -> CLOSED
 *                      \-> AUTH_TIMEOUT
 * </pre>
 * Any non-terminal state may move to CLOSED on upstream failure or client disconnect.
 */
public enum RelaySessionState implements StateMachine.Transitions<RelaySessionState> {
    NEW,
    AWAITING_AUTH,
    AUTHENTICATED,
    STREAMING,
    FINALIZING,
    CLOSED,
    AUTH_TIMEOUT;

    private static final Map<RelaySessionState, Set<RelaySessionState>> TRANSITIONS =
            new EnumMap<>(RelaySessionState.class);

    static {
        TRANSITIONS.put(NEW, EnumSet.of(AWAITING_AUTH, CLOSED));
        TRANSITIONS.put(AWAITING_AUTH, EnumSet.of(AUTHENTICATED, AUTH_TIMEOUT, CLOSED));
        TRANSITIONS.put(AUTHENTICATED, EnumSet.of(STREAMING, FINALIZING, CLOSED));
        TRANSITIONS.put(STREAMING, EnumSet.of(FINALIZING, CLOSED));
        TRANSITIONS.put(FINALIZING, EnumSet.of(CLOSED));
        TRANSITIONS.put(CLOSED, EnumSet.noneOf(RelaySessionState.class));
        TRANSITIONS.put(AUTH_TIMEOUT, EnumSet.noneOf(RelaySessionState.class));
    }

    @Override
    public boolean canTransitionTo(RelaySessionState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return this == CLOSED || this == AUTH_TIMEOUT;
    }
}
