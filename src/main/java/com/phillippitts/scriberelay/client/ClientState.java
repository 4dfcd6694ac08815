package com.phillippitts.scriberelay.client;

import com.phillippitts.scriberelay.util.StateMachine;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a dictation client.
 *
 * <pre>
 * IDLE -> CONNECTING -> LISTENING -> STOPPING -> IDLE
 * </pre>
 * ERROR is reachable from CONNECTING or LISTENING and leaves via IDLE or a new CONNECTING.
 * CONNECTING may return straight to IDLE when stopped or timed out.
 */
public enum ClientState implements StateMachine.Transitions<ClientState> {
    IDLE,
    CONNECTING,
    LISTENING,
    STOPPING,
    ERROR;

    private static final Map<ClientState, Set<ClientState>> TRANSITIONS = new EnumMap<>(ClientState.class);

    static {
        TRANSITIONS.put(IDLE, EnumSet.of(CONNECTING));
        TRANSITIONS.put(CONNECTING, EnumSet.of(LISTENING, IDLE, ERROR));
        TRANSITIONS.put(LISTENING, EnumSet.of(STOPPING, ERROR));
        TRANSITIONS.put(STOPPING, EnumSet.of(IDLE));
        TRANSITIONS.put(ERROR, EnumSet.of(IDLE, CONNECTING));
    }

    @Override
    public boolean canTransitionTo(ClientState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isActive() {
        return this == CONNECTING || this == LISTENING || this == STOPPING;
    }
}
