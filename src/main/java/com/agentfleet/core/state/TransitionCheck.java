package com.agentfleet.core.state;

/**
 * Result of a transition-table lookup.
 */
public record TransitionCheck(boolean allowed, String reason) {

    static TransitionCheck allow() {
        return new TransitionCheck(true, null);
    }

    static TransitionCheck deny(String reason) {
        return new TransitionCheck(false, reason);
    }
}
