package com.agentfleet.ask;

import java.time.Instant;

/**
 * Settled outcome of an ask.
 *
 * @param ok             true when a non-blank answer arrived
 * @param requestId      the ask
 * @param answer         trimmed raw answer, null when none
 * @param selectedOption the option the answer picked by index or label, null when none matched
 * @param timedOut       true when the deadline passed first
 * @param respondedAt    when the ask settled
 */
public record AskResolution(
    boolean ok,
    String requestId,
    String answer,
    String selectedOption,
    boolean timedOut,
    Instant respondedAt
) {
    static AskResolution timeout(String requestId, Instant at) {
        return new AskResolution(false, requestId, null, null, true, at);
    }
}
