package com.agentfleet.supervisor;

/**
 * How a supervised process is asked to stop.
 */
public enum StopSignal {
    /** {@link Process#destroy()}, escalated to a forced kill after the grace window. */
    GRACEFUL,
    /** {@link Process#destroyForcibly()} immediately. */
    FORCE
}
