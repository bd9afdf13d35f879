package com.agentfleet.quota;

/**
 * Terminal outcome of a runtime instance.
 */
public enum FinalStatus {
    COMPLETED(RuntimeStatus.COMPLETED),
    FAILED(RuntimeStatus.FAILED),
    INTERRUPTED(RuntimeStatus.INTERRUPTED);

    private final RuntimeStatus runtimeStatus;

    FinalStatus(RuntimeStatus runtimeStatus) {
        this.runtimeStatus = runtimeStatus;
    }

    public RuntimeStatus runtimeStatus() {
        return runtimeStatus;
    }
}
