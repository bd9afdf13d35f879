package com.agentfleet.quota;

/**
 * Effective quota and the layer it came from.
 */
public record QuotaResolution(int quota, Source source) {

    public enum Source { WORKFLOW, PROJECT, DEFAULT }
}
