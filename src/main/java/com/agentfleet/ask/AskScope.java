package com.agentfleet.ask;

/**
 * Filter over pending asks. Null fields match anything; set fields must match exactly.
 */
public record AskScope(
    String requestId,
    String agentId,
    String sessionId,
    String workflowId,
    String epicId
) {
    public static final AskScope ANY = new AskScope(null, null, null, null, null);

    public static AskScope forWorkflow(String workflowId) {
        return new AskScope(null, null, null, workflowId, null);
    }

    public static AskScope forAgent(String agentId) {
        return new AskScope(null, agentId, null, null, null);
    }

    public boolean matches(PendingAsk ask) {
        return accepts(requestId, ask.requestId())
                && accepts(agentId, ask.agentId())
                && accepts(sessionId, ask.sessionId())
                && accepts(workflowId, ask.workflowId())
                && accepts(epicId, ask.epicId());
    }

    private static boolean accepts(String wanted, String actual) {
        return wanted == null || wanted.isEmpty() || wanted.equals(actual);
    }
}
