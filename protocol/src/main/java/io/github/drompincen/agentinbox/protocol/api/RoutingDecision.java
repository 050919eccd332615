package io.github.drompincen.agentinbox.protocol.api;

/**
 * Which agent answers a turn and why.
 *
 * @param previousAgentId set only when the decision changes the thread's agent
 * @param explicit        true when the user addressed the agent with an @mention
 * @param effectiveText   the user text forwarded to generation, mention token removed
 */
public record RoutingDecision(
        String agentId,
        String agentName,
        double confidence,
        String reasoning,
        String previousAgentId,
        boolean explicit,
        String effectiveText
) {
    public boolean changedAgent() {
        return previousAgentId != null && !previousAgentId.equals(agentId);
    }
}
