package io.github.drompincen.agentinbox.runtime.routing;

import io.github.drompincen.agentinbox.runtime.agent.AgentCapabilities;

import java.util.Collection;
import java.util.List;

/**
 * Picks the agent best suited to a message. Implementations may throw; the router treats any
 * failure as "keep the current agent".
 */
public interface IntentClassifier {

    Classification classify(String userText, List<String> context, Collection<AgentCapabilities> candidates);

    record Classification(String agentId, double confidence, String reasoning) {}
}
