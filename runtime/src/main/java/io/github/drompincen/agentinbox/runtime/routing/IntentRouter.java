package io.github.drompincen.agentinbox.runtime.routing;

import io.github.drompincen.agentinbox.protocol.api.RoutingDecision;
import io.github.drompincen.agentinbox.runtime.agent.AgentCapabilities;
import io.github.drompincen.agentinbox.runtime.agent.AgentRegistry;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decides which agent answers a user message.
 *
 * <p>An @mention of a registered agent always wins. Without one, only threads owned by a
 * generalist are classified; a specialist keeps its thread until the user says otherwise.
 */
@Component
public class IntentRouter {

    private static final Logger log = LoggerFactory.getLogger(IntentRouter.class);

    private final AgentRegistry agentRegistry;
    private final IntentClassifier classifier;
    private final InboxProperties.Router settings;

    public IntentRouter(AgentRegistry agentRegistry, IntentClassifier classifier, InboxProperties properties) {
        this.agentRegistry = agentRegistry;
        this.classifier = classifier;
        this.settings = properties.getRouter();
    }

    public RoutingDecision route(String userText, String currentAgentId, List<ContextLine> recentContext) {
        AgentCapabilities current = agentRegistry.getOrDefault(currentAgentId);

        for (MentionParser.Mention mention : MentionParser.find(userText)) {
            Optional<AgentCapabilities> target = agentRegistry.findByMention(mention.name());
            if (target.isPresent()) {
                AgentCapabilities agent = target.get();
                log.debug("Explicit assignment to {} via @{}", agent.agentId(), mention.name());
                return new RoutingDecision(agent.agentId(), agent.name(), 1.0,
                        "Explicit assignment via @" + agent.name(),
                        previousIfChanged(current, agent), true,
                        MentionParser.strip(userText, mention));
            }
        }

        if (!settings.isEnabled() || !agentRegistry.isGeneralist(current.agentId())) {
            return keep(current, 1.0, "Continuing with current agent", userText);
        }

        IntentClassifier.Classification classification;
        try {
            classification = classifier.classify(userText, contextLines(recentContext), agentRegistry.all());
        } catch (Exception e) {
            log.warn("Routing unavailable, keeping {}: {}", current.agentId(), e.getMessage());
            return keep(current, 0.0, "routing unavailable", userText);
        }
        if (classification == null) {
            log.warn("Routing unavailable, keeping {}: classifier returned nothing", current.agentId());
            return keep(current, 0.0, "routing unavailable", userText);
        }

        Optional<AgentCapabilities> selected = agentRegistry.get(classification.agentId());
        if (selected.isEmpty()) {
            log.info("Classifier chose unknown agent '{}', keeping {}", classification.agentId(), current.agentId());
            return keep(current, 0.0, "Unknown agent '" + classification.agentId() + "', keeping current agent", userText);
        }

        AgentCapabilities agent = selected.get();
        return new RoutingDecision(agent.agentId(), agent.name(), classification.confidence(),
                classification.reasoning(), previousIfChanged(current, agent), false, userText);
    }

    private List<String> contextLines(List<ContextLine> recentContext) {
        if (recentContext == null || recentContext.isEmpty()) return List.of();
        int from = Math.max(0, recentContext.size() - settings.getContextMessages());
        return recentContext.subList(from, recentContext.size()).stream()
                .map(line -> line.format(settings.getContextChars()))
                .toList();
    }

    private static String previousIfChanged(AgentCapabilities current, AgentCapabilities next) {
        return current.agentId().equals(next.agentId()) ? null : current.agentId();
    }

    private static RoutingDecision keep(AgentCapabilities current, double confidence, String reasoning, String text) {
        return new RoutingDecision(current.agentId(), current.name(), confidence, reasoning, null, false, text);
    }
}
