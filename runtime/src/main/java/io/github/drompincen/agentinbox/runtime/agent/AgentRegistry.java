package io.github.drompincen.agentinbox.runtime.agent;

import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Capability-keyed map of every agent that can own a thread.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private static final int DEFAULT_MAX_TOOL_CALLS = 5;

    private final Map<String, AgentCapabilities> agents = new LinkedHashMap<>();
    private final InboxProperties properties;

    public AgentRegistry(InboxProperties properties) {
        this.properties = properties;
        registerBuiltIns();
        log.info("Registered {} agents, default '{}'", agents.size(), properties.getDefaultAgent());
    }

    private void registerBuiltIns() {
        register(new AgentCapabilities("assistant", "Assistant", "General questions and answers",
                true, false, 0, AgentPrompts.ASSISTANT, List.of()));
        register(new AgentCapabilities("omni", "Omni", "Generalist that can use every tool",
                true, true, 15, AgentPrompts.OMNI,
                List.of("calculate_roi", "calculate_break_even", "data-transform")));
        register(new AgentCapabilities("dexter", "Dexter", "Financial and data analysis",
                false, true, DEFAULT_MAX_TOOL_CALLS, AgentPrompts.DEXTER,
                List.of("calculate_roi", "calculate_break_even")));
        register(new AgentCapabilities("emmie", "Emmie", "Email drafting and sending",
                false, true, 10, AgentPrompts.EMMIE, List.of()));
        register(specialist("cassie", "Cassie", "Customer support and CRM", AgentPrompts.CASSIE));
        register(specialist("kai", "Kai", "External integrations", AgentPrompts.KAI));
        register(specialist("lex", "Lex", "Legal review", AgentPrompts.LEX));
        register(specialist("nova", "Nova", "Marketing", AgentPrompts.NOVA));
        register(specialist("vera", "Vera", "Research", AgentPrompts.VERA));
        register(specialist("ari", "Ari", "Recruiting", AgentPrompts.ARI));
        register(specialist("aura", "Aura", "Operations and scheduling", AgentPrompts.AURA));
        register(specialist("echo", "Echo", "Social media", AgentPrompts.ECHO));
        register(specialist("finn", "Finn", "Bookkeeping", AgentPrompts.FINN));
    }

    private static AgentCapabilities specialist(String id, String name, String description, String prompt) {
        return new AgentCapabilities(id, name, description, false, true, DEFAULT_MAX_TOOL_CALLS, prompt, List.of());
    }

    public synchronized void register(AgentCapabilities capabilities) {
        agents.put(capabilities.agentId(), capabilities);
    }

    public synchronized Optional<AgentCapabilities> get(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    /** Looks an agent up by id or display name, ignoring case. */
    public synchronized Optional<AgentCapabilities> findByMention(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        String needle = token.toLowerCase(Locale.ROOT);
        return agents.values().stream()
                .filter(a -> a.agentId().toLowerCase(Locale.ROOT).equals(needle)
                        || a.name().toLowerCase(Locale.ROOT).equals(needle))
                .findFirst();
    }

    public boolean isGeneralist(String agentId) {
        return properties.getGeneralistAgents().contains(agentId);
    }

    public AgentCapabilities defaultAgent() {
        return get(properties.getDefaultAgent())
                .orElseThrow(() -> new IllegalStateException("Default agent not registered: "
                        + properties.getDefaultAgent()));
    }

    /** Falls back to the default agent for ids that are no longer registered. */
    public AgentCapabilities getOrDefault(String agentId) {
        return get(agentId).orElseGet(this::defaultAgent);
    }

    public synchronized Collection<AgentCapabilities> all() {
        return Collections.unmodifiableCollection(List.copyOf(agents.values()));
    }
}
