package io.github.drompincen.agentinbox.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the inbox orchestration core, bound from the {@code agentinbox} prefix:
 *
 * <pre>
 * agentinbox:
 *   default-agent: assistant
 *   generalist-agents: [assistant, omni]
 *   router:
 *     context-messages: 5
 *   orchestrator:
 *     tool-timeout-ms: 30000
 *   turn:
 *     pool-size: 8
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "agentinbox")
public class InboxProperties {

    /** Agent assigned to new threads. */
    private String defaultAgent = "assistant";

    /** Agents that may be routed away from by intent classification. */
    private List<String> generalistAgents = new ArrayList<>(List.of("assistant", "omni"));

    private Router router = new Router();
    private Orchestrator orchestrator = new Orchestrator();
    private Turn turn = new Turn();

    public String getDefaultAgent() { return defaultAgent; }
    public void setDefaultAgent(String defaultAgent) { this.defaultAgent = defaultAgent; }

    public List<String> getGeneralistAgents() { return generalistAgents; }
    public void setGeneralistAgents(List<String> generalistAgents) { this.generalistAgents = generalistAgents; }

    public Router getRouter() { return router; }
    public void setRouter(Router router) { this.router = router; }

    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }

    public Turn getTurn() { return turn; }
    public void setTurn(Turn turn) { this.turn = turn; }

    public static class Router {
        private boolean enabled = true;
        private int contextMessages = 5;
        private int contextChars = 200;
        private long classifierTimeoutMs = 10_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getContextMessages() { return contextMessages; }
        public void setContextMessages(int contextMessages) { this.contextMessages = contextMessages; }

        public int getContextChars() { return contextChars; }
        public void setContextChars(int contextChars) { this.contextChars = contextChars; }

        public long getClassifierTimeoutMs() { return classifierTimeoutMs; }
        public void setClassifierTimeoutMs(long classifierTimeoutMs) { this.classifierTimeoutMs = classifierTimeoutMs; }
    }

    public static class Orchestrator {
        private int historyMessages = 10;
        private int maxRetries = 3;
        private long initialBackoffMs = 1_000;
        private long maxBackoffMs = 10_000;
        private long toolTimeoutMs = 30_000;
        private int maxConsecutiveToolFailures = 3;

        public int getHistoryMessages() { return historyMessages; }
        public void setHistoryMessages(int historyMessages) { this.historyMessages = historyMessages; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public long getToolTimeoutMs() { return toolTimeoutMs; }
        public void setToolTimeoutMs(long toolTimeoutMs) { this.toolTimeoutMs = toolTimeoutMs; }

        public int getMaxConsecutiveToolFailures() { return maxConsecutiveToolFailures; }
        public void setMaxConsecutiveToolFailures(int maxConsecutiveToolFailures) {
            this.maxConsecutiveToolFailures = maxConsecutiveToolFailures;
        }
    }

    public static class Turn {
        private int poolSize = 8;
        private long lockTtlSeconds = 300;
        private int previewChars = 200;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public long getLockTtlSeconds() { return lockTtlSeconds; }
        public void setLockTtlSeconds(long lockTtlSeconds) { this.lockTtlSeconds = lockTtlSeconds; }

        public int getPreviewChars() { return previewChars; }
        public void setPreviewChars(int previewChars) { this.previewChars = previewChars; }
    }
}
