package io.github.drompincen.agentinbox.runtime.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentinbox.runtime.agent.AgentCapabilities;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import io.github.drompincen.agentinbox.runtime.llm.ChatTurn;
import io.github.drompincen.agentinbox.runtime.llm.LlmRequest;
import io.github.drompincen.agentinbox.runtime.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies intent with a single blocking model call that must answer with
 * {@code {"agent": "...", "confidence": 0.0-1.0, "reasoning": "..."}}.
 */
@Component
public class LlmIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmIntentClassifier.class);

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern BARE_JSON = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private final LlmService llmService;
    private final ObjectMapper objectMapper;
    private final long timeoutMs;

    public LlmIntentClassifier(LlmService llmService, ObjectMapper objectMapper, InboxProperties properties) {
        this.llmService = llmService;
        this.objectMapper = objectMapper;
        this.timeoutMs = properties.getRouter().getClassifierTimeoutMs();
    }

    @Override
    public Classification classify(String userText, List<String> context, Collection<AgentCapabilities> candidates) {
        if (!llmService.isAvailable()) {
            throw new IllegalStateException("LLM provider not available");
        }
        LlmRequest request = new LlmRequest(null, null,
                List.of(ChatTurn.system(systemPrompt(candidates)), ChatTurn.user(userPrompt(userText, context))),
                List.of());
        try {
            String raw = CompletableFuture.supplyAsync(() -> llmService.call(request))
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            Classification result = parse(raw);
            log.debug("Classified as {} ({}): {}", result.agentId(), result.confidence(), result.reasoning());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Intent classification interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("Intent classification failed: " + e.getMessage(), e);
        }
    }

    Classification parse(String raw) throws Exception {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty classifier response");
        }
        String json = raw.strip();
        Matcher fenced = FENCED_JSON.matcher(json);
        if (fenced.find()) {
            json = fenced.group(1);
        } else {
            Matcher bare = BARE_JSON.matcher(json);
            if (bare.find()) json = bare.group();
        }
        JsonNode node = objectMapper.readTree(json);
        String agent = node.path("agent").asText("");
        if (agent.isBlank()) {
            throw new IllegalArgumentException("classifier response has no agent");
        }
        double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.0)));
        return new Classification(agent.strip().toLowerCase(Locale.ROOT), confidence, node.path("reasoning").asText(""));
    }

    private String systemPrompt(Collection<AgentCapabilities> candidates) {
        StringBuilder sb = new StringBuilder("""
                You route inbox messages to the agent best suited to answer them.
                Reply with only a JSON object: {"agent": "<agent id>", "confidence": <0.0-1.0>, "reasoning": "<one sentence>"}
                Agents:
                """);
        for (AgentCapabilities agent : candidates) {
            sb.append("- ").append(agent.agentId()).append(": ").append(agent.description()).append('\n');
        }
        return sb.toString();
    }

    private String userPrompt(String userText, List<String> context) {
        StringBuilder sb = new StringBuilder();
        if (!context.isEmpty()) {
            sb.append("Recent conversation:\n");
            context.forEach(line -> sb.append(line).append('\n'));
            sb.append('\n');
        }
        sb.append("New message:\n").append(userText);
        return sb.toString();
    }
}
