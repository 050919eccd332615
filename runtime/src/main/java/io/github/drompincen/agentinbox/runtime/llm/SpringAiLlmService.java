package io.github.drompincen.agentinbox.runtime.llm;

import io.github.drompincen.agentinbox.protocol.event.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible provider through Spring AI. The model is created on first use from the
 * key found in the environment, so the application starts without one and reports
 * itself unavailable until a key is set.
 */
@Service
public class SpringAiLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlmService.class);

    static final String API_KEY_PROPERTY = "agentinbox.llm.api-key";
    static final String BASE_URL_PROPERTY = "agentinbox.llm.base-url";
    static final String MODEL_PROPERTY = "agentinbox.llm.model";
    private static final String DEFAULT_BASE_URL = "https://api.openai.com";
    private static final String DEFAULT_MODEL = "gpt-4o";

    private final Environment environment;

    private volatile ChatModel model;
    private volatile String modelKey;

    public SpringAiLlmService(Environment environment) {
        this.environment = environment;
    }

    private String resolveKey() {
        String key = System.getProperty(API_KEY_PROPERTY);
        if (key != null && !key.isBlank()) return key;
        key = environment.getProperty(API_KEY_PROPERTY, "");
        if (!key.isBlank()) return key;
        return environment.getProperty("OPENAI_API_KEY", "");
    }

    private boolean hasRealKey(String key) {
        return key != null && !key.isBlank() && !key.startsWith("sk-placeholder");
    }

    @Override
    public boolean isAvailable() {
        return hasRealKey(resolveKey());
    }

    @Override
    public String providerName() {
        return "openai";
    }

    @Override
    public String modelName() {
        return environment.getProperty(MODEL_PROPERTY, DEFAULT_MODEL);
    }

    private synchronized ChatModel getOrCreateModel() {
        String key = resolveKey();
        if (!hasRealKey(key)) {
            throw new LlmProviderException("No LLM API key configured (set " + API_KEY_PROPERTY
                    + " or OPENAI_API_KEY)", false);
        }
        if (model != null && key.equals(modelKey)) return model;

        OpenAiApi api = OpenAiApi.builder()
                .apiKey(key)
                .baseUrl(environment.getProperty(BASE_URL_PROPERTY, DEFAULT_BASE_URL))
                .build();
        model = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(modelName()).build())
                .build();
        modelKey = key;
        log.info("Created OpenAI chat model {}", modelName());
        return model;
    }

    @Override
    public Flux<LlmChunk> stream(LlmRequest request) {
        return Flux.defer(() -> getOrCreateModel().stream(buildPrompt(request, true)))
                .concatMapIterable(this::toChunks)
                .onErrorMap(e -> !(e instanceof LlmProviderException), LlmProviderException::from);
    }

    @Override
    public String call(LlmRequest request) {
        try {
            ChatResponse response = getOrCreateModel().call(buildPrompt(request, false));
            if (response == null || response.getResult() == null) return "";
            String text = response.getResult().getOutput().getText();
            return text != null ? text : "";
        } catch (RuntimeException e) {
            throw LlmProviderException.from(e);
        }
    }

    private List<LlmChunk> toChunks(ChatResponse response) {
        List<LlmChunk> chunks = new ArrayList<>(2);
        if (response.getResult() != null && response.getResult().getOutput() != null) {
            AssistantMessage output = response.getResult().getOutput();
            String text = output.getText();
            if (text != null && !text.isEmpty()) {
                chunks.add(LlmChunk.text(text));
            }
            if (output.hasToolCalls()) {
                chunks.add(LlmChunk.toolCalls(output.getToolCalls().stream()
                        .map(tc -> new ToolCallRequest(tc.id(), tc.name(), tc.arguments()))
                        .toList()));
            }
        }
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null && usage.getPromptTokens() != null && usage.getPromptTokens() > 0) {
            int completion = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            chunks.add(LlmChunk.usage(new TokenUsage(usage.getPromptTokens(), completion, false)));
        }
        return chunks;
    }

    Prompt buildPrompt(LlmRequest request, boolean streaming) {
        List<Message> messages = new ArrayList<>();
        for (ChatTurn turn : request.messages()) {
            switch (turn.role()) {
                case SYSTEM -> messages.add(new SystemMessage(turn.content()));
                case USER -> messages.add(new UserMessage(turn.content()));
                case ASSISTANT -> messages.add(new AssistantMessage(turn.content(), Map.of(),
                        turn.toolCalls().stream()
                                .map(tc -> new AssistantMessage.ToolCall(tc.id(), "function", tc.name(), tc.arguments()))
                                .toList()));
                case TOOL -> messages.add(new ToolResponseMessage(List.of(
                        new ToolResponseMessage.ToolResponse(turn.toolCallId(), turn.toolName(), turn.content()))));
            }
        }

        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .model(modelName())
                .internalToolExecutionEnabled(false);
        if (streaming) {
            options.streamUsage(true);
        }
        if (!request.tools().isEmpty()) {
            options.toolCallbacks(request.tools().stream().map(DeclaredTool::new).map(ToolCallback.class::cast).toList());
        }
        return new Prompt(messages, options.build());
    }

    /**
     * Advertises a tool to the model. Execution stays with the orchestrator, so calling it here
     * is a programming error.
     */
    private record DeclaredTool(ToolSpec spec) implements ToolCallback {

        @Override
        public ToolDefinition getToolDefinition() {
            return ToolDefinition.builder()
                    .name(spec.name())
                    .description(spec.description())
                    .inputSchema(spec.inputSchema().toString())
                    .build();
        }

        @Override
        public String call(String toolInput) {
            throw new IllegalStateException("Tool " + spec.name() + " is executed by the orchestrator");
        }
    }
}
