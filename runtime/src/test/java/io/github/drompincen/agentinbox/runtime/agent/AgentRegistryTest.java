package io.github.drompincen.agentinbox.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentinbox.runtime.config.InboxProperties;
import io.github.drompincen.agentinbox.runtime.tools.Tool;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolRegistry;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AgentRegistryTest {

    private AgentRegistry registry;
    private ToolRegistry tools;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry(new InboxProperties());
        tools = new ToolRegistry();
        tools.register(new Tool() {
            @Override public String name() { return "calculate_roi"; }
            @Override public String displayName() { return "Calculate ROI"; }
            @Override public String description() { return "roi"; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) {
                return ToolResult.success(input);
            }
        });
    }

    @Test
    void builtInAgentsAreRegistered() {
        assertThat(registry.all()).extracting(AgentCapabilities::agentId).contains(
                "assistant", "omni", "dexter", "emmie", "cassie", "kai", "lex", "nova", "vera", "ari", "aura", "echo", "finn");
        assertThat(registry.defaultAgent().agentId()).isEqualTo("assistant");
        assertThat(registry.get("omni").orElseThrow().maxToolCalls()).isEqualTo(15);
        assertThat(registry.get("emmie").orElseThrow().maxToolCalls()).isEqualTo(10);
        assertThat(registry.get("nova").orElseThrow().maxToolCalls()).isEqualTo(5);
        assertThat(registry.get("assistant").orElseThrow().agentic()).isFalse();
    }

    @Test
    void toolInstructionsFollowThePersonaLine() {
        String prompt = registry.get("dexter").orElseThrow().systemPrompt();

        assertThat(prompt).startsWith("You are Dexter, a financial and data analyst working inside the user's inbox. "
                + "Use calculate_roi and calculate_break_even");
        assertThat(prompt).contains("arithmetic yourself. Answer concisely");
        assertThat(registry.get("emmie").orElseThrow().systemPrompt())
                .startsWith("You are Emmie, an email specialist who drafts, replies to and sends email working inside the user's inbox. Answer concisely");
    }

    @Test
    void onlyGeneralistsAreRoutable() {
        assertThat(registry.isGeneralist("assistant")).isTrue();
        assertThat(registry.isGeneralist("omni")).isTrue();
        assertThat(registry.isGeneralist("dexter")).isFalse();
    }

    @Test
    void mentionLookupIgnoresCase() {
        assertThat(registry.findByMention("DEXTER")).map(AgentCapabilities::agentId).contains("dexter");
        assertThat(registry.findByMention("Emmie")).map(AgentCapabilities::agentId).contains("emmie");
        assertThat(registry.findByMention("nobody")).isEmpty();
        assertThat(registry.getOrDefault("retired-agent").agentId()).isEqualTo("assistant");
    }

    @Test
    void executorOnlyRunsToolsTheAgentOwns() {
        ToolContext ctx = new ToolContext("t1", "u1", "dexter");
        ObjectMapper mapper = new ObjectMapper();
        AgentCapabilities dexter = registry.get("dexter").orElseThrow();
        AgentCapabilities emmie = registry.get("emmie").orElseThrow();

        assertThat(dexter.tools(tools)).extracting(Tool::name).containsExactly("calculate_roi");
        assertThat(dexter.executor(tools, ctx).execute("calculate_roi", mapper.createObjectNode()).success()).isTrue();
        assertThat(emmie.executor(tools, ctx).execute("calculate_roi", mapper.createObjectNode()).error())
                .isEqualTo("Tool not found: calculate_roi");
        assertThat(dexter.displayName(tools, "calculate_roi")).isEqualTo("Calculate ROI");
        assertThat(dexter.displayName(tools, "unknown")).isEqualTo("unknown");
    }

    @Test
    void textOnlyAgentHasNoTools() {
        AgentCapabilities assistant = registry.get("assistant").orElseThrow();

        assertThat(assistant.tools(tools)).isEmpty();
        assertThat(assistant.toDto().tools()).isEqualTo(List.of());
    }
}
