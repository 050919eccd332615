package io.github.drompincen.agentinbox.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BreakEvenToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final BreakEvenTool tool = new BreakEvenTool();
    private final ToolContext ctx = new ToolContext("t1", "u1", "dexter");

    private ObjectNode input() {
        ObjectNode input = MAPPER.createObjectNode();
        input.put("fixed_costs", 10_000);
        input.put("variable_cost_per_unit", 20);
        input.put("selling_price_per_unit", 45);
        return input;
    }

    @Test
    void computesBreakEvenPoint() {
        ToolResult result = tool.execute(ctx, input());

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("contribution_margin").asDouble()).isEqualTo(25.0);
        assertThat(result.output().get("break_even_units").asDouble()).isEqualTo(400.0);
        assertThat(result.output().get("break_even_revenue").asDouble()).isEqualTo(18_000.0);
        assertThat(result.output().has("margin_of_safety_units")).isFalse();
        assertThat(result.summary()).isEqualTo("Break-even at 400 units");
    }

    @Test
    void reportsSafetyMarginAndTargetVolume() {
        ObjectNode input = input();
        input.put("current_sales_units", 500);
        input.put("target_profit", 5_000);

        ToolResult result = tool.execute(ctx, input);

        assertThat(result.output().get("margin_of_safety_units").asDouble()).isEqualTo(100.0);
        assertThat(result.output().get("margin_of_safety_percent").asDouble()).isEqualTo(20.0);
        assertThat(result.output().get("target_profit_units").asDouble()).isEqualTo(600.0);
    }

    @Test
    void priceMustCoverVariableCost() {
        ObjectNode input = input();
        input.put("selling_price_per_unit", 20);

        assertThat(tool.execute(ctx, input).success()).isFalse();
    }
}
