package io.github.drompincen.agentinbox.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RoiCalculatorToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RoiCalculatorTool tool = new RoiCalculatorTool();
    private final ToolContext ctx = new ToolContext("t1", "u1", "dexter");

    private ObjectNode input(double investment, double revenue, int months, double recurring) {
        ObjectNode input = MAPPER.createObjectNode();
        input.put("investment_cost", investment);
        input.put("revenue_generated", revenue);
        input.put("timeframe_months", months);
        input.put("recurring_costs", recurring);
        return input;
    }

    @Test
    void profitableInvestment() {
        ToolResult result = tool.execute(ctx, input(50_000, 125_000, 12, 0));

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("roi_percentage").asDouble()).isEqualTo(150.0);
        assertThat(result.output().get("net_profit").asDouble()).isEqualTo(75_000.0);
        assertThat(result.output().get("payback_period_months").asDouble()).isCloseTo(4.8, within(0.01));
        assertThat(result.output().get("category").asText()).isEqualTo("excellent");
        assertThat(result.summary()).isEqualTo("ROI 150.0% (excellent)");
    }

    @Test
    void recurringCostsCountTowardsTotal() {
        ToolResult result = tool.execute(ctx, input(10_000, 15_000, 10, 100));

        // total 11000, net 4000
        assertThat(result.output().get("total_investment").asDouble()).isEqualTo(11_000.0);
        assertThat(result.output().get("roi_percentage").asDouble()).isCloseTo(36.36, within(0.01));
        assertThat(result.output().get("category").asText()).isEqualTo("good");
    }

    @Test
    void lossNeverPaysBack() {
        ToolResult result = tool.execute(ctx, input(10_000, 2_000, 12, 500));

        assertThat(result.output().get("category").asText()).isEqualTo("loss");
        assertThat(result.output().get("payback_period_months").isNull()).isTrue();
    }

    @Test
    void categoriesFollowThresholds() {
        assertThat(RoiCalculatorTool.category(50)).isEqualTo("excellent");
        assertThat(RoiCalculatorTool.category(20)).isEqualTo("good");
        assertThat(RoiCalculatorTool.category(0)).isEqualTo("moderate");
        assertThat(RoiCalculatorTool.category(-0.1)).isEqualTo("loss");
    }

    @Test
    void rejectsImplausibleInput() {
        assertThat(tool.execute(ctx, input(-1, 10, 12, 0)).error()).contains("investment_cost");
        assertThat(tool.execute(ctx, input(100, 10, 0, 0)).error()).contains("at least 1");
        assertThat(tool.execute(ctx, input(100, 10, 601, 0)).error()).contains("600");
        assertThat(tool.execute(ctx, input(2e9, 10, 12, 0)).error()).contains("unrealistically");
        assertThat(tool.execute(ctx, input(0, 10, 12, 0)).success()).isFalse();
        assertThat(tool.execute(ctx, MAPPER.createObjectNode()).error()).isEqualTo("'investment_cost' is required");
    }
}
