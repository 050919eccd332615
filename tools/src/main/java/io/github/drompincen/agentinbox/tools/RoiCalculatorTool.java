package io.github.drompincen.agentinbox.tools;

import io.github.drompincen.agentinbox.runtime.tools.Tool;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

/**
 * Return on investment over a timeframe, with payback period and a coarse category.
 */
public class RoiCalculatorTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double MAX_INVESTMENT = 1_000_000_000d;
    static final double MAX_REVENUE = 10_000_000_000d;
    static final int MAX_MONTHS = 600;

    @Override public String name() { return "calculate_roi"; }

    @Override public String displayName() { return "Calculate ROI"; }

    @Override public String description() {
        return "Calculate return on investment for a project: ROI percentage, net profit, payback period " +
               "in months, average monthly profit and a category (excellent, good, moderate, loss).";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("investment_cost").put("type", "number")
                .put("description", "Initial investment");
        props.putObject("revenue_generated").put("type", "number")
                .put("description", "Revenue generated over the timeframe");
        props.putObject("timeframe_months").put("type", "integer")
                .put("description", "Timeframe in months (1-600)");
        props.putObject("recurring_costs").put("type", "number")
                .put("description", "Optional monthly running costs");
        ArrayNode required = schema.putArray("required");
        required.add("investment_cost").add("revenue_generated").add("timeframe_months");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (!input.path("investment_cost").isNumber()) return ToolResult.failure("'investment_cost' is required");
        if (!input.path("revenue_generated").isNumber()) return ToolResult.failure("'revenue_generated' is required");
        if (!input.path("timeframe_months").isNumber()) return ToolResult.failure("'timeframe_months' is required");

        double investment = input.get("investment_cost").asDouble();
        double revenue = input.get("revenue_generated").asDouble();
        int months = input.get("timeframe_months").asInt();
        double recurring = input.path("recurring_costs").asDouble(0);

        String invalid = validate(investment, revenue, months, recurring);
        if (invalid != null) return ToolResult.failure(invalid);

        double totalCosts = investment + recurring * months;
        double netProfit = revenue - totalCosts;
        double roi = netProfit / totalCosts * 100;
        double monthlyNet = revenue / months - recurring;

        double payback;
        if (monthlyNet > 0) {
            payback = investment / monthlyNet;
        } else if (netProfit > 0 && recurring == 0) {
            payback = months * investment / revenue;
        } else {
            payback = Double.POSITIVE_INFINITY;
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("roi_percentage", round(roi));
        result.put("net_profit", round(netProfit));
        result.put("total_investment", round(totalCosts));
        result.put("monthly_profit", round(netProfit / months));
        if (Double.isInfinite(payback)) {
            result.putNull("payback_period_months");
        } else {
            result.put("payback_period_months", round(payback));
        }
        result.put("category", category(roi));
        return ToolResult.success(result, String.format(Locale.ROOT, "ROI %.1f%% (%s)", roi, category(roi)));
    }

    static String validate(double investment, double revenue, int months, double recurring) {
        if (investment < 0) return "investment_cost must not be negative";
        if (revenue < 0) return "revenue_generated must not be negative";
        if (recurring < 0) return "recurring_costs must not be negative";
        if (months < 1) return "timeframe_months must be at least 1";
        if (months > MAX_MONTHS) return "timeframe_months must not exceed " + MAX_MONTHS;
        if (investment > MAX_INVESTMENT) return "investment_cost is unrealistically high";
        if (revenue > MAX_REVENUE) return "revenue_generated is unrealistically high";
        if (investment == 0 && recurring == 0) return "investment_cost or recurring_costs must be greater than 0";
        return null;
    }

    static String category(double roi) {
        if (roi >= 50) return "excellent";
        if (roi >= 20) return "good";
        if (roi >= 0) return "moderate";
        return "loss";
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
