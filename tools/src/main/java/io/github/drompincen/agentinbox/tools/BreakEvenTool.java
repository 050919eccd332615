package io.github.drompincen.agentinbox.tools;

import io.github.drompincen.agentinbox.runtime.tools.Tool;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

public class BreakEvenTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "calculate_break_even"; }

    @Override public String displayName() { return "Break-even Analysis"; }

    @Override public String description() {
        return "Break-even analysis from fixed costs, variable cost per unit and selling price. " +
               "Optionally reports margin of safety for current sales and the volume needed for a target profit.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("fixed_costs").put("type", "number");
        props.putObject("variable_cost_per_unit").put("type", "number");
        props.putObject("selling_price_per_unit").put("type", "number");
        props.putObject("current_sales_units").put("type", "integer")
                .put("description", "Optional current sales volume");
        props.putObject("target_profit").put("type", "number")
                .put("description", "Optional profit goal");
        schema.putArray("required").add("fixed_costs").add("variable_cost_per_unit").add("selling_price_per_unit");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        for (String field : new String[]{"fixed_costs", "variable_cost_per_unit", "selling_price_per_unit"}) {
            if (!input.path(field).isNumber()) return ToolResult.failure("'" + field + "' is required");
        }
        double fixed = input.get("fixed_costs").asDouble();
        double variable = input.get("variable_cost_per_unit").asDouble();
        double price = input.get("selling_price_per_unit").asDouble();

        if (fixed < 0) return ToolResult.failure("fixed_costs must not be negative");
        if (variable < 0) return ToolResult.failure("variable_cost_per_unit must not be negative");
        if (price <= 0) return ToolResult.failure("selling_price_per_unit must be positive");
        if (price <= variable) {
            return ToolResult.failure("selling_price_per_unit must exceed variable_cost_per_unit");
        }

        double margin = price - variable;
        double units = fixed / margin;

        ObjectNode result = MAPPER.createObjectNode();
        result.put("contribution_margin", round(margin));
        result.put("contribution_margin_ratio", round(margin / price * 100));
        result.put("break_even_units", round(units));
        result.put("break_even_revenue", round(units * price));

        if (input.path("current_sales_units").isNumber()) {
            long current = input.get("current_sales_units").asLong();
            if (current < 0) return ToolResult.failure("current_sales_units must not be negative");
            double safetyUnits = current - units;
            result.put("margin_of_safety_units", round(safetyUnits));
            result.put("margin_of_safety_revenue", round(safetyUnits * price));
            result.put("margin_of_safety_percent", current > 0 ? round(safetyUnits / current * 100) : 0);
        }
        if (input.path("target_profit").isNumber()) {
            double target = input.get("target_profit").asDouble();
            if (target < 0) return ToolResult.failure("target_profit must not be negative");
            double targetUnits = (fixed + target) / margin;
            result.put("target_profit_units", round(targetUnits));
            result.put("target_profit_revenue", round(targetUnits * price));
        }
        return ToolResult.success(result, String.format(Locale.ROOT, "Break-even at %.0f units", Math.ceil(units)));
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
