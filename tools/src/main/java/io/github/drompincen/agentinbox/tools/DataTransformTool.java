package io.github.drompincen.agentinbox.tools;

import io.github.drompincen.agentinbox.runtime.tools.Tool;
import io.github.drompincen.agentinbox.runtime.tools.ToolContext;
import io.github.drompincen.agentinbox.runtime.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.StreamSupport;

/**
 * Reshapes a list of JSON rows. Runs without approval, so it never touches anything outside
 * the rows it is given.
 */
public class DataTransformTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> OPERATIONS = Set.of("dedupe", "filter", "sort", "group", "pivot", "aggregate");

    @Override public String name() { return "data-transform"; }

    @Override public String displayName() { return "Transform Data"; }

    @Override public String description() {
        return "Transform or aggregate tabular data. Operations: dedupe, filter (field/value), sort (field), " +
               "group, pivot or aggregate (groupBy, optional sum field).";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("operation").put("type", "string");
        props.putObject("source").put("type", "string")
                .put("description", "Name of the data set, for reporting");
        props.putObject("rows").put("type", "array")
                .put("description", "Rows to transform, each a JSON object");
        props.putObject("groupBy").put("type", "string");
        props.putObject("field").put("type", "string");
        props.putObject("value").put("type", "string");
        props.putObject("sum").put("type", "string");
        schema.putArray("required").add("operation");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        String operation = input.path("operation").asText("").toLowerCase(Locale.ROOT);
        if (operation.isBlank()) return ToolResult.failure("'operation' is required");
        if (!OPERATIONS.contains(operation)) return ToolResult.failure("Unsupported operation: " + operation);

        String source = input.path("source").asText("data");
        JsonNode rowsNode = input.path("rows");
        if (!rowsNode.isMissingNode() && !rowsNode.isArray()) {
            return ToolResult.failure("'rows' must be an array");
        }
        List<JsonNode> rows = rowsNode.isArray()
                ? StreamSupport.stream(rowsNode.spliterator(), false).toList()
                : List.of();

        ArrayNode out;
        switch (operation) {
            case "dedupe" -> out = dedupe(rows);
            case "filter" -> {
                String field = input.path("field").asText(null);
                if (field == null) return ToolResult.failure("'field' is required for filter");
                String value = input.path("value").asText("");
                out = MAPPER.createArrayNode();
                rows.stream().filter(r -> value.equals(r.path(field).asText())).forEach(out::add);
            }
            case "sort" -> {
                String field = input.path("field").asText(null);
                if (field == null) return ToolResult.failure("'field' is required for sort");
                out = MAPPER.createArrayNode();
                rows.stream().sorted(byField(field)).forEach(out::add);
            }
            default -> {
                String groupBy = input.path("groupBy").asText(null);
                if (groupBy == null) return ToolResult.failure("'groupBy' is required for " + operation);
                out = group(rows, groupBy, input.path("sum").asText(null));
            }
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("operation", operation);
        result.put("source", source);
        result.put("inputRows", rows.size());
        result.put("outputRows", out.size());
        result.set("rows", out);
        return ToolResult.success(result, out.size() + " rows");
    }

    private static ArrayNode dedupe(List<JsonNode> rows) {
        ArrayNode out = MAPPER.createArrayNode();
        new LinkedHashSet<>(rows).forEach(out::add);
        return out;
    }

    private static ArrayNode group(List<JsonNode> rows, String groupBy, String sumField) {
        Map<String, ObjectNode> groups = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            String key = row.path(groupBy).asText("");
            ObjectNode g = groups.computeIfAbsent(key, k -> {
                ObjectNode n = MAPPER.createObjectNode();
                n.put(groupBy, k);
                n.put("count", 0);
                if (sumField != null) n.put(sumField, 0.0);
                return n;
            });
            g.put("count", g.get("count").asInt() + 1);
            if (sumField != null) {
                g.put(sumField, g.get(sumField).asDouble() + row.path(sumField).asDouble(0));
            }
        }
        ArrayNode out = MAPPER.createArrayNode();
        groups.values().forEach(out::add);
        return out;
    }

    private static Comparator<JsonNode> byField(String field) {
        return (a, b) -> {
            JsonNode x = a.path(field);
            JsonNode y = b.path(field);
            if (x.isNumber() && y.isNumber()) return Double.compare(x.asDouble(), y.asDouble());
            return x.asText("").compareTo(y.asText(""));
        };
    }
}
