package io.github.drompincen.agentinbox.runtime.action;

import java.util.Map;

/**
 * An action tag found in generated text.
 *
 * @param rawType the type exactly as written in the tag
 * @param start   offset of the opening {@code [[} in the scanned text
 * @param end     offset just past the closing {@code ]]}
 */
public record ToolAction(
        String id,
        ActionType type,
        String rawType,
        Map<String, Object> params,
        int start,
        int end
) {
    public boolean requiresApproval() {
        return type.requiresApproval();
    }

    public String preview() {
        if (type == ActionType.CUSTOM) {
            return "Custom action " + rawType;
        }
        return type.preview(params);
    }

    /** Name stored on approvals and used to look the action up in the tool registry. */
    public String wireType() {
        return type == ActionType.CUSTOM ? rawType : type.wireName();
    }
}
