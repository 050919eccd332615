package io.github.drompincen.agentinbox.runtime.action;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Closed vocabulary of side-effecting actions an agent can propose with an inline tag.
 * Whether an action needs human sign-off is fixed here, per type, not decided per call.
 */
public enum ActionType {

    DATA_EXPORT("data-export", true,
            p -> "Export " + str(p, "dataSource", "data") + " as " + str(p, "format", "csv").toUpperCase(Locale.ROOT)),
    DATA_TRANSFORM("data-transform", false,
            p -> "Transform " + str(p, "source", "data") + ": " + str(p, "operation", "transform")),
    SPREADSHEET_UPDATE("spreadsheet-update", true,
            p -> "Update spreadsheet " + str(p, "sheetName", "sheet") + " (" + str(p, "range", "all") + ")"),
    HUBSPOT_CREATE_CONTACT("hubspot-create-contact", true,
            p -> ("Create CRM contact " + str(p, "firstName", "") + " " + str(p, "lastName", "")).trim()
                    + " <" + str(p, "email", "?") + ">"),
    HUBSPOT_UPDATE_DEAL("hubspot-update-deal", true,
            p -> "Update deal " + str(p, "dealId", "?")),
    HUBSPOT_CREATE_TASK("hubspot-create-task", true,
            p -> "Create CRM task: " + str(p, "subject", "follow-up")),
    HUBSPOT_LOG_ACTIVITY("hubspot-log-activity", false,
            p -> "Log CRM activity for contact " + str(p, "contactId", "?")),
    GMAIL_SEND_MESSAGE("gmail-send-message", true,
            p -> "Send email to " + str(p, "to", "?") + ": subject " + str(p, "subject", "(none)")),
    GMAIL_DRAFT_EMAIL("gmail-draft-email", false,
            p -> "Draft email to " + str(p, "to", "?") + ": subject " + str(p, "subject", "(none)")),
    GMAIL_REPLY("gmail-reply", true,
            p -> "Reply in thread " + str(p, "threadId", str(p, "messageId", "?"))),
    CALENDAR_CREATE_EVENT("calendar-create-event", true,
            p -> "Schedule event " + str(p, "title", "(untitled)") + " at " + str(p, "start", "?")),
    WORKFLOW_TRIGGER("workflow-trigger", true,
            p -> "Trigger workflow " + str(p, "workflowId", "?")),
    EXTERNAL_API_CALL("external-api-call", true,
            p -> str(p, "method", "GET").toUpperCase(Locale.ROOT) + " " + str(p, "url", "?")),
    CUSTOM("custom", true,
            p -> "Custom action");

    private final String wireName;
    private final boolean requiresApproval;
    private final Function<Map<String, Object>, String> previewer;

    ActionType(String wireName, boolean requiresApproval, Function<Map<String, Object>, String> previewer) {
        this.wireName = wireName;
        this.requiresApproval = requiresApproval;
        this.previewer = previewer;
    }

    public String wireName() {
        return wireName;
    }

    public boolean requiresApproval() {
        return requiresApproval;
    }

    /** One-line description of the action for the approval card. */
    public String preview(Map<String, Object> params) {
        return previewer.apply(params != null ? params : Map.of());
    }

    public static Optional<ActionType> fromWire(String type) {
        if (type == null) return Optional.empty();
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t != CUSTOM && t.wireName.equals(normalized))
                .findFirst();
    }

    /** Unknown types fall back to {@link #CUSTOM}, which always requires approval. */
    public static ActionType classify(String type) {
        return fromWire(type).orElse(CUSTOM);
    }

    private static String str(Map<String, Object> params, String key, String fallback) {
        Object value = params.get(key);
        if (value == null) return fallback;
        String s = String.valueOf(value);
        return s.isBlank() ? fallback : s;
    }
}
