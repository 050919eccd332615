package io.github.drompincen.agentinbox.runtime.action;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code [[TOOL_ACTION: {...}]]} tags in agent output. The tag body runs to the brace
 * that closes its opening brace, so params may nest objects and arrays freely.
 */
@Component
public class ToolActionExtractor {

    private static final Logger log = LoggerFactory.getLogger(ToolActionExtractor.class);

    static final String TAG_OPEN = "[[TOOL_ACTION:";
    static final String TAG_CLOSE = "]]";

    /** Fallback for bodies whose braces or quotes do not balance. */
    private static final Pattern LENIENT_TAG = Pattern.compile(
            "\\[\\[TOOL_ACTION:\\s*(\\{.*?\\})\\s*\\]\\]", Pattern.DOTALL);

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ToolActionExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    record Tag(int start, int end, String body) {}

    /**
     * Returns every well-formed tag in order of appearance. Tags whose body is not a JSON
     * object with a {@code type} are skipped.
     */
    public List<ToolAction> extract(String text) {
        List<ToolAction> actions = new ArrayList<>();
        if (text == null || text.isEmpty()) return actions;

        for (Tag tag : findTags(text)) {
            try {
                JsonNode node = objectMapper.readTree(tag.body());
                String type = node.path("type").asText("");
                if (type.isBlank()) {
                    log.warn("Ignoring tool action without type: {}", abbreviate(tag.body()));
                    continue;
                }
                Map<String, Object> params = node.path("params").isObject()
                        ? objectMapper.convertValue(node.get("params"), PARAMS_TYPE)
                        : new LinkedHashMap<>();
                actions.add(new ToolAction("action-" + UUID.randomUUID(), ActionType.classify(type),
                        type.trim(), params, tag.start(), tag.end()));
            } catch (Exception e) {
                log.warn("Failed to parse tool action: {}", abbreviate(tag.body()));
            }
        }
        return actions;
    }

    public boolean hasToolActions(String text) {
        return text != null && !findTags(text).isEmpty();
    }

    /**
     * Removes all tags, malformed ones included. Repeats until nothing is found so that a tag
     * exposed by removing an inner one is also removed.
     */
    public String strip(String text) {
        if (text == null) return "";
        String current = text;
        while (true) {
            List<Tag> tags = findTags(current);
            if (tags.isEmpty()) return current;
            StringBuilder sb = new StringBuilder(current.length());
            int last = 0;
            for (Tag tag : tags) {
                sb.append(current, last, tag.start());
                last = tag.end();
            }
            sb.append(current, last, current.length());
            current = sb.toString();
        }
    }

    List<Tag> findTags(String text) {
        List<Tag> tags = new ArrayList<>();
        int from = 0;
        while (true) {
            int open = text.indexOf(TAG_OPEN, from);
            if (open < 0) return tags;
            Tag tag = readTag(text, open);
            if (tag == null) {
                from = open + TAG_OPEN.length();
            } else {
                tags.add(tag);
                from = tag.end();
            }
        }
    }

    private static Tag readTag(String text, int open) {
        int bodyStart = skipWhitespace(text, open + TAG_OPEN.length());
        if (bodyStart < text.length() && text.charAt(bodyStart) == '{') {
            int bodyEnd = closingBrace(text, bodyStart);
            if (bodyEnd > 0) {
                int close = skipWhitespace(text, bodyEnd);
                if (text.startsWith(TAG_CLOSE, close)) {
                    return new Tag(open, close + TAG_CLOSE.length(), text.substring(bodyStart, bodyEnd));
                }
            }
        }
        Matcher lenient = LENIENT_TAG.matcher(text).region(open, text.length());
        return lenient.lookingAt() ? new Tag(open, lenient.end(), lenient.group(1)) : null;
    }

    /** Index just past the brace matching the one at {@code start}, or -1. Braces inside strings do not count. */
    private static int closingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
            } else if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i + 1;
            }
        }
        return -1;
    }

    private static int skipWhitespace(String text, int i) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }

    public String preview(String text, int maxChars) {
        String stripped = strip(text).trim();
        return stripped.length() <= maxChars ? stripped : stripped.substring(0, maxChars);
    }

    private static String abbreviate(String s) {
        return s.length() > 120 ? s.substring(0, 120) + "..." : s;
    }
}
