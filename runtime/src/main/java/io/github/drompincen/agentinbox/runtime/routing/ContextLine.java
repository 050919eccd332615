package io.github.drompincen.agentinbox.runtime.routing;

/** A prior message as seen by the classifier. */
public record ContextLine(String role, String content) {

    public String format(int maxChars) {
        String text = content == null ? "" : content.strip();
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars);
        }
        return role + ": " + text;
    }
}
