package io.github.drompincen.agentinbox.protocol.event;

/**
 * Token counts for one turn. {@code estimated} is true when the provider reported nothing
 * and the counts were derived from text length.
 */
public record TokenUsage(int promptTokens, int completionTokens, boolean estimated) {

    public static final TokenUsage NONE = new TokenUsage(0, 0, false);

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) return this;
        return new TokenUsage(promptTokens + other.promptTokens,
                completionTokens + other.completionTokens,
                estimated || other.estimated);
    }

    public static TokenUsage estimate(int promptChars, int completionChars) {
        return new TokenUsage(promptChars / 4, completionChars / 4, true);
    }
}
