package io.github.drompincen.agentinbox.runtime.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code @name} tokens in user text. An {@code @} inside a word, as in an email
 * address, is not a mention.
 */
public final class MentionParser {

    private static final Pattern MENTION = Pattern.compile("(?<![\\w@.])@([A-Za-z][\\w-]*)");

    private MentionParser() {}

    public record Mention(String name, int start, int end) {}

    public static List<Mention> find(String text) {
        List<Mention> mentions = new ArrayList<>();
        if (text == null) return mentions;
        Matcher m = MENTION.matcher(text);
        while (m.find()) {
            mentions.add(new Mention(m.group(1), m.start(), m.end()));
        }
        return mentions;
    }

    /**
     * Removes the mention and collapses the whitespace around it. Returns the original text
     * when nothing else is left.
     */
    public static String strip(String text, Mention mention) {
        String stripped = (text.substring(0, mention.start()) + " " + text.substring(mention.end()))
                .replaceAll("[ \\t]{2,}", " ")
                .strip();
        return stripped.isEmpty() ? text : stripped;
    }
}
