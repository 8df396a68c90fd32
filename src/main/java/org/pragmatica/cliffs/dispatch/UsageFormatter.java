package org.pragmatica.cliffs.dispatch;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.util.ArrayList;
import java.util.List;

/**
 * Word wrapping for usage help.
 */
public final class UsageFormatter {
    public static final int DEFAULT_MAX_WIDTH = 70;
    public static final int DEFAULT_INDENT = 4;

    private static final Splitter WORDS = Splitter.onPattern("\\s+").omitEmptyStrings();

    private UsageFormatter() {}

    /**
     * Wrap text into lines of at most {@code maxWidth} characters, each prefixed with
     * {@code indent} spaces. Words are never split, so a word longer than the width gets a line of
     * its own. A width of 0 disables wrapping.
     */
    public static List<String> wrap(String text, int maxWidth, int indent) {
        var prefix = Strings.repeat(" ", indent);
        if (maxWidth == 0) {
            return List.of(prefix + text);
        }
        var lines = new ArrayList<String>();
        var line = new StringBuilder(prefix);
        for (var word : WORDS.split(text)) {
            if (line.length() > prefix.length() && line.length() + 1 + word.length() > maxWidth) {
                lines.add(line.toString());
                line.setLength(0);
                line.append(prefix);
            }
            if (line.length() > prefix.length()) {
                line.append(' ');
            }
            line.append(word);
        }
        if (line.length() > prefix.length()) {
            lines.add(line.toString());
        }
        return lines;
    }
}
