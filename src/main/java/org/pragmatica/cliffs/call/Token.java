package org.pragmatica.cliffs.call;

import org.pragmatica.cliffs.tree.SourceSpan;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A call token: optional kind tag, raw text as typed, span in the call string and logical value.
 *
 * <p>For quoted tokens the text keeps the quotes while the value is the unquoted content.
 */
public record Token(Optional<String> kind, String text, SourceSpan span, Object value) {
    public Token {
        checkNotNull(kind, "kind");
        checkNotNull(text, "text");
        checkNotNull(span, "span");
        checkNotNull(value, "value");
    }

    public static Token plain(String text, int start, int end) {
        return new Token(Optional.empty(), text, SourceSpan.of(start, end), text);
    }

    public static Token quoted(String text, int start, int end, String value) {
        return new Token(Optional.empty(), text, SourceSpan.of(start, end), value);
    }

    /**
     * Logical value as a string, the form literals and parameter types work with.
     */
    public String valueText() {
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return "'" + valueText() + "' at " + span.start();
    }
}
