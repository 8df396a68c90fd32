package org.pragmatica.cliffs.call;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient boolean conversion: numbers first (non-zero is true), then common yes/no words.
 */
public final class LooseBoolean {
    private static final Set<String> AFFIRMATIVE = Set.of("y", "yes", "t", "true", "do", "ok", "sure", "alright");
    private static final Set<String> NEGATIVE = Set.of("n", "no", "f", "false", "dont");

    private LooseBoolean() {}

    public static Boolean parse(String text) {
        var trimmed = text.strip();
        var number = parseNumber(trimmed);
        if (number.isPresent()) {
            return number.get() != 0.0;
        }
        var word = trimmed.toLowerCase(Locale.ROOT);
        if (AFFIRMATIVE.contains(word)) {
            return Boolean.TRUE;
        }
        if (NEGATIVE.contains(word)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("String '" + trimmed + "' cannot be loosely converted to a boolean");
    }

    private static Optional<Double> parseNumber(String text) {
        try{
            return Optional.of(Double.valueOf(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
