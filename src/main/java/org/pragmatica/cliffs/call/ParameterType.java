package org.pragmatica.cliffs.call;

/**
 * Converts a call token into a typed parameter value.
 *
 * <p>Implementations signal a token that is not a valid value by throwing
 * {@link IllegalArgumentException} (which includes {@link NumberFormatException}).
 */
@FunctionalInterface
public interface ParameterType<T> {
    T parse(String text);
}
