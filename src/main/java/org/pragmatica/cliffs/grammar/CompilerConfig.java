package org.pragmatica.cliffs.grammar;

/**
 * Grammar compilation options.
 */
public record CompilerConfig(
    SimplifyMode simplifyMode,
    boolean allCaseInsensitive
) {
    public static final CompilerConfig DEFAULT = new CompilerConfig(
        SimplifyMode.YES,
        false
    );

    public CompilerConfig withSimplifyMode(SimplifyMode simplifyMode) {
        return new CompilerConfig(simplifyMode, allCaseInsensitive);
    }

    public CompilerConfig withAllCaseInsensitive(boolean allCaseInsensitive) {
        return new CompilerConfig(simplifyMode, allCaseInsensitive);
    }
}
