package org.pragmatica.cliffs.grammar;

/**
 * What the grammar parser does with the tree flattening pass.
 */
public enum SimplifyMode {
    /**
     * Keep the tree exactly as written.
     */
    NO,
    /**
     * Keep the tree as written, log the simplified form when it differs.
     */
    WARN,
    /**
     * Flatten the tree, log when that changed it.
     */
    YES,
    /**
     * Flatten the tree without logging.
     */
    SILENTLY
}
