package org.pragmatica.cliffs.call;

/**
 * How unordered groups search for an order of their children.
 */
public enum UnorderedStrategy {
    /**
     * Each round commits the best-scoring child that matches at the current position.
     * Linear number of rounds, but an early choice may rule out a better overall assignment.
     */
    GREEDY,
    /**
     * Try every permutation of the children and keep the best-scoring complete match.
     * Finds the best assignment at factorial cost in the group size.
     */
    PERMUTATION
}
