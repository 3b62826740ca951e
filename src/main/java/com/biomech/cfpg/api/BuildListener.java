package com.biomech.cfpg.api;

/**
 * Observability hook for the pre-CFPG fixed-point loop.
 *
 * A round sweeps every level of the graph once. Callbacks run synchronously
 * on the building thread.
 */
public interface BuildListener {

    BuildListener NONE = new BuildListener() {
    };

    /**
     * Called before a round begins.
     *
     * @param round 1-based round number
     * @param nodes node count of the round's input graph
     * @param edges edge count of the round's input graph
     */
    default void onRoundStart(int round, int nodes, int edges) {
    }

    /**
     * Called after one level of a round has been merged.
     *
     * @param round     current round
     * @param level     depth that was processed
     * @param nodes     node count of the graph after this level
     * @param edges     edge count of the graph after this level
     */
    default void onLevelProcessed(int round, int level, int nodes, int edges) {
    }

    /**
     * Called when a round completes.
     *
     * @param round     current round
     * @param edges     edge count at the end of the round
     * @param converged true if the round left the edge set unchanged or empty
     */
    default void onRoundEnd(int round, int edges, boolean converged) {
    }
}
