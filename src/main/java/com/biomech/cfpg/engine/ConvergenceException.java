package com.biomech.cfpg.engine;

/**
 * Raised when the pre-CFPG fixed-point loop has not settled within the
 * configured number of rounds.
 */
public class ConvergenceException extends IllegalStateException {
    private final int rounds;

    public ConvergenceException(int rounds, int edges) {
        super("Pre-CFPG did not converge after " + rounds + " rounds (" + edges + " edges still changing)");
        this.rounds = rounds;
    }

    public int rounds() {
        return rounds;
    }
}
