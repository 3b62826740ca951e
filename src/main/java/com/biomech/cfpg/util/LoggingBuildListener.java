package com.biomech.cfpg.util;

import com.biomech.cfpg.api.BuildListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logs the progress of pre-CFPG builds and keeps simple totals.
 *
 * <p>
 * Rounds are logged at DEBUG and levels at TRACE. The counters cover every
 * build the listener has observed.
 */
public final class LoggingBuildListener implements BuildListener {
    private static final Logger log = LogManager.getLogger(LoggingBuildListener.class);

    private long roundStartNanos, lastRoundNanos;
    private long totalRounds, totalBuilds;
    private int lastRounds, maxRounds;

    @Override
    public void onRoundStart(int round, int nodes, int edges) {
        roundStartNanos = System.nanoTime();
        if (round == 1)
            totalBuilds++;
        log.debug("Round {} start: {} nodes, {} edges", round, nodes, edges);
    }

    @Override
    public void onLevelProcessed(int round, int level, int nodes, int edges) {
        log.trace("Round {} level {}: {} nodes, {} edges", round, level, nodes, edges);
    }

    @Override
    public void onRoundEnd(int round, int edges, boolean converged) {
        lastRoundNanos = System.nanoTime() - roundStartNanos;
        totalRounds++;
        lastRounds = round;
        if (round > maxRounds)
            maxRounds = round;
        log.debug("Round {} end: {} edges, converged={} ({} us)", round, edges, converged,
                lastRoundNanos / 1000);
    }

    /** Rounds taken by the most recent build (so far, if it is still running). */
    public int lastRounds() {
        return lastRounds;
    }

    /** Most rounds any observed build needed. */
    public int maxRounds() {
        return maxRounds;
    }

    public long totalRounds() {
        return totalRounds;
    }

    public long totalBuilds() {
        return totalBuilds;
    }

    public long lastRoundNanos() {
        return lastRoundNanos;
    }

    public double avgRoundsPerBuild() {
        return totalBuilds > 0 ? (double) totalRounds / totalBuilds : 0;
    }
}
