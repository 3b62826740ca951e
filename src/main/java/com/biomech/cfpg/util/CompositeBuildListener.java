package com.biomech.cfpg.util;

import com.biomech.cfpg.api.BuildListener;
import java.util.Arrays;

/**
 * Fans {@link BuildListener} callbacks out to several listeners, in
 * registration order.
 */
public class CompositeBuildListener implements BuildListener {
    private BuildListener[] listeners = new BuildListener[0];

    public void addForComposite(BuildListener listener) {
        BuildListener[] old = listeners;
        BuildListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRoundStart(int round, int nodes, int edges) {
        for (BuildListener l : listeners)
            l.onRoundStart(round, nodes, edges);
    }

    @Override
    public void onLevelProcessed(int round, int level, int nodes, int edges) {
        for (BuildListener l : listeners)
            l.onLevelProcessed(round, level, nodes, edges);
    }

    @Override
    public void onRoundEnd(int round, int edges, boolean converged) {
        for (BuildListener l : listeners)
            l.onRoundEnd(round, edges, converged);
    }
}
