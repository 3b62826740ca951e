package com.biomech.cfpg;

import com.biomech.cfpg.api.BuildListener;
import com.biomech.cfpg.api.PathSet;
import com.biomech.cfpg.engine.Cfpg;
import com.biomech.cfpg.engine.CombinedCfpg;
import com.biomech.cfpg.engine.PathsGraph;
import com.biomech.cfpg.engine.PreCfpg;
import com.biomech.cfpg.engine.ReachableSets;
import com.biomech.cfpg.graph.DirectedGraph;
import com.biomech.cfpg.io.GraphLoader;
import com.biomech.cfpg.io.PathQueryOptions;
import com.biomech.cfpg.io.SifLoader;
import com.biomech.cfpg.util.CompositeBuildListener;
import com.biomech.cfpg.util.GraphExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Query facade over one read-only {@link DirectedGraph}.
 *
 * <p>
 * Answers sample, enumerate and count queries for either an exact path length
 * or every length from 1 up to a bound. Each query runs the full pipeline
 * (reach sets, paths graph, pre-CFPG, CFPG); reach sets are cached per
 * (source, target) pair and reused across lengths.
 *
 * <p>
 * <b>Thread Safety:</b> not thread-safe (the reach-set cache and the random
 * source are unguarded). Use one PathFinder per thread; the graph itself may
 * be shared.
 */
public final class PathFinder {
    private static final Logger log = LogManager.getLogger(PathFinder.class);

    private final DirectedGraph graph;
    private final PathQueryOptions options;
    private final Random random;
    private final CompositeBuildListener listeners = new CompositeBuildListener();
    private final Map<List<String>, ReachableSets> reachCache = new HashMap<>();

    public PathFinder(DirectedGraph graph) {
        this(graph, PathQueryOptions.defaults());
    }

    public PathFinder(DirectedGraph graph, PathQueryOptions options) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.options = Objects.requireNonNull(options, "options").validate();
        this.random = options.getSeed() != null ? new Random(options.getSeed()) : new Random();
    }

    /**
     * Creates a PathFinder over a JSON graph definition.
     *
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public static PathFinder fromJson(Path graphJson, PathQueryOptions options) {
        try {
            return new PathFinder(GraphLoader.load(graphJson), options);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph definition from " + graphJson, e);
        }
    }

    /**
     * Creates a PathFinder over a SIF file.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static PathFinder fromSif(Path sif, PathQueryOptions options) {
        try {
            return new PathFinder(SifLoader.load(sif), options);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SIF graph from " + sif, e);
        }
    }

    /**
     * Registers a listener for pre-CFPG builds. Adds to the existing listeners
     * rather than replacing them.
     */
    public void addListener(BuildListener listener) {
        listeners.addForComposite(listener);
    }

    public DirectedGraph graph() {
        return graph;
    }

    public PathQueryOptions options() {
        return options;
    }

    /** Drops every cached reach set. */
    public void clearCache() {
        reachCache.clear();
    }

    /**
     * Reach sets covering at least {@code depth}. Computed to the configured
     * max depth (or {@code depth}, if larger) and cached.
     */
    public ReachableSets reachableSets(String source, String target, int depth) {
        List<String> key = List.of(source, target);
        ReachableSets cached = reachCache.get(key);
        if (cached != null && cached.bound() >= depth)
            return cached;
        ReachableSets reach = ReachableSets.compute(graph, source, target, Math.max(depth, options.getMaxDepth()),
                options.isSigned());
        reachCache.put(key, reach);
        return reach;
    }

    public PathsGraph pathsGraph(String source, String target, int length) {
        if (length < 0)
            throw new IllegalArgumentException("Negative path length: " + length);
        ReachableSets reach = length == 0 ? null : reachableSets(source, target, length);
        return PathsGraph.fromGraph(graph, source, target, length, reach, options.isSigned(),
                options.getTargetPolarity());
    }

    public PreCfpg preCfpg(String source, String target, int length) {
        return PreCfpg.fromPathsGraph(pathsGraph(source, target, length), options.getMaxRounds(), listeners);
    }

    /**
     * Runs the full pipeline for one length.
     *
     * @throws com.biomech.cfpg.engine.ConvergenceException if the pre-CFPG
     *                                                      does not converge
     */
    public Cfpg cfpg(String source, String target, int length) {
        PathsGraph pg = pathsGraph(source, target, length);
        PreCfpg pre = PreCfpg.fromPathsGraph(pg, options.getMaxRounds(), listeners);
        Cfpg cfpg = Cfpg.fromPreCfpg(pre);
        log.info("{} -> {} length {}: paths graph {}/{}, pre-CFPG {}/{} in {} round(s), CFPG {}/{} (nodes/edges)",
                source, target, length, pg.graph().nodeCount(), pg.graph().edgeCount(), pre.graph().nodeCount(),
                pre.graph().edgeCount(), pre.rounds(), cfpg.graph().nodeCount(), cfpg.graph().edgeCount());
        if (log.isDebugEnabled())
            log.debug("\n{}{}{}", GraphExplain.explain(pg), GraphExplain.explain(pre), GraphExplain.explain(cfpg));
        return cfpg;
    }

    /**
     * The path set answering queries for one length: the CFPG, or the paths
     * graph when cycle-free filtering is switched off.
     */
    public PathSet pathSet(String source, String target, int length) {
        return options.isCycleFree() ? cfpg(source, target, length) : pathsGraph(source, target, length);
    }

    /** The path set over every length from 1 to {@code maxDepth}. */
    public PathSet pathSetUpTo(String source, String target, int maxDepth) {
        if (maxDepth < 0)
            throw new IllegalArgumentException("Negative max depth: " + maxDepth);
        if (options.isCycleFree()) {
            List<Cfpg> cfpgs = new ArrayList<>();
            for (int len = 1; len <= maxDepth; len++)
                cfpgs.add(cfpg(source, target, len));
            return new CombinedCfpg(cfpgs);
        }
        List<PathsGraph> graphs = new ArrayList<>();
        for (int len = 1; len <= maxDepth; len++)
            graphs.add(pathsGraph(source, target, len));
        return new WalkMixture(graphs);
    }

    public List<List<String>> samplePaths(String source, String target, int length, int numSamples) {
        return pathSet(source, target, length).samplePaths(numSamples, random);
    }

    /** Samples the configured number of paths. */
    public List<List<String>> samplePaths(String source, String target, int length) {
        return samplePaths(source, target, length, options.getNumSamples());
    }

    public List<List<String>> enumeratePaths(String source, String target, int length) {
        return pathSet(source, target, length).enumeratePaths();
    }

    public long countPaths(String source, String target, int length) {
        return pathSet(source, target, length).countPaths();
    }

    public List<List<String>> samplePathsUpTo(String source, String target, int maxDepth, int numSamples) {
        return pathSetUpTo(source, target, maxDepth).samplePaths(numSamples, random);
    }

    /** Samples the configured number of paths over lengths 1 to the configured max depth. */
    public List<List<String>> samplePathsUpTo(String source, String target) {
        return samplePathsUpTo(source, target, options.getMaxDepth(), options.getNumSamples());
    }

    public List<List<String>> enumeratePathsUpTo(String source, String target, int maxDepth) {
        return pathSetUpTo(source, target, maxDepth).enumeratePaths();
    }

    public long countPathsUpTo(String source, String target, int maxDepth) {
        return pathSetUpTo(source, target, maxDepth).countPaths();
    }

    /**
     * Walks of several lengths. A sample first picks a length in proportion to
     * its number of walks, then walks that length's paths graph.
     */
    private static final class WalkMixture implements PathSet {
        private final List<PathsGraph> graphs = new ArrayList<>();
        private final long[] counts;
        private final long total;

        WalkMixture(List<PathsGraph> all) {
            for (PathsGraph pg : all)
                if (!pg.isEmpty())
                    graphs.add(pg);
            counts = new long[graphs.size()];
            long sum = 0;
            for (int i = 0; i < counts.length; i++) {
                counts[i] = graphs.get(i).countPaths();
                sum = Math.addExact(sum, counts[i]);
            }
            total = sum;
        }

        @Override
        public boolean isEmpty() {
            return graphs.isEmpty();
        }

        @Override
        public List<List<String>> samplePaths(int numSamples, Random random) {
            if (numSamples < 0)
                throw new IllegalArgumentException("Negative sample count: " + numSamples);
            List<List<String>> out = new ArrayList<>(numSamples);
            if (isEmpty())
                return out;
            for (int n = 0; n < numSamples; n++) {
                double r = random.nextDouble() * total;
                int pick = counts.length - 1;
                double acc = 0;
                for (int i = 0; i < counts.length; i++) {
                    acc += counts[i];
                    if (r < acc) {
                        pick = i;
                        break;
                    }
                }
                out.addAll(graphs.get(pick).samplePaths(1, random));
            }
            return out;
        }

        @Override
        public List<List<String>> enumeratePaths() {
            List<List<String>> out = new ArrayList<>();
            for (PathsGraph pg : graphs)
                out.addAll(pg.enumeratePaths());
            return out;
        }

        @Override
        public long countPaths() {
            return total;
        }
    }
}
