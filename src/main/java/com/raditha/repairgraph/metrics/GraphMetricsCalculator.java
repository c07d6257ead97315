package com.raditha.repairgraph.metrics;

import com.raditha.repairgraph.cache.GraphCache;
import com.raditha.repairgraph.callgraph.CallGraphBuilder;
import com.raditha.repairgraph.cfg.ControlFlowGraphBuilder;
import com.raditha.repairgraph.config.AnalysisConfig;
import com.raditha.repairgraph.dfg.DataFlowGraphBuilder;
import com.raditha.repairgraph.extraction.AnalysisUnit;
import com.raditha.repairgraph.extraction.FilePair;
import com.raditha.repairgraph.extraction.SourceFile;
import com.raditha.repairgraph.extraction.SourceUnitParser;
import com.raditha.repairgraph.ged.GedResult;
import com.raditha.repairgraph.ged.GraphEditDistance;
import com.raditha.repairgraph.merge.GraphMerger;
import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.GraphBuildException;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the distance between two versions of some code for every requested graph kind.
 * <p>
 * Each graph is built once per side: merged kinds reuse the control-flow, data-flow and call
 * graphs built for the plain kinds. A kind that cannot be built on either side is reported as
 * unavailable with the reason; it never turns into a zero distance and never hides the other kinds.
 */
public class GraphMetricsCalculator {
    private static final Logger logger = LoggerFactory.getLogger(GraphMetricsCalculator.class);

    public static final String SNIPPET_PATH = "snippet.java";

    private final AnalysisConfig config;
    private final GraphCache cache;
    private final GraphEditDistance engine;
    private final SourceUnitParser parser = new SourceUnitParser();
    private final BasicMetricsCalculator basicCalculator = new BasicMetricsCalculator();

    public GraphMetricsCalculator(AnalysisConfig config) {
        this(config, config.cacheEnabled() ? new GraphCache() : null);
    }

    /**
     * @param cache shared graph cache, or null to build every graph afresh
     */
    public GraphMetricsCalculator(AnalysisConfig config, GraphCache cache) {
        this.config = config;
        this.cache = cache;
        this.engine = config.gedEngine();
    }

    /**
     * Compare two versions of a single snippet.
     */
    public GraphMetricsReport compute(String before, String after) {
        return compute(SNIPPET_PATH, List.of(new FilePair(SNIPPET_PATH, before, after)));
    }

    /**
     * Compare two versions of a set of files analysed as one unit. Pairs beyond the configured
     * scope limit are dropped.
     */
    public GraphMetricsReport compute(String name, List<FilePair> pairs) {
        List<FilePair> scope = pairs;
        int dropped = 0;
        if (pairs.size() > config.maxScopeFiles()) {
            dropped = pairs.size() - config.maxScopeFiles();
            scope = pairs.subList(0, config.maxScopeFiles());
            logger.warn("{}: analysing the first {} of {} files, {} dropped",
                    name, config.maxScopeFiles(), pairs.size(), dropped);
        }

        Side before = new Side(name, scope, true);
        Side after = new Side(name, scope, false);
        Map<GraphKind, GraphMetric> metrics = new EnumMap<>(GraphKind.class);
        for (GraphKind kind : GraphKind.values()) {
            if (config.kinds().contains(kind)) {
                metrics.put(kind, measure(name, kind, before, after));
            }
        }

        BasicMetrics basic = BasicMetrics.EMPTY;
        for (int i = 0; i < scope.size(); i++) {
            basic = basic.plus(basicCalculator.compute(scope.get(i), before.file(i), after.file(i)));
        }
        SyntaxMetrics syntax = before.parsed() && after.parsed()
                ? SyntaxMetrics.between(before.files, after.files)
                : null;
        int defUseBefore = BasicMetrics.UNAVAILABLE;
        int defUseAfter = BasicMetrics.UNAVAILABLE;
        if (usesDataFlow()) {
            defUseBefore = defUseChains(name, before);
            defUseAfter = defUseChains(name, after);
        }
        return new GraphMetricsReport(name, metrics, basic, scope.size(), dropped,
                syntax, defUseBefore, defUseAfter);
    }

    private boolean usesDataFlow() {
        return config.kinds().contains(GraphKind.DFG)
                || config.kinds().contains(GraphKind.PDG)
                || config.kinds().contains(GraphKind.CPG);
    }

    private int defUseChains(String name, Side side) {
        try {
            return defUseChains(side.graph(GraphKind.DFG));
        } catch (GraphBuildException e) {
            logger.debug("{}: no def-use chains: {}", name, e.getMessage());
            return BasicMetrics.UNAVAILABLE;
        }
    }

    /**
     * Def-use edges that end in a variable use; edges into merge points are not chains.
     */
    static int defUseChains(ProgramGraph dfg) {
        int chains = 0;
        for (ProgramEdge edge : dfg.edgesOfKind(EdgeKind.DEF_USE)) {
            if (dfg.node(edge.target()).kind() == NodeKind.VARIABLE_USE) {
                chains++;
            }
        }
        return chains;
    }

    private GraphMetric measure(String name, GraphKind kind, Side before, Side after) {
        ProgramGraph a;
        ProgramGraph b;
        try {
            a = before.graph(kind);
        } catch (GraphBuildException e) {
            logger.warn("{}: no {} before the change: {}", name, kind, e.getMessage());
            return GraphMetric.unavailable(kind, "before: " + e.getMessage());
        }
        try {
            b = after.graph(kind);
        } catch (GraphBuildException e) {
            logger.warn("{}: no {} after the change: {}", name, kind, e.getMessage());
            return GraphMetric.unavailable(kind, "after: " + e.getMessage());
        }
        GedResult result = config.isAdaptiveWidth()
                ? engine.compute(a, b)
                : engine.compute(a, b, config.beamWidth());
        logger.debug("{}: {} ged={} ({})", name, kind, result.ged(), result.method());
        return GraphMetric.measured(kind, result);
    }

    /**
     * One version of the compared files, parsed and built lazily, each at most once.
     */
    private final class Side {
        private final String name;
        private final List<FilePair> pairs;
        private final boolean before;
        private final String identity;
        private final Map<GraphKind, ProgramGraph> built = new EnumMap<>(GraphKind.class);
        private final Map<GraphKind, GraphBuildException> failed = new EnumMap<>(GraphKind.class);
        private List<SourceFile> files;
        private GraphBuildException parseFailure;

        Side(String name, List<FilePair> pairs, boolean before) {
            this.name = name;
            this.pairs = pairs;
            this.before = before;
            StringBuilder sb = new StringBuilder(name).append('\0');
            for (FilePair pair : pairs) {
                sb.append(pair.path()).append('\0').append(text(pair)).append('\0');
            }
            this.identity = sb.toString();
        }

        ProgramGraph graph(GraphKind kind) throws GraphBuildException {
            ProgramGraph graph = built.get(kind);
            if (graph != null) {
                return graph;
            }
            if (failed.containsKey(kind)) {
                throw failed.get(kind);
            }
            try {
                graph = construct(kind);
                built.put(kind, graph);
                return graph;
            } catch (GraphBuildException e) {
                failed.put(kind, e);
                throw e;
            }
        }

        /**
         * Component graphs of merged kinds are fetched before entering the cache, so a cache
         * computation never nests inside another.
         */
        private ProgramGraph construct(GraphKind kind) throws GraphBuildException {
            switch (kind) {
                case CFG:
                    return cached(kind, () -> new ControlFlowGraphBuilder(config.blockPolicy()).build(unit()));
                case DFG:
                    return cached(kind, () -> new DataFlowGraphBuilder().build(unit()));
                case CALL_GRAPH:
                    return cached(kind, () -> new CallGraphBuilder().build(unit()));
                case PDG: {
                    ProgramGraph cfg = graph(GraphKind.CFG);
                    ProgramGraph dfg = graph(GraphKind.DFG);
                    return cached(kind, () -> GraphMerger.programDependenceGraph(cfg, dfg));
                }
                case CPG: {
                    ProgramGraph pdg = graph(GraphKind.PDG);
                    ProgramGraph callGraph = graph(GraphKind.CALL_GRAPH);
                    return cached(kind, () -> GraphMerger.codePropertyGraph(pdg, callGraph));
                }
                default:
                    throw new IllegalArgumentException("Unsupported graph kind " + kind);
            }
        }

        private ProgramGraph cached(GraphKind kind, GraphCache.GraphSupplier builder) throws GraphBuildException {
            if (cache == null) {
                return builder.build();
            }
            return cache.get(kind, config.blockPolicy(), identity, builder);
        }

        AnalysisUnit unit() throws GraphBuildException {
            parse();
            if (parseFailure != null) {
                throw parseFailure;
            }
            return new AnalysisUnit(name, files);
        }

        boolean parsed() {
            parse();
            return parseFailure == null;
        }

        /**
         * The parsed file at this index, or null when it did not parse.
         */
        SourceFile file(int index) {
            parse();
            return files.get(index);
        }

        private void parse() {
            if (files != null) {
                return;
            }
            files = new ArrayList<>();
            for (FilePair pair : pairs) {
                try {
                    files.add(parser.parse(pair.path(), text(pair)).files().get(0));
                } catch (GraphBuildException e) {
                    files.add(null);
                    if (parseFailure == null) {
                        parseFailure = e;
                    }
                }
            }
        }

        private String text(FilePair pair) {
            return before ? pair.before() : pair.after();
        }
    }
}
