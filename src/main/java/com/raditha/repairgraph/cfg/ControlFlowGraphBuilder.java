package com.raditha.repairgraph.cfg;

import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.UnparsableStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.raditha.repairgraph.extraction.AnalysisUnit;
import com.raditha.repairgraph.extraction.Callable;
import com.raditha.repairgraph.extraction.CallableCollector;
import com.raditha.repairgraph.extraction.StatementKeys;
import com.raditha.repairgraph.extraction.StatementShapes;
import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.GraphBuildException;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import com.raditha.repairgraph.model.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the control-flow graph of an analysis unit.
 * <p>
 * Every callable gets its own entry and exit node. A synthetic unit entry links to each
 * callable entry in declaration order, so the whole graph has a single entry. The walk
 * threads a set of pending exits (node id plus the kind of the edge that will leave it)
 * through the statements; each statement connects the pending exits to its first node and
 * returns its own exits.
 * <p>
 * A {@code finally} block gets one copy of its nodes. Returns, breaks, continues and uncaught
 * throws that leave its try or catch blocks run through it before going on to their targets.
 * <p>
 * Code after an unconditional jump still gets nodes. Such nodes are flagged
 * {@link ProgramNode#ATTR_UNREACHABLE} after the walk.
 */
public class ControlFlowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    public static final String UNIT_ENTRY_LABEL = "unit";
    public static final String EXIT_LABEL = "exit";

    private final BlockPolicy blockPolicy;

    public ControlFlowGraphBuilder() {
        this(BlockPolicy.STATEMENT);
    }

    public ControlFlowGraphBuilder(BlockPolicy blockPolicy) {
        this.blockPolicy = blockPolicy;
    }

    /**
     * Build the CFG of every callable in the unit.
     *
     * @throws GraphBuildException if a body contains a construct that cannot be decomposed
     */
    public ProgramGraph build(AnalysisUnit unit) throws GraphBuildException {
        ProgramGraph.Builder graph = ProgramGraph.builder(GraphKind.CFG, unit.name());
        int unitEntry = graph.addNode(NodeKind.FUNCTION_ENTRY, UNIT_ENTRY_LABEL, SourcePosition.UNKNOWN);
        graph.setEntry(unitEntry);

        for (Callable callable : CallableCollector.callables(unit)) {
            int entry = new CallableWalker(graph, callable).walk();
            graph.addEdge(unitEntry, entry, EdgeKind.CONTROL_FLOW);
        }

        flagUnreachable(graph, unitEntry);
        if (blockPolicy == BlockPolicy.BASIC_BLOCK) {
            BasicBlockCoalescer.coalesce(graph);
        }

        ProgramGraph cfg = graph.build();
        logger.debug("Built {}", cfg);
        return cfg;
    }

    private static void flagUnreachable(ProgramGraph.Builder graph, int entry) {
        Set<Integer> reachable = graph.reachableFrom(entry, e -> e.kind().isControlFlow());
        List<ProgramNode> unreachable = graph.nodes().stream()
                .filter(n -> !reachable.contains(n.id()))
                .toList();
        for (ProgramNode node : unreachable) {
            graph.replaceNode(node.withAttribute(ProgramNode.ATTR_UNREACHABLE, "true"));
        }
        if (!unreachable.isEmpty()) {
            logger.debug("{} unreachable control-flow nodes", unreachable.size());
        }
    }

    /**
     * Where control goes next: the node it leaves and the kind of the edge it leaves on.
     */
    private record Exit(int node, EdgeKind kind) {
    }

    /**
     * A statement that break or continue can name.
     */
    private static final class JumpTarget {
        final String label;
        final Integer continueTarget;
        final boolean breakable;
        final Set<Exit> breaks = new LinkedHashSet<>();

        JumpTarget(String label, Integer continueTarget, boolean breakable) {
            this.label = label;
            this.continueTarget = continueTarget;
            this.breakable = breakable;
        }
    }

    /**
     * Where an abrupt jump goes: the exit when {@code target} is null, otherwise the break or
     * continue target.
     */
    private record Destination(JumpTarget target, boolean isContinue) {
        static final Destination RETURN = new Destination(null, false);
    }

    /**
     * A try statement with a finally block, collecting the jumps that leave it.
     */
    private static final class FinallyFrame {
        final int targetDepth;
        final Map<Destination, Set<Exit>> jumps = new LinkedHashMap<>();

        FinallyFrame(int targetDepth) {
            this.targetDepth = targetDepth;
        }
    }

    /**
     * Walks one callable body. One instance per callable.
     */
    private static final class CallableWalker {
        private final ProgramGraph.Builder graph;
        private final Callable callable;
        private final Deque<JumpTarget> targets = new ArrayDeque<>();
        private final Deque<List<Integer>> handlers = new ArrayDeque<>();
        private final Deque<FinallyFrame> finallies = new ArrayDeque<>();
        private final Map<String, String> attributes;
        private int exit;
        private String pendingLabel;

        CallableWalker(ProgramGraph.Builder graph, Callable callable) {
            this.graph = graph;
            this.callable = callable;
            this.attributes = Map.of(ProgramNode.ATTR_CALLABLE, callable.signature());
        }

        int walk() throws GraphBuildException {
            int entry = graph.addNode(NodeKind.FUNCTION_ENTRY, callable.signature(), callable.position(),
                    Set.of(callable.entryKey()), attributes);
            exit = graph.addNode(NodeKind.FUNCTION_EXIT, EXIT_LABEL, callable.position(), Set.of(), attributes);
            connect(visit(callable.body(), exits(entry, EdgeKind.CONTROL_FLOW)), exit);
            return entry;
        }

        private Set<Exit> visit(Statement statement, Set<Exit> preds) throws GraphBuildException {
            if (statement instanceof BlockStmt block) {
                return visitAll(block.getStatements(), preds);
            }
            if (statement instanceof EmptyStmt) {
                return preds;
            }
            if (statement instanceof LabeledStmt labeled) {
                return visitLabeled(labeled, preds);
            }
            if (statement instanceof IfStmt ifStmt) {
                return visitIf(ifStmt, preds);
            }
            if (statement instanceof WhileStmt || statement instanceof ForStmt || statement instanceof ForEachStmt) {
                return visitLoop(statement, loopBody(statement), preds);
            }
            if (statement instanceof DoStmt doStmt) {
                return visitDo(doStmt, preds);
            }
            if (statement instanceof SwitchStmt switchStmt) {
                return visitSwitch(switchStmt, preds);
            }
            if (statement instanceof TryStmt tryStmt) {
                return visitTry(tryStmt, preds);
            }
            if (statement instanceof BreakStmt breakStmt) {
                return visitBreak(breakStmt, preds);
            }
            if (statement instanceof ContinueStmt continueStmt) {
                return visitContinue(continueStmt, preds);
            }
            if (statement instanceof ReturnStmt) {
                jump(exits(statementNode(statement, preds), EdgeKind.CONTROL_FLOW), Destination.RETURN);
                return Set.of();
            }
            if (statement instanceof ThrowStmt) {
                int node = statementNode(statement, preds);
                if (handlers.isEmpty()) {
                    jump(exits(node, EdgeKind.CONTROL_FLOW), Destination.RETURN);
                }
                return Set.of();
            }
            if (statement instanceof SynchronizedStmt sync) {
                int node = statementNode(statement, preds);
                return visit(sync.getBody(), exits(node, EdgeKind.CONTROL_FLOW));
            }
            if (statement instanceof YieldStmt) {
                throw new GraphBuildException("yield outside of a switch expression", GraphKind.CFG,
                        SourcePosition.of(statement));
            }
            if (statement instanceof UnparsableStmt) {
                throw new GraphBuildException("Unparsable statement", GraphKind.CFG, SourcePosition.of(statement));
            }
            return exits(statementNode(statement, preds), EdgeKind.CONTROL_FLOW);
        }

        private Set<Exit> visitAll(List<Statement> statements, Set<Exit> preds) throws GraphBuildException {
            Set<Exit> current = preds;
            for (Statement statement : statements) {
                current = visit(statement, current);
            }
            return current;
        }

        private Set<Exit> visitLabeled(LabeledStmt labeled, Set<Exit> preds) throws GraphBuildException {
            String label = labeled.getLabel().asString();
            Statement inner = labeled.getStatement();
            if (isLoopOrSwitch(inner)) {
                pendingLabel = label;
                return visit(inner, preds);
            }
            JumpTarget target = new JumpTarget(label, null, false);
            targets.push(target);
            Set<Exit> out = new LinkedHashSet<>(visit(inner, preds));
            targets.pop();
            out.addAll(target.breaks);
            return out;
        }

        private Set<Exit> visitIf(IfStmt ifStmt, Set<Exit> preds) throws GraphBuildException {
            int branch = statementNode(ifStmt, preds);
            Set<Exit> out = new LinkedHashSet<>(visit(ifStmt.getThenStmt(), exits(branch, EdgeKind.CONTROL_FLOW_TRUE)));
            if (ifStmt.getElseStmt().isPresent()) {
                out.addAll(visit(ifStmt.getElseStmt().get(), exits(branch, EdgeKind.CONTROL_FLOW_FALSE)));
            } else {
                out.add(new Exit(branch, EdgeKind.CONTROL_FLOW_FALSE));
            }
            return out;
        }

        private Set<Exit> visitLoop(Statement loop, Statement body, Set<Exit> preds) throws GraphBuildException {
            String label = takeLabel();
            int header = statementNode(loop, preds);
            JumpTarget target = new JumpTarget(label, header, true);
            targets.push(target);
            Set<Exit> bodyExits = visit(body, exits(header, EdgeKind.CONTROL_FLOW_TRUE));
            targets.pop();
            for (Exit e : bodyExits) {
                graph.addEdge(e.node(), header, EdgeKind.CONTROL_FLOW_LOOPBACK);
            }
            Set<Exit> out = exits(header, EdgeKind.CONTROL_FLOW_FALSE);
            out.addAll(target.breaks);
            return out;
        }

        /**
         * Body first, condition last. The condition node loops back to the first body node.
         */
        private Set<Exit> visitDo(DoStmt doStmt, Set<Exit> preds) throws GraphBuildException {
            String label = takeLabel();
            int condition = statementNode(doStmt, Set.of());
            JumpTarget target = new JumpTarget(label, condition, true);
            targets.push(target);
            Set<Exit> entry = new LinkedHashSet<>(preds);
            entry.add(new Exit(condition, EdgeKind.CONTROL_FLOW_LOOPBACK));
            Set<Exit> bodyExits = visit(doStmt.getBody(), entry);
            targets.pop();
            connect(bodyExits, condition);
            Set<Exit> out = exits(condition, EdgeKind.CONTROL_FLOW_FALSE);
            out.addAll(target.breaks);
            return out;
        }

        private Set<Exit> visitSwitch(SwitchStmt switchStmt, Set<Exit> preds) throws GraphBuildException {
            String label = takeLabel();
            int selector = statementNode(switchStmt, preds);
            JumpTarget target = new JumpTarget(label, null, true);
            targets.push(target);

            Set<Exit> out = new LinkedHashSet<>();
            Set<Exit> fallThrough = Set.of();
            boolean hasDefault = false;
            for (SwitchEntry entry : switchStmt.getEntries()) {
                hasDefault |= entry.getLabels().isEmpty();
                Set<Exit> in = new LinkedHashSet<>(fallThrough);
                in.add(new Exit(selector, EdgeKind.CONTROL_FLOW));
                Set<Exit> result = visitAll(entry.getStatements(), in);
                if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                    fallThrough = result;
                } else {
                    out.addAll(result);
                    fallThrough = Set.of();
                }
            }
            targets.pop();

            out.addAll(fallThrough);
            out.addAll(target.breaks);
            if (!hasDefault) {
                out.add(new Exit(selector, EdgeKind.CONTROL_FLOW));
            }
            return out;
        }

        private Set<Exit> visitTry(TryStmt tryStmt, Set<Exit> preds) throws GraphBuildException {
            List<Integer> handlerEntries = new ArrayList<>();
            for (CatchClause clause : tryStmt.getCatchClauses()) {
                handlerEntries.add(graph.addNode(NodeKind.STATEMENT, StatementShapes.labelOf(clause),
                        SourcePosition.of(clause), Set.of(StatementKeys.of(callable.file().path(), clause)),
                        attributes));
            }
            if (!handlerEntries.isEmpty()) {
                handlers.push(handlerEntries);
            }
            FinallyFrame frame = null;
            if (tryStmt.getFinallyBlock().isPresent()) {
                frame = new FinallyFrame(targets.size());
                finallies.push(frame);
            }
            Set<Exit> current = preds;
            if (!tryStmt.getResources().isEmpty()) {
                current = exits(statementNode(tryStmt, preds), EdgeKind.CONTROL_FLOW);
            }
            Set<Exit> out = new LinkedHashSet<>(visit(tryStmt.getTryBlock(), current));
            if (!handlerEntries.isEmpty()) {
                handlers.pop();
            }

            for (int i = 0; i < handlerEntries.size(); i++) {
                CatchClause clause = tryStmt.getCatchClauses().get(i);
                out.addAll(visit(clause.getBody(), exits(handlerEntries.get(i), EdgeKind.CONTROL_FLOW)));
            }
            if (frame != null) {
                finallies.pop();
                return visitFinally(tryStmt.getFinallyBlock().get(), out, frame);
            }
            return out;
        }

        /**
         * Normal and abrupt exits of the try enter the finally block together; its exits then go on
         * to the normal successor and to every collected jump destination.
         */
        private Set<Exit> visitFinally(BlockStmt finallyBlock, Set<Exit> normal, FinallyFrame frame)
                throws GraphBuildException {
            Set<Exit> in = new LinkedHashSet<>(normal);
            frame.jumps.values().forEach(in::addAll);
            int nodesBefore = graph.nodes().size();
            Set<Exit> after = visit(finallyBlock, in);
            if (graph.nodes().size() == nodesBefore) {
                // nothing to run: each jump goes on from where it started
                frame.jumps.forEach((destination, from) -> jump(from, destination));
                return normal;
            }
            for (Destination destination : frame.jumps.keySet()) {
                jump(after, destination);
            }
            return normal.isEmpty() ? Set.of() : after;
        }

        /**
         * Send control to a destination, through the innermost finally block the jump leaves.
         */
        private void jump(Set<Exit> from, Destination destination) {
            FinallyFrame frame = finallies.peek();
            if (frame != null && crosses(frame, destination)) {
                frame.jumps.computeIfAbsent(destination, d -> new LinkedHashSet<>()).addAll(from);
                return;
            }
            if (destination.target() == null) {
                connect(from, exit);
            } else if (destination.isContinue()) {
                for (Exit e : from) {
                    EdgeKind kind = e.kind() == EdgeKind.CONTROL_FLOW ? EdgeKind.CONTROL_FLOW_LOOPBACK : e.kind();
                    graph.addEdge(e.node(), destination.target().continueTarget, kind);
                }
            } else {
                destination.target().breaks.addAll(from);
            }
        }

        /**
         * A jump leaves the frame when it returns, or when its target was already open as the
         * frame's try statement started.
         */
        private boolean crosses(FinallyFrame frame, Destination destination) {
            if (destination.target() == null) {
                return true;
            }
            int fromTop = 0;
            for (JumpTarget target : targets) {
                if (target == destination.target()) {
                    return targets.size() - fromTop <= frame.targetDepth;
                }
                fromTop++;
            }
            return true;
        }

        private Set<Exit> visitBreak(BreakStmt breakStmt, Set<Exit> preds) throws GraphBuildException {
            int node = statementNode(breakStmt, preds);
            JumpTarget target = breakStmt.getLabel().isPresent()
                    ? findLabeled(breakStmt.getLabel().get().asString())
                    : findInnermost(true);
            if (target == null) {
                throw new GraphBuildException("break without an enclosing target", GraphKind.CFG,
                        SourcePosition.of(breakStmt));
            }
            jump(exits(node, EdgeKind.CONTROL_FLOW), new Destination(target, false));
            return Set.of();
        }

        private Set<Exit> visitContinue(ContinueStmt continueStmt, Set<Exit> preds) throws GraphBuildException {
            int node = statementNode(continueStmt, preds);
            JumpTarget target = continueStmt.getLabel().isPresent()
                    ? findLabeled(continueStmt.getLabel().get().asString())
                    : findInnermost(false);
            if (target == null || target.continueTarget == null) {
                throw new GraphBuildException("continue without an enclosing loop", GraphKind.CFG,
                        SourcePosition.of(continueStmt));
            }
            jump(exits(node, EdgeKind.CONTROL_FLOW), new Destination(target, true));
            return Set.of();
        }

        private JumpTarget findLabeled(String label) {
            for (JumpTarget target : targets) {
                if (label.equals(target.label)) {
                    return target;
                }
            }
            return null;
        }

        private JumpTarget findInnermost(boolean forBreak) {
            for (JumpTarget target : targets) {
                if (forBreak ? target.breakable : target.continueTarget != null) {
                    return target;
                }
            }
            return null;
        }

        /**
         * Add the node for a statement, connect the pending exits to it, and add exception
         * edges to the innermost handlers when the statement may raise.
         */
        private int statementNode(Statement statement, Set<Exit> preds) {
            int id = graph.addNode(StatementShapes.kindOf(statement), StatementShapes.labelOf(statement),
                    SourcePosition.of(statement), Set.of(StatementKeys.of(callable.file().path(), statement)),
                    attributes);
            connect(preds, id);
            if (!handlers.isEmpty() && StatementShapes.mayRaise(statement)) {
                for (int handler : handlers.peek()) {
                    graph.addEdge(id, handler, EdgeKind.CONTROL_FLOW_EXCEPTION);
                }
            }
            return id;
        }

        private void connect(Set<Exit> preds, int target) {
            for (Exit e : preds) {
                graph.addEdge(e.node(), target, e.kind());
            }
        }

        private String takeLabel() {
            String label = pendingLabel;
            pendingLabel = null;
            return label;
        }

        private static Set<Exit> exits(int node, EdgeKind kind) {
            Set<Exit> exits = new LinkedHashSet<>();
            exits.add(new Exit(node, kind));
            return exits;
        }

        private static boolean isLoopOrSwitch(Statement statement) {
            return statement instanceof WhileStmt || statement instanceof ForStmt || statement instanceof ForEachStmt
                    || statement instanceof DoStmt || statement instanceof SwitchStmt;
        }

        private static Statement loopBody(Statement loop) {
            if (loop instanceof WhileStmt w) {
                return w.getBody();
            }
            if (loop instanceof ForStmt f) {
                return f.getBody();
            }
            return ((ForEachStmt) loop).getBody();
        }
    }
}
