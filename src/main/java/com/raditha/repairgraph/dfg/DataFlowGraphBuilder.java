package com.raditha.repairgraph.dfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import com.github.javaparser.ast.expr.TypePatternExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
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
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
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
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import com.raditha.repairgraph.model.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a version-aware data-flow graph: every write creates a new version node, every read
 * resolves to exactly one reaching version, and phi nodes stand for the confluence of several
 * versions where control-flow paths join.
 * <p>
 * Node labels carry base names only ({@code def x}, {@code use x}, {@code phi x}); version
 * numbers live in attributes so renumbering alone never changes the graph's labels.
 * Statement nodes share kind, label and statement key with their control-flow counterparts.
 * <p>
 * Code that control flow cannot reach is not modelled.
 */
public class DataFlowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DataFlowGraphBuilder.class);

    public static final String UNKNOWN_LABEL = "unknown";

    private static final Set<String> REFLECTIVE_LOOKUPS = Set.of(
            "getField", "getMethod", "getDeclaredField", "getDeclaredMethod", "forName");

    /**
     * Build the DFG of every callable in the unit.
     *
     * @throws GraphBuildException if a body contains a construct that cannot be decomposed
     */
    public ProgramGraph build(AnalysisUnit unit) throws GraphBuildException {
        ProgramGraph.Builder graph = ProgramGraph.builder(GraphKind.DFG, unit.name());
        UnknownSink unknown = new UnknownSink(graph);
        for (Callable callable : CallableCollector.callables(unit)) {
            new CallableWalker(graph, callable, unknown).walk();
        }
        int pruned = pruneUnusedPhis(graph);
        ProgramGraph dfg = graph.build();
        logger.debug("Built {} ({} unused phi nodes pruned)", dfg, pruned);
        return dfg;
    }

    /**
     * Remove phi nodes nothing reads, repeatedly, since dropping one can leave its inputs unused.
     */
    private static int pruneUnusedPhis(ProgramGraph.Builder graph) {
        int removed = 0;
        boolean changed = true;
        while (changed) {
            Set<Integer> withConsumers = new HashSet<>();
            for (ProgramEdge edge : graph.edges()) {
                withConsumers.add(edge.source());
            }
            List<Integer> unused = graph.nodes().stream()
                    .filter(n -> n.kind() == NodeKind.PHI && !withConsumers.contains(n.id()))
                    .map(ProgramNode::id)
                    .toList();
            unused.forEach(graph::removeNode);
            removed += unused.size();
            changed = !unused.isEmpty();
        }
        return removed;
    }

    /**
     * The single synthetic node standing for every location that cannot be resolved statically.
     */
    private static final class UnknownSink {
        private final ProgramGraph.Builder graph;
        private Integer id;

        UnknownSink(ProgramGraph.Builder graph) {
            this.graph = graph;
        }

        int id() {
            if (id == null) {
                id = graph.addNode(NodeKind.UNKNOWN, UNKNOWN_LABEL, SourcePosition.UNKNOWN);
            }
            return id;
        }
    }

    /**
     * Break and continue targets, with the environments that jump to them.
     */
    private static final class JumpFrame {
        final String label;
        final boolean loop;
        final boolean breakable;
        final List<Environment> breaks = new ArrayList<>();
        final List<Environment> continues = new ArrayList<>();

        JumpFrame(String label, boolean loop, boolean breakable) {
            this.label = label;
            this.loop = loop;
            this.breakable = breakable;
        }
    }

    /**
     * The data-flow node of one statement, created on first use so that statements without
     * reads or writes do not appear in the DFG.
     */
    private static final class StatementRef {
        private final Node astNode;
        private final NodeKind kind;
        private final String label;
        private final CallableWalker walker;
        private Integer id;

        StatementRef(CallableWalker walker, Node astNode, NodeKind kind, String label) {
            this.walker = walker;
            this.astNode = astNode;
            this.kind = kind;
            this.label = label;
        }

        int id() {
            if (id == null) {
                String key = StatementKeys.of(walker.callable.file().path(), astNode);
                id = walker.statementNodes.computeIfAbsent(key, k -> walker.graph.addNode(kind, label,
                        SourcePosition.of(astNode), Set.of(k), walker.attributes));
            }
            return id;
        }

        SourcePosition position() {
            return SourcePosition.of(astNode);
        }
    }

    /**
     * Walks one callable. One instance per callable; version counters restart per callable.
     */
    private static final class CallableWalker {
        private final ProgramGraph.Builder graph;
        private final Callable callable;
        private final UnknownSink unknown;
        private final Map<String, String> attributes;
        private final Map<String, Integer> counters = new HashMap<>();
        private final Map<String, Integer> inputs = new HashMap<>();
        private final Map<String, Integer> statementNodes = new HashMap<>();
        private final Map<String, Integer> uses = new HashMap<>();
        private final Map<Integer, Integer> replaced = new HashMap<>();
        private final Set<String> locals;
        private final Deque<JumpFrame> frames = new ArrayDeque<>();
        private final Deque<List<Environment>> raisePoints = new ArrayDeque<>();
        private String pendingLabel;

        CallableWalker(ProgramGraph.Builder graph, Callable callable, UnknownSink unknown) {
            this.graph = graph;
            this.callable = callable;
            this.unknown = unknown;
            this.attributes = Map.of(ProgramNode.ATTR_CALLABLE, callable.signature());
            this.locals = new HashSet<>(AssignedNames.declaredIn(callable.body()));
            callable.parameters().forEach(p -> locals.add(p.getNameAsString()));
        }

        void walk() throws GraphBuildException {
            Environment env = new Environment();
            for (Parameter parameter : callable.parameters()) {
                String name = parameter.getNameAsString();
                int id = versionNode(NodeKind.VARIABLE_DEFINITION, "param " + name, name, 0,
                        SourcePosition.of(parameter));
                inputs.put(name, id);
                env.put(name, id);
            }
            visit(callable.body(), env);
        }

        // ---- statements ----

        /**
         * Walk a statement.
         *
         * @return the environment after normal completion, or null when the statement never
         *         completes normally (return, throw, break, continue on every path)
         */
        private Environment visit(Statement statement, Environment env) throws GraphBuildException {
            if (env == null) {
                return null;
            }
            if (statement instanceof BlockStmt block) {
                Environment current = env;
                for (Statement s : block.getStatements()) {
                    current = visit(s, current);
                }
                return current;
            }
            if (statement instanceof EmptyStmt || statement instanceof LocalClassDeclarationStmt
                    || statement instanceof LocalRecordDeclarationStmt) {
                return env;
            }
            if (statement instanceof LabeledStmt labeled) {
                return visitLabeled(labeled, env);
            }
            if (statement instanceof IfStmt ifStmt) {
                evaluate(statement, List.of(ifStmt.getCondition()), env);
                Environment thenEnv = visit(ifStmt.getThenStmt(), env.copy());
                Environment elseEnv = ifStmt.getElseStmt().isPresent()
                        ? visit(ifStmt.getElseStmt().get(), env.copy())
                        : env;
                return join(listOf(thenEnv, elseEnv), SourcePosition.of(ifStmt));
            }
            if (statement instanceof WhileStmt whileStmt) {
                return visitLoop(whileStmt, List.of(), List.of(whileStmt.getCondition()), whileStmt.getBody(),
                        List.of(), env);
            }
            if (statement instanceof ForStmt forStmt) {
                List<Expression> compare = forStmt.getCompare().map(List::of).orElse(List.of());
                return visitLoop(forStmt, forStmt.getInitialization(), compare, forStmt.getBody(),
                        forStmt.getUpdate(), env);
            }
            if (statement instanceof ForEachStmt forEach) {
                return visitForEach(forEach, env);
            }
            if (statement instanceof DoStmt doStmt) {
                return visitDo(doStmt, env);
            }
            if (statement instanceof SwitchStmt switchStmt) {
                return visitSwitch(switchStmt, env);
            }
            if (statement instanceof TryStmt tryStmt) {
                return visitTry(tryStmt, env);
            }
            if (statement instanceof ReturnStmt || statement instanceof ThrowStmt) {
                evaluate(statement, StatementShapes.headOf(statement), env);
                return null;
            }
            if (statement instanceof BreakStmt breakStmt) {
                JumpFrame frame = breakStmt.getLabel().isPresent()
                        ? findLabeled(breakStmt.getLabel().get().asString())
                        : findInnermost(true);
                if (frame == null) {
                    throw new GraphBuildException("break without an enclosing target", GraphKind.DFG,
                            SourcePosition.of(breakStmt));
                }
                frame.breaks.add(env.copy());
                return null;
            }
            if (statement instanceof ContinueStmt continueStmt) {
                JumpFrame frame = continueStmt.getLabel().isPresent()
                        ? findLabeled(continueStmt.getLabel().get().asString())
                        : findInnermost(false);
                if (frame == null || !frame.loop) {
                    throw new GraphBuildException("continue without an enclosing loop", GraphKind.DFG,
                            SourcePosition.of(continueStmt));
                }
                frame.continues.add(env.copy());
                return null;
            }
            if (statement instanceof SynchronizedStmt sync) {
                evaluate(statement, List.of(sync.getExpression()), env);
                return visit(sync.getBody(), env);
            }
            if (statement instanceof YieldStmt) {
                throw new GraphBuildException("yield outside of a switch expression", GraphKind.DFG,
                        SourcePosition.of(statement));
            }
            if (statement instanceof UnparsableStmt) {
                throw new GraphBuildException("Unparsable statement", GraphKind.DFG, SourcePosition.of(statement));
            }
            evaluate(statement, StatementShapes.headOf(statement), env);
            return env;
        }

        private Environment visitLabeled(LabeledStmt labeled, Environment env) throws GraphBuildException {
            Statement inner = labeled.getStatement();
            String label = labeled.getLabel().asString();
            if (inner instanceof WhileStmt || inner instanceof ForStmt || inner instanceof ForEachStmt
                    || inner instanceof DoStmt || inner instanceof SwitchStmt) {
                pendingLabel = label;
                return visit(inner, env);
            }
            JumpFrame frame = new JumpFrame(label, false, false);
            frames.push(frame);
            Environment out = visit(inner, env);
            frames.pop();
            List<Environment> exits = new ArrayList<>(frame.breaks);
            exits.add(out);
            return join(exits, SourcePosition.of(labeled));
        }

        /**
         * while and for loops. Initialization runs once before the header; names the loop
         * writes get a header phi fed by the pre-loop version and by every back edge.
         */
        private Environment visitLoop(Statement loop, List<Expression> init, List<Expression> condition,
                Statement body, List<Expression> update, Environment env) throws GraphBuildException {
            String label = takeLabel();
            evaluate(loop, init, env);

            List<Node> scanned = new ArrayList<>(condition);
            scanned.addAll(update);
            scanned.add(body);
            Map<String, Integer> phis = headerPhis(scanned, env, SourcePosition.of(loop));
            Environment header = env.copy();
            phis.forEach(header::put);
            evaluate(loop, condition, header);

            JumpFrame frame = new JumpFrame(label, true, true);
            frames.push(frame);
            Environment bodyOut = visit(body, header.copy());
            frames.pop();

            List<Environment> backEnvs = new ArrayList<>(frame.continues);
            backEnvs.add(bodyOut);
            Environment back = join(backEnvs, SourcePosition.of(loop));
            if (back != null) {
                evaluate(loop, update, back);
            }
            closeHeaderPhis(phis, back == null ? List.of() : List.of(back));

            List<Environment> exits = new ArrayList<>();
            exits.add(header);
            exits.addAll(frame.breaks);
            return join(exits, SourcePosition.of(loop));
        }

        private Environment visitForEach(ForEachStmt forEach, Environment env) throws GraphBuildException {
            String label = takeLabel();
            evaluate(forEach, List.of(forEach.getIterable()), env);

            Map<String, Integer> phis = headerPhis(List.of(forEach.getBody()), env, SourcePosition.of(forEach));
            Environment header = env.copy();
            phis.forEach(header::put);

            Environment bodyIn = header.copy();
            StatementRef headerNode = statementRef(forEach);
            for (VariableDeclarator variable : forEach.getVariable().getVariables()) {
                write(variable.getNameAsString(), headerNode, bodyIn, SourcePosition.of(variable));
            }

            JumpFrame frame = new JumpFrame(label, true, true);
            frames.push(frame);
            Environment bodyOut = visit(forEach.getBody(), bodyIn);
            frames.pop();

            List<Environment> backEnvs = new ArrayList<>(frame.continues);
            backEnvs.add(bodyOut);
            closeHeaderPhis(phis, nonNull(backEnvs));

            List<Environment> exits = new ArrayList<>();
            exits.add(header);
            exits.addAll(frame.breaks);
            return join(exits, SourcePosition.of(forEach));
        }

        /**
         * do-while: the phis sit at the body entry, fed by the pre-loop version and by the
         * versions reaching the condition.
         */
        private Environment visitDo(DoStmt doStmt, Environment env) throws GraphBuildException {
            String label = takeLabel();
            Map<String, Integer> phis = headerPhis(List.of(doStmt.getBody(), doStmt.getCondition()), env,
                    SourcePosition.of(doStmt));
            Environment entry = env.copy();
            phis.forEach(entry::put);

            JumpFrame frame = new JumpFrame(label, true, true);
            frames.push(frame);
            Environment bodyOut = visit(doStmt.getBody(), entry);
            frames.pop();

            List<Environment> toCondition = new ArrayList<>(frame.continues);
            toCondition.add(bodyOut);
            Environment condition = join(toCondition, SourcePosition.of(doStmt));
            if (condition != null) {
                evaluate(doStmt, List.of(doStmt.getCondition()), condition);
            }
            closeHeaderPhis(phis, condition == null ? List.of() : List.of(condition));

            List<Environment> exits = new ArrayList<>(frame.breaks);
            exits.add(condition);
            return join(exits, SourcePosition.of(doStmt));
        }

        private Environment visitSwitch(SwitchStmt switchStmt, Environment env) throws GraphBuildException {
            String label = takeLabel();
            evaluate(switchStmt, List.of(switchStmt.getSelector()), env);

            JumpFrame frame = new JumpFrame(label, false, true);
            frames.push(frame);
            List<Environment> exits = new ArrayList<>();
            Environment fallThrough = null;
            boolean hasDefault = false;
            for (SwitchEntry entry : switchStmt.getEntries()) {
                hasDefault |= entry.getLabels().isEmpty();
                Environment in = join(listOf(fallThrough, env.copy()), SourcePosition.of(entry));
                Environment current = in;
                for (Statement s : entry.getStatements()) {
                    current = visit(s, current);
                }
                if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                    fallThrough = current;
                } else {
                    exits.add(current);
                    fallThrough = null;
                }
            }
            frames.pop();

            exits.add(fallThrough);
            exits.addAll(frame.breaks);
            if (!hasDefault) {
                exits.add(env);
            }
            return join(exits, SourcePosition.of(switchStmt));
        }

        /**
         * Handlers see a phi of every version that reaches a statement of the try block that
         * may raise; finally sees the join of the try and handler exits.
         */
        private Environment visitTry(TryStmt tryStmt, Environment env) throws GraphBuildException {
            boolean hasHandlers = !tryStmt.getCatchClauses().isEmpty();
            List<Environment> raising = new ArrayList<>();
            raising.add(env.copy());
            if (hasHandlers) {
                raisePoints.push(raising);
            }
            if (!tryStmt.getResources().isEmpty()) {
                evaluate(tryStmt, tryStmt.getResources(), env);
            }
            Environment tryOut = visit(tryStmt.getTryBlock(), env);
            if (hasHandlers) {
                raisePoints.pop();
            }

            List<Environment> exits = new ArrayList<>();
            exits.add(tryOut);
            for (CatchClause clause : tryStmt.getCatchClauses()) {
                Environment handler = join(raising, SourcePosition.of(clause));
                StatementRef catchNode = new StatementRef(this, clause, NodeKind.STATEMENT,
                        StatementShapes.labelOf(clause));
                write(clause.getParameter().getNameAsString(), catchNode, handler,
                        SourcePosition.of(clause.getParameter()));
                exits.add(visit(clause.getBody(), handler));
            }
            Environment out = join(exits, SourcePosition.of(tryStmt));
            if (tryStmt.getFinallyBlock().isPresent()) {
                return visit(tryStmt.getFinallyBlock().get(), out);
            }
            return out;
        }

        // ---- phi handling ----

        private Map<String, Integer> headerPhis(List<Node> loopParts, Environment env, SourcePosition position) {
            Map<String, Integer> phis = new LinkedHashMap<>();
            for (String name : AssignedNames.writtenIn(loopParts.toArray(new Node[0]))) {
                if (!env.has(name) && locals.contains(name)) {
                    continue;
                }
                int phi = newPhi(name, position);
                addVersionEdge(resolve(env, name), phi);
                phis.put(name, phi);
            }
            return phis;
        }

        /**
         * Add back-edge versions to the header phis and eliminate those left with a single
         * distinct incoming version.
         */
        private void closeHeaderPhis(Map<String, Integer> phis, List<Environment> backEnvs) {
            for (Map.Entry<String, Integer> entry : phis.entrySet()) {
                int phi = canonical(entry.getValue());
                for (Environment back : backEnvs) {
                    int version = resolve(back, entry.getKey());
                    if (version != phi) {
                        addVersionEdge(version, phi);
                    }
                }
                List<ProgramEdge> incoming = graph.edges().stream()
                        .filter(e -> e.target() == phi && e.kind() == EdgeKind.DEF_USE && e.source() != phi)
                        .toList();
                if (incoming.size() == 1) {
                    int source = incoming.get(0).source();
                    incoming.forEach(graph::removeEdge);
                    graph.removeEdge(new ProgramEdge(phi, phi, EdgeKind.DEF_USE));
                    graph.redirectAndRemove(phi, source);
                    replaced.put(phi, source);
                }
            }
        }

        /**
         * Merge the environments of paths that meet. Null entries are paths that do not reach
         * the join. A name bound on some paths only is dropped when it is a local (it went out
         * of scope) and completed with its input version otherwise.
         */
        private Environment join(List<Environment> envs, SourcePosition position) {
            List<Environment> live = nonNull(envs);
            if (live.isEmpty()) {
                return null;
            }
            if (live.size() == 1) {
                return live.get(0);
            }
            Set<String> names = new LinkedHashSet<>();
            live.forEach(e -> names.addAll(e.names()));

            Environment joined = new Environment();
            for (String name : names) {
                boolean everywhere = live.stream().allMatch(e -> e.has(name));
                if (!everywhere && locals.contains(name)) {
                    continue;
                }
                Set<Integer> versions = new LinkedHashSet<>();
                for (Environment e : live) {
                    versions.add(resolve(e, name));
                }
                if (versions.size() == 1) {
                    joined.put(name, versions.iterator().next());
                } else {
                    int phi = newPhi(name, position);
                    versions.forEach(v -> addVersionEdge(v, phi));
                    joined.put(name, phi);
                }
            }
            return joined;
        }

        private int newPhi(String name, SourcePosition position) {
            return versionNode(NodeKind.PHI, "phi " + name, name, nextVersion(name), position);
        }

        // ---- expressions ----

        private StatementRef statementRef(Statement statement) {
            return new StatementRef(this, statement, StatementShapes.kindOf(statement),
                    StatementShapes.labelOf(statement));
        }

        /**
         * Walk expressions evaluated by a statement's own node, in order, updating the environment.
         */
        private void evaluate(Statement owner, List<? extends Expression> expressions, Environment env) {
            if (expressions.isEmpty()) {
                return;
            }
            if (!raisePoints.isEmpty() && StatementShapes.mayRaise(owner)) {
                raisePoints.peek().add(env.copy());
            }
            StatementRef ref = statementRef(owner);
            for (Expression expression : expressions) {
                walk(expression, ref, env);
            }
        }

        private void walk(Node node, StatementRef ref, Environment env) {
            if (node instanceof LambdaExpr lambda) {
                readCaptures(lambda, ref, env);
            } else if (node instanceof AssignExpr assign) {
                walkAssign(assign, ref, env);
            } else if (node instanceof UnaryExpr unary && AssignedNames.isIncrementOrDecrement(unary)) {
                String name = AssignedNames.targetName(unary.getExpression());
                if (name != null) {
                    read(name, ref, env);
                    write(name, ref, env, SourcePosition.of(unary));
                } else {
                    walkChildren(unary.getExpression(), ref, env);
                    writeUnknown(ref);
                }
            } else if (node instanceof VariableDeclarationExpr declaration) {
                for (VariableDeclarator variable : declaration.getVariables()) {
                    if (variable.getInitializer().isPresent()) {
                        walk(variable.getInitializer().get(), ref, env);
                        write(variable.getNameAsString(), ref, env, SourcePosition.of(variable));
                    }
                }
            } else if (node instanceof NameExpr name) {
                read(name.getNameAsString(), ref, env);
            } else if (node instanceof FieldAccessExpr field && field.getScope() instanceof ThisExpr) {
                read("this." + field.getNameAsString(), ref, env);
            } else if (node instanceof InstanceOfExpr instanceOf) {
                walk(instanceOf.getExpression(), ref, env);
                instanceOf.getPattern().ifPresent(p -> p.findAll(TypePatternExpr.class)
                        .forEach(t -> write(t.getNameAsString(), ref, env, SourcePosition.of(t))));
            } else if (node instanceof ObjectCreationExpr creation) {
                creation.getScope().ifPresent(s -> walk(s, ref, env));
                creation.getArguments().forEach(a -> walk(a, ref, env));
            } else if (!(node instanceof ClassExpr) && !(node instanceof TypeExpr)) {
                if (node instanceof MethodCallExpr call && isReflectiveLookup(call)) {
                    graph.addEdge(unknown.id(), ref.id(), EdgeKind.DATA_FLOW);
                }
                walkChildren(node, ref, env);
            }
        }

        private void walkChildren(Node node, StatementRef ref, Environment env) {
            for (Node child : node.getChildNodes()) {
                walk(child, ref, env);
            }
        }

        private void walkAssign(AssignExpr assign, StatementRef ref, Environment env) {
            String name = AssignedNames.targetName(assign.getTarget());
            if (name != null) {
                if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
                    read(name, ref, env);
                }
                walk(assign.getValue(), ref, env);
                write(name, ref, env, SourcePosition.of(assign));
                return;
            }
            Expression target = assign.getTarget();
            if (target instanceof ArrayAccessExpr array) {
                walk(array.getName(), ref, env);
                walk(array.getIndex(), ref, env);
            } else if (target instanceof FieldAccessExpr field) {
                walk(field.getScope(), ref, env);
            }
            walk(assign.getValue(), ref, env);
            writeUnknown(ref);
        }

        /**
         * A lambda body is not evaluated by the statement, but the locals it captures are read.
         */
        private void readCaptures(LambdaExpr lambda, StatementRef ref, Environment env) {
            Set<String> own = AssignedNames.declaredIn(lambda);
            Set<String> captured = new LinkedHashSet<>();
            lambda.getBody().findAll(NameExpr.class).forEach(n -> captured.add(n.getNameAsString()));
            for (String name : captured) {
                if (!own.contains(name) && env.has(name)) {
                    read(name, ref, env);
                }
            }
        }

        private boolean isReflectiveLookup(MethodCallExpr call) {
            if (!REFLECTIVE_LOOKUPS.contains(call.getNameAsString())) {
                return false;
            }
            return call.getArguments().isEmpty() || !(call.getArgument(0) instanceof StringLiteralExpr);
        }

        // ---- versions ----

        private void read(String name, StatementRef ref, Environment env) {
            if (!env.has(name) && !locals.contains(name) && looksLikeTypeName(name)) {
                return;
            }
            int version = resolve(env, name);
            int statement = ref.id();
            String key = statement + ":" + version;
            Integer use = uses.get(key);
            if (use == null) {
                String versionNumber = graph.node(version).attribute(ProgramNode.ATTR_VERSION).orElse("0");
                use = graph.addNode(NodeKind.VARIABLE_USE, "use " + name, ref.position(), Set.of(),
                        versionAttributes(name, versionNumber));
                uses.put(key, use);
            }
            graph.addEdge(version, use, EdgeKind.DEF_USE);
            graph.addEdge(use, statement, EdgeKind.DATA_FLOW);
        }

        private void write(String name, StatementRef ref, Environment env, SourcePosition position) {
            int definition = versionNode(NodeKind.VARIABLE_DEFINITION, "def " + name, name, nextVersion(name),
                    position);
            graph.addEdge(ref.id(), definition, EdgeKind.DATA_FLOW);
            env.put(name, definition);
        }

        private void writeUnknown(StatementRef ref) {
            graph.addEdge(ref.id(), unknown.id(), EdgeKind.DATA_FLOW);
        }

        /**
         * The version a read of the name resolves to: the reaching version when there is one,
         * the name's input version otherwise.
         */
        private int resolve(Environment env, String name) {
            Integer id = env.get(name);
            if (id != null) {
                return canonical(id);
            }
            return inputs.computeIfAbsent(name, n -> versionNode(NodeKind.VARIABLE_DEFINITION, "in " + n, n, 0,
                    callable.position()));
        }

        private int canonical(int id) {
            int current = id;
            Integer next = replaced.get(current);
            while (next != null) {
                current = next;
                next = replaced.get(current);
            }
            return current;
        }

        private void addVersionEdge(int version, int phi) {
            graph.addEdge(canonical(version), phi, EdgeKind.DEF_USE);
        }

        private int nextVersion(String name) {
            return counters.merge(name, 1, Integer::sum);
        }

        private int versionNode(NodeKind kind, String label, String name, int version, SourcePosition position) {
            return graph.addNode(kind, label, position, Set.of(), versionAttributes(name, String.valueOf(version)));
        }

        private Map<String, String> versionAttributes(String name, String version) {
            Map<String, String> attrs = new HashMap<>(attributes);
            attrs.put(ProgramNode.ATTR_VARIABLE, name);
            attrs.put(ProgramNode.ATTR_VERSION, version);
            return attrs;
        }

        // ---- jump targets ----

        private JumpFrame findLabeled(String label) {
            for (JumpFrame frame : frames) {
                if (label.equals(frame.label)) {
                    return frame;
                }
            }
            return null;
        }

        private JumpFrame findInnermost(boolean forBreak) {
            for (JumpFrame frame : frames) {
                if (forBreak ? frame.breakable : frame.loop) {
                    return frame;
                }
            }
            return null;
        }

        private String takeLabel() {
            String label = pendingLabel;
            pendingLabel = null;
            return label;
        }
    }

    /**
     * Names that start upper case and are not bound locally are taken to be type names
     * ({@code Math.max}, {@code System.out}), not variable reads.
     */
    private static boolean looksLikeTypeName(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    private static List<Environment> nonNull(List<Environment> envs) {
        return envs.stream().filter(Objects::nonNull).toList();
    }

    private static List<Environment> listOf(Environment first, Environment second) {
        List<Environment> list = new ArrayList<>(2);
        list.add(first);
        list.add(second);
        return list;
    }
}
