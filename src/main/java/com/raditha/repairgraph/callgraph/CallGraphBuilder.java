package com.raditha.repairgraph.callgraph;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.repairgraph.extraction.AnalysisUnit;
import com.raditha.repairgraph.extraction.Callable;
import com.raditha.repairgraph.extraction.CallableCollector;
import com.raditha.repairgraph.extraction.CallableCollector.DeclaredType;
import com.raditha.repairgraph.extraction.StatementKeys;
import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import com.raditha.repairgraph.model.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a name-resolved call graph.
 * <p>
 * Declarations of every type and callable in the unit are collected first, across all files,
 * then each static call site is resolved by simple name and arity, preferring the caller's own
 * type. No dynamic dispatch or type inference is attempted. A callee that is not declared in
 * the unit resolves to an external sink node, one per callee name.
 * <p>
 * Every call site gets its own node carrying the statement key of the statement containing it,
 * so merging with a PDG attributes the call to that statement.
 */
public class CallGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CallGraphBuilder.class);

    public ProgramGraph build(AnalysisUnit unit) {
        return new Resolution(unit).build();
    }

    /**
     * One build. Holds the declaration index of the unit.
     */
    private static final class Resolution {
        private final AnalysisUnit unit;
        private final ProgramGraph.Builder graph;
        private final Map<String, Integer> typeNodes = new LinkedHashMap<>();
        private final Map<String, String> typesBySimpleName = new HashMap<>();
        private final List<Callable> callables = new ArrayList<>();
        private final List<Integer> callableNodes = new ArrayList<>();
        private final Map<String, List<Integer>> callablesByName = new HashMap<>();
        private final Map<String, Integer> externals = new HashMap<>();
        private int calls;
        private int unresolved;

        Resolution(AnalysisUnit unit) {
            this.unit = unit;
            this.graph = ProgramGraph.builder(GraphKind.CALL_GRAPH, unit.name());
        }

        ProgramGraph build() {
            List<DeclaredType> types = CallableCollector.types(unit);
            for (DeclaredType type : types) {
                int id = graph.addNode(NodeKind.DECLARATION, "class " + type.qualifiedName(),
                        SourcePosition.of(type.declaration()));
                typeNodes.put(type.qualifiedName(), id);
                typesBySimpleName.putIfAbsent(type.declaration().getNameAsString(), type.qualifiedName());
                type.enclosingType().map(typeNodes::get)
                        .ifPresent(outer -> graph.addEdge(outer, id, EdgeKind.DECLARES));
            }
            for (DeclaredType type : types) {
                for (Callable callable : CallableCollector.callablesOf(type)) {
                    int id = graph.addNode(NodeKind.DECLARATION, callable.signature(), callable.position(),
                            Set.of(callable.entryKey()), Map.of(ProgramNode.ATTR_CALLABLE, callable.signature()));
                    callablesByName.computeIfAbsent(callable.name() + "/" + callable.arity(), k -> new ArrayList<>())
                            .add(callables.size());
                    callables.add(callable);
                    callableNodes.add(id);
                    graph.addEdge(typeNodes.get(type.qualifiedName()), id, EdgeKind.DECLARES);
                }
            }

            for (int i = 0; i < callables.size(); i++) {
                linkCallSites(callables.get(i), callableNodes.get(i), callables.get(i).body());
            }

            ProgramGraph callGraph = graph.build();
            logger.debug("Built {} ({} call sites, {} external)", callGraph, calls, unresolved);
            return callGraph;
        }

        /**
         * Visit the callable's code, skipping local class bodies (they are callables of their own).
         */
        private void linkCallSites(Callable caller, int callerNode, Node node) {
            if (node instanceof LocalClassDeclarationStmt || node instanceof LocalRecordDeclarationStmt) {
                return;
            }
            if (node instanceof MethodCallExpr call) {
                String scopeType = call.getScope().flatMap(this::typeNamedBy).orElse(null);
                addCallSite(caller, callerNode, call, call.getNameAsString(), call.getArguments().size(),
                        scopeType, false);
            } else if (node instanceof ObjectCreationExpr creation) {
                String typeName = creation.getType().getNameAsString();
                addCallSite(caller, callerNode, creation, typeName, creation.getArguments().size(),
                        typesBySimpleName.get(typeName), true);
            } else if (node instanceof ExplicitConstructorInvocationStmt invocation && invocation.isThis()) {
                String simpleName = caller.name();
                addCallSite(caller, callerNode, invocation, simpleName, invocation.getArguments().size(),
                        caller.owner(), true);
            }
            for (Node child : node.getChildNodes()) {
                linkCallSites(caller, callerNode, child);
            }
        }

        private void addCallSite(Callable caller, int callerNode, Node site, String name, int arity,
                String preferredType, boolean constructor) {
            Optional<String> key = enclosingStatementKey(caller, site);
            int siteNode = graph.addNode(NodeKind.CALL_SITE, "call " + name + "/" + arity, SourcePosition.of(site),
                    key.map(k -> Set.of(k)).orElse(Set.of()), Map.of(ProgramNode.ATTR_CALLABLE, caller.signature()));
            graph.addEdge(callerNode, siteNode, EdgeKind.CONTAINS);
            graph.addEdge(siteNode, resolve(caller, name, arity, preferredType, constructor), EdgeKind.CALL);
            calls++;
        }

        /**
         * Resolve by name and arity. Preference order: the type named by the call's scope, the
         * caller's own type, then the first declaration in the unit. Constructors of declared
         * types without a matching constructor resolve to the type itself.
         */
        private int resolve(Callable caller, String name, int arity, String preferredType, boolean constructor) {
            List<Integer> candidates = callablesByName.getOrDefault(name + "/" + arity, List.of()).stream()
                    .filter(i -> callables.get(i).constructor() == constructor)
                    .toList();
            if (!candidates.isEmpty()) {
                int chosen = candidates.stream()
                        .filter(i -> callables.get(i).owner().equals(preferredType))
                        .findFirst()
                        .or(() -> candidates.stream()
                                .filter(i -> callables.get(i).owner().equals(caller.owner()))
                                .findFirst())
                        .orElse(candidates.get(0));
                return callableNodes.get(chosen);
            }
            if (constructor && preferredType != null && typeNodes.containsKey(preferredType)) {
                return typeNodes.get(preferredType);
            }
            unresolved++;
            return externals.computeIfAbsent(name,
                    n -> graph.addNode(NodeKind.EXTERNAL, "external " + n, SourcePosition.UNKNOWN));
        }

        /**
         * The type a call scope names, when the scope is a declared type's simple name.
         */
        private Optional<String> typeNamedBy(Expression scope) {
            if (scope instanceof NameExpr name) {
                return Optional.ofNullable(typesBySimpleName.get(name.getNameAsString()));
            }
            return Optional.empty();
        }

        /**
         * Key of the statement whose control-flow node evaluates the call site: the nearest
         * enclosing statement that is not inside a lambda, switch expression or anonymous class
         * body nested in the caller.
         */
        private Optional<String> enclosingStatementKey(Callable caller, Node site) {
            Statement candidate = site instanceof Statement statement ? statement : null;
            Optional<Node> current = site.getParentNode();
            while (current.isPresent() && current.get() != caller.declaration()) {
                Node node = current.get();
                if (node instanceof LambdaExpr || node instanceof SwitchExpr || node instanceof BodyDeclaration) {
                    candidate = null;
                } else if (candidate == null && node instanceof Statement statement) {
                    candidate = statement;
                }
                current = node.getParentNode();
            }
            if (candidate == null || candidate == caller.body()) {
                return Optional.empty();
            }
            return Optional.of(StatementKeys.of(caller.file().path(), candidate));
        }
    }
}
