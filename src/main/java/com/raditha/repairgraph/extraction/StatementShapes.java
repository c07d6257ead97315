package com.raditha.repairgraph.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.raditha.repairgraph.model.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The graph-facing shape of a statement: its node kind, its matching label, and the
 * expressions the statement node itself evaluates (its head). Nested statements of compound
 * statements are not part of the head; they get nodes of their own.
 * <p>
 * Every builder derives node labels from here so that the CFG and DFG views of a statement
 * agree on kind and label.
 */
public final class StatementShapes {

    private static final DefaultPrettyPrinter PRINTER = new DefaultPrettyPrinter(
            new DefaultPrinterConfiguration().removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS)));

    private StatementShapes() {
    }

    public static NodeKind kindOf(Statement statement) {
        if (statement instanceof IfStmt || statement instanceof SwitchStmt) {
            return NodeKind.BRANCH;
        }
        if (statement instanceof WhileStmt || statement instanceof ForStmt
                || statement instanceof ForEachStmt || statement instanceof DoStmt) {
            return NodeKind.LOOP_HEADER;
        }
        return NodeKind.STATEMENT;
    }

    /**
     * Matching label of a statement node. Whitespace is collapsed and comments are dropped,
     * so reformatting alone never changes a label.
     */
    public static String labelOf(Statement statement) {
        if (statement instanceof IfStmt s) {
            return "if (" + print(s.getCondition()) + ")";
        }
        if (statement instanceof WhileStmt s) {
            return "while (" + print(s.getCondition()) + ")";
        }
        if (statement instanceof DoStmt s) {
            return "do-while (" + print(s.getCondition()) + ")";
        }
        if (statement instanceof ForStmt s) {
            return "for (" + join(s.getInitialization()) + "; "
                    + s.getCompare().map(StatementShapes::print).orElse("") + "; "
                    + join(s.getUpdate()) + ")";
        }
        if (statement instanceof ForEachStmt s) {
            return "for (" + print(s.getVariable()) + " : " + print(s.getIterable()) + ")";
        }
        if (statement instanceof SwitchStmt s) {
            return "switch (" + print(s.getSelector()) + ")";
        }
        if (statement instanceof TryStmt s) {
            return "try (" + join(s.getResources()) + ")";
        }
        if (statement instanceof SynchronizedStmt s) {
            return "synchronized (" + print(s.getExpression()) + ")";
        }
        if (statement instanceof LocalClassDeclarationStmt s) {
            return "class " + s.getClassDeclaration().getNameAsString();
        }
        if (statement instanceof LocalRecordDeclarationStmt s) {
            return "record " + s.getRecordDeclaration().getNameAsString();
        }
        return print(statement);
    }

    public static String labelOf(CatchClause clause) {
        return "catch (" + print(clause.getParameter()) + ")";
    }

    /**
     * The expressions evaluated by the statement's own node, in evaluation order.
     * For a {@code for} loop this includes initialization and update expressions.
     */
    public static List<Expression> headOf(Statement statement) {
        List<Expression> head = new ArrayList<>();
        if (statement instanceof ExpressionStmt s) {
            head.add(s.getExpression());
        } else if (statement instanceof ReturnStmt s) {
            s.getExpression().ifPresent(head::add);
        } else if (statement instanceof ThrowStmt s) {
            head.add(s.getExpression());
        } else if (statement instanceof IfStmt s) {
            head.add(s.getCondition());
        } else if (statement instanceof WhileStmt s) {
            head.add(s.getCondition());
        } else if (statement instanceof DoStmt s) {
            head.add(s.getCondition());
        } else if (statement instanceof ForStmt s) {
            head.addAll(s.getInitialization());
            s.getCompare().ifPresent(head::add);
            head.addAll(s.getUpdate());
        } else if (statement instanceof ForEachStmt s) {
            head.add(s.getIterable());
        } else if (statement instanceof SwitchStmt s) {
            head.add(s.getSelector());
        } else if (statement instanceof TryStmt s) {
            head.addAll(s.getResources());
        } else if (statement instanceof SynchronizedStmt s) {
            head.add(s.getExpression());
        } else if (statement instanceof AssertStmt s) {
            head.add(s.getCheck());
            s.getMessage().ifPresent(head::add);
        } else if (statement instanceof ExplicitConstructorInvocationStmt s) {
            s.getExpression().ifPresent(head::add);
            head.addAll(s.getArguments());
        }
        return head;
    }

    /**
     * Check if evaluating the statement's head may raise: it throws, or contains a call,
     * an object creation, an array access, a cast or a division.
     * Lambda bodies are not evaluated by the statement and do not count.
     */
    public static boolean mayRaise(Statement statement) {
        if (statement instanceof ThrowStmt || statement instanceof ExplicitConstructorInvocationStmt) {
            return true;
        }
        for (Expression expression : headOf(statement)) {
            if (mayRaise(expression)) {
                return true;
            }
        }
        return false;
    }

    private static boolean mayRaise(Node node) {
        if (node instanceof LambdaExpr) {
            return false;
        }
        if (node instanceof MethodCallExpr || node instanceof ObjectCreationExpr
                || node instanceof ArrayAccessExpr || node instanceof CastExpr) {
            return true;
        }
        if (node instanceof BinaryExpr binary && (binary.getOperator() == BinaryExpr.Operator.DIVIDE
                || binary.getOperator() == BinaryExpr.Operator.REMAINDER)) {
            return true;
        }
        for (Node child : node.getChildNodes()) {
            if (mayRaise(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Comment free, single line rendering of an AST node.
     */
    public static String print(Node node) {
        return PRINTER.print(node).replaceAll("\\s+", " ").trim();
    }

    private static String join(NodeList<? extends Node> nodes) {
        return nodes.stream().map(StatementShapes::print).collect(Collectors.joining(", "));
    }
}
