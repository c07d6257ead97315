package com.raditha.repairgraph.metrics;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.repairgraph.extraction.SourceFile;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Halstead measures of a version of the code.
 * <p>
 * Operators are the unary, binary, assignment, conditional and instanceof operators plus the
 * declaring and control keywords (type and callable declarations, if, loops, switch, return and
 * throw). Operands are variable names and literal values.
 *
 * @param distinctOperators n1
 * @param distinctOperands  n2
 * @param totalOperators    N1
 * @param totalOperands     N2
 */
public record HalsteadMetrics(int distinctOperators, int distinctOperands, int totalOperators, int totalOperands) {

    public static final HalsteadMetrics EMPTY = new HalsteadMetrics(0, 0, 0, 0);

    public static HalsteadMetrics of(List<SourceFile> files) {
        Set<String> operators = new HashSet<>();
        Set<String> operands = new HashSet<>();
        int operatorCount = 0;
        int operandCount = 0;
        for (SourceFile file : files) {
            for (Node node : file.unit().findAll(Node.class)) {
                String operator = operator(node);
                if (operator != null) {
                    operators.add(operator);
                    operatorCount++;
                    continue;
                }
                String operand = operand(node);
                if (operand != null) {
                    operands.add(operand);
                    operandCount++;
                }
            }
        }
        return new HalsteadMetrics(operators.size(), operands.size(), operatorCount, operandCount);
    }

    private static String operator(Node node) {
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator().asString();
        }
        if (node instanceof UnaryExpr unary) {
            return unary.getOperator().asString();
        }
        if (node instanceof AssignExpr assign) {
            return assign.getOperator().asString();
        }
        if (node instanceof ConditionalExpr) {
            return "?:";
        }
        if (node instanceof InstanceOfExpr) {
            return "instanceof";
        }
        if (node instanceof ClassOrInterfaceDeclaration || node instanceof EnumDeclaration
                || node instanceof RecordDeclaration) {
            return "type";
        }
        if (node instanceof MethodDeclaration || node instanceof ConstructorDeclaration) {
            return "callable";
        }
        if (node instanceof IfStmt) {
            return "if";
        }
        if (node instanceof ForStmt || node instanceof ForEachStmt) {
            return "for";
        }
        if (node instanceof WhileStmt || node instanceof DoStmt) {
            return "while";
        }
        if (node instanceof SwitchStmt) {
            return "switch";
        }
        if (node instanceof ReturnStmt) {
            return "return";
        }
        if (node instanceof ThrowStmt) {
            return "throw";
        }
        return null;
    }

    private static String operand(Node node) {
        if (node instanceof NameExpr name) {
            return name.getNameAsString();
        }
        if (node instanceof LiteralStringValueExpr literal) {
            return literal.getValue();
        }
        if (node instanceof BooleanLiteralExpr bool) {
            return String.valueOf(bool.getValue());
        }
        if (node instanceof NullLiteralExpr) {
            return "null";
        }
        return null;
    }

    public int vocabulary() {
        return distinctOperators + distinctOperands;
    }

    public int length() {
        return totalOperators + totalOperands;
    }

    /**
     * N * log2(n); 0 when there is nothing to measure.
     */
    public double volume() {
        if (distinctOperators == 0 || distinctOperands == 0) {
            return 0.0;
        }
        return length() * (Math.log(vocabulary()) / Math.log(2));
    }

    /**
     * (n1 / 2) * (N2 / n2); 0 when there is nothing to measure.
     */
    public double difficulty() {
        if (distinctOperators == 0 || distinctOperands == 0) {
            return 0.0;
        }
        return (distinctOperators / 2.0) * ((double) totalOperands / distinctOperands);
    }

    public double effort() {
        return difficulty() * volume();
    }
}
