package com.raditha.repairgraph.dfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.TypePatternExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Static scans for the names a piece of code writes or declares.
 * Loop handling uses these to know, before walking a body, which names need a header phi.
 */
final class AssignedNames {

    private AssignedNames() {
    }

    /**
     * Names written somewhere in the given nodes that are not declared inside them.
     * Lambda bodies and local or anonymous class bodies are ignored.
     */
    static Set<String> writtenIn(Node... roots) {
        Set<String> written = new LinkedHashSet<>();
        Set<String> declared = new LinkedHashSet<>();
        for (Node root : roots) {
            if (root != null) {
                scan(root, written, declared);
            }
        }
        written.removeAll(declared);
        return written;
    }

    /**
     * Every name declared as a local, parameter, catch parameter or pattern binding in the node.
     */
    static Set<String> declaredIn(Node root) {
        Set<String> declared = new LinkedHashSet<>();
        root.findAll(VariableDeclarator.class).forEach(v -> declared.add(v.getNameAsString()));
        root.findAll(Parameter.class).forEach(p -> declared.add(p.getNameAsString()));
        root.findAll(TypePatternExpr.class).forEach(p -> declared.add(p.getNameAsString()));
        return declared;
    }

    /**
     * Name a write to this expression defines, or null when the target is not a plain variable
     * (array element, field of another object).
     */
    static String targetName(Expression target) {
        if (target instanceof NameExpr name) {
            return name.getNameAsString();
        }
        if (target instanceof FieldAccessExpr field && field.getScope() instanceof ThisExpr) {
            return "this." + field.getNameAsString();
        }
        return null;
    }

    static boolean isIncrementOrDecrement(UnaryExpr unary) {
        return unary.getOperator().isPostfix() || unary.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT
                || unary.getOperator() == UnaryExpr.Operator.PREFIX_DECREMENT;
    }

    private static void scan(Node node, Set<String> written, Set<String> declared) {
        if (node instanceof LambdaExpr || node instanceof LocalClassDeclarationStmt
                || node instanceof LocalRecordDeclarationStmt) {
            return;
        }
        if (node instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isPresent()) {
            creation.getScope().ifPresent(s -> scan(s, written, declared));
            creation.getArguments().forEach(a -> scan(a, written, declared));
            return;
        }
        if (node instanceof AssignExpr assign) {
            String name = targetName(assign.getTarget());
            if (name != null) {
                written.add(name);
            }
        } else if (node instanceof UnaryExpr unary && isIncrementOrDecrement(unary)) {
            String name = targetName(unary.getExpression());
            if (name != null) {
                written.add(name);
            }
        } else if (node instanceof VariableDeclarator declarator) {
            declared.add(declarator.getNameAsString());
        } else if (node instanceof Parameter parameter) {
            declared.add(parameter.getNameAsString());
        } else if (node instanceof TypePatternExpr pattern) {
            declared.add(pattern.getNameAsString());
        }
        for (Node child : node.getChildNodes()) {
            scan(child, written, declared);
        }
    }
}
