package com.raditha.repairgraph.metrics;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.raditha.repairgraph.extraction.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-down tree edit distance between syntax trees.
 * <p>
 * A node is labelled by its syntax class, with the operator for unary, binary and assignment
 * expressions; names and literal values are not part of the label. Two nodes with equal labels
 * cost nothing and their child lists are aligned in order; unequal labels cost one relabel, or
 * deleting one subtree and inserting the other when that is cheaper. Inserting or deleting a
 * subtree costs its size.
 */
public final class AstEditDistance {

    /**
     * Distance between two syntax trees and their sizes.
     *
     * @param distance   edit operations between the trees
     * @param sizeBefore nodes before the change
     * @param sizeAfter  nodes after the change
     */
    public record Result(int distance, int sizeBefore, int sizeAfter) {

        public int sizeDelta() {
            return Math.abs(sizeAfter - sizeBefore);
        }

        public double normalized() {
            int size = Math.max(sizeBefore, sizeAfter);
            return size == 0 ? 0.0 : (double) distance / size;
        }
    }

    /**
     * Syntax tree with the label and subtree size precomputed.
     */
    static final class Tree {
        final String label;
        final List<Tree> children;
        final int size;

        Tree(String label, List<Tree> children) {
            this.label = label;
            this.children = children;
            int total = 1;
            for (Tree child : children) {
                total += child.size;
            }
            this.size = total;
        }
    }

    private AstEditDistance() {
    }

    /**
     * Compare two versions of a set of files; the files of each side hang off one root, in order.
     */
    public static Result compute(List<SourceFile> before, List<SourceFile> after) {
        Tree a = root(before);
        Tree b = root(after);
        return new Result(distance(a, b), a.size, b.size);
    }

    static Tree root(List<SourceFile> files) {
        List<Tree> children = new ArrayList<>();
        for (SourceFile file : files) {
            children.add(tree(file.unit()));
        }
        return new Tree("Unit", children);
    }

    static Tree tree(Node node) {
        List<Tree> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                children.add(tree(child));
            }
        }
        return new Tree(label(node), children);
    }

    static String label(Node node) {
        String kind = node.getClass().getSimpleName();
        if (node instanceof BinaryExpr binary) {
            return kind + " " + binary.getOperator().asString();
        }
        if (node instanceof UnaryExpr unary) {
            return kind + " " + unary.getOperator().asString();
        }
        if (node instanceof AssignExpr assign) {
            return kind + " " + assign.getOperator().asString();
        }
        return kind;
    }

    static int distance(Tree a, Tree b) {
        int children = forestDistance(a.children, b.children);
        if (a.label.equals(b.label)) {
            return children;
        }
        return Math.min(1 + children, a.size + b.size);
    }

    /**
     * Ordered alignment of two child lists: match, delete or insert whole subtrees.
     */
    private static int forestDistance(List<Tree> first, List<Tree> second) {
        int m = first.size();
        int n = second.size();
        if (m == 0 || n == 0) {
            int total = 0;
            for (Tree tree : m == 0 ? second : first) {
                total += tree.size;
            }
            return total;
        }
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        for (int j = 1; j <= n; j++) {
            previous[j] = previous[j - 1] + second.get(j - 1).size;
        }
        for (int i = 1; i <= m; i++) {
            Tree left = first.get(i - 1);
            current[0] = previous[0] + left.size;
            for (int j = 1; j <= n; j++) {
                Tree right = second.get(j - 1);
                int match = previous[j - 1] + distance(left, right);
                int delete = previous[j] + left.size;
                int insert = current[j - 1] + right.size;
                current[j] = Math.min(match, Math.min(delete, insert));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[n];
    }
}
