package com.raditha.repairgraph.metrics;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.raditha.repairgraph.extraction.SourceFile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * How a change alters the types the code declares and uses.
 * <p>
 * Declarations are keyed by their owner and name ({@code Type.method.variable} for parameters and
 * locals, {@code Type.field} for fields), so a declaration counts as retyped only when the same key
 * exists on both sides with a different type.
 *
 * @param typedParametersDelta       parameters after minus before
 * @param returnTypesDelta           methods returning a value, after minus before
 * @param explicitVariablesDelta     locals with a written type, after minus before
 * @param inferredVariablesDelta     locals declared with {@code var}, after minus before
 * @param newTypes                   type names used only after the change, sorted
 * @param removedTypes               type names used only before the change, sorted
 * @param changedDeclarations        {@code key: old -> new} for every retyped declaration, sorted
 */
public record TypeChange(
        int typedParametersDelta,
        int returnTypesDelta,
        int explicitVariablesDelta,
        int inferredVariablesDelta,
        List<String> newTypes,
        List<String> removedTypes,
        List<String> changedDeclarations) {

    public TypeChange {
        newTypes = List.copyOf(newTypes);
        removedTypes = List.copyOf(removedTypes);
        changedDeclarations = List.copyOf(changedDeclarations);
    }

    public int totalChanges() {
        return newTypes.size() + removedTypes.size() + changedDeclarations.size();
    }

    public static TypeChange between(List<SourceFile> before, List<SourceFile> after) {
        Summary a = Summary.of(before);
        Summary b = Summary.of(after);

        Set<String> added = new TreeSet<>(b.typeNames);
        added.removeAll(a.typeNames);
        Set<String> removed = new TreeSet<>(a.typeNames);
        removed.removeAll(b.typeNames);

        Set<String> changed = new TreeSet<>();
        for (Map.Entry<String, String> entry : a.declarations.entrySet()) {
            String now = b.declarations.get(entry.getKey());
            if (now != null && !now.equals(entry.getValue())) {
                changed.add(entry.getKey() + ": " + entry.getValue() + " -> " + now);
            }
        }
        return new TypeChange(
                b.parameters - a.parameters,
                b.returnTypes - a.returnTypes,
                b.explicitVariables - a.explicitVariables,
                b.inferredVariables - a.inferredVariables,
                new ArrayList<>(added),
                new ArrayList<>(removed),
                new ArrayList<>(changed));
    }

    private static final class Summary {
        int parameters;
        int returnTypes;
        int explicitVariables;
        int inferredVariables;
        final Set<String> typeNames = new TreeSet<>();
        final Map<String, String> declarations = new HashMap<>();

        static Summary of(List<SourceFile> files) {
            Summary summary = new Summary();
            for (SourceFile file : files) {
                summary.scan(file);
            }
            return summary;
        }

        private void scan(SourceFile file) {
            for (Parameter parameter : file.unit().findAll(Parameter.class)) {
                parameters++;
                declare(parameter, parameter.getNameAsString(), parameter.getType());
            }
            for (MethodDeclaration method : file.unit().findAll(MethodDeclaration.class)) {
                if (!method.getType().isVoidType()) {
                    returnTypes++;
                }
            }
            for (VariableDeclarationExpr expr : file.unit().findAll(VariableDeclarationExpr.class)) {
                for (VariableDeclarator variable : expr.getVariables()) {
                    if (variable.getType().isVarType()) {
                        inferredVariables++;
                    } else {
                        explicitVariables++;
                        declare(variable, variable.getNameAsString(), variable.getType());
                    }
                }
            }
            for (FieldDeclaration field : file.unit().findAll(FieldDeclaration.class)) {
                for (VariableDeclarator variable : field.getVariables()) {
                    declare(variable, variable.getNameAsString(), variable.getType());
                }
            }
            for (ClassOrInterfaceType type : file.unit().findAll(ClassOrInterfaceType.class)) {
                typeNames.add(type.getNameAsString());
            }
            for (PrimitiveType type : file.unit().findAll(PrimitiveType.class)) {
                typeNames.add(type.asString());
            }
        }

        private void declare(Node node, String variable, Type type) {
            declarations.put(owner(node) + "." + variable, type.asString());
        }

        /**
         * Enclosing type and callable names, outermost first.
         */
        private static String owner(Node node) {
            List<String> names = new ArrayList<>();
            Node current = node.getParentNode().orElse(null);
            while (current != null) {
                if (current instanceof CallableDeclaration<?> callable) {
                    names.add(0, callable.getNameAsString());
                } else if (current instanceof TypeDeclaration<?> type) {
                    names.add(0, type.getNameAsString());
                }
                current = current.getParentNode().orElse(null);
            }
            return names.isEmpty() ? "<top>" : String.join(".", names);
        }
    }
}
