package com.raditha.repairgraph.metrics;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.raditha.repairgraph.extraction.SourceFile;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * How a change moves variables between local and field scope.
 * <p>
 * Inside every method and constructor a name is local when it is a parameter or a local
 * declaration, and a field when the code reaches it through {@code this.} or uses a field of the
 * enclosing type that no local shadows. Callables are matched across the change by type and name.
 *
 * @param localToField   names local in a callable before and used as fields there after
 * @param fieldToLocal   names used as fields in a callable before and local there after
 * @param newFields      fields declared only after the change
 * @param removedFields  fields declared only before the change
 */
public record ScopeChange(int localToField, int fieldToLocal, int newFields, int removedFields) {

    public int totalChanges() {
        return localToField + fieldToLocal + newFields + removedFields;
    }

    public static ScopeChange between(List<SourceFile> before, List<SourceFile> after) {
        Summary a = Summary.of(before);
        Summary b = Summary.of(after);

        int localToField = 0;
        int fieldToLocal = 0;
        for (Map.Entry<String, Scopes> entry : a.callables.entrySet()) {
            Scopes then = entry.getValue();
            Scopes now = b.callables.get(entry.getKey());
            if (now == null) {
                continue;
            }
            for (String local : then.locals) {
                if (now.fields.contains(local) && !now.locals.contains(local)) {
                    localToField++;
                }
            }
            for (String field : then.fields) {
                if (now.locals.contains(field)) {
                    fieldToLocal++;
                }
            }
        }
        return new ScopeChange(localToField, fieldToLocal,
                difference(b.fields, a.fields), difference(a.fields, b.fields));
    }

    private static int difference(Set<String> from, Set<String> minus) {
        Set<String> rest = new HashSet<>(from);
        rest.removeAll(minus);
        return rest.size();
    }

    private static final class Scopes {
        final Set<String> locals = new HashSet<>();
        final Set<String> fields = new HashSet<>();
    }

    private static final class Summary {
        /** Type.field for every declared field. */
        final Set<String> fields = new HashSet<>();
        /** Type.callable to its scopes. */
        final Map<String, Scopes> callables = new HashMap<>();

        static Summary of(List<SourceFile> files) {
            Summary summary = new Summary();
            for (SourceFile file : files) {
                for (TypeDeclaration<?> type : file.unit().findAll(TypeDeclaration.class)) {
                    summary.scan(type);
                }
            }
            return summary;
        }

        private void scan(TypeDeclaration<?> type) {
            String typeName = type.getNameAsString();
            Set<String> declared = new HashSet<>();
            for (FieldDeclaration field : type.getFields()) {
                for (VariableDeclarator variable : field.getVariables()) {
                    declared.add(variable.getNameAsString());
                    fields.add(typeName + "." + variable.getNameAsString());
                }
            }
            for (CallableDeclaration<?> callable : type.findAll(CallableDeclaration.class)) {
                if (enclosingType(callable) != type) {
                    continue;
                }
                Scopes scopes = new Scopes();
                for (Parameter parameter : callable.findAll(Parameter.class)) {
                    scopes.locals.add(parameter.getNameAsString());
                }
                for (VariableDeclarator variable : callable.findAll(VariableDeclarator.class)) {
                    scopes.locals.add(variable.getNameAsString());
                }
                for (FieldAccessExpr access : callable.findAll(FieldAccessExpr.class)) {
                    if (access.getScope() instanceof ThisExpr) {
                        scopes.fields.add(access.getNameAsString());
                    }
                }
                for (NameExpr name : callable.findAll(NameExpr.class)) {
                    String id = name.getNameAsString();
                    if (declared.contains(id) && !scopes.locals.contains(id)) {
                        scopes.fields.add(id);
                    }
                }
                callables.merge(typeName + "." + callable.getNameAsString(), scopes, Summary::union);
            }
        }

        private static Scopes union(Scopes first, Scopes second) {
            first.locals.addAll(second.locals);
            first.fields.addAll(second.fields);
            return first;
        }

        private static Node enclosingType(Node node) {
            Node current = node.getParentNode().orElse(null);
            while (current != null && !(current instanceof TypeDeclaration)) {
                current = current.getParentNode().orElse(null);
            }
            return current;
        }
    }
}
