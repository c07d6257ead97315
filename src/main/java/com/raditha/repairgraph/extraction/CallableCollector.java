package com.raditha.repairgraph.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the types and callables of an analysis unit in declaration order.
 * Member types and local classes are included; anonymous classes are not (their code belongs
 * to the enclosing callable).
 */
public final class CallableCollector {

    private CallableCollector() {
    }

    /**
     * A type declaration with its unit-qualified name.
     */
    public record DeclaredType(SourceFile file, String qualifiedName, TypeDeclaration<?> declaration,
            Optional<String> enclosingType) {
    }

    public static List<DeclaredType> types(AnalysisUnit unit) {
        List<DeclaredType> types = new ArrayList<>();
        for (SourceFile file : unit.files()) {
            for (TypeDeclaration<?> type : file.unit().findAll(TypeDeclaration.class)) {
                types.add(new DeclaredType(file, qualifiedName(type), type, enclosingTypeName(type)));
            }
        }
        return types;
    }

    public static List<Callable> callables(AnalysisUnit unit) {
        List<Callable> callables = new ArrayList<>();
        for (DeclaredType type : types(unit)) {
            callables.addAll(callablesOf(type));
        }
        return callables;
    }

    public static List<Callable> callablesOf(DeclaredType type) {
        List<Callable> callables = new ArrayList<>();
        String owner = type.qualifiedName();
        String simpleName = type.declaration().getNameAsString();
        for (BodyDeclaration<?> member : type.declaration().getMembers()) {
            if (member instanceof MethodDeclaration method) {
                method.getBody().ifPresent(body -> callables.add(new Callable(type.file(), owner,
                        method.getNameAsString(), method.getParameters().size(), false, method, body,
                        method.getParameters())));
            } else if (member instanceof ConstructorDeclaration constructor) {
                callables.add(new Callable(type.file(), owner, simpleName, constructor.getParameters().size(),
                        true, constructor, constructor.getBody(), constructor.getParameters()));
            } else if (member instanceof CompactConstructorDeclaration compact) {
                List<Parameter> components = type.declaration() instanceof RecordDeclaration recordType
                        ? recordType.getParameters() : List.of();
                callables.add(new Callable(type.file(), owner, simpleName, components.size(), true, compact,
                        compact.getBody(), components));
            } else if (member instanceof InitializerDeclaration initializer) {
                String name = initializer.isStatic() ? "<clinit>" : "<init>";
                callables.add(new Callable(type.file(), owner, name, 0, false, initializer,
                        initializer.getBody(), List.of()));
            }
        }
        return callables;
    }

    static String qualifiedName(TypeDeclaration<?> type) {
        StringBuilder sb = new StringBuilder(type.getNameAsString());
        Optional<String> enclosing = enclosingTypeName(type);
        enclosing.ifPresent(e -> sb.insert(0, e + "."));
        return sb.toString();
    }

    private static Optional<String> enclosingTypeName(TypeDeclaration<?> type) {
        Optional<Node> parent = type.getParentNode();
        while (parent.isPresent()) {
            if (parent.get() instanceof TypeDeclaration<?> enclosing) {
                return Optional.of(qualifiedName(enclosing));
            }
            parent = parent.get().getParentNode();
        }
        return Optional.empty();
    }
}
