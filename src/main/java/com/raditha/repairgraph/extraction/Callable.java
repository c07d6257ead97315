package com.raditha.repairgraph.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.raditha.repairgraph.model.SourcePosition;

import java.util.List;

/**
 * A method, constructor or initializer block with a body.
 *
 * @param file        file the callable is declared in
 * @param owner       name of the declaring type, qualified by its enclosing types ({@code Outer.Inner})
 * @param name        simple name; the type's simple name for constructors
 * @param arity       number of parameters
 * @param constructor true for constructors and compact constructors
 * @param declaration the declaring AST node
 * @param body        the body to decompose
 * @param parameters  declared parameters in order
 */
public record Callable(
        SourceFile file,
        String owner,
        String name,
        int arity,
        boolean constructor,
        Node declaration,
        BlockStmt body,
        List<Parameter> parameters) {

    public Callable {
        parameters = List.copyOf(parameters);
    }

    /**
     * Label shared by the CFG entry node and the call graph declaration: {@code Owner.name/arity}.
     */
    public String signature() {
        return owner + "." + name + "/" + arity;
    }

    /**
     * Statement key of the callable's entry, shared by every view that has a node for it.
     */
    public String entryKey() {
        return StatementKeys.of(file.path(), declaration) + "#entry";
    }

    public SourcePosition position() {
        return SourcePosition.of(declaration);
    }
}
