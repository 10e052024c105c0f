package org.fluxgen.cli.document;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * JSON form of a package graph, as read by the {@code generate} command.
 * <p>
 * Types are written as type expressions ({@code map[string][]int}). Nodes carry
 * document-wide ids; connections refer to ports as {@code id.selector} where the
 * selector is one of {@code out[i]}, {@code in[i]}, {@code seq}, {@code param[i]},
 * {@code result[i]}, {@code cond[i]}, {@code key} or {@code value}.
 *
 * @param pkg         The package being generated.
 * @param imports     Foreign packages whose names may qualify types and symbols.
 * @param types       Named type declarations.
 * @param symbols     Foreign functions, variables and constants.
 * @param functions   Top-level function and method definitions.
 * @param connections Data and sequence connections, applied in order.
 */
public record GraphDocument(
        @SerializedName("package") PackageRef pkg,
        List<PackageRef> imports,
        List<TypeDecl> types,
        List<SymbolDecl> symbols,
        List<FunctionDecl> functions,
        List<ConnectionDecl> connections
) {

    public record PackageRef(String path, String name) {}

    /**
     * @param pkg        Path of the declaring package, or {@code null} for the local package.
     * @param name       The type name.
     * @param underlying The underlying type expression.
     */
    public record TypeDecl(String pkg, String name, String underlying) {}

    /**
     * @param kind     {@code func}, {@code var} or {@code const}.
     * @param pkg      Name or path of the declaring package.
     * @param name     The symbol name.
     * @param type     The type expression; a signature for functions.
     * @param receiver The receiver of a method, or {@code null}.
     */
    public record SymbolDecl(String kind, String pkg, String name, String type, VarDecl receiver) {}

    public record VarDecl(String name, String type) {}

    /**
     * @param id        Document id, usable as a connection endpoint.
     * @param name      The function name.
     * @param receiver  The receiver of a method, or {@code null}.
     * @param signature The signature without receiver, e.g. {@code func(n int) string}.
     * @param body      The function body.
     */
    public record FunctionDecl(String id, String name, VarDecl receiver, String signature, BlockDecl body) {}

    public record BlockDecl(List<VarDecl> locals, List<NodeDecl> nodes) {}

    /**
     * One node. Only the fields relevant to its kind are read.
     */
    public record NodeDecl(
            String id,
            String kind,
            String func,
            Boolean ellipsis,
            String literal,
            String text,
            Boolean set,
            String type,
            Integer elements,
            String operator,
            Boolean unary,
            String symbol,
            String field,
            String method,
            String local,
            String signature,
            BlockDecl body,
            List<BlockDecl> branches
    ) {}

    /**
     * @param from   Output endpoint.
     * @param to     Input endpoint.
     * @param hidden Whether the connection is drawn hidden.
     * @param label  Label of a hidden connection.
     */
    public record ConnectionDecl(String from, String to, Boolean hidden, String label) {}
}
