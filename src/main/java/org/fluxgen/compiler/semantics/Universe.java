package org.fluxgen.compiler.semantics;

import java.util.List;

/**
 * Names predeclared in the universe block of the target language.
 */
public final class Universe {

    private static final List<String> NAMES = List.of(
            "bool", "byte", "complex64", "complex128", "error", "float32", "float64",
            "int", "int8", "int16", "int32", "int64", "rune", "string",
            "uint", "uint8", "uint16", "uint32", "uint64", "uintptr",
            "true", "false", "iota", "nil",
            "append", "cap", "close", "complex", "copy", "delete", "imag", "len",
            "make", "new", "panic", "print", "println", "real", "recover");

    private static final List<String> KEYWORDS = List.of(
            "break", "case", "chan", "const", "continue", "default", "defer", "else",
            "fallthrough", "for", "func", "go", "goto", "if", "import", "interface",
            "map", "package", "range", "return", "select", "struct", "switch", "type", "var");

    private Universe() {}

    /**
     * @return The reserved keywords, which can never be used as identifiers.
     */
    public static List<String> keywords() {
        return KEYWORDS;
    }

    /**
     * @return The predeclared names in a fixed order.
     */
    public static List<String> names() {
        return NAMES;
    }
}
