package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.Type;

/**
 * A package-level constant. Reading it produces a {@code const} declaration.
 */
public record ConstSymbol(GoPackage pkg, String name, Type type) implements Symbol {}
