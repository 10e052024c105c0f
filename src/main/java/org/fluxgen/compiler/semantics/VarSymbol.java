package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.Type;

/**
 * A package-level variable.
 */
public record VarSymbol(GoPackage pkg, String name, Type type) implements Symbol {}
