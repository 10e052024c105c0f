package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;

import java.util.Optional;

/**
 * A declared function or method.
 *
 * @param pkg       The declaring package.
 * @param name      The function name.
 * @param signature The signature; methods carry a receiver.
 */
public record FuncSymbol(GoPackage pkg, String name, SignatureType signature) implements Symbol {

    @Override
    public Type type() {
        return signature;
    }

    public boolean isMethod() {
        return signature.isMethod();
    }

    /**
     * @return The named type of the receiver with any pointer stripped, if this is a method
     * on a named type.
     */
    public Optional<NamedType> receiverType() {
        if (!isMethod()) {
            return Optional.empty();
        }
        Type t = Types.indirect(signature.receiver().type()).base();
        return t instanceof NamedType n ? Optional.of(n) : Optional.empty();
    }
}
