package org.fluxgen.compiler.types;

import java.util.List;

/**
 * Function signature. For methods {@code receiver} is non-null.
 * When {@code variadic} is set the last parameter has a {@link SliceType}.
 */
public record SignatureType(Var receiver, List<Var> params, List<Var> results, boolean variadic) implements Type {

    public SignatureType {
        params = List.copyOf(params);
        results = List.copyOf(results);
    }

    public SignatureType(List<Var> params, List<Var> results) {
        this(null, params, results, false);
    }

    public boolean isMethod() {
        return receiver != null;
    }

    /**
     * @return The same signature without its receiver.
     */
    public SignatureType withoutReceiver() {
        return new SignatureType(null, params, results, variadic);
    }
}
