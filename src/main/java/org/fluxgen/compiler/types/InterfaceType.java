package org.fluxgen.compiler.types;

import java.util.List;

/**
 * Structural interface given by its method set.
 */
public record InterfaceType(List<Method> methods) implements Type {

    public InterfaceType {
        methods = List.copyOf(methods);
    }

    /**
     * A method of an interface.
     */
    public record Method(String name, SignatureType signature) {}
}
