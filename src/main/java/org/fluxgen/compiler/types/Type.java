package org.fluxgen.compiler.types;

/**
 * Structural type of a port, a symbol or a definition. Instances are immutable
 * except for {@link NamedType}, whose underlying type may be bound after creation
 * to allow recursive declarations.
 * <p>
 * Identity between types is decided by a {@link TypeResolver}, not by {@code equals}.
 */
public sealed interface Type permits BasicType, NamedType, PointerType, ArrayType, SliceType,
        MapType, ChanType, SignatureType, InterfaceType, StructType, WildcardType {}
