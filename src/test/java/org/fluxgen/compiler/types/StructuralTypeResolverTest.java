package org.fluxgen.compiler.types;

import org.fluxgen.compiler.api.ResolverException;
import org.fluxgen.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StructuralTypeResolverTest {

    private static final GoPackage DEMO = new GoPackage("example.com/demo", "demo");
    private static final GoPackage IO = new GoPackage("io", "io");

    private StructuralTypeResolver resolver;
    private NamedType reader;

    @BeforeEach
    void setUp() {
        resolver = new StructuralTypeResolver(DEMO);
        resolver.registerPackage(IO);
        reader = resolver.declare(new NamedType(IO, "Reader", new InterfaceType(List.of())));
    }

    @Test
    void resolvesLocalNamesUnqualified() throws ResolverException {
        NamedType point = resolver.declare(new NamedType(DEMO, "Point", null));
        point.bindUnderlying(resolver.resolve("struct{X, Y int}"));

        assertThat(resolver.resolve("*Point")).isEqualTo(new PointerType(point));
        assertThat(resolver.resolve("demo.Point")).isEqualTo(point);
    }

    @Test
    void resolvesForeignNamesByPackageNameOrPath() throws ResolverException {
        assertThat(resolver.resolve("io.Reader")).isSameAs(reader);
        assertThat(resolver.declaration("io.Reader")).isSameAs(reader);
    }

    @Test
    void supportsSelfReferencingDeclarations() throws ResolverException {
        NamedType node = resolver.declare(new NamedType(DEMO, "Node", null));
        node.bindUnderlying(resolver.resolve("struct{Next *Node; Value int}"));

        StructType s = (StructType) node.underlying();
        assertThat(s.field("Next").orElseThrow().type()).isEqualTo(new PointerType(node));
    }

    @Test
    void blankAndUnknownReferencesResolveToWildcard() throws ResolverException {
        assertThat(resolver.resolve("")).isSameAs(WildcardType.INSTANCE);
        assertThat(resolver.resolve(null)).isSameAs(WildcardType.INSTANCE);
        assertThat(resolver.resolve("Nowhere")).isSameAs(WildcardType.INSTANCE);
    }

    @Test
    void memoizesParsedExpressionsUntilRedeclared() throws ResolverException {
        Type first = resolver.resolve("[]io.Reader");
        assertThat(resolver.resolve("[]io.Reader")).isSameAs(first);

        resolver.declare(new NamedType(IO, "Writer", new InterfaceType(List.of())));

        assertThat(resolver.resolve("[]io.Reader")).isNotSameAs(first).isEqualTo(first);
    }

    @Test
    void identityAndHashAgree() throws ResolverException {
        Type a = resolver.resolve("func(x []byte) (int, error)");
        Type b = resolver.resolve("func(buf []uint8) (n int, err error)");
        Type c = resolver.resolve("func([]byte) int");

        assertThat(resolver.isIdentical(a, b)).isTrue();
        assertThat(resolver.hash(a)).isEqualTo(resolver.hash(b));
        assertThat(resolver.isIdentical(a, c)).isFalse();
    }
}
