package org.fluxgen.compiler.types;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class TypesTest {

    private static final GoPackage DEMO = new GoPackage("example.com/demo", "demo");

    @Mock
    private TypeResolver resolver;

    @Test
    void wildcardsAreAssignableWithoutAskingTheResolver() {
        assertThat(Types.assignable(resolver, WildcardType.INSTANCE, Types.INT)).isTrue();
        assertThat(Types.assignable(resolver, Types.INT, WildcardType.INSTANCE)).isTrue();

        verify(resolver, never()).isIdentical(any(), any());
    }

    @Test
    void assignabilityDefersToTheResolversIdentity() {
        when(resolver.isIdentical(Types.INT, Types.STRING)).thenReturn(false);

        assertThat(Types.assignable(resolver, Types.INT, Types.STRING)).isFalse();
        verify(resolver, atLeastOnce()).isIdentical(Types.INT, Types.STRING);
    }

    @Test
    void pointerToAssignableElementNeedsDereference() {
        PointerType ptr = new PointerType(Types.INT);
        when(resolver.isIdentical(any(), any())).thenAnswer(inv -> TypeIdentity.identical(inv.getArgument(0), inv.getArgument(1)));

        assertThat(Types.needsDereference(resolver, ptr, Types.INT)).isTrue();
        assertThat(Types.needsDereference(resolver, ptr, ptr)).isFalse();
        assertThat(Types.needsDereference(resolver, Types.INT, Types.INT)).isFalse();
    }

    @Test
    void namedAndUnnamedWithIdenticalUnderlyingAreAssignable() {
        NamedType ids = new NamedType(DEMO, "IDs", new SliceType(Types.INT));
        StructuralTypeResolver real = new StructuralTypeResolver(DEMO);

        assertThat(Types.assignable(real, new SliceType(Types.INT), ids)).isTrue();
        assertThat(Types.assignable(real, ids, new NamedType(DEMO, "Other", new SliceType(Types.INT)))).isFalse();
    }

    @Test
    void referenceLikeTypesLookThroughNames() {
        NamedType handler = new NamedType(DEMO, "Handler", new SignatureType(List.of(), List.of()));

        assertThat(Types.isReferenceLike(handler)).isTrue();
        assertThat(Types.isReferenceLike(new MapType(Types.STRING, Types.INT))).isTrue();
        assertThat(Types.isReferenceLike(new ArrayType(2, Types.INT))).isFalse();
        assertThat(Types.isReferenceLike(Types.STRING)).isFalse();
    }

    @Test
    void underlyingStopsOnUnboundSelfReference() {
        NamedType loop = new NamedType(DEMO, "Loop", null);
        loop.bindUnderlying(loop);

        assertThat(Types.underlying(loop)).isSameAs(WildcardType.INSTANCE);
    }

    @Test
    void predeclaredNamesIncludeError() {
        assertThat(Types.predeclared("error")).contains(Types.ERROR);
        assertThat(Types.predeclared("Error")).isEmpty();
    }
}
