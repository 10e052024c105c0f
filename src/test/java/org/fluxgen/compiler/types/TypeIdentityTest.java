package org.fluxgen.compiler.types;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TypeIdentityTest {

    private static final GoPackage A = new GoPackage("example.com/a", "a");
    private static final GoPackage B = new GoPackage("example.com/b", "b");

    private final TypeHasher hasher = new TypeHasher();

    @Test
    void aliasesOfBasicTypesAreIdentical() {
        assertThat(TypeIdentity.identical(Types.BYTE, Types.UINT8)).isTrue();
        assertThat(TypeIdentity.identical(Types.RUNE, Types.INT32)).isTrue();
        assertThat(hasher.hash(Types.BYTE)).isEqualTo(hasher.hash(Types.UINT8));
        assertThat(TypeIdentity.identical(Types.INT, Types.INT64)).isFalse();
    }

    @Test
    void namedTypesAreIdenticalByDeclarationOnly() {
        NamedType one = new NamedType(A, "ID", Types.INT);
        NamedType same = new NamedType(A, "ID", Types.STRING);
        NamedType other = new NamedType(B, "ID", Types.INT);

        assertThat(TypeIdentity.identical(one, same)).isTrue();
        assertThat(TypeIdentity.identical(one, other)).isFalse();
        assertThat(TypeIdentity.identical(one, Types.INT)).isFalse();
        assertThat(hasher.hash(one)).isEqualTo(hasher.hash(same));
    }

    @Test
    void interfaceMethodOrderDoesNotMatter() {
        InterfaceType.Method len = new InterfaceType.Method("Len",
                new SignatureType(List.of(), List.of(new Var("", Types.INT))));
        InterfaceType.Method reset = new InterfaceType.Method("Reset", new SignatureType(List.of(), List.of()));
        InterfaceType x = new InterfaceType(List.of(len, reset));
        InterfaceType y = new InterfaceType(List.of(reset, len));

        assertThat(TypeIdentity.identical(x, y)).isTrue();
        assertThat(hasher.hash(x)).isEqualTo(hasher.hash(y));
    }

    @Test
    void structFieldNamesAndOrderMatter() {
        StructType xy = new StructType(List.of(
                new StructType.Field("X", Types.INT, false), new StructType.Field("Y", Types.INT, false)));
        StructType yx = new StructType(List.of(
                new StructType.Field("Y", Types.INT, false), new StructType.Field("X", Types.INT, false)));

        assertThat(TypeIdentity.identical(xy, yx)).isFalse();
        assertThat(TypeIdentity.identical(xy, new StructType(xy.fields()))).isTrue();
    }

    @Test
    void variadicnessAndChannelDirectionMatter() {
        SignatureType plain = new SignatureType(null, List.of(new Var("", new SliceType(Types.INT))), List.of(), false);
        SignatureType variadic = new SignatureType(null, List.of(new Var("", new SliceType(Types.INT))), List.of(), true);

        assertThat(TypeIdentity.identical(plain, variadic)).isFalse();
        assertThat(TypeIdentity.identical(new ChanType(ChanType.Direction.SEND_ONLY, Types.INT),
                new ChanType(ChanType.Direction.SEND_RECV, Types.INT))).isFalse();
    }

    @Test
    void hasherCachesPerInstance() {
        SliceType s = new SliceType(Types.STRING);

        int first = hasher.hash(s);
        int size = hasher.size();

        assertThat(hasher.hash(s)).isEqualTo(first);
        assertThat(hasher.size()).isEqualTo(size);
    }
}
