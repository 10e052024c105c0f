package org.fluxgen.compiler.backend.emit;

import org.fluxgen.compiler.types.ArrayType;
import org.fluxgen.compiler.types.ChanType;
import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.InterfaceType;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.PointerType;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.StructType;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.Var;
import org.fluxgen.compiler.types.WildcardType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TypeFormatterTest {

    private static final GoPackage LOCAL = new GoPackage("example.com/demo", "demo");
    private static final GoPackage IO = new GoPackage("io", "io");

    private final List<GoPackage> requested = new ArrayList<>();
    private TypeFormatter formatter;

    @BeforeEach
    void setUp() {
        requested.clear();
        formatter = new TypeFormatter(p -> {
            if (p.equals(LOCAL)) {
                return null;
            }
            requested.add(p);
            return p.name();
        });
    }

    @Test
    void writesCompositeTypes() {
        assertThat(formatter.format(new MapType(Types.STRING, new SliceType(new PointerType(Types.INT)))))
                .isEqualTo("map[string][]*int");
        assertThat(formatter.format(new ArrayType(4, Types.BYTE))).isEqualTo("[4]byte");
        assertThat(formatter.format(new ChanType(ChanType.Direction.RECV_ONLY, Types.BOOL))).isEqualTo("<-chan bool");
        assertThat(formatter.format(new ChanType(ChanType.Direction.SEND_ONLY, Types.BOOL))).isEqualTo("chan<- bool");
    }

    @Test
    void qualifiesForeignNamedTypesOnly() {
        NamedType reader = new NamedType(IO, "Reader", new InterfaceType(List.of()));
        NamedType local = new NamedType(LOCAL, "Point", new StructType(List.of()));

        assertThat(formatter.format(new PointerType(reader))).isEqualTo("*io.Reader");
        assertThat(formatter.format(local)).isEqualTo("Point");
        assertThat(requested).containsExactly(IO);
    }

    @Test
    void writesSignaturesWithNamesAndVariadics() {
        SignatureType sig = new SignatureType(null,
                List.of(new Var("format", Types.STRING), new Var("args", new SliceType(Types.INT))),
                List.of(new Var("n", Types.INT), new Var("err", Types.ERROR)), true);

        assertThat(formatter.format(sig)).isEqualTo("func(format string, args ...int) (n int, err error)");
        assertThat(formatter.format(new SignatureType(List.of(new Var("", Types.INT)), List.of(new Var("", Types.BOOL)))))
                .isEqualTo("func(int) bool");
    }

    @Test
    void writesStructsAndInterfaces() {
        StructType s = new StructType(List.of(
                new StructType.Field("X", Types.INT, false),
                new StructType.Field("Reader", new NamedType(IO, "Reader", new InterfaceType(List.of())), true)));
        InterfaceType i = new InterfaceType(List.of(
                new InterfaceType.Method("Len", new SignatureType(List.of(), List.of(new Var("", Types.INT))))));

        assertThat(formatter.format(s)).isEqualTo("struct{X int; io.Reader}");
        assertThat(formatter.format(i)).isEqualTo("interface{Len() int}");
    }

    @Test
    void completenessLooksThroughComponents() {
        assertThat(TypeFormatter.isComplete(new SliceType(Types.INT))).isTrue();
        assertThat(TypeFormatter.isComplete(new MapType(Types.STRING, WildcardType.INSTANCE))).isFalse();
        assertThat(TypeFormatter.isComplete(new SignatureType(List.of(new Var("a", WildcardType.INSTANCE)), List.of())))
                .isFalse();
    }

    @Test
    void refusesWildcards() {
        assertThatThrownBy(() -> formatter.format(new SliceType(WildcardType.INSTANCE)))
                .isInstanceOf(IllegalStateException.class);
    }
}
