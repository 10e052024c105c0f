package org.fluxgen.compiler.types;

import org.fluxgen.compiler.api.CodegenErrorCode;
import org.fluxgen.compiler.api.ResolverException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TypeExpressionParserTest {

    private static final NamedType STRINGER = new NamedType(new GoPackage("fmt", "fmt"), "Stringer",
            new InterfaceType(List.of()));
    private static final Map<String, Type> NAMES = Map.of("fmt.Stringer", STRINGER);

    private static Type parse(String text) throws ResolverException {
        return TypeExpressionParser.parse(text, NAMES::get);
    }

    @Test
    void parsesNestedComposites() throws ResolverException {
        Type t = parse("map[string][]*fmt.Stringer");

        assertThat(t).isEqualTo(new MapType(Types.STRING, new SliceType(new PointerType(STRINGER))));
    }

    @Test
    void parsesArraysAndChannels() throws ResolverException {
        assertThat(parse("[8]byte")).isEqualTo(new ArrayType(8, Types.BYTE));
        assertThat(parse("<-chan int")).isEqualTo(new ChanType(ChanType.Direction.RECV_ONLY, Types.INT));
        assertThat(parse("chan<- int")).isEqualTo(new ChanType(ChanType.Direction.SEND_ONLY, Types.INT));
        assertThat(parse("chan (int)")).isEqualTo(new ChanType(ChanType.Direction.SEND_RECV, Types.INT));
    }

    @Test
    void parsesNamedVariadicSignature() throws ResolverException {
        SignatureType sig = (SignatureType) parse("func(format string, args ...int) (n int, err error)");

        assertThat(sig.variadic()).isTrue();
        assertThat(sig.params()).containsExactly(new Var("format", Types.STRING), new Var("args", new SliceType(Types.INT)));
        assertThat(sig.results()).containsExactly(new Var("n", Types.INT), new Var("err", Types.ERROR));
    }

    @Test
    void parsesGroupedAndUnnamedParameters() throws ResolverException {
        SignatureType grouped = (SignatureType) parse("func(a, b int) bool");
        SignatureType unnamed = (SignatureType) parse("func(int, fmt.Stringer)");

        assertThat(grouped.params()).extracting(Var::name).containsExactly("a", "b");
        assertThat(grouped.params()).extracting(Var::type).containsOnly(Types.INT);
        assertThat(grouped.results()).containsExactly(new Var("", Types.BOOL));
        assertThat(unnamed.params()).extracting(Var::type).containsExactly(Types.INT, STRINGER);
        assertThat(unnamed.results()).isEmpty();
    }

    @Test
    void parsesStructWithEmbeddedField() throws ResolverException {
        StructType s = (StructType) parse("struct{X, Y int; *fmt.Stringer}");

        assertThat(s.fields()).extracting(StructType.Field::name).containsExactly("X", "Y", "Stringer");
        assertThat(s.fields().get(2).embedded()).isTrue();
        assertThat(s.fields().get(2).type()).isEqualTo(new PointerType(STRINGER));
    }

    @Test
    void parsesInterfaceMethods() throws ResolverException {
        InterfaceType i = (InterfaceType) parse("interface{Len() int; Less(i, j int) bool}");

        assertThat(i.methods()).extracting(InterfaceType.Method::name).containsExactly("Len", "Less");
    }

    @Test
    void unknownNamesBecomeWildcards() throws ResolverException {
        assertThat(parse("[]Missing")).isEqualTo(new SliceType(WildcardType.INSTANCE));
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThatThrownBy(() -> parse("map[string"))
                .isInstanceOf(ResolverException.class)
                .satisfies(e -> assertThat(((ResolverException) e).errorCode()).isEqualTo(CodegenErrorCode.RESOLVER_FAILURE));
        assertThatThrownBy(() -> parse("[x]int")).isInstanceOf(ResolverException.class);
        assertThatThrownBy(() -> parse("int int")).isInstanceOf(ResolverException.class);
    }
}
