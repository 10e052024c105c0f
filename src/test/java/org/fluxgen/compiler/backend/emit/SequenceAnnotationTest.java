package org.fluxgen.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SequenceAnnotationTest {

    @Test
    void formatsPredecessorsAndId() {
        assertThat(new SequenceAnnotation(List.of(1, 2), 3).format()).isEqualTo("//1,2;3");
        assertThat(new SequenceAnnotation(List.of(), 0).format()).isEqualTo("//;0");
        assertThat(new SequenceAnnotation(List.of(4), -1).format()).isEqualTo("//4;");
    }

    @Test
    void parsesTrailerOfAGeneratedLine() {
        SequenceAnnotation a = SequenceAnnotation.parse("\tsink(n)//0,5;7\n").orElseThrow();

        assertThat(a.predecessors()).containsExactly(0, 5);
        assertThat(a.id()).isEqualTo(7);
    }

    @Test
    void parsesEmptyParts() {
        SequenceAnnotation a = SequenceAnnotation.parse("first()//;0").orElseThrow();
        SequenceAnnotation b = SequenceAnnotation.parse("second()//0;").orElseThrow();

        assertThat(a.predecessors()).isEmpty();
        assertThat(a.id()).isZero();
        assertThat(b.predecessors()).containsExactly(0);
        assertThat(b.id()).isEqualTo(-1);
    }

    @Test
    void linesWithoutTrailerYieldNothing() {
        assertThat(SequenceAnnotation.parse("n := source()")).isEmpty();
        assertThat(SequenceAnnotation.parse("x := a // comment")).isEmpty();
    }
}
