package org.asmscribe.annotator.frontend.lexer;

import org.asmscribe.annotator.api.ClassifiedLine;
import org.asmscribe.annotator.api.LineTag;
import org.asmscribe.annotator.api.RawLine;
import org.asmscribe.annotator.config.ClassifierRules;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier(ClassifierRules.defaults());

    static Stream<Arguments> lines() {
        return Stream.of(
                Arguments.of("", LineTag.BLANK),
                Arguments.of("   \t ", LineTag.BLANK),
                Arguments.of("\t.file\t\"main.cpp\"", LineTag.DIRECTIVE),
                Arguments.of("\t.def\tmain;", LineTag.DIRECTIVE),
                Arguments.of("\t.scl\t2;", LineTag.DIRECTIVE),
                Arguments.of("\t.type\t32;", LineTag.DIRECTIVE),
                Arguments.of("\t.endef", LineTag.DIRECTIVE),
                Arguments.of(".set @feat.00, 0", LineTag.DIRECTIVE),
                Arguments.of("\t.globl\t@feat.00", LineTag.DIRECTIVE),
                Arguments.of("\t.globl\tmain                            # -- Begin function main", LineTag.FUNCTION_START),
                Arguments.of("\t.globl\t\"??H@YA?AUPoint@@AEBU0@0@Z\"", LineTag.FUNCTION_START),
                Arguments.of("\t.global\tpoint_add", LineTag.FUNCTION_START),
                Arguments.of("main:                                   # @main", LineTag.LABEL),
                Arguments.of("\"??H@YA?AUPoint@@AEBU0@0@Z\":            # @\"??H@YA?AUPoint@@AEBU0@0@Z\"", LineTag.LABEL),
                Arguments.of(".LBB0_1:", LineTag.LABEL),
                Arguments.of("                                        # -- End function", LineTag.FUNCTION_END),
                Arguments.of("\tmovsd\txmm0, qword ptr [rdx]", LineTag.INSTRUCTION),
                Arguments.of("# %bb.0:", LineTag.INSTRUCTION),
                Arguments.of("\t.p2align\t4, 0x90", LineTag.INSTRUCTION),
                Arguments.of("\t.globlx\tmain", LineTag.INSTRUCTION),
                Arguments.of("what is this even", LineTag.INSTRUCTION));
    }

    @ParameterizedTest
    @MethodSource("lines")
    void classify_assignsExpectedTag(String text, LineTag expected) {
        assertThat(classifier.classify(text)).isEqualTo(expected);
    }

    @Test
    void classify_keepsRawLineUnchanged() {
        RawLine raw = new RawLine(7, "\tmovsd\tqword ptr [rcx], xmm0   ");

        ClassifiedLine classified = classifier.classify(raw);

        assertThat(classified.raw()).isSameAs(raw);
        assertThat(classified.text()).isEqualTo("\tmovsd\tqword ptr [rcx], xmm0   ");
        assertThat(classified.lineNumber()).isEqualTo(7);
    }

    @Test
    void declaredName_stripsQuotesAndTrailingComment() {
        assertThat(classifier.declaredName("\t.globl\t\"??H@YA?AUPoint@@AEBU0@0@Z\"     # -- Begin function x"))
                .contains("??H@YA?AUPoint@@AEBU0@0@Z");
        assertThat(classifier.declaredName("\t.globl\tmain")).contains("main");
        assertThat(classifier.declaredName("\t.globl")).isEmpty();
        assertThat(classifier.declaredName("\tmov rax, rcx")).isEmpty();
    }

    @Test
    void labelName_extractsBareLabelsOnly() {
        assertThat(classifier.labelName("main:   # @main")).contains("main");
        assertThat(classifier.labelName("\"??Z@unknown\":")).contains("??Z@unknown");
        assertThat(classifier.labelName("mov rax, qword ptr fs:[0]")).isEmpty();
        assertThat(classifier.labelName("$LN3@main: mov eax, 1")).isEmpty();
    }

    @Test
    void classify_isIdempotentForGeneratedCommentLines() {
        assertThat(classifier.classify("; END POINT_ADD (10 instructions)")).isEqualTo(LineTag.INSTRUCTION);
        assertThat(classifier.classify("; FUNCTION: Vector Addition")).isEqualTo(LineTag.INSTRUCTION);
        assertThat(classifier.classify("main:" + " ".repeat(40) + "; function main")).isEqualTo(LineTag.LABEL);
    }
}
