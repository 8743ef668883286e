package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.api.AnnotatedLine;
import org.asmscribe.annotator.api.ClassifiedLine;
import org.asmscribe.annotator.api.FunctionContext;
import org.asmscribe.annotator.api.LineTag;
import org.asmscribe.annotator.api.RawLine;
import org.asmscribe.annotator.config.AnnotatorSettings;
import org.asmscribe.annotator.config.HeaderMetadata;
import org.asmscribe.annotator.config.RenderStyle;
import org.asmscribe.annotator.config.RenderingOptions;
import org.asmscribe.annotator.frontend.operands.OpcodeClass;
import org.asmscribe.annotator.frontend.operands.OpcodeTable;
import org.asmscribe.annotator.frontend.operands.SemanticTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Renderer}.
 */
@Tag("unit")
class RendererTest {

    private static final String POINT_ADD = "??H@YA?AUPoint@@AEBU0@0@Z";

    private AnnotatorSettings settings;
    private Renderer renderer;
    private HeaderMetadata noHeader;

    @BeforeEach
    void setUp() {
        settings = AnnotatorSettings.defaults();
        renderer = new Renderer(settings.rendering(), settings.layout(), settings.convention(), settings.functions());
        noHeader = settings.header().withEnabled(false);
    }

    private static AnnotatedLine line(int number, String text, LineTag tag, FunctionContext context, String comment) {
        return new AnnotatedLine(new ClassifiedLine(new RawLine(number, text), tag), context, List.of(), comment);
    }

    private List<AnnotatedLine> pointAdd(boolean terminated) {
        FunctionContext context = new FunctionContext(POINT_ADD, "point_add", 1);
        List<AnnotatedLine> lines = new ArrayList<>(List.of(
                line(1, "\t.def\t\"" + POINT_ADD + "\";", LineTag.DIRECTIVE, null, null),
                line(2, "\t.globl\t\"" + POINT_ADD + "\"", LineTag.FUNCTION_START, context, "function point_add"),
                line(3, "\"" + POINT_ADD + "\":", LineTag.LABEL, context, "function point_add"),
                line(4, "\tmovsd\txmm0, qword ptr [rdx]", LineTag.INSTRUCTION, context,
                        "Move scalar double | load field x of 2nd argument"),
                line(5, "# %bb.0:", LineTag.INSTRUCTION, context, null),
                line(6, "\tret", LineTag.INSTRUCTION, context, "Return from function")));
        if (terminated) {
            lines.add(line(7, "# -- End function", LineTag.FUNCTION_END, context, null));
        }
        return lines;
    }

    private static String padded(String text, int column) {
        return text + " ".repeat(column - text.length());
    }

    private static List<String> lines(String rendered) {
        return List.of(rendered.split("\n", -1));
    }

    @Test
    void dropsDirectivesAndKeepsEveryOtherLineAsSubstring() {
        String out = renderer.render(noHeader, pointAdd(true));

        assertThat(out).doesNotContain(".def");
        for (AnnotatedLine line : pointAdd(true)) {
            if (line.tag() != LineTag.DIRECTIVE) {
                assertThat(lines(out)).anySatisfy(rendered -> assertThat(rendered).contains(line.text()));
            }
        }
        assertThat(out).endsWith("\n");
    }

    @Test
    void generatedLinesAreCommentsOrBlank() {
        HeaderMetadata header = settings.header().withSummary(true);
        List<AnnotatedLine> input = pointAdd(true);

        String out = renderer.render(header, input);

        List<String> originals = input.stream().map(AnnotatedLine::text).toList();
        for (String rendered : lines(out)) {
            boolean original = originals.stream().anyMatch(rendered::contains);
            assertThat(original || rendered.isEmpty() || rendered.startsWith(";"))
                    .as("generated line '%s'", rendered)
                    .isTrue();
        }
    }

    @Test
    void alignsCommentsAtIndentPlusCommentColumn() {
        String out = renderer.render(noHeader, pointAdd(true));

        String movsd = lines(out).stream().filter(l -> l.contains("movsd")).findFirst().orElseThrow();
        assertThat(movsd).startsWith("\tmovsd\txmm0, qword ptr [rdx]");
        assertThat(movsd.indexOf("; Move scalar double")).isEqualTo(64);
    }

    @Test
    void indentsInstructionsWithoutLeadingWhitespace() {
        AnnotatedLine bare = line(1, "ret", LineTag.INSTRUCTION, null, null);
        AnnotatedLine label = line(2, "main:", LineTag.LABEL, null, null);

        assertThat(renderer.format(bare)).isEqualTo("    ret");
        assertThat(renderer.format(label)).isEqualTo("main:");
    }

    @Test
    void longInstructionGetsSingleSpaceBeforeComment() {
        Renderer narrow = new Renderer(new RenderingOptions(10, 2), Map.of(), List.of());
        AnnotatedLine longLine = line(1, "\tvmovupd\tymmword ptr [rsp + 128], ymm0", LineTag.INSTRUCTION, null, "Move");

        assertThat(narrow.format(longLine)).isEqualTo("\tvmovupd\tymmword ptr [rsp + 128], ymm0 ; Move");
    }

    @Test
    void writesFunctionBannerAndEndLine() {
        List<String> out = lines(renderer.render(noHeader, pointAdd(true)));

        assertThat(out).containsSubsequence(
                "; " + "=".repeat(78),
                "; FUNCTION: Vector Addition",
                "; " + "=".repeat(78),
                "; Symbol: " + POINT_ADD,
                "; Signature: Point add_points(Point* result, const Point* p1, const Point* p2)",
                "; Description: Adds two 3D points component-wise",
                ";",
                padded("\t.globl\t\"" + POINT_ADD + "\"", 64) + "; function point_add");
        assertThat(out).containsSubsequence(
                "# -- End function",
                "; END POINT_ADD (2 instructions)",
                "; " + "-".repeat(78));
        assertThat(out).noneMatch(l -> l.startsWith("; WARNING"));
    }

    @Test
    void undescribedFunctionUsesUpperCaseNameAndNoSymbolLine() {
        FunctionContext context = new FunctionContext("helper", "helper", 1);
        List<String> out = lines(renderer.render(noHeader, List.of(
                line(1, "\t.globl\thelper", LineTag.FUNCTION_START, context, null),
                line(2, "# -- End function", LineTag.FUNCTION_END, context, null))));

        assertThat(out).contains("; FUNCTION: HELPER", "; END HELPER (0 instructions)");
        assertThat(out).noneMatch(l -> l.startsWith("; Symbol:"));
    }

    @Test
    void assemblerDirectivesAreNotCountedAsInstructions() {
        FunctionContext context = new FunctionContext("main", "main", 1);
        OpcodeClass pseudo = OpcodeTable.initialize().lookup(".p2align").orElseThrow();
        List<String> out = lines(renderer.render(noHeader, List.of(
                line(1, "\t.globl\tmain", LineTag.FUNCTION_START, context, "function main"),
                new AnnotatedLine(new ClassifiedLine(new RawLine(2, "\t.p2align\t4, 0x90"), LineTag.INSTRUCTION),
                        context, List.of(new SemanticTag.OpcodeTag(".p2align", pseudo)), "Assembler directive"),
                line(3, "\tret", LineTag.INSTRUCTION, context, "Return from function"),
                line(4, "# -- End function", LineTag.FUNCTION_END, context, null))));

        assertThat(out).contains("; END MAIN (1 instructions)");
    }

    @Test
    void warnsAboutUnterminatedFunction() {
        List<String> out = lines(renderer.render(noHeader, pointAdd(false)));

        assertThat(out).contains("; WARNING: unterminated function point_add");
        assertThat(out).noneMatch(l -> l.startsWith("; END"));
    }

    @Test
    void headerContainsTitleLegendAndLayout() {
        List<String> out = lines(renderer.render(settings.header(), pointAdd(true)));

        assertThat(out.get(0)).isEqualTo("; " + "=".repeat(78));
        assertThat(out).anySatisfy(l -> assertThat(l).contains("ANNOTATED ASSEMBLY LISTING"));
        assertThat(out).contains("; CALLING CONVENTION (Windows x64):", "; RECORD LAYOUT: Point (24 bytes)");
        assertThat(out).anySatisfy(l -> assertThat(l).startsWith(";   rcx").endsWith("1st argument (result)"));
        assertThat(out).anySatisfy(l -> assertThat(l).startsWith(";   rax").endsWith("integer return value"));
        assertThat(out).containsSubsequence(
                ";   +--------+--------+--------+",
                ";   |   x    |   y    |   z    |",
                ";   +--------+--------+--------+",
                ";   0        8        16       24");
        assertThat(out).doesNotContain("; FUNCTIONS:");
    }

    @Test
    void headerSummaryListsFunctions() {
        List<String> out = lines(renderer.render(settings.header().withSummary(true), pointAdd(false)));

        assertThat(out).containsSubsequence(
                "; FUNCTIONS:",
                ";   point_add  2 instructions, source symbol " + POINT_ADD + ", unterminated");
    }

    @Test
    void disabledHeaderStartsWithBody() {
        String out = renderer.render(noHeader, pointAdd(true));

        assertThat(out).doesNotContain("CALLING CONVENTION");
        assertThat(lines(out).get(1)).isEqualTo("; FUNCTION: Vector Addition");
    }

    @Test
    void boxStyleFramesBanners() {
        List<String> out = lines(renderer.render(settings.header().withStyle(RenderStyle.BOX), pointAdd(true)));

        assertThat(out.get(0)).isEqualTo("; +" + "=".repeat(76) + "+");
        assertThat(out.get(1)).startsWith("; | ").endsWith(" |").contains("ANNOTATED ASSEMBLY LISTING").hasSize(80);
        assertThat(out).contains("; +" + "-".repeat(76) + "+");
    }

    @Test
    void footerClosesDocument() {
        HeaderMetadata header = new HeaderMetadata(true, "", "", List.of(), List.of("Built with -O2", ""),
                RenderStyle.PLAIN, false);
        Renderer bodyOnly = new Renderer(settings.rendering(), Map.of(), List.of());

        List<String> out = lines(bodyOnly.render(header, pointAdd(true)));

        assertThat(out.subList(out.size() - 5, out.size())).containsExactly(
                "; " + "=".repeat(78),
                "; Built with -O2",
                ";",
                "; " + "=".repeat(78),
                "");
    }
}
