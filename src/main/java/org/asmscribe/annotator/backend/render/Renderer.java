package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.api.AnnotatedLine;
import org.asmscribe.annotator.api.FunctionContext;
import org.asmscribe.annotator.api.LineTag;
import org.asmscribe.annotator.config.ArgumentConvention;
import org.asmscribe.annotator.config.FunctionDescription;
import org.asmscribe.annotator.config.HeaderMetadata;
import org.asmscribe.annotator.config.RecordLayout;
import org.asmscribe.annotator.config.RenderStyle;
import org.asmscribe.annotator.config.RenderingOptions;
import org.asmscribe.annotator.frontend.operands.Action;
import org.asmscribe.annotator.frontend.operands.SemanticTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Turns annotated lines into the final text: header, annotated body and footer.
 * <p>
 * Purely a formatting step. Directive lines are dropped; every other line keeps its original
 * text as an unmodified substring of the output line. Instructions without leading whitespace
 * are indented, and comments start at a fixed column. Everything the renderer generates is
 * either blank or starts with {@code ;}.
 * <p>
 * The body is buffered before the header is written so the header can summarize it.
 */
public class Renderer {

    private static final Logger log = LoggerFactory.getLogger(Renderer.class);

    private final RenderingOptions options;
    private final Map<String, FunctionDescription> descriptions;
    private final List<IHeaderSection> sections;

    public Renderer(RenderingOptions options, RecordLayout layout, ArgumentConvention convention,
                    Map<String, FunctionDescription> descriptions) {
        this(options, descriptions, List.of(
                new TitleSection(),
                new ConventionLegendSection(convention),
                new LayoutDiagramSection(layout),
                new FunctionSummarySection()));
    }

    public Renderer(RenderingOptions options, Map<String, FunctionDescription> descriptions,
                    List<IHeaderSection> sections) {
        this.options = options;
        this.descriptions = Map.copyOf(descriptions);
        this.sections = List.copyOf(sections);
    }

    public String render(HeaderMetadata header, Stream<AnnotatedLine> lines) {
        return render(header, (Iterable<AnnotatedLine>) lines::iterator);
    }

    /**
     * Renders the complete document.
     *
     * @param header Header and footer text and switches.
     * @param lines  The annotated body, consumed once.
     * @return the document, lines separated by {@code \n}, ending with a line terminator.
     */
    public String render(HeaderMetadata header, Iterable<AnnotatedLine> lines) {
        Map<FunctionContext, Counter> functions = new LinkedHashMap<>();
        List<String> body = new ArrayList<>();

        for (AnnotatedLine line : lines) {
            if (line.tag() == LineTag.DIRECTIVE) {
                continue;
            }
            FunctionContext context = line.context();
            if (context != null && !functions.containsKey(context)) {
                functions.put(context, new Counter());
                functionBanner(header.style(), context, body);
            }
            body.add(format(line));
            if (context == null) {
                continue;
            }
            Counter counter = functions.get(context);
            if (line.tag() == LineTag.INSTRUCTION && line.comment() != null && !isPseudoOp(line)) {
                counter.instructions++;
            } else if (line.tag() == LineTag.FUNCTION_END) {
                counter.terminated = true;
                body.add("; END " + context.displayName().toUpperCase(Locale.ROOT)
                        + " (" + counter.instructions + " instructions)");
                body.add(Banners.rule(header.style(), '-'));
            }
        }

        List<FunctionSummary> summaries = new ArrayList<>();
        functions.forEach((context, counter) ->
                summaries.add(new FunctionSummary(context, counter.instructions, counter.terminated)));
        for (FunctionSummary summary : summaries) {
            if (!summary.terminated()) {
                body.add("; WARNING: unterminated function " + summary.context().displayName());
            }
        }

        List<String> out = new ArrayList<>();
        if (header.enabled()) {
            for (IHeaderSection section : sections) {
                section.render(header, summaries, out);
            }
            if (!out.isEmpty()) {
                out.add("");
            }
        }
        out.addAll(body);
        if (header.enabled() && !header.footer().isEmpty()) {
            out.add("");
            out.add(Banners.rule(header.style(), '='));
            header.footer().forEach(line -> out.add(Banners.comment(line)));
            out.add(Banners.rule(header.style(), '='));
        }
        log.debug("Rendered {} body lines, {} functions", body.size(), summaries.size());
        return String.join("\n", out) + "\n";
    }

    String format(AnnotatedLine line) {
        String text = line.text();
        if (line.tag() == LineTag.INSTRUCTION && !text.isEmpty() && !Character.isWhitespace(text.charAt(0))) {
            text = " ".repeat(options.indent()) + text;
        }
        if (line.comment() == null || line.comment().isEmpty()) {
            return text;
        }
        int column = options.indent() + options.commentColumn();
        String padding = text.length() < column ? " ".repeat(column - text.length()) : " ";
        return text + padding + "; " + line.comment();
    }

    private void functionBanner(RenderStyle style, FunctionContext context, List<String> out) {
        FunctionDescription description = descriptions.get(context.displayName());
        String title = description != null && !description.title().isEmpty()
                ? description.title()
                : context.displayName().toUpperCase(Locale.ROOT);
        out.add(Banners.rule(style, '='));
        out.add("; FUNCTION: " + title);
        out.add(Banners.rule(style, '='));
        if (!context.displayName().equals(context.sourceSpelling())) {
            out.add("; Symbol: " + context.sourceSpelling());
        }
        if (description != null) {
            optional(out, "Signature", description.signature());
            optional(out, "Description", description.description());
            optional(out, "Algorithm", description.algorithm());
            optional(out, "Complexity", description.complexity());
        }
        out.add(";");
    }

    private static boolean isPseudoOp(AnnotatedLine line) {
        return line.tags().stream().anyMatch(tag -> tag instanceof SemanticTag.OpcodeTag opcode
                && opcode.opcodeClass().action() == Action.PSEUDO);
    }

    private static void optional(List<String> out, String label, String value) {
        if (!value.isEmpty()) {
            out.add("; " + label + ": " + value);
        }
    }

    private static final class Counter {
        private int instructions;
        private boolean terminated;
    }
}
