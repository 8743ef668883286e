package org.asmscribe.annotator.backend.annotate;

import org.asmscribe.annotator.api.AnnotatedLine;
import org.asmscribe.annotator.api.ClassifiedLine;
import org.asmscribe.annotator.api.FunctionContext;
import org.asmscribe.annotator.config.ArgumentConvention;
import org.asmscribe.annotator.config.RecordLayout;
import org.asmscribe.annotator.diagnostics.DiagnosticKind;
import org.asmscribe.annotator.diagnostics.DiagnosticsEngine;
import org.asmscribe.annotator.frontend.lexer.LineClassifier;
import org.asmscribe.annotator.frontend.operands.InstructionParser;
import org.asmscribe.annotator.frontend.operands.OperandClassifier;
import org.asmscribe.annotator.frontend.operands.ParsedInstruction;
import org.asmscribe.annotator.frontend.operands.SemanticTag;
import org.asmscribe.annotator.frontend.semantics.FunctionBoundaryTracker;
import org.asmscribe.annotator.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Attaches function contexts and explanatory comments to classified lines.
 * <p>
 * Each call to {@link #annotate(Iterator, DiagnosticsEngine)} starts a {@link Pass}: a lazy, single-pass iterator that
 * emits exactly one {@link AnnotatedLine} per input line, in input order. Nothing is dropped or
 * reordered here; deciding what to print is the renderer's job.
 * <p>
 * Comments are composed general to specific, e.g.
 * {@code Add scalar double | add field x of 3rd argument}.
 */
public class Annotator {

    private static final Logger log = LoggerFactory.getLogger(Annotator.class);

    static final String SEPARATOR = " | ";

    private final LineClassifier classifier;
    private final InstructionParser instructionParser;
    private final OperandClassifier operandClassifier;
    private final SymbolTable symbols;
    private final RecordLayout layout;
    private final ArgumentConvention convention;

    public Annotator(LineClassifier classifier, OperandClassifier operandClassifier, SymbolTable symbols,
                     RecordLayout layout, ArgumentConvention convention) {
        this.classifier = classifier;
        this.instructionParser = new InstructionParser(classifier.rules().commentPrefixes());
        this.operandClassifier = operandClassifier;
        this.symbols = symbols;
        this.layout = layout;
        this.convention = convention;
    }

    /**
     * Starts a pass over the given lines.
     *
     * @param lines       Classified lines in input order. Consumed at most once.
     * @param diagnostics Receives boundary warnings and informational findings of this pass.
     * @return the pass; iterate it to drive the annotation.
     */
    public Pass annotate(Iterator<ClassifiedLine> lines, DiagnosticsEngine diagnostics) {
        return new Pass(lines, new FunctionBoundaryTracker(classifier, symbols, diagnostics), diagnostics);
    }

    /**
     * Stream form of {@link #annotate(Iterator, DiagnosticsEngine)}. The returned stream is
     * sequential, ordered and lazy.
     */
    public Stream<AnnotatedLine> annotate(Stream<ClassifiedLine> lines, DiagnosticsEngine diagnostics) {
        Pass pass = annotate(lines.iterator(), diagnostics);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pass, Spliterator.ORDERED), false);
    }

    /**
     * One annotation run. Not restartable: once the source is exhausted, the boundary tracker is
     * finished and an open function is reported as unterminated.
     */
    public final class Pass implements Iterator<AnnotatedLine> {

        private final Iterator<ClassifiedLine> source;
        private final FunctionBoundaryTracker tracker;
        private final DiagnosticsEngine diagnostics;

        private Pass(Iterator<ClassifiedLine> source, FunctionBoundaryTracker tracker, DiagnosticsEngine diagnostics) {
            this.source = source;
            this.tracker = tracker;
            this.diagnostics = diagnostics;
        }

        @Override
        public boolean hasNext() {
            if (source.hasNext()) {
                return true;
            }
            tracker.finish();
            return false;
        }

        @Override
        public AnnotatedLine next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ClassifiedLine line = source.next();
            FunctionContext context = tracker.accept(line);
            return annotateLine(line, context, diagnostics);
        }

        /**
         * @return the functions opened so far, in input order.
         */
        public List<FunctionContext> functions() {
            return tracker.functions();
        }
    }

    private AnnotatedLine annotateLine(ClassifiedLine line, FunctionContext context, DiagnosticsEngine diagnostics) {
        return switch (line.tag()) {
            case FUNCTION_START -> context != null
                    ? new AnnotatedLine(line, context, List.of(), "function " + context.displayName())
                    : AnnotatedLine.plain(line, null);
            case LABEL -> annotateLabel(line, context);
            case INSTRUCTION -> context != null
                    ? annotateInstruction(line, context, diagnostics)
                    : AnnotatedLine.plain(line, null);
            case DIRECTIVE, FUNCTION_END, BLANK -> AnnotatedLine.plain(line, context);
        };
    }

    private AnnotatedLine annotateLabel(ClassifiedLine line, FunctionContext context) {
        Optional<String> label = classifier.labelName(line.text());
        if (label.isEmpty()) {
            return AnnotatedLine.plain(line, context);
        }
        if (context != null && context.sourceSpelling().equals(label.get())) {
            return new AnnotatedLine(line, context, List.of(), "function " + context.displayName());
        }
        if (symbols.contains(label.get())) {
            return new AnnotatedLine(line, context, List.of(), "function " + symbols.resolve(label.get()));
        }
        return AnnotatedLine.plain(line, context);
    }

    private AnnotatedLine annotateInstruction(ClassifiedLine line, FunctionContext context,
                                              DiagnosticsEngine diagnostics) {
        Optional<ParsedInstruction> parsed = instructionParser.parse(line.text());
        if (parsed.isEmpty()) {
            return AnnotatedLine.plain(line, context);
        }
        List<SemanticTag> tags = operandClassifier.classify(parsed.get(), layout, convention);
        for (SemanticTag tag : tags) {
            report(tag, line.lineNumber(), diagnostics);
        }
        String comment = compose(tags);
        log.trace("Line {}: {}", line.lineNumber(), comment);
        return new AnnotatedLine(line, context, tags, comment);
    }

    private void report(SemanticTag tag, int lineNumber, DiagnosticsEngine diagnostics) {
        if (tag instanceof SemanticTag.UnclassifiedOpcode unknown) {
            diagnostics.reportInfo(DiagnosticKind.UNKNOWN_OPCODE,
                    "No classification for opcode '" + unknown.mnemonic() + "'", lineNumber);
        } else if (tag instanceof SemanticTag.OutsideLayout outside) {
            diagnostics.reportInfo(DiagnosticKind.OFFSET_OUTSIDE_LAYOUT,
                    "Offset " + outside.offset() + " through " + outside.register() + " starts no field of "
                            + outside.layoutName(), lineNumber);
        } else if (tag instanceof SemanticTag.CallTarget call && !call.resolved()) {
            diagnostics.reportInfo(DiagnosticKind.UNRESOLVED_SYMBOL,
                    "No display name for call target '" + call.sourceSpelling() + "'", lineNumber);
        }
    }

    /**
     * Joins tag descriptions, general tags before specific ones.
     */
    static String compose(List<SemanticTag> tags) {
        return Stream.concat(
                        tags.stream().filter(SemanticTag::isGeneral),
                        tags.stream().filter(t -> !t.isGeneral()))
                .map(SemanticTag::describe)
                .collect(Collectors.joining(SEPARATOR));
    }
}
