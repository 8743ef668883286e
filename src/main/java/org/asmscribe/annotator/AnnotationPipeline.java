package org.asmscribe.annotator;

import org.asmscribe.annotator.api.AnnotatedLine;
import org.asmscribe.annotator.api.RawLine;
import org.asmscribe.annotator.backend.annotate.Annotator;
import org.asmscribe.annotator.backend.render.Renderer;
import org.asmscribe.annotator.config.AnnotatorSettings;
import org.asmscribe.annotator.diagnostics.DiagnosticsEngine;
import org.asmscribe.annotator.frontend.io.MissingInputFileException;
import org.asmscribe.annotator.frontend.io.SourceLoader;
import org.asmscribe.annotator.frontend.lexer.LineClassifier;
import org.asmscribe.annotator.frontend.operands.OpcodeTable;
import org.asmscribe.annotator.frontend.operands.OperandClassifier;
import org.asmscribe.annotator.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Wires loader, classifier, annotator and renderer into one run.
 * <p>
 * The symbol table, opcode table and all settings are built once in the constructor and only read
 * afterwards, so one pipeline may annotate several inputs, also concurrently. Each run gets its
 * own boundary tracker and {@link DiagnosticsEngine}.
 */
public class AnnotationPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnnotationPipeline.class);

    private final AnnotatorSettings settings;
    private final LineClassifier classifier;
    private final Annotator annotator;
    private final Renderer renderer;

    public AnnotationPipeline(AnnotatorSettings settings) {
        this.settings = settings;
        SymbolTable symbols = new SymbolTable(settings.symbols());
        this.classifier = new LineClassifier(settings.classifier());
        this.annotator = new Annotator(classifier, new OperandClassifier(OpcodeTable.initialize(), symbols), symbols,
                settings.layout(), settings.convention());
        this.renderer = new Renderer(settings.rendering(), settings.layout(), settings.convention(),
                settings.functions());
    }

    /**
     * Loads and annotates a file.
     *
     * @param input The assembly listing.
     * @return the rendered document and the diagnostics of the run.
     * @throws MissingInputFileException If the file does not exist.
     * @throws IOException               If the file cannot be read.
     */
    public AnnotationResult annotate(Path input) throws MissingInputFileException, IOException {
        SourceLoader.LoadResult loaded = SourceLoader.loadFile(input);
        log.debug("Loaded {} lines from {}", loaded.lines().size(), loaded.logicalName());
        return annotate(loaded.lines(), loaded.charset());
    }

    /**
     * Annotates listing text that is already in memory.
     */
    public AnnotationResult annotate(String text) {
        return annotate(SourceLoader.split(text));
    }

    public AnnotationResult annotate(List<RawLine> lines) {
        return annotate(lines, StandardCharsets.UTF_8);
    }

    /**
     * @param lines   The listing.
     * @param charset Charset the lines were decoded with, handed through to the result.
     */
    public AnnotationResult annotate(List<RawLine> lines, Charset charset) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Annotator.Pass pass = annotator.annotate(lines.stream().map(classifier::classify).iterator(), diagnostics);
        String text = renderer.render(settings.header(), (Iterable<AnnotatedLine>) () -> pass);
        log.info("Annotated {} lines, {} functions, {} diagnostics ({} warnings)", lines.size(),
                pass.functions().size(), diagnostics.getDiagnostics().size(), diagnostics.getWarnings().size());
        return new AnnotationResult(text, diagnostics.getDiagnostics(), pass.functions(), charset);
    }
}
