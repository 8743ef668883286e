package org.asmscribe.cli.commands;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.asmscribe.annotator.AnnotationPipeline;
import org.asmscribe.annotator.AnnotationResult;
import org.asmscribe.annotator.config.AnnotatorSettings;
import org.asmscribe.annotator.config.HeaderMetadata;
import org.asmscribe.annotator.config.RenderStyle;
import org.asmscribe.annotator.diagnostics.DiagnosticsEngine;
import org.asmscribe.annotator.frontend.io.MissingInputFileException;
import org.asmscribe.cli.CommandLineInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that annotates one assembly listing.
 * <p>
 * The annotated text goes to the output file, or to standard output if none is given, encoded
 * in the charset the input was read with. Diagnostics are summarized on standard error.
 * <p>
 * Exit codes: 0 success, 1 input not found or unreadable (or output not writable),
 * 2 invalid configuration.
 */
@Command(
    name = "annotate",
    mixinStandardHelpOptions = true,
    description = "Annotate an x86-64 assembly listing with readable names and comments"
)
public class AnnotateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnnotateCommand.class);

    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Assembly listing to annotate"
    )
    private Path inputFile;

    @Option(
        names = {"-o", "--output"},
        description = "Write the annotated listing to this file instead of standard output"
    )
    private Path outputFile;

    @Option(
        names = {"--no-header"},
        description = "Omit the documentation header and footer"
    )
    private boolean noHeader;

    @Option(
        names = {"--summary"},
        description = "List every function found in the header"
    )
    private boolean summary;

    @Option(
        names = {"--style"},
        description = "Banner style: ${COMPLETION-CANDIDATES} (default: from configuration)"
    )
    private RenderStyle style;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private OutputStream standardOutput = System.out;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AnnotatorSettings settings;
        try {
            settings = AnnotatorSettings.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            log.debug("Configuration rejected", e);
            return EXIT_CONFIG_ERROR;
        }

        AnnotationPipeline pipeline = new AnnotationPipeline(settings.withHeader(header(settings.header())));
        AnnotationResult result;
        try {
            result = pipeline.annotate(inputFile);
        } catch (MissingInputFileException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException e) {
            err.println("Error: failed to read " + inputFile + ": " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        if (outputFile != null) {
            try {
                Path parentDir = outputFile.toAbsolutePath().getParent();
                if (parentDir != null) {
                    Files.createDirectories(parentDir);
                }
                Files.writeString(outputFile, result.text(), result.charset());
            } catch (IOException e) {
                err.println("Error: failed to write " + outputFile + ": " + e.getMessage());
                return EXIT_INPUT_ERROR;
            }
            out.println("Annotated listing written to " + outputFile);
        } else {
            out.flush();
            try {
                standardOutput.write(result.text().getBytes(result.charset()));
                standardOutput.flush();
            } catch (IOException e) {
                err.println("Error: failed to write standard output: " + e.getMessage());
                return EXIT_INPUT_ERROR;
            }
        }
        out.flush();

        String diagnostics = DiagnosticsEngine.summarize(result.diagnostics());
        if (!diagnostics.isEmpty()) {
            err.print(diagnostics);
            err.flush();
        }
        return 0;
    }

    /**
     * Replaces the byte stream the annotated listing is written to when no output file is given.
     * The listing bypasses picocli's writer so that it keeps the encoding of the input.
     */
    void setStandardOutput(OutputStream standardOutput) {
        this.standardOutput = standardOutput;
    }

    private HeaderMetadata header(HeaderMetadata configured) {
        HeaderMetadata header = configured;
        if (noHeader) {
            header = header.withEnabled(false);
        }
        if (summary) {
            header = header.withSummary(true);
        }
        if (style != null) {
            header = header.withStyle(style);
        }
        return header;
    }
}
