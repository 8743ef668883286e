package org.asmscribe.cli.commands;

import org.asmscribe.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the annotate command.
 */
@Tag("unit")
public class AnnotateCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private ByteArrayOutputStream listingOut;
    private Path listing;

    @BeforeEach
    void setUp() throws Exception {
        out = new StringWriter();
        err = new StringWriter();
        listingOut = new ByteArrayOutputStream();
        listing = tempDir.resolve("point_ops.s");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/point_ops_intel.s")) {
            assertThat(in).isNotNull();
            Files.copy(in, listing);
        }
    }

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        ((AnnotateCommand) cmdLine.getSubcommands().get("annotate").getCommand()).setStandardOutput(listingOut);
        return cmdLine.execute(args);
    }

    private String annotatedStdout() {
        return listingOut.toString(StandardCharsets.UTF_8);
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("annotate", "help");
    }

    @Test
    void testHelpOutput() {
        int exitCode = execute("annotate", "--help");

        assertThat(exitCode).isEqualTo(0);
        String output = out.toString() + err.toString();
        assertThat(output).contains("annotate");
        assertThat(output).contains("--file");
        assertThat(output).contains("--output");
        assertThat(output).contains("--no-header");
    }

    @Test
    void testAnnotateToStandardOutput() {
        int exitCode = execute("annotate", "-f", listing.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), annotatedStdout())
            .isEqualTo(0);
        assertThat(annotatedStdout())
            .contains("ANNOTATED ASSEMBLY LISTING")
            .contains("; FUNCTION: Vector Addition")
            .contains("; Call function | call point_add")
            .contains("\tcall\t\"??Z@unknown\"")
            .doesNotContain("@feat.00");
        assertThat(err.toString()).contains("UNRESOLVED_SYMBOL: 1");
    }

    @Test
    void testAnnotateToOutputFile() throws Exception {
        Path output = tempDir.resolve("annotated/point_ops.annotated.s");

        int exitCode = execute("annotate", "-f", listing.toString(), "-o", output.toString());

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        assertThat(out.toString()).contains("Annotated listing written to");
        assertThat(Files.readString(output)).contains("; FUNCTION: Main Program");
    }

    @Test
    void testHeaderOptions() {
        int exitCode = execute("annotate", "-f", listing.toString(), "--no-header");

        assertThat(exitCode).isEqualTo(0);
        assertThat(annotatedStdout()).doesNotContain("CALLING CONVENTION").contains("; FUNCTION: Vector Addition");

        listingOut.reset();
        execute("annotate", "-f", listing.toString(), "--style", "BOX", "--summary");

        assertThat(annotatedStdout()).contains("; +====").contains("; FUNCTIONS:");
    }

    @Test
    void testMissingInputFile() {
        int exitCode = execute("annotate", "-f", tempDir.resolve("absent.s").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Input file not found").contains("absent.s");
        assertThat(out.toString()).isEmpty();
        assertThat(listingOut.size()).isZero();
    }

    @Test
    void testMissingFileOption() {
        int exitCode = execute("annotate");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--file");
    }

    @Test
    void testInvalidConfiguration() throws Exception {
        Path config = tempDir.resolve("bad.conf");
        Files.writeString(config, "asmscribe.rendering.indent = wide\n");

        int exitCode = execute("-c", config.toString(), "annotate", "-f", listing.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Error: invalid configuration");
    }

    @Test
    void testMissingConfigurationFile() {
        int exitCode = execute("-c", tempDir.resolve("none.conf").toString(), "annotate", "-f", listing.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    void testConfigurationOverridesRendering() throws Exception {
        Path config = tempDir.resolve("narrow.conf");
        Files.writeString(config, """
            asmscribe.header.enabled = false
            asmscribe.rendering { comment-column = 30, indent = 2 }
            """);

        int exitCode = execute("-c", config.toString(), "annotate", "-f", listing.toString());

        assertThat(exitCode).isEqualTo(0);
        String ret = annotatedStdout().lines().filter(l -> l.startsWith("\tret")).findFirst().orElseThrow();
        assertThat(ret.indexOf("; Return from function")).isEqualTo(32);
    }

    @Test
    void testLatin1ListingKeepsItsBytesInOutputFile() throws Exception {
        Path input = tempDir.resolve("latin1.s");
        byte[] original = "\tmov\teax, 0 # caf\u00e9".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(input, ("\t.globl\tmain\nmain:\n\tmov\teax, 0 # caf\u00e9\n# -- End function\n")
                .getBytes(StandardCharsets.ISO_8859_1));
        Path output = tempDir.resolve("latin1.annotated.s");

        int exitCode = execute("annotate", "-f", input.toString(), "-o", output.toString(), "--no-header");

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        byte[] written = Files.readAllBytes(output);
        assertThat(indexOf(written, original)).isGreaterThanOrEqualTo(0);
        assertThat(indexOf(written, "caf\u00e9".getBytes(StandardCharsets.UTF_8))).isEqualTo(-1);
    }

    @Test
    void testLatin1ListingKeepsItsBytesOnStandardOutput() throws Exception {
        Path input = tempDir.resolve("latin1.s");
        byte[] original = "\tmov\teax, 0 # caf\u00e9".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(input, ("\t.globl\tmain\nmain:\n\tmov\teax, 0 # caf\u00e9\n# -- End function\n")
                .getBytes(StandardCharsets.ISO_8859_1));

        int exitCode = execute("annotate", "-f", input.toString(), "--no-header");

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        assertThat(indexOf(listingOut.toByteArray(), original)).isGreaterThanOrEqualTo(0);
    }
}
