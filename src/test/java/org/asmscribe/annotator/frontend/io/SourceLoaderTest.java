package org.asmscribe.annotator.frontend.io;

import org.asmscribe.annotator.api.RawLine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link SourceLoader}.
 */
@Tag("unit")
class SourceLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void split_numbersLinesFromOneAndNormalizesTerminators() {
        assertThat(SourceLoader.split("a\r\nb\rc\n"))
                .extracting(RawLine::lineNumber, RawLine::text)
                .containsExactly(tuple(1, "a"), tuple(2, "b"), tuple(3, "c"));
    }

    @Test
    void split_keepsBlankLinesAndLastUnterminatedLine() {
        assertThat(SourceLoader.split("\tret\n\n\n# -- End function"))
                .extracting(RawLine::text)
                .containsExactly("\tret", "", "", "# -- End function");
        assertThat(SourceLoader.split("")).isEmpty();
        assertThat(SourceLoader.split("\n")).extracting(RawLine::text).containsExactly("");
    }

    @Test
    void loadFile_readsUtf8() throws Exception {
        Path file = tempDir.resolve("main.s");
        Files.writeString(file, "main:\n\tret\n", StandardCharsets.UTF_8);

        SourceLoader.LoadResult result = SourceLoader.loadFile(file);

        assertThat(result.lines()).extracting(RawLine::text).containsExactly("main:", "\tret");
        assertThat(result.logicalName()).endsWith("main.s");
        assertThat(result.charset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void loadFile_fallsBackToLatin1ForInvalidUtf8() throws Exception {
        Path file = tempDir.resolve("msvc.asm");
        Files.write(file, new byte[]{'#', ' ', (byte) 0xE9, '\n'});

        SourceLoader.LoadResult result = SourceLoader.loadFile(file);

        assertThat(result.lines()).extracting(RawLine::text).containsExactly("# é");
        assertThat(result.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
    }

    @Test
    void loadFile_missingFileThrowsWithPath() {
        Path missing = tempDir.resolve("nope.s");

        assertThatThrownBy(() -> SourceLoader.loadFile(missing))
                .isInstanceOf(MissingInputFileException.class)
                .hasMessageContaining("Input file not found")
                .hasMessageContaining("nope.s");
    }

    @Test
    void loadFile_directoryIsNotAnInput() {
        assertThatThrownBy(() -> SourceLoader.loadFile(tempDir)).isInstanceOf(MissingInputFileException.class);
    }

    @Test
    void loadClasspath_readsFixture() throws IOException {
        SourceLoader.LoadResult result = SourceLoader.loadClasspath("fixtures/point_ops_att.s");

        assertThat(result.lines()).isNotEmpty();
        assertThat(result.lines().get(0).text()).isEqualTo("\t.text");
        assertThat(result.logicalName()).isEqualTo("fixtures/point_ops_att.s");
    }

    @Test
    void loadClasspath_missingResourceThrows() {
        assertThatThrownBy(() -> SourceLoader.loadClasspath("fixtures/absent.s"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("fixtures/absent.s");
    }
}
