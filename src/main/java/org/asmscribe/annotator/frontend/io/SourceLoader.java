package org.asmscribe.annotator.frontend.io;

import org.asmscribe.annotator.api.RawLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads assembly listings from the filesystem or the classpath and splits them into numbered lines.
 * <p>
 * Compiler listings are usually UTF-8, but MSVC tooling may emit Windows-1252 text. Files that are
 * not valid UTF-8 are re-read as ISO-8859-1 so that every byte survives as one character.
 */
public final class SourceLoader {

    /**
     * Result of loading a listing.
     *
     * @param lines       The lines with 1-based numbers, terminators removed.
     * @param logicalName The normalized path or resource name, for diagnostics.
     * @param charset     The charset the text was decoded with; output must be encoded with it
     *                    for the original bytes to survive.
     */
    public record LoadResult(List<RawLine> lines, String logicalName, Charset charset) {

        public LoadResult {
            lines = List.copyOf(lines);
        }
    }

    private SourceLoader() {}

    /**
     * Loads a listing from a local path.
     *
     * @param path The file to read.
     * @return the numbered lines.
     * @throws MissingInputFileException If the path does not name a regular file.
     * @throws IOException               If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws MissingInputFileException, IOException {
        if (!Files.isRegularFile(path)) {
            throw new MissingInputFileException(path);
        }
        String content;
        Charset charset = StandardCharsets.UTF_8;
        try {
            content = Files.readString(path, charset);
        } catch (CharacterCodingException e) {
            charset = StandardCharsets.ISO_8859_1;
            content = Files.readString(path, charset);
        }
        return new LoadResult(split(content), path.normalize().toString().replace('\\', '/'), charset);
    }

    /**
     * Loads a listing from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return the numbered lines.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n"));
                return new LoadResult(split(content), resourcePath, StandardCharsets.UTF_8);
            }
        }
    }

    /**
     * Splits text into numbered lines. {@code \r\n}, {@code \r} and {@code \n} all end a line;
     * a final terminator does not produce an extra empty line.
     *
     * @param text The listing.
     * @return the lines, numbered from 1.
     */
    public static List<RawLine> split(String text) {
        String normalized = normalizeLineEndings(text);
        List<RawLine> lines = new ArrayList<>();
        if (normalized.isEmpty()) {
            return lines;
        }
        String[] parts = normalized.split("\n", -1);
        int count = normalized.endsWith("\n") ? parts.length - 1 : parts.length;
        for (int i = 0; i < count; i++) {
            lines.add(new RawLine(i + 1, parts[i]));
        }
        return lines;
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
