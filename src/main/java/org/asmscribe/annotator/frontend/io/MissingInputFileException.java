package org.asmscribe.annotator.frontend.io;

import java.nio.file.Path;

/**
 * The assembly file to annotate does not exist or is not a regular file.
 */
public class MissingInputFileException extends Exception {

    private final Path path;

    public MissingInputFileException(Path path) {
        super("Input file not found: " + path.toAbsolutePath());
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
