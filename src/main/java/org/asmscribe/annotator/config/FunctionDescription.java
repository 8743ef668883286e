package org.asmscribe.annotator.config;

import java.util.Objects;

/**
 * Optional prose about one function, shown in its banner. Any part may be empty.
 */
public record FunctionDescription(String title, String signature, String description, String algorithm,
                                  String complexity) {

    public FunctionDescription {
        title = Objects.requireNonNullElse(title, "");
        signature = Objects.requireNonNullElse(signature, "");
        description = Objects.requireNonNullElse(description, "");
        algorithm = Objects.requireNonNullElse(algorithm, "");
        complexity = Objects.requireNonNullElse(complexity, "");
    }
}
