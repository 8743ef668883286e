package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.config.HeaderMetadata;

import java.util.List;

/**
 * Table of contents: every function of the body with its compiler spelling and size.
 * Only rendered when the header asks for it.
 */
public class FunctionSummarySection implements IHeaderSection {

    @Override
    public void render(HeaderMetadata header, List<FunctionSummary> functions, List<String> out) {
        if (!header.includeSummary() || functions.isEmpty()) {
            return;
        }
        out.add("; FUNCTIONS:");
        int width = functions.stream().mapToInt(f -> f.context().displayName().length()).max().orElse(0);
        for (FunctionSummary summary : functions) {
            String name = summary.context().displayName();
            StringBuilder line = new StringBuilder(";   ")
                    .append(name).append(" ".repeat(width - name.length()))
                    .append("  ").append(summary.instructions()).append(" instructions");
            if (!name.equals(summary.context().sourceSpelling())) {
                line.append(", source symbol ").append(summary.context().sourceSpelling());
            }
            if (!summary.terminated()) {
                line.append(", unterminated");
            }
            out.add(line.toString());
        }
        out.add(";");
    }
}
