package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.config.HeaderMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Framed title and subtitle followed by the free-form description lines.
 */
public class TitleSection implements IHeaderSection {

    @Override
    public void render(HeaderMetadata header, List<FunctionSummary> functions, List<String> out) {
        List<String> titleLines = new ArrayList<>();
        if (!header.title().isEmpty()) {
            titleLines.add(header.title());
        }
        if (!header.subtitle().isEmpty()) {
            titleLines.add(header.subtitle());
        }
        if (!titleLines.isEmpty()) {
            Banners.frame(header.style(), titleLines, out);
            out.add(";");
        }
        if (!header.description().isEmpty()) {
            header.description().forEach(line -> out.add(Banners.comment(line)));
            out.add(";");
        }
    }
}
