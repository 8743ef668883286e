package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.config.HeaderMetadata;

import java.util.List;

/**
 * One block of the documentation header printed above the annotated body.
 * <p>
 * Sections run in a fixed order after the body has been buffered, so they may describe the
 * functions found in it. Every line a section emits must start with {@code ;} so that the
 * header stays inert when the output is classified again.
 */
public interface IHeaderSection {

    /**
     * Appends this section's lines.
     *
     * @param header    Static header text and switches.
     * @param functions Functions of the body in input order.
     * @param out       Receives the rendered lines, without line terminators.
     */
    void render(HeaderMetadata header, List<FunctionSummary> functions, List<String> out);
}
