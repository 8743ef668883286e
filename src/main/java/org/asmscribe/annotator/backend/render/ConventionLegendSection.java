package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.config.ArgumentConvention;
import org.asmscribe.annotator.config.ArgumentRole;
import org.asmscribe.annotator.config.HeaderMetadata;

import java.util.List;
import java.util.Map;

/**
 * Legend of register roles generated from the calling convention.
 */
public class ConventionLegendSection implements IHeaderSection {

    private final ArgumentConvention convention;

    public ConventionLegendSection(ArgumentConvention convention) {
        this.convention = convention;
    }

    @Override
    public void render(HeaderMetadata header, List<FunctionSummary> functions, List<String> out) {
        if (convention.registers().isEmpty() && convention.notes().isEmpty()) {
            return;
        }
        out.add("; CALLING CONVENTION (" + convention.name() + "):");
        int width = Math.max(
                convention.registers().keySet().stream().mapToInt(String::length).max().orElse(0),
                convention.notes().keySet().stream().mapToInt(String::length).max().orElse(0));
        for (Map.Entry<String, ArgumentRole> entry : convention.orderedRegisters()) {
            out.add(";   " + pad(entry.getKey(), width) + "  " + entry.getValue().describe());
        }
        convention.notes().forEach((register, note) -> out.add(";   " + pad(register, width) + "  " + note));
        out.add(";");
    }

    private static String pad(String text, int width) {
        return text + " ".repeat(Math.max(0, width - text.length()));
    }
}
