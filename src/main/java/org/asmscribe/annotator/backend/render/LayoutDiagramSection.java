package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.config.HeaderMetadata;
import org.asmscribe.annotator.config.RecordField;
import org.asmscribe.annotator.config.RecordLayout;

import java.util.ArrayList;
import java.util.List;

/**
 * Byte diagram of the record layout, one cell per field and one per gap:
 * <pre>
 * ;   +--------+--------+--------+
 * ;   |   x    |   y    |   z    |
 * ;   +--------+--------+--------+
 * ;   0        8        16       24
 * </pre>
 */
public class LayoutDiagramSection implements IHeaderSection {

    private static final int MIN_CELL = 8;

    private final RecordLayout layout;

    public LayoutDiagramSection(RecordLayout layout) {
        this.layout = layout;
    }

    @Override
    public void render(HeaderMetadata header, List<FunctionSummary> functions, List<String> out) {
        if (layout.fields().isEmpty()) {
            return;
        }
        out.add("; RECORD LAYOUT: " + layout.name() + " (" + layout.totalSize() + " bytes)");

        List<String> names = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        int position = 0;
        for (RecordField field : layout.fields()) {
            if (field.offset() > position) {
                names.add("pad");
                starts.add(position);
            }
            names.add(field.name());
            starts.add(field.offset());
            position = field.offset() + RecordField.FIELD_SIZE;
        }
        if (position < layout.totalSize()) {
            names.add("pad");
            starts.add(position);
        }

        StringBuilder border = new StringBuilder(";   +");
        StringBuilder cells = new StringBuilder(";   |");
        StringBuilder offsets = new StringBuilder(";   ");
        for (int i = 0; i < names.size(); i++) {
            int width = Math.max(MIN_CELL, names.get(i).length() + 2);
            border.append("-".repeat(width)).append('+');
            cells.append(center(names.get(i), width)).append('|');
            offsets.append(padRight(String.valueOf(starts.get(i)), width + 1));
        }
        offsets.append(layout.totalSize());
        out.add(border.toString());
        out.add(cells.toString());
        out.add(border.toString());
        out.add(offsets.toString());
        for (RecordField field : layout.fields()) {
            out.add(";   " + field.name() + " at offset " + field.offset() + " (" + RecordField.FIELD_SIZE + " bytes)");
        }
        out.add(";");
    }

    private static String center(String text, int width) {
        int left = (width - text.length()) / 2;
        return " ".repeat(left) + text + " ".repeat(width - text.length() - left);
    }

    private static String padRight(String text, int width) {
        return text + " ".repeat(Math.max(1, width - text.length()));
    }
}
