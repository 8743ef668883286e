package org.asmscribe.annotator.config;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Byte layout of the fixed-size record that argument pointers refer to, for example
 * a 24-byte {@code Point} with doubles {@code x}, {@code y} and {@code z}.
 * <p>
 * Offsets must be strictly increasing and every field must fit the record:
 * {@code offset + 8 <= totalSize}.
 *
 * @param name      Record type name used in comments and the layout diagram.
 * @param fields    Fields in offset order.
 * @param totalSize Size of the record in bytes.
 */
public record RecordLayout(String name, List<RecordField> fields, int totalSize) {

    public RecordLayout {
        Objects.requireNonNull(name, "name");
        fields = List.copyOf(fields);
        if (totalSize <= 0) {
            throw new IllegalArgumentException("Record '" + name + "' must have a positive size, got: " + totalSize);
        }
        Set<String> names = new HashSet<>();
        int previous = -1;
        for (RecordField field : fields) {
            if (field.offset() <= previous) {
                throw new IllegalArgumentException("Record '" + name + "': offsets must be strictly increasing, field '"
                        + field.name() + "' at " + field.offset() + " follows offset " + previous);
            }
            if (field.offset() + RecordField.FIELD_SIZE > totalSize) {
                throw new IllegalArgumentException("Record '" + name + "': field '" + field.name() + "' at offset "
                        + field.offset() + " does not fit into " + totalSize + " bytes");
            }
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Record '" + name + "': duplicate field '" + field.name() + "'");
            }
            previous = field.offset();
        }
    }

    /**
     * Finds the field that starts exactly at the given offset. There is no nearest-offset
     * matching: an offset that falls inside or between fields yields empty.
     *
     * @param offset Byte offset relative to the start of the record.
     * @return the field starting at {@code offset}, or empty.
     */
    public Optional<RecordField> fieldAt(long offset) {
        for (RecordField field : fields) {
            if (field.offset() == offset) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
