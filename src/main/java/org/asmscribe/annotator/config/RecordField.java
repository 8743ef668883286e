package org.asmscribe.annotator.config;

import java.util.Objects;

/**
 * One 8-byte field of a {@link RecordLayout}.
 *
 * @param name   Field name as the source code spells it (e.g. {@code x}).
 * @param offset Byte offset from the start of the record.
 */
public record RecordField(String name, int offset) {

    /** Every field the model understands is double- or pointer-sized. */
    public static final int FIELD_SIZE = 8;

    public RecordField {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Field '" + name + "' has negative offset " + offset);
        }
    }
}
