package org.asmscribe.annotator.frontend.operands;

/**
 * Width and kind of the data an instruction operates on.
 */
public enum DataWidth {
    NONE(""),
    INT8("8-bit integer"),
    INT16("16-bit integer"),
    INT32("32-bit integer"),
    INT64("64-bit integer"),
    FLOAT32("32-bit float"),
    FLOAT64("64-bit float"),
    PACKED_FLOAT32("packed 32-bit floats"),
    PACKED_FLOAT64("packed 64-bit floats"),
    VECTOR128("128-bit vector");

    private final String label;

    DataWidth(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isInteger() {
        return this == INT8 || this == INT16 || this == INT32 || this == INT64;
    }

    /**
     * Maps an AT&T size suffix ({@code b}, {@code w}, {@code l}, {@code q}) to an integer width.
     *
     * @return the width, or {@code null} for any other character.
     */
    static DataWidth fromAttSuffix(char suffix) {
        return switch (suffix) {
            case 'b' -> INT8;
            case 'w' -> INT16;
            case 'l' -> INT32;
            case 'q' -> INT64;
            default -> null;
        };
    }
}
