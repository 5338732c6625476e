package io.surfworks.kerneldetect.shape;

import java.util.Optional;

/**
 * Padding modes of windowed operators.
 */
public enum Padding {
    /** Pad so that the output covers every input position: {@code ceil(in / stride)}. */
    SAME,
    /** No padding: {@code ceil((in - kernel + 1) / stride)}. */
    VALID;

    public static Optional<Padding> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toUpperCase()) {
            case "SAME" -> Optional.of(SAME);
            case "VALID" -> Optional.of(VALID);
            default -> Optional.empty();
        };
    }
}
