package io.surfworks.kerneldetect.fusion;

/**
 * How a node with several consumers may be fused forward.
 */
public enum Multiplicity {
    /** A node with more than one consumer is never fused forward. */
    SINGLE_CONSUMER,
    /** A node fuses into its first fusible consumer only; the others stay outside its block. */
    FIRST_CONSUMER,
    /** A node fuses into every fusible consumer. */
    ALL_CONSUMERS;

    /**
     * Maps the numeric code used by rule-test results: 0 single consumer,
     * 1 first consumer, anything else all consumers.
     */
    public static Multiplicity fromCode(int code) {
        return switch (code) {
            case 0 -> SINGLE_CONSUMER;
            case 1 -> FIRST_CONSUMER;
            default -> ALL_CONSUMERS;
        };
    }
}
