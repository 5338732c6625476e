package io.surfworks.kerneldetect.shape;

/**
 * A recoverable problem found while inferring the shape of one node.
 *
 * @param kind    what went wrong
 * @param node    the node name
 * @param type    the node's op type
 * @param message human-readable detail
 */
public record ShapeDiagnostic(Kind kind, String node, String type, String message) {

    public enum Kind {
        /** No shape rule is registered for the op type. */
        UNSUPPORTED_OPERATOR,
        /** A rule's structural precondition failed: missing input, ambiguous weight, bad attribute. */
        MALFORMED_TOPOLOGY,
        /** Element counts disagree across a reshape or matmul boundary. */
        SHAPE_MISMATCH
    }

    @Override
    public String toString() {
        return String.format("%s %s (%s): %s", kind, node, type, message);
    }
}
