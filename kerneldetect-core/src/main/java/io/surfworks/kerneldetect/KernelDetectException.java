package io.surfworks.kerneldetect;

/**
 * Exception thrown when a graph or fusion policy handed to the detector is unusable.
 *
 * <p>Per-node shape problems are not reported this way; they are collected as
 * diagnostics so that one malformed operator does not abort the whole graph.
 */
public class KernelDetectException extends RuntimeException {

    public KernelDetectException(String message) {
        super(message);
    }

    public KernelDetectException(String message, Throwable cause) {
        super(message, cause);
    }
}
