package io.surfworks.kerneldetect.shape;

import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;

/**
 * Computes the input and output shapes of one node from its attributes and its
 * already-annotated producers.
 *
 * <p>Rules never throw for bad input. When a structural precondition fails they
 * record a diagnostic on the context and return empty, leaving the node's shapes
 * untouched.
 */
@FunctionalInterface
public interface ShapeRule {

    /**
     * @param graph   the graph being annotated
     * @param node    the node to shape
     * @param context sink for diagnostics
     * @return the inferred shapes, or empty if they could not be determined
     */
    Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context);
}
