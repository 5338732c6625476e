package io.surfworks.kerneldetect.shape;

import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for pack and strided-slice nodes, whose effective shape is the
 * input shape recorded by a nearby downstream reshape.
 *
 * <p>The first {@value #SEARCH_LIMIT} nodes of the breadth-first walk from the
 * node (the node itself included) are searched. If no shaped reshape is found
 * the node gets {@link Shape#UNKNOWN_4D}. In the forward pass the reshape has
 * usually not been shaped yet; {@link ShapeInference} reruns this rule once
 * the whole graph is annotated.
 */
final class DownstreamReshapeRule implements ShapeRule {

    static final int SEARCH_LIMIT = 5;

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        for (IrNode candidate : graph.breadthFirst(node, SEARCH_LIMIT)) {
            if (OpKind.fromType(candidate.type()) == OpKind.RESHAPE && !candidate.inputShapes().isEmpty()) {
                List<Shape> recorded = candidate.inputShapes();
                return Optional.of(new InferredShapes(recorded, recorded));
            }
        }
        return Optional.of(InferredShapes.of(Shape.UNKNOWN_4D, Shape.UNKNOWN_4D));
    }
}
