package io.surfworks.kerneldetect.shape;

import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for operators that do not change the shape of their first input:
 * activations, batch norm, bias add, identity.
 */
final class PropagationRule implements ShapeRule {

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        if (node.inbounds().isEmpty()) {
            context.malformed(node, "no input to propagate");
            return Optional.empty();
        }
        IrNode producer = graph.node(node.inbounds().get(0));
        Optional<Shape> shape = Operands.shapeOf(producer, node, context);
        return shape.map(s -> InferredShapes.of(s, s));
    }
}
