package io.surfworks.kerneldetect.shape;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for split: one output per consumer, each with the split axis
 * divided by the consumer count (truncating).
 */
final class SplitRule implements ShapeRule {

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        List<IrNode> inputs = Operands.dataInputs(graph, node);
        if (inputs.isEmpty()) {
            context.malformed(node, "no data input");
            return Optional.empty();
        }
        Optional<Shape> maybeInput = Operands.shapeOf(inputs.get(0), node, context);
        if (maybeInput.isEmpty()) {
            return Optional.empty();
        }
        Shape input = maybeInput.get();

        Optional<Integer> splitDim = node.attributes().integer("split_dim");
        if (splitDim.isEmpty()) {
            splitDim = Operands.inboundPayload(graph, node).filter(p -> p.size() == 1).map(p -> p.get(0));
        }
        if (splitDim.isEmpty()) {
            context.malformed(node, "missing split_dim");
            return Optional.empty();
        }
        int axis = input.normalizeAxis(splitDim.get());
        if (axis < 0 || axis >= input.rank()) {
            context.malformed(node, "split_dim %d out of range for %s", splitDim.get(), input);
            return Optional.empty();
        }

        int parts = node.outbounds().size();
        if (parts == 0) {
            context.malformed(node, "split has no consumers");
            return Optional.empty();
        }
        Shape part = input.withDim(axis, input.dim(axis) / parts);
        return Optional.of(new InferredShapes(List.of(input), Collections.nCopies(parts, part)));
    }
}
