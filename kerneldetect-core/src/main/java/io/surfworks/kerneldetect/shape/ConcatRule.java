package io.surfworks.kerneldetect.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for concatenation: the first input's shape with the concat axis
 * summed over all inputs. Producers with an empty or missing shape (such as the
 * scalar axis constant of {@code ConcatV2}) are not counted as inputs.
 */
final class ConcatRule implements ShapeRule {

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        List<Shape> inputs = new ArrayList<>();
        for (IrNode producer : graph.inbounds(node)) {
            producer.outputShape().filter(s -> !s.isEmpty()).ifPresent(inputs::add);
        }
        if (inputs.isEmpty()) {
            context.malformed(node, "no shaped inputs to concatenate");
            return Optional.empty();
        }

        Optional<Integer> axisAttr = node.attributes().integer("axis");
        if (axisAttr.isEmpty()) {
            axisAttr = Operands.inboundPayload(graph, node).filter(p -> p.size() == 1).map(p -> p.get(0));
        }
        if (axisAttr.isEmpty()) {
            context.malformed(node, "missing concat axis");
            return Optional.empty();
        }

        Shape first = inputs.get(0);
        int axis = first.normalizeAxis(axisAttr.get());
        if (axis < 0 || axis >= first.rank()) {
            context.malformed(node, "concat axis %d out of range for %s", axisAttr.get(), first);
            return Optional.empty();
        }

        int total = 0;
        for (Shape input : inputs) {
            if (input.rank() != first.rank()) {
                context.malformed(node, "input %s has a different rank from %s", input, first);
                return Optional.empty();
            }
            total += input.dim(axis);
        }
        return Optional.of(new InferredShapes(inputs, List.of(first.withDim(axis, total))));
    }
}
