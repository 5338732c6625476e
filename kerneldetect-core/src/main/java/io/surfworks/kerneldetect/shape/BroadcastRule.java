package io.surfworks.kerneldetect.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for element-wise binary operators (add, multiply).
 *
 * <p>The output takes the highest-rank input shape; inputs of equal rank are
 * combined by taking the larger size per dimension, the upper bound of
 * broadcasting.
 */
final class BroadcastRule implements ShapeRule {

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        List<Shape> inputs = new ArrayList<>();
        for (IrNode producer : graph.inbounds(node)) {
            Optional<Shape> shape = Operands.shapeOf(producer, node, context);
            if (shape.isEmpty()) {
                return Optional.empty();
            }
            inputs.add(shape.get());
        }
        if (inputs.isEmpty()) {
            context.malformed(node, "no inputs to broadcast");
            return Optional.empty();
        }
        if (inputs.size() < 2) {
            context.malformed(node, "broadcast op has %d input", inputs.size());
        }

        List<Integer> target = new ArrayList<>();
        for (Shape input : inputs) {
            if (input.rank() > target.size()) {
                target = new ArrayList<>(input.dims());
            } else if (input.rank() == target.size()) {
                for (int i = 0; i < target.size(); i++) {
                    target.set(i, Math.max(target.get(i), input.dim(i)));
                }
            }
        }
        return Optional.of(new InferredShapes(inputs, List.of(new Shape(target))));
    }
}
