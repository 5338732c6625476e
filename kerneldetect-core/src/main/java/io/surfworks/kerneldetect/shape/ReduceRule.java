package io.surfworks.kerneldetect.shape;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for reductions (mean, global pooling).
 *
 * <p>Reduced axes come from {@code reduction_indices}, else from a constant
 * input, else default to the spatial axes {@code [1, 2]}. They are removed in
 * ascending order, each removal shifting the later indices down by one. With
 * {@code keep_dims} set the axes are kept with size 1 instead.
 */
final class ReduceRule implements ShapeRule {

    private static final List<Integer> SPATIAL_AXES = List.of(1, 2);

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        Optional<Shape> maybeInput = Operands.singleDataInput(graph, node, context);
        if (maybeInput.isEmpty()) {
            return Optional.empty();
        }
        Shape input = maybeInput.get();

        List<Integer> indices = node.attributes().intList("reduction_indices")
                .or(() -> Operands.inboundPayload(graph, node))
                .orElse(SPATIAL_AXES);

        TreeSet<Integer> axes = new TreeSet<>();
        for (int index : indices) {
            int axis = input.normalizeAxis(index);
            if (axis < 0 || axis >= input.rank()) {
                context.malformed(node, "reduction index %d out of range for %s", index, input);
                return Optional.empty();
            }
            axes.add(axis);
        }

        boolean keepDims = Boolean.TRUE.equals(node.attributes().get("keep_dims"));
        Shape output = input;
        int removed = 0;
        for (int axis : axes) {
            if (keepDims) {
                output = output.withDim(axis, 1);
            } else {
                output = output.withoutDim(axis - removed);
                removed++;
            }
        }
        return Optional.of(InferredShapes.of(input, output));
    }
}
