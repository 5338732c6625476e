package io.surfworks.kerneldetect.shape;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for transpose. The permutation comes from a {@code perm}
 * attribute or, like reshape's target, from a {@code Const} or {@code Pack}
 * producer.
 */
final class TransposeRule implements ShapeRule {

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        Optional<List<Integer>> perm = node.attributes().intList("perm")
                .or(() -> Operands.inboundPayload(graph, node));
        if (perm.isEmpty()) {
            context.malformed(node, "no permutation attribute or producer");
            return Optional.empty();
        }

        Optional<Shape> maybeInput = Operands.singleDataInput(graph, node, context);
        if (maybeInput.isEmpty()) {
            return Optional.empty();
        }
        Shape input = maybeInput.get();

        List<Integer> order = perm.get();
        if (order.size() != input.rank() || !isPermutation(order)) {
            context.malformed(node, "permutation %s does not fit input %s", order, input);
            return Optional.empty();
        }
        return Optional.of(InferredShapes.of(input, input.permute(order)));
    }

    private static boolean isPermutation(List<Integer> order) {
        HashSet<Integer> seen = new HashSet<>();
        for (int axis : order) {
            if (axis < 0 || axis >= order.size() || !seen.add(axis)) {
                return false;
            }
        }
        return true;
    }
}
