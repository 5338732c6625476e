package io.surfworks.kerneldetect.shape;

import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for fully-connected layers: {@code [.., in] x [in, out] -> [.., out]}.
 */
final class MatMulRule implements ShapeRule {

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        List<IrNode> weights = Operands.weightRoots(graph, node);
        if (weights.size() != 1) {
            context.malformed(node, "expected one weight tensor, found %d", weights.size());
            return Optional.empty();
        }
        Optional<Shape> weight = Operands.tensorShape(weights.get(0));
        if (weight.isEmpty() || weight.get().rank() != 2) {
            context.malformed(node, "cannot parse weight shape %s", weight.map(Shape::toString).orElse("<none>"));
            return Optional.empty();
        }

        Optional<Shape> maybeInput = Operands.singleDataInput(graph, node, context);
        if (maybeInput.isEmpty()) {
            return Optional.empty();
        }
        Shape input = maybeInput.get();
        if (input.isEmpty()) {
            context.malformed(node, "input of matmul is a scalar");
            return Optional.empty();
        }

        int featureAxis = input.rank() - 1;
        if (input.dim(featureAxis) != weight.get().dim(0)) {
            context.mismatch(node, "input features %d do not match weight shape %s",
                    input.dim(featureAxis), weight.get());
            return Optional.empty();
        }
        return Optional.of(InferredShapes.of(input, input.withDim(featureAxis, weight.get().dim(1))));
    }
}
