package io.surfworks.kerneldetect.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for reshape.
 *
 * <p>The target comes from the {@code shape} attribute if present, otherwise
 * from a {@code Const} or {@code Pack} producer. A single {@code -1} in the
 * target is resolved from the input's element count. Element-count mismatches
 * are reported but the target is still used.
 */
final class ReshapeRule implements ShapeRule {

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        Optional<List<Integer>> target = node.attributes().intList("shape");
        IrNode dataProducer = null;
        if (target.isPresent()) {
            if (!node.inbounds().isEmpty()) {
                dataProducer = graph.node(node.inbounds().get(0));
            }
        } else {
            for (IrNode producer : graph.inbounds(node)) {
                Optional<List<Integer>> payload = Operands.constantPayload(producer);
                if (payload.isPresent()) {
                    target = payload;
                } else {
                    dataProducer = producer;
                }
            }
        }

        if (target.isEmpty()) {
            context.malformed(node, "no target shape attribute or shape producer");
            return Optional.empty();
        }
        if (dataProducer == null) {
            context.malformed(node, "no data input");
            return Optional.empty();
        }
        Optional<Shape> maybeInput = Operands.shapeOf(dataProducer, node, context);
        if (maybeInput.isEmpty()) {
            return Optional.empty();
        }
        Shape input = maybeInput.get();
        Shape output = resolveWildcard(target.get(), input.elementCount());

        if (input.elementCount() != output.elementCount()) {
            context.mismatch(node, "input shape %s and output shape %s not matched", input, output);
        }
        return Optional.of(InferredShapes.of(input, output));
    }

    private static Shape resolveWildcard(List<Integer> target, long elements) {
        int wildcard = -1;
        long known = 1;
        for (int i = 0; i < target.size(); i++) {
            int dim = target.get(i);
            if (dim == -1 && wildcard < 0) {
                wildcard = i;
            } else {
                known *= Math.abs((long) dim);
            }
        }
        if (wildcard < 0 || known == 0 || elements % known != 0) {
            return new Shape(target);
        }
        List<Integer> resolved = new ArrayList<>(target);
        resolved.set(wildcard, (int) (elements / known));
        return new Shape(resolved);
    }
}
