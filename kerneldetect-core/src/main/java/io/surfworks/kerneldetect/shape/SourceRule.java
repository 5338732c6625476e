package io.surfworks.kerneldetect.shape;

import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for nodes whose shape is declared rather than computed:
 * constants ({@code tensor_shape}) and placeholders ({@code shape}).
 */
final class SourceRule implements ShapeRule {

    private final String attribute;

    SourceRule(String attribute) {
        this.attribute = attribute;
    }

    static SourceRule constant() {
        return new SourceRule("tensor_shape");
    }

    static SourceRule placeholder() {
        return new SourceRule("shape");
    }

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        Optional<Shape> declared = node.attributes().shape(attribute);
        if (declared.isEmpty()) {
            context.malformed(node, "missing '%s' attribute", attribute);
            return Optional.empty();
        }
        return Optional.of(InferredShapes.source(declared.get()));
    }
}
