package io.surfworks.kerneldetect.shape;

import java.util.List;

import io.surfworks.kerneldetect.ir.Shape;

/**
 * Result of applying a shape rule to one node.
 *
 * @param inputs  the shapes of the node's data inputs
 * @param outputs the shapes of the node's outputs, one per output tensor
 */
public record InferredShapes(List<Shape> inputs, List<Shape> outputs) {

    public InferredShapes {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public static InferredShapes of(Shape input, Shape output) {
        return new InferredShapes(List.of(input), List.of(output));
    }

    public static InferredShapes source(Shape output) {
        return new InferredShapes(List.of(), List.of(output));
    }
}
