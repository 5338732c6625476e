package io.surfworks.kerneldetect.shape;

import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.Attributes;
import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Shape rule for sliding-window operators on NHWC tensors: convolution,
 * depthwise convolution and pooling.
 *
 * <p>Besides the shapes, the rule annotates the node with {@code pads}
 * ({@code [top, bottom, left, right]}) and, for convolutions, with
 * {@code kernel_shape} and {@code weight_shape}.
 */
final class WindowRule implements ShapeRule {

    enum Variant {
        /** Output channels from the weight's last dimension. */
        CONV,
        /** Output channels from the weight's input-channel dimension. */
        DEPTHWISE,
        /** Kernel from {@code ksize}, channels unchanged. */
        POOL
    }

    private static final List<Integer> UNIT = List.of(1, 1, 1, 1);

    private final Variant variant;

    WindowRule(Variant variant) {
        this.variant = variant;
    }

    @Override
    public Optional<InferredShapes> infer(GraphIr graph, IrNode node, ShapeContext context) {
        Attributes attrs = node.attributes();

        int kernelH;
        int kernelW;
        Integer channels = null;
        Shape weightShape = null;
        if (variant == Variant.POOL) {
            List<Integer> ksize = attrs.intList("ksize").orElse(List.of());
            if (ksize.size() != 4) {
                context.malformed(node, "invalid ksize %s", ksize);
                return Optional.empty();
            }
            kernelH = ksize.get(1);
            kernelW = ksize.get(2);
        } else {
            List<IrNode> weights = Operands.weightRoots(graph, node);
            if (weights.size() != 1) {
                context.malformed(node, "expected one weight tensor, found %d", weights.size());
                return Optional.empty();
            }
            Optional<Shape> weight = Operands.tensorShape(weights.get(0));
            if (weight.isEmpty() || weight.get().rank() != 4) {
                context.malformed(node, "cannot parse weight shape %s", weight.map(Shape::toString).orElse("<none>"));
                return Optional.empty();
            }
            weightShape = weight.get();
            kernelH = weightShape.dim(0);
            kernelW = weightShape.dim(1);
            channels = variant == Variant.CONV ? weightShape.dim(3) : weightShape.dim(2);
        }

        Optional<Shape> maybeInput = Operands.singleDataInput(graph, node, context);
        if (maybeInput.isEmpty()) {
            return Optional.empty();
        }
        Shape input = maybeInput.get();
        if (input.rank() != 4) {
            context.malformed(node, "expected NHWC input, got %s", input);
            return Optional.empty();
        }
        if (channels == null) {
            channels = input.dim(3);
        }

        List<Integer> strides = attrs.intList("strides").orElse(UNIT);
        if (!isSpatialOnly(strides)) {
            context.malformed(node, "invalid strides %s", strides);
            return Optional.empty();
        }
        List<Integer> dilations = variant == Variant.POOL ? UNIT : attrs.intList("dilations").orElse(UNIT);
        if (!isSpatialOnly(dilations)) {
            context.malformed(node, "invalid dilations %s", dilations);
            return Optional.empty();
        }

        String paddingName = attrs.string("padding").orElse(null);
        Optional<Padding> padding = Padding.parse(paddingName);
        if (padding.isEmpty()) {
            context.malformed(node, "unexpected padding %s", paddingName);
            return Optional.empty();
        }

        WindowGeometry h = WindowGeometry.of(input.dim(1),
                WindowGeometry.effectiveKernel(kernelH, dilations.get(1)), strides.get(1), padding.get());
        WindowGeometry w = WindowGeometry.of(input.dim(2),
                WindowGeometry.effectiveKernel(kernelW, dilations.get(2)), strides.get(2), padding.get());

        attrs.put("pads", List.of(h.padBefore(), h.padAfter(), w.padBefore(), w.padAfter()));
        if (weightShape != null) {
            attrs.put("kernel_shape", List.of(kernelH, kernelW));
            attrs.put("weight_shape", weightShape.dims());
        }

        Shape output = Shape.of(input.dim(0), h.output(), w.output(), channels);
        return Optional.of(InferredShapes.of(input, output));
    }

    // Batch and channel entries must be 1; only H and W may vary.
    private static boolean isSpatialOnly(List<Integer> values) {
        return values.size() == 4 && values.get(0) == 1 && values.get(3) == 1
                && values.get(1) >= 1 && values.get(2) >= 1;
    }
}
