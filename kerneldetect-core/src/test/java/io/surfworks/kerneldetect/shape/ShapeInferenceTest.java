package io.surfworks.kerneldetect.shape;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.kerneldetect.ir.Attributes;
import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

@DisplayName("ShapeInference")
class ShapeInferenceTest {

    private ShapeInference inference;

    @BeforeEach
    void setUp() {
        inference = ShapeInference.withStandardRules();
    }

    private static Attributes input(int... shape) {
        return Attributes.of("shape", Shape.of(shape).dims());
    }

    private static Attributes weight(int... shape) {
        return Attributes.of("tensor_shape", Shape.of(shape).dims());
    }

    private static Attributes constant(List<Integer> payload) {
        return Attributes.of("tensor_shape", List.of(payload.size()), "constant", payload);
    }

    private static Attributes scalar(int value) {
        return Attributes.of("tensor_shape", List.of(), "constant", List.of(value));
    }

    private static Shape out(GraphIr graph, String name) {
        return graph.require(name).outputShape().orElseThrow(() -> new AssertionError(name + " has no output shape"));
    }

    @Nested
    @DisplayName("Windowed operators")
    class Windowed {

        private GraphIr conv(String type, int[] inputShape, int[] weightShape, Attributes attrs) {
            return GraphIr.builder()
                    .node("x", "Placeholder", input(inputShape))
                    .node("w", "Const", weight(weightShape))
                    .node("conv", type, attrs, "x", "w")
                    .build();
        }

        @Test
        @DisplayName("strided SAME convolution takes channels from the weight")
        void sameConvolution() {
            GraphIr graph = conv("Conv2D", new int[]{1, 32, 32, 3}, new int[]{3, 3, 3, 16},
                    Attributes.of("strides", List.of(1, 2, 2, 1), "padding", "SAME"));

            ShapeReport report = inference.infer(graph);

            assertTrue(report.isClean(), report.toString());
            IrNode node = graph.require("conv");
            assertEquals(Shape.of(1, 16, 16, 16), out(graph, "conv"));
            assertEquals(List.of(Shape.of(1, 32, 32, 3)), node.inputShapes());
            assertEquals(List.of(0, 1, 0, 1), node.attributes().intList("pads").orElseThrow());
            assertEquals(List.of(3, 3), node.attributes().intList("kernel_shape").orElseThrow());
            assertEquals(List.of(3, 3, 3, 16), node.attributes().intList("weight_shape").orElseThrow());
        }

        @Test
        @DisplayName("VALID convolution shrinks by kernel - 1, widened by dilation")
        void validDilatedConvolution() {
            GraphIr plain = conv("Conv2D", new int[]{1, 32, 32, 3}, new int[]{3, 3, 3, 8},
                    Attributes.of("padding", "VALID"));
            GraphIr dilated = conv("Conv2D", new int[]{1, 32, 32, 3}, new int[]{3, 3, 3, 8},
                    Attributes.of("padding", "VALID", "dilations", List.of(1, 2, 2, 1)));

            inference.infer(plain);
            inference.infer(dilated);

            assertEquals(Shape.of(1, 30, 30, 8), out(plain, "conv"));
            assertEquals(Shape.of(1, 28, 28, 8), out(dilated, "conv"));
        }

        @Test
        @DisplayName("VALID convolution uses each spatial axis independently")
        void validNonSquare() {
            GraphIr graph = conv("Conv2D", new int[]{1, 20, 10, 3}, new int[]{5, 3, 3, 4},
                    Attributes.of("padding", "VALID", "strides", List.of(1, 1, 2, 1)));

            inference.infer(graph);

            assertEquals(Shape.of(1, 16, 4, 4), out(graph, "conv"));
        }

        @Test
        @DisplayName("depthwise convolution takes channels from the weight's input-channel axis")
        void depthwiseConvolution() {
            GraphIr graph = conv("DepthwiseConv2dNative", new int[]{1, 16, 16, 8}, new int[]{3, 3, 8, 1},
                    Attributes.of("strides", List.of(1, 1, 1, 1), "padding", "SAME"));

            inference.infer(graph);

            assertEquals(Shape.of(1, 16, 16, 8), out(graph, "conv"));
        }

        @Test
        @DisplayName("weight behind an Identity chain is found")
        void weightThroughIdentity() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 8, 4))
                    .node("w", "Const", weight(1, 1, 4, 12))
                    .node("w/read", "Identity", "w")
                    .node("conv", "Conv2D", Attributes.of("padding", "SAME"), "x", "w/read")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertEquals(Shape.of(1, 8, 8, 12), out(graph, "conv"));
            assertTrue(report.diagnosticsFor("conv").isEmpty());
        }

        @Test
        @DisplayName("pooling keeps the channel count")
        void pooling() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 32, 32, 16))
                    .node("pool", "MaxPool", Attributes.of(
                            "ksize", List.of(1, 2, 2, 1), "strides", List.of(1, 2, 2, 1), "padding", "VALID"), "x")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(1, 16, 16, 16), out(graph, "pool"));
        }

        @Test
        @DisplayName("padding stored as bytes is decoded")
        void bytePadding() {
            GraphIr graph = conv("Conv2D", new int[]{1, 8, 8, 3}, new int[]{3, 3, 3, 4},
                    Attributes.of("padding", "SAME".getBytes(StandardCharsets.UTF_8)));

            inference.infer(graph);

            assertEquals(Shape.of(1, 8, 8, 4), out(graph, "conv"));
        }

        @Test
        @DisplayName("stride on the batch axis is rejected")
        void batchStrideRejected() {
            GraphIr graph = conv("Conv2D", new int[]{1, 32, 32, 3}, new int[]{3, 3, 3, 16},
                    Attributes.of("strides", List.of(2, 1, 1, 1), "padding", "SAME"));

            ShapeReport report = inference.infer(graph);

            assertFalse(graph.require("conv").hasOutputShape());
            assertEquals(List.of("conv"), report.unresolvedNodes());
            assertEquals(ShapeDiagnostic.Kind.MALFORMED_TOPOLOGY, report.diagnosticsFor("conv").get(0).kind());
        }

        @Test
        @DisplayName("unknown padding mode is rejected")
        void unknownPaddingRejected() {
            GraphIr graph = conv("Conv2D", new int[]{1, 8, 8, 3}, new int[]{3, 3, 3, 4},
                    Attributes.of("padding", "EXPLICIT"));

            ShapeReport report = inference.infer(graph);

            assertFalse(graph.require("conv").hasOutputShape());
            assertFalse(report.diagnostics(ShapeDiagnostic.Kind.MALFORMED_TOPOLOGY).isEmpty());
        }

        @Test
        @DisplayName("two weight tensors make the weight ambiguous")
        void ambiguousWeight() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 8, 3))
                    .node("w1", "Const", weight(3, 3, 3, 4))
                    .node("w2", "Const", weight(3, 3, 3, 4))
                    .node("conv", "Conv2D", Attributes.of("padding", "SAME"), "x", "w1", "w2")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertEquals(List.of("conv"), report.unresolvedNodes());
        }
    }

    @Nested
    @DisplayName("Element-wise operators")
    class Elementwise {

        @Test
        @DisplayName("propagation ops copy the predecessor's shape")
        void propagation() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 7, 7, 32))
                    .node("bn", "FusedBatchNormV3", "x")
                    .node("relu", "Relu6", "bn")
                    .build();

            inference.infer(graph);

            for (String name : List.of("bn", "relu")) {
                IrNode node = graph.require(name);
                IrNode producer = graph.inbounds(node).get(0);
                assertEquals(producer.outputShape(), node.outputShape());
                assertEquals(producer.outputShapes(), node.inputShapes());
            }
        }

        @Test
        @DisplayName("broadcast takes the higher-rank input")
        void broadcastHigherRank() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 8, 16))
                    .node("b", "Const", weight(16))
                    .node("add", "AddV2", "x", "b")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(1, 8, 8, 16), out(graph, "add"));
            assertEquals(2, graph.require("add").inputShapes().size());
        }

        @Test
        @DisplayName("broadcast of equal rank takes the per-dimension maximum")
        void broadcastEqualRank() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 1, 16))
                    .node("y", "Placeholder", input(1, 1, 8, 16))
                    .node("mul", "Mul", "x", "y")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(1, 8, 8, 16), out(graph, "mul"));
        }
    }

    @Nested
    @DisplayName("Fully connected")
    class FullyConnected {

        @Test
        @DisplayName("matmul replaces the feature axis")
        void matmul() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 128))
                    .node("w", "Const", weight(128, 10))
                    .node("fc", "MatMul", "x", "w")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertTrue(report.isClean());
            assertEquals(Shape.of(1, 10), out(graph, "fc"));
        }

        @Test
        @DisplayName("feature mismatch leaves the node unshaped")
        void matmulMismatch() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 64))
                    .node("w", "Const", weight(128, 10))
                    .node("fc", "MatMul", "x", "w")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertFalse(graph.require("fc").hasOutputShape());
            assertEquals(1, report.diagnostics(ShapeDiagnostic.Kind.SHAPE_MISMATCH).size());
        }
    }

    @Nested
    @DisplayName("Reductions")
    class Reductions {

        @Test
        @DisplayName("reduced axes are removed with index shift")
        void axesRemoved() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 7, 7, 64))
                    .node("mean", "Mean", Attributes.of("reduction_indices", List.of(2, 1)), "x")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(1, 64), out(graph, "mean"));
        }

        @Test
        @DisplayName("keep_dims keeps reduced axes with size 1")
        void keepDims() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 7, 7, 64))
                    .node("mean", "Mean", Attributes.of("reduction_indices", List.of(1, 2), "keep_dims", true), "x")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(1, 1, 1, 64), out(graph, "mean"));
        }

        @Test
        @DisplayName("axes can come from a constant input")
        void axesFromConstant() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 7, 7, 64))
                    .node("axes", "Const", constant(List.of(-1)))
                    .node("mean", "Mean", "x", "axes")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(1, 7, 7), out(graph, "mean"));
        }
    }

    @Nested
    @DisplayName("Layout operators")
    class Layout {

        @Test
        @DisplayName("reshape resolves a -1 target dimension")
        void reshapeWildcard() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 7, 7, 64))
                    .node("flat", "Reshape", Attributes.of("shape", List.of(1, -1)), "x")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertTrue(report.isClean());
            assertEquals(Shape.of(1, 3136), out(graph, "flat"));
        }

        @Test
        @DisplayName("reshape reads its target from a constant producer")
        void reshapeFromConstant() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(2, 4, 4, 8))
                    .node("target", "Const", constant(List.of(2, 16, 8)))
                    .node("r", "Reshape", "x", "target")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(2, 16, 8), out(graph, "r"));
            assertEquals(List.of(Shape.of(2, 4, 4, 8)), graph.require("r").inputShapes());
        }

        @Test
        @DisplayName("reshape element-count mismatch is reported but not fatal")
        void reshapeMismatch() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 4, 4, 2))
                    .node("r", "Reshape", Attributes.of("shape", List.of(1, 100)), "x")
                    .node("relu", "Relu", "r")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertEquals(Shape.of(1, 100), out(graph, "r"));
            assertEquals(Shape.of(1, 100), out(graph, "relu"));
            assertEquals(1, report.diagnostics(ShapeDiagnostic.Kind.SHAPE_MISMATCH).size());
            assertTrue(report.unresolvedNodes().isEmpty());
        }

        @Test
        @DisplayName("concat sums the axis and ignores the scalar axis input")
        void concat() {
            GraphIr graph = GraphIr.builder()
                    .node("a", "Placeholder", input(1, 8, 8, 16))
                    .node("b", "Placeholder", input(1, 8, 8, 32))
                    .node("c", "Placeholder", input(1, 8, 8, 8))
                    .node("axis", "Const", scalar(-1))
                    .node("cat", "ConcatV2", "a", "b", "c", "axis")
                    .build();

            inference.infer(graph);

            Shape result = out(graph, "cat");
            assertEquals(Shape.of(1, 8, 8, 56), result);
            int sum = 0;
            for (Shape in : graph.require("cat").inputShapes()) {
                sum += in.dim(3);
                assertEquals(result.withDim(3, 0), in.withDim(3, 0));
            }
            assertEquals(result.dim(3), sum);
        }

        @Test
        @DisplayName("split divides the axis by the consumer count")
        void split() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 8, 32))
                    .node("dim", "Const", scalar(3))
                    .node("split", "Split", "dim", "x")
                    .node("r1", "Relu", "split")
                    .node("r2", "Relu", "split")
                    .node("r3", "Relu", "split")
                    .build();

            inference.infer(graph);

            List<Shape> outputs = graph.require("split").outputShapes();
            assertEquals(3, outputs.size());
            outputs.forEach(s -> assertEquals(Shape.of(1, 8, 8, 10), s));
            assertEquals(Shape.of(1, 8, 8, 10), out(graph, "r2"));
        }

        @Test
        @DisplayName("split_dim attribute takes precedence")
        void splitDimAttribute() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(4, 6))
                    .node("split", "Split", Attributes.of("split_dim", 0), "x")
                    .node("a", "Relu", "split")
                    .node("b", "Relu", "split")
                    .build();

            inference.infer(graph);

            assertEquals(List.of(Shape.of(2, 6), Shape.of(2, 6)), graph.require("split").outputShapes());
        }

        @Test
        @DisplayName("transpose permutes the input")
        void transpose() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 6, 16))
                    .node("perm", "Const", constant(List.of(0, 3, 1, 2)))
                    .node("t", "Transpose", "x", "perm")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.of(1, 16, 8, 6), out(graph, "t"));
        }

        @Test
        @DisplayName("invalid permutation is rejected")
        void invalidPermutation() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 6, 16))
                    .node("t", "Transpose", Attributes.of("perm", List.of(0, 1, 1, 2)), "x")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertEquals(List.of("t"), report.unresolvedNodes());
        }
    }

    @Nested
    @DisplayName("Downstream patch pass")
    class PatchPass {

        @Test
        @DisplayName("pack takes the input shape recorded by a downstream reshape")
        void packPatchedFromReshape() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 7, 7, 64))
                    .node("pack", "Pack", Attributes.of("constant", List.of(3136)))
                    .node("flat", "Reshape", "x", "pack")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertEquals(Shape.of(1, 3136), out(graph, "flat"));
            assertEquals(Shape.of(1, 7, 7, 64), out(graph, "pack"));
            assertEquals(List.of(Shape.of(1, 7, 7, 64)), graph.require("pack").inputShapes());
            assertTrue(report.isClean(), report.toString());
        }

        @Test
        @DisplayName("strided slice without a nearby reshape gets the placeholder shape")
        void stridedSliceFallback() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 8, 3))
                    .node("slice", "StridedSlice", "x")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.UNKNOWN_4D, out(graph, "slice"));
        }

        @Test
        @DisplayName("reshape beyond the search window is not used")
        void reshapeTooFar() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 4, 4, 2))
                    .node("slice", "StridedSlice", "x")
                    .node("a", "Relu", "slice")
                    .node("b", "Relu", "a")
                    .node("c", "Relu", "b")
                    .node("d", "Relu", "c")
                    .node("r", "Reshape", Attributes.of("shape", List.of(1, -1)), "d")
                    .build();

            inference.infer(graph);

            assertEquals(Shape.UNKNOWN_4D, out(graph, "slice"));
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class Failures {

        @Test
        @DisplayName("unsupported operator is reported and traversal continues")
        void unsupportedOperator() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 8, 8, 3))
                    .node("odd", "FancyOp", "x")
                    .node("after", "Relu", "odd")
                    .node("ok", "Relu", "x")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertFalse(report.isClean());
            assertEquals(Set.of("FancyOp"), report.unsupportedTypes());
            assertEquals(List.of("odd", "after"), report.unresolvedNodes());
            assertEquals(Shape.of(1, 8, 8, 3), out(graph, "ok"));
            assertEquals(4, report.visitedNodes());
        }

        @Test
        @DisplayName("a throwing rule is recorded against its node")
        void throwingRule() {
            ShapeRule broken = (g, n, c) -> {
                throw new IllegalStateException("boom");
            };
            ShapeInference custom = new ShapeInference(Map.of(
                    OpKind.PLACEHOLDER, SourceRule.placeholder(),
                    OpKind.PROPAGATE, broken));
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder", input(1, 2))
                    .node("relu", "Relu", "x")
                    .build();

            ShapeReport report = custom.infer(graph);

            List<ShapeDiagnostic> diagnostics = report.diagnosticsFor("relu");
            assertEquals(1, diagnostics.size());
            assertTrue(diagnostics.get(0).message().contains("boom"));
            assertTrue(custom.supports(OpKind.PROPAGATE));
            assertFalse(custom.supports(OpKind.CONV));
        }

        @Test
        @DisplayName("UNSUPPORTED cannot be given a rule")
        void unsupportedKindRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ShapeInference(Map.of(OpKind.UNSUPPORTED, SourceRule.constant())));
        }

        @Test
        @DisplayName("missing declared shape is malformed")
        void missingDeclaredShape() {
            GraphIr graph = GraphIr.builder()
                    .node("x", "Placeholder")
                    .build();

            ShapeReport report = inference.infer(graph);

            assertEquals(ShapeDiagnostic.Kind.MALFORMED_TOPOLOGY, report.diagnostics().get(0).kind());
        }
    }
}
