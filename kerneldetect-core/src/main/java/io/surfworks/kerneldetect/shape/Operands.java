package io.surfworks.kerneldetect.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.Shape;

/**
 * Helpers for locating a node's data input, weight tensor and constant payloads.
 */
final class Operands {

    private static final String IDENTITY = "Identity";

    private Operands() {}

    /**
     * Producers that carry activations: everything except constants, packs and
     * {@code Identity} nodes (which in frozen graphs wrap weights).
     */
    static List<IrNode> dataInputs(GraphIr graph, IrNode node) {
        List<IrNode> inputs = new ArrayList<>();
        for (IrNode producer : graph.inbounds(node)) {
            OpKind kind = OpKind.fromType(producer.type());
            if (kind == OpKind.CONST || kind == OpKind.PACK || IDENTITY.equals(producer.type())) {
                continue;
            }
            inputs.add(producer);
        }
        return inputs;
    }

    /**
     * The {@code Const} roots feeding this node directly or through a chain of
     * {@code Identity} nodes.
     */
    static List<IrNode> weightRoots(GraphIr graph, IrNode node) {
        List<IrNode> roots = new ArrayList<>();
        for (IrNode producer : graph.inbounds(node)) {
            IrNode current = producer;
            while (IDENTITY.equals(current.type()) && current.inbounds().size() == 1) {
                current = graph.node(current.inbounds().get(0));
            }
            if (OpKind.fromType(current.type()) == OpKind.CONST && !roots.contains(current)) {
                roots.add(current);
            }
        }
        return roots;
    }

    /**
     * The declared tensor shape of a constant, falling back to its inferred output.
     */
    static Optional<Shape> tensorShape(IrNode constant) {
        Optional<Shape> declared = constant.attributes().shape("tensor_shape");
        return declared.isPresent() ? declared : constant.outputShape();
    }

    /**
     * The integer payload of a constant-producing node. A {@code Pack} payload is
     * flattened and prefixed with a unit batch dimension.
     */
    static Optional<List<Integer>> constantPayload(IrNode producer) {
        OpKind kind = OpKind.fromType(producer.type());
        if (kind == OpKind.CONST) {
            return producer.attributes().flatIntList("constant");
        }
        if (kind == OpKind.PACK) {
            return producer.attributes().flatIntList("constant").map(values -> {
                List<Integer> withBatch = new ArrayList<>(values.size() + 1);
                withBatch.add(1);
                withBatch.addAll(values);
                return withBatch;
            });
        }
        return Optional.empty();
    }

    /**
     * The first payload found among the node's constant-producing inbounds.
     */
    static Optional<List<Integer>> inboundPayload(GraphIr graph, IrNode node) {
        for (IrNode producer : graph.inbounds(node)) {
            Optional<List<Integer>> payload = constantPayload(producer);
            if (payload.isPresent()) {
                return payload;
            }
        }
        return Optional.empty();
    }

    /**
     * The output shape of the node's single data input, recording a diagnostic
     * if there is not exactly one or it has not been shaped.
     */
    static Optional<Shape> singleDataInput(GraphIr graph, IrNode node, ShapeContext context) {
        List<IrNode> inputs = dataInputs(graph, node);
        if (inputs.size() != 1) {
            context.malformed(node, "expected one data input, found %d", inputs.size());
            return Optional.empty();
        }
        return shapeOf(inputs.get(0), node, context);
    }

    /**
     * The first output shape of a producer, recording a diagnostic if it has none.
     */
    static Optional<Shape> shapeOf(IrNode producer, IrNode consumer, ShapeContext context) {
        Optional<Shape> shape = producer.outputShape();
        if (shape.isEmpty()) {
            context.malformed(consumer, "producer %s has no output shape", producer.name());
        }
        return shape;
    }
}
