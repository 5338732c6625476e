package io.surfworks.kerneldetect.shape;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;

/**
 * Annotates every node of a {@link GraphIr} with its input and output shapes.
 *
 * <p>Inference runs in two passes over a topological order of the nodes
 * reachable from the head nodes:
 * <ol>
 *   <li>Each node is dispatched on its {@link OpKind} to a {@link ShapeRule}.
 *       Nodes without a rule are reported as unsupported and left unshaped.</li>
 *   <li>Pack and strided-slice nodes are revisited: their shape can only be
 *       read off a downstream reshape, which is shaped by now.</li>
 * </ol>
 *
 * <p>Per-node failures never abort the run. They are collected in the returned
 * {@link ShapeReport} and the affected nodes keep whatever shapes they had.
 *
 * <p>Example:
 * <pre>{@code
 * ShapeReport report = ShapeInference.withStandardRules().infer(graph);
 * if (!report.isClean()) {
 *     report.diagnostics().forEach(System.err::println);
 * }
 * }</pre>
 */
public final class ShapeInference {

    private static final Logger LOG = Logger.getLogger(ShapeInference.class.getName());

    private final Map<OpKind, ShapeRule> rules;

    /**
     * Creates an inference pass with the given rules. {@link OpKind#UNSUPPORTED}
     * cannot be given a rule.
     */
    public ShapeInference(Map<OpKind, ShapeRule> rules) {
        if (rules.containsKey(OpKind.UNSUPPORTED)) {
            throw new IllegalArgumentException("UNSUPPORTED cannot have a shape rule");
        }
        this.rules = new EnumMap<>(OpKind.class);
        this.rules.putAll(rules);
    }

    /**
     * Creates an inference pass with a rule for every supported {@link OpKind}.
     */
    public static ShapeInference withStandardRules() {
        Map<OpKind, ShapeRule> rules = new EnumMap<>(OpKind.class);
        rules.put(OpKind.PROPAGATE, new PropagationRule());
        rules.put(OpKind.BROADCAST, new BroadcastRule());
        rules.put(OpKind.CONV, new WindowRule(WindowRule.Variant.CONV));
        rules.put(OpKind.DEPTHWISE_CONV, new WindowRule(WindowRule.Variant.DEPTHWISE));
        rules.put(OpKind.POOL, new WindowRule(WindowRule.Variant.POOL));
        rules.put(OpKind.MATMUL, new MatMulRule());
        rules.put(OpKind.REDUCE, new ReduceRule());
        rules.put(OpKind.RESHAPE, new ReshapeRule());
        rules.put(OpKind.CONCAT, new ConcatRule());
        rules.put(OpKind.SPLIT, new SplitRule());
        rules.put(OpKind.TRANSPOSE, new TransposeRule());
        rules.put(OpKind.CONST, SourceRule.constant());
        rules.put(OpKind.PLACEHOLDER, SourceRule.placeholder());
        rules.put(OpKind.PACK, new DownstreamReshapeRule());
        rules.put(OpKind.STRIDED_SLICE, new DownstreamReshapeRule());
        return new ShapeInference(rules);
    }

    /**
     * Infers shapes for all nodes reachable from the graph's head nodes.
     */
    public ShapeReport infer(GraphIr graph) {
        return infer(graph, graph.heads());
    }

    /**
     * Infers shapes for all nodes reachable from the given head nodes.
     *
     * @param graph the graph to annotate in place
     * @param heads the traversal roots
     * @return diagnostics and the nodes left unshaped
     */
    public ShapeReport infer(GraphIr graph, Collection<IrNode> heads) {
        ShapeContext context = new ShapeContext();
        List<IrNode> order = graph.traversalOrder(heads);

        for (IrNode node : order) {
            apply(graph, node, context, "First pass");
        }

        for (IrNode node : order) {
            if (OpKind.fromType(node.type()).needsDownstreamPatch()) {
                apply(graph, node, context, "Second pass");
            }
        }

        List<String> unresolved = order.stream()
                .filter(n -> !n.hasOutputShape())
                .map(IrNode::name)
                .toList();
        ShapeReport report = new ShapeReport(context.diagnostics(), order.size(), unresolved);
        LOG.fine(String.format("Shape inference visited %d nodes: %d diagnostics, %d unresolved",
                order.size(), report.diagnostics().size(), unresolved.size()));
        return report;
    }

    public boolean supports(OpKind kind) {
        return rules.containsKey(kind);
    }

    private void apply(GraphIr graph, IrNode node, ShapeContext context, String pass) {
        ShapeRule rule = rules.get(OpKind.fromType(node.type()));
        if (rule == null) {
            context.unsupported(node);
            return;
        }

        Optional<InferredShapes> shapes;
        try {
            shapes = rule.infer(graph, node, context);
        } catch (RuntimeException e) {
            context.failed(node, e);
            return;
        }

        shapes.ifPresent(s -> {
            node.setInputShapes(s.inputs());
            node.setOutputShapes(s.outputs());
            LOG.fine(String.format("%s: %s (%s) input %s output %s",
                    pass, node.name(), node.type(), s.inputs(), s.outputs()));
        });
    }
}
