package io.surfworks.kerneldetect.fusion;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.kerneldetect.ir.GraphIr;

/**
 * Splits a shape-annotated graph into basic blocks, the units that execute as
 * one fused kernel.
 *
 * <p>Splitting runs in two stages:
 * <ol>
 *   <li>{@link #preprocess(GraphIr)} collapses every occurrence of the policy's
 *       fusion-unit templates into a single node named after the template.</li>
 *   <li>{@link #fuse(FusionAwareGraph)} walks the nodes in topological order and
 *       greedily absorbs fusible consumers into the block of the current node,
 *       revisiting the grown block until nothing more can be absorbed.</li>
 * </ol>
 *
 * <p>The splitter holds no per-run state. One instance may serve any number of
 * graphs, but each graph must be split by one thread at a time.
 *
 * <p>Example:
 * <pre>{@code
 * KernelSplitter splitter = new KernelSplitter(FusionPolicyLoader.resolve());
 * List<BasicBlock> kernels = splitter.split(graph);
 * }</pre>
 */
public final class KernelSplitter {

    private static final Logger LOG = Logger.getLogger(KernelSplitter.class.getName());

    private final FusionPolicy policy;

    public KernelSplitter(FusionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public FusionPolicy policy() {
        return policy;
    }

    /**
     * Pre-fuses the graph and partitions it into basic blocks.
     *
     * @param graph the graph, modified in place by pre-fusion
     * @return the blocks, ordered by their earliest member
     */
    public List<BasicBlock> split(GraphIr graph) {
        preprocess(graph);
        return fuse(new FusionAwareGraph(graph));
    }

    /**
     * Collapses all non-overlapping template occurrences, templates taken in
     * policy order.
     *
     * @return the occurrences that were collapsed
     */
    public List<FusionMatch> preprocess(GraphIr graph) {
        SubgraphMatcher matcher = new SubgraphMatcher();
        List<FusionMatch> collapsed = new ArrayList<>();
        for (FusionUnit unit : policy.fusionUnits()) {
            List<FusionMatch> matches = matcher.match(graph, unit, TypeMatcher.OP_TYPE);
            int count = 0;
            for (FusionMatch match : matches) {
                // An earlier collapse can route a path out of this occurrence and back in.
                if (!graph.isConvex(match.matchedNodes())) {
                    LOG.warning("Skipping " + match + ": no longer convex after earlier pre-fusion");
                    continue;
                }
                graph.fuse(match.matchedNodes(), unit.name());
                collapsed.add(match);
                count++;
            }
            if (count > 0) {
                LOG.fine(String.format("Pre-fused %d occurrence(s) of %s", count, unit.name()));
            }
        }
        return collapsed;
    }

    /**
     * Runs the pairwise fusion loop over the given view.
     *
     * <p>A consumer is absorbed when the table lists the pair (type of the
     * block member feeding it, type of the consumer). In
     * {@link Multiplicity#SINGLE_CONSUMER} mode a block with more than one
     * candidate consumer is not fused forward at all. After a successful fusion
     * the same position is examined again.
     *
     * @return the resulting partition
     */
    public List<BasicBlock> fuse(FusionAwareGraph fag) {
        RuleFlags flags = policy.flags();
        FusibilityTable table = policy.fusibility();
        int fusions = 0;
        int visits = 0;

        int i = -1;
        while (i < fag.size() - 1) {
            i++;
            visits++;
            if (fag.isFused(i)) {
                continue;
            }
            fag.markReady(i);

            List<Integer> consumers = fag.outbounds(i);
            if (consumers.isEmpty()) {
                continue;
            }
            if (flags.multiplicity() == Multiplicity.SINGLE_CONSUMER && consumers.size() > 1) {
                continue;
            }

            boolean fused = false;
            for (int j : consumers) {
                if (fag.isFused(j) || !fag.outbounds(i).contains(j)) {
                    continue;
                }
                String producerType = fag.type(fag.sourceOf(i, j));
                if (!table.isFusible(producerType, fag.type(j))) {
                    continue;
                }
                if (flags.requireReady() && !fag.isReady(j)) {
                    continue;
                }
                fag.fuse(i, j, flags.multiplicity() == Multiplicity.ALL_CONSUMERS);
                fag.markReady(j);
                fused = true;
                fusions++;
                if (flags.multiplicity() == Multiplicity.FIRST_CONSUMER) {
                    break;
                }
            }
            if (fused) {
                i--;
            }
        }

        List<BasicBlock> blocks = fag.basicBlocks();
        LOG.fine(String.format("Fusion loop: %d visits, %d fusions, %d blocks", visits, fusions, blocks.size()));
        return blocks;
    }
}
