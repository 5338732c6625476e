package io.surfworks.kerneldetect.fusion;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;

/**
 * Finds non-overlapping occurrences of {@link FusionUnit} templates in a graph.
 *
 * <p>Matching is a backtracking search over template positions. Positions are
 * visited so that each one after the first is connected to an earlier one when
 * the template allows it, which restricts candidates to graph neighbours.
 * Every required template edge must exist in the graph between the bound
 * nodes; additional graph edges are allowed. An occurrence must be convex:
 * no path between two of its nodes may pass through a node outside it, so
 * that collapsing it keeps the graph acyclic. The first position draws its
 * candidates in topological order.
 *
 * <p>A matcher remembers the nodes it has handed out. Within one matcher no
 * two occurrences share a node, whether they come from the same template or
 * from different ones. Use a fresh matcher for each pre-fusion pass.
 */
public final class SubgraphMatcher {

    private static final Logger LOG = Logger.getLogger(SubgraphMatcher.class.getName());

    private final Set<Integer> claimed = new HashSet<>();

    /**
     * Finds all occurrences of the template not overlapping earlier ones, and
     * claims their nodes.
     *
     * @param graph   the graph to search
     * @param unit    the template
     * @param matcher decides which nodes may fill a position
     * @return the occurrences, in discovery order
     */
    public List<FusionMatch> match(GraphIr graph, FusionUnit unit, TypeMatcher matcher) {
        List<String> order = searchOrder(unit);
        List<IrNode> roots = graph.traversalOrder();
        List<FusionMatch> matches = new ArrayList<>();

        while (true) {
            Map<String, IrNode> binding = new LinkedHashMap<>();
            if (!bind(graph, unit, matcher, order, roots, 0, binding)) {
                break;
            }
            Map<String, IrNode> ordered = new LinkedHashMap<>();
            for (String alias : unit.aliases().keySet()) {
                ordered.put(alias, binding.get(alias));
            }
            FusionMatch match = new FusionMatch(unit.name(), ordered);
            matches.add(match);
            for (IrNode node : binding.values()) {
                claimed.add(node.index());
            }
            LOG.fine("Matched " + match);
        }
        return matches;
    }

    public boolean isClaimed(IrNode node) {
        return claimed.contains(node.index());
    }

    private boolean bind(GraphIr graph, FusionUnit unit, TypeMatcher matcher,
                         List<String> order, List<IrNode> roots, int position, Map<String, IrNode> binding) {
        if (position == order.size()) {
            return graph.isConvex(binding.values());
        }
        String alias = order.get(position);
        Set<String> accepted = unit.aliases().get(alias);

        for (IrNode candidate : candidates(graph, unit, alias, roots, binding)) {
            if (candidate.isRemoved() || claimed.contains(candidate.index()) || binding.containsValue(candidate)) {
                continue;
            }
            if (!matcher.matches(candidate, accepted) || !edgesHold(unit, alias, candidate, binding)) {
                continue;
            }
            binding.put(alias, candidate);
            if (bind(graph, unit, matcher, order, roots, position + 1, binding)) {
                return true;
            }
            binding.remove(alias);
        }
        return false;
    }

    // Neighbours of an already bound position when the template links to one, else every node.
    private static List<IrNode> candidates(GraphIr graph, FusionUnit unit, String alias,
                                           List<IrNode> roots, Map<String, IrNode> binding) {
        for (FusionUnit.Edge edge : unit.edges()) {
            if (edge.to().equals(alias) && binding.containsKey(edge.from())) {
                return graph.outbounds(binding.get(edge.from()));
            }
            if (edge.from().equals(alias) && binding.containsKey(edge.to())) {
                return graph.inbounds(binding.get(edge.to()));
            }
        }
        return roots;
    }

    private static boolean edgesHold(FusionUnit unit, String alias, IrNode candidate, Map<String, IrNode> binding) {
        for (FusionUnit.Edge edge : unit.edges()) {
            if (edge.from().equals(alias) && binding.containsKey(edge.to())) {
                if (!candidate.outbounds().contains(binding.get(edge.to()).index())) {
                    return false;
                }
            } else if (edge.to().equals(alias) && binding.containsKey(edge.from())) {
                if (!binding.get(edge.from()).outbounds().contains(candidate.index())) {
                    return false;
                }
            }
        }
        return true;
    }

    private static List<String> searchOrder(FusionUnit unit) {
        List<String> declared = new ArrayList<>(unit.aliases().keySet());
        List<String> order = new ArrayList<>();
        while (!declared.isEmpty()) {
            String next = declared.get(0);
            for (String alias : declared) {
                if (isLinked(unit, alias, order)) {
                    next = alias;
                    break;
                }
            }
            order.add(next);
            declared.remove(next);
        }
        return order;
    }

    private static boolean isLinked(FusionUnit unit, String alias, List<String> placed) {
        for (FusionUnit.Edge edge : unit.edges()) {
            if ((edge.from().equals(alias) && placed.contains(edge.to()))
                    || (edge.to().equals(alias) && placed.contains(edge.from()))) {
                return true;
            }
        }
        return false;
    }
}
