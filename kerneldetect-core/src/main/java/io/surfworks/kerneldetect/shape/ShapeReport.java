package io.surfworks.kerneldetect.shape;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Outcome of one {@link ShapeInference} run.
 *
 * @param diagnostics     problems recorded in traversal order
 * @param visitedNodes    number of nodes visited by the first pass
 * @param unresolvedNodes names of visited nodes that still have no output shape
 */
public record ShapeReport(List<ShapeDiagnostic> diagnostics, int visitedNodes, List<String> unresolvedNodes) {

    public ShapeReport {
        diagnostics = List.copyOf(diagnostics);
        unresolvedNodes = List.copyOf(unresolvedNodes);
    }

    /**
     * True if every visited node received an output shape and nothing was recorded.
     */
    public boolean isClean() {
        return diagnostics.isEmpty() && unresolvedNodes.isEmpty();
    }

    public List<ShapeDiagnostic> diagnostics(ShapeDiagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }

    public List<ShapeDiagnostic> diagnosticsFor(String node) {
        return diagnostics.stream().filter(d -> d.node().equals(node)).toList();
    }

    /**
     * Op types that had no shape rule.
     */
    public Set<String> unsupportedTypes() {
        return diagnostics(ShapeDiagnostic.Kind.UNSUPPORTED_OPERATOR).stream()
                .map(ShapeDiagnostic::type)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
