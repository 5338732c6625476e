package io.surfworks.kerneldetect.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.kerneldetect.ir.IrNode;

/**
 * Collects the diagnostics of one shape inference run and logs them as they arrive.
 */
public final class ShapeContext {

    private static final Logger LOG = Logger.getLogger(ShapeContext.class.getName());

    private final List<ShapeDiagnostic> diagnostics = new ArrayList<>();

    ShapeContext() {}

    public void unsupported(IrNode node) {
        record(ShapeDiagnostic.Kind.UNSUPPORTED_OPERATOR, node, node.type() + " is not supported yet");
    }

    public void malformed(IrNode node, String format, Object... args) {
        record(ShapeDiagnostic.Kind.MALFORMED_TOPOLOGY, node, String.format(format, args));
    }

    public void mismatch(IrNode node, String format, Object... args) {
        record(ShapeDiagnostic.Kind.SHAPE_MISMATCH, node, String.format(format, args));
    }

    void failed(IrNode node, RuntimeException e) {
        String message = "Shape rule failed: " + e.getMessage();
        diagnostics.add(new ShapeDiagnostic(ShapeDiagnostic.Kind.MALFORMED_TOPOLOGY, node.name(), node.type(), message));
        LOG.log(Level.WARNING, "Shape rule for " + node.name() + " (" + node.type() + ") failed", e);
    }

    List<ShapeDiagnostic> diagnostics() {
        return diagnostics;
    }

    private void record(ShapeDiagnostic.Kind kind, IrNode node, String message) {
        ShapeDiagnostic diagnostic = new ShapeDiagnostic(kind, node.name(), node.type(), message);
        diagnostics.add(diagnostic);
        if (kind == ShapeDiagnostic.Kind.UNSUPPORTED_OPERATOR) {
            LOG.warning(node.type() + " not supported yet (node " + node.name() + ")");
        } else {
            LOG.warning(diagnostic.toString());
        }
    }
}
