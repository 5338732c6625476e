package io.surfworks.kerneldetect.fusion;

import java.util.Set;

import io.surfworks.kerneldetect.ir.IrNode;

/**
 * Decides whether a graph node may fill a template position.
 */
@FunctionalInterface
public interface TypeMatcher {

    /** Accepts a node whose op type is one of the position's types. */
    TypeMatcher OP_TYPE = (node, acceptedTypes) -> acceptedTypes.contains(node.type());

    boolean matches(IrNode node, Set<String> acceptedTypes);
}
