package io.surfworks.kerneldetect.fusion;

import java.util.Objects;

/**
 * Switches controlling the edge cases of the pairwise fusion loop.
 *
 * @param multiplicity whether, and into how many consumers, a multi-consumer node may fuse
 * @param requireReady if true, a consumer can only be absorbed once it has been marked ready
 */
public record RuleFlags(Multiplicity multiplicity, boolean requireReady) {

    public static final RuleFlags DEFAULT = new RuleFlags(Multiplicity.SINGLE_CONSUMER, false);

    public RuleFlags {
        Objects.requireNonNull(multiplicity, "multiplicity");
    }

    public RuleFlags withMultiplicity(Multiplicity value) {
        return new RuleFlags(value, requireReady);
    }

    public RuleFlags withRequireReady(boolean value) {
        return new RuleFlags(multiplicity, value);
    }
}
