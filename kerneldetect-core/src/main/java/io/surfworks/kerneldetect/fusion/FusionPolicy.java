package io.surfworks.kerneldetect.fusion;

import java.util.List;
import java.util.Objects;

/**
 * Declarative fusion data: templates for pre-fusion, the pairwise fusibility
 * table and the rule switches of the fusion loop.
 *
 * <p>A policy is immutable and may be shared by any number of concurrent split
 * runs.
 *
 * @param fusionUnits templates, matched in list order
 * @param fusibility  pairwise producer/consumer fusibility
 * @param flags       fusion loop switches
 */
public record FusionPolicy(List<FusionUnit> fusionUnits, FusibilityTable fusibility, RuleFlags flags) {

    public FusionPolicy {
        fusionUnits = List.copyOf(fusionUnits);
        Objects.requireNonNull(fusibility, "fusibility");
        Objects.requireNonNull(flags, "flags");
    }

    public static FusionPolicy of(FusibilityTable fusibility, RuleFlags flags) {
        return new FusionPolicy(List.of(), fusibility, flags);
    }

    public FusionPolicy withFlags(RuleFlags value) {
        return new FusionPolicy(fusionUnits, fusibility, value);
    }

    public FusionPolicy withFusionUnits(List<FusionUnit> value) {
        return new FusionPolicy(value, fusibility, flags);
    }

    @Override
    public String toString() {
        return String.format("FusionPolicy[units=%d, fusiblePairs=%d, flags=%s]",
                fusionUnits.size(), fusibility.size(), flags);
    }
}
