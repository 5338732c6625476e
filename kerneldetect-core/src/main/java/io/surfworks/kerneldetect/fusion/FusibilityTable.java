package io.surfworks.kerneldetect.fusion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Pairwise lookup of whether a producer op type may fuse into a consumer op type.
 *
 * <p>Lookups are directional and closed-world: a pair that was never added is
 * not fusible. Instances are immutable.
 */
public final class FusibilityTable {

    private static final FusibilityTable EMPTY = new FusibilityTable(Map.of());

    private final Map<String, Set<String>> consumersByProducer;

    private FusibilityTable(Map<String, Set<String>> consumersByProducer) {
        this.consumersByProducer = consumersByProducer;
    }

    public static FusibilityTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isFusible(String producerType, String consumerType) {
        Set<String> consumers = consumersByProducer.get(producerType);
        return consumers != null && consumers.contains(consumerType);
    }

    /**
     * Consumer types the given producer type may fuse into.
     */
    public Set<String> consumersOf(String producerType) {
        return consumersByProducer.getOrDefault(producerType, Set.of());
    }

    public int size() {
        return consumersByProducer.values().stream().mapToInt(Set::size).sum();
    }

    @Override
    public String toString() {
        return "FusibilityTable" + consumersByProducer;
    }

    public static final class Builder {

        private final Map<String, Set<String>> pairs = new LinkedHashMap<>();

        private Builder() {}

        public Builder allow(String producerType, String consumerType) {
            pairs.computeIfAbsent(producerType, k -> new LinkedHashSet<>()).add(consumerType);
            return this;
        }

        public Builder allowAll(FusibilityTable other) {
            other.consumersByProducer.forEach((producer, consumers) ->
                    consumers.forEach(consumer -> allow(producer, consumer)));
            return this;
        }

        public FusibilityTable build() {
            Map<String, Set<String>> frozen = new LinkedHashMap<>();
            pairs.forEach((producer, consumers) ->
                    frozen.put(producer, Collections.unmodifiableSet(new LinkedHashSet<>(consumers))));
            return new FusibilityTable(Collections.unmodifiableMap(frozen));
        }
    }
}
