package fr.lapetina.search.transport.domain.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for node selection strategies, keyed by the name used in configuration.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<NodeSelectionStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("random", RandomStrategy::new);
        register("round-robin", RoundRobinStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<NodeSelectionStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if not found
     */
    public static Optional<NodeSelectionStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<NodeSelectionStrategy> supplier = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, with default fallback.
     */
    public static NodeSelectionStrategy createOrDefault(String name, NodeSelectionStrategy defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    /**
     * Returns all registered strategy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
