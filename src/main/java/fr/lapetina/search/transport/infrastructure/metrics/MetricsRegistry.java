package fr.lapetina.search.transport.infrastructure.metrics;

import fr.lapetina.search.transport.domain.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Transport metrics using Micrometer.
 *
 * Provides:
 * - Attempt counters per node and outcome
 * - Attempt latency timers per node
 * - Error counters by kind
 * - Dead-node gauge
 * - Prometheus exposition when backed by a Prometheus registry
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "search_transport";

    private final MeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorKind, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
        log.info("MetricsRegistry initialized: prefix={}, registry={}", prefix, registry.getClass().getSimpleName());
    }

    public MetricsRegistry(String prefix) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Returns a registry that records nothing. A composite registry with no
     * children drops every measurement.
     */
    public static MetricsRegistry noop() {
        return new MetricsRegistry(new CompositeMeterRegistry(), DEFAULT_PREFIX);
    }

    /**
     * Counts one HTTP attempt against a node with its outcome
     * ({@code success}, {@code http_error}, {@code malformed}, {@code connection_failure}, {@code timeout}).
     */
    public void incrementAttemptCount(String nodeId, String outcome) {
        String key = nodeId + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Total number of HTTP attempts")
                        .tag("node", nodeId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of one attempt, whatever its outcome.
     */
    public void recordLatency(String nodeId, Duration latency) {
        latencyTimers.computeIfAbsent(nodeId, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("HTTP attempt latency")
                        .tag("node", nodeId)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts one failed logical request by kind.
     */
    public void incrementErrorCount(ErrorKind kind) {
        errorCounters.computeIfAbsent(kind, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed requests")
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for the number of nodes currently marked dead.
     */
    public void registerDeadNodes(Supplier<Number> deadCount) {
        Gauge.builder(prefix + "_dead_nodes", deadCount, s -> s.get().doubleValue())
                .description("Number of nodes currently marked dead")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output, or an empty string when the
     * underlying registry is not a Prometheus one.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
