package fr.lapetina.search.transport.infrastructure.health;

import fr.lapetina.search.transport.domain.model.SearchNode;
import fr.lapetina.search.transport.domain.strategy.NodeSelectionStrategy;
import fr.lapetina.search.transport.domain.strategy.RandomStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The set of configured nodes and the record of which ones are presumed dead.
 *
 * <p>Selection prefers live nodes. When every node is marked dead the pool
 * selects among all of them instead of failing, so a cluster that comes back
 * is noticed by ordinary traffic. Dead marks decay lazily: on each selection,
 * marks older than the revival delay are evicted.
 *
 * <p>Probing a node happens outside the pool and outside its lock. Two callers
 * may probe the same node at once and report {@link #markDead} and
 * {@link #markLive} close together; the last report wins.
 *
 * Thread-safe: a single lock guards the dead-mark map.
 */
public final class NodePool {

    private final Logger log;
    private final List<SearchNode> nodes;
    private final Map<SearchNode, Instant> deadSince = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration revivalDelay;
    private final NodeSelectionStrategy strategy;
    private final Clock clock;

    public NodePool(
            List<SearchNode> nodes,
            Duration revivalDelay,
            NodeSelectionStrategy strategy,
            Clock clock,
            Logger logger
    ) {
        Objects.requireNonNull(nodes, "Nodes are required");
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("At least one node is required");
        }
        Set<SearchNode> unique = new LinkedHashSet<>(nodes);
        if (unique.size() != nodes.size()) {
            throw new IllegalArgumentException("Duplicate node URLs: " + nodes);
        }
        Objects.requireNonNull(revivalDelay, "Revival delay is required");
        if (revivalDelay.isNegative()) {
            throw new IllegalArgumentException("Revival delay must not be negative: " + revivalDelay);
        }
        this.nodes = List.copyOf(nodes);
        this.revivalDelay = revivalDelay;
        this.strategy = Objects.requireNonNull(strategy, "Strategy is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.log = logger != null ? logger : LoggerFactory.getLogger(NodePool.class);
    }

    public NodePool(List<SearchNode> nodes, Duration revivalDelay) {
        this(nodes, revivalDelay, new RandomStrategy(), Clock.systemUTC(), null);
    }

    /**
     * Creates a pool from base URLs with the default random strategy.
     */
    public static NodePool fromUrls(List<String> urls, Duration revivalDelay) {
        List<SearchNode> nodes = new ArrayList<>(urls.size());
        for (String url : urls) {
            nodes.add(SearchNode.of(url));
        }
        return new NodePool(nodes, revivalDelay);
    }

    /**
     * Returns the node the next attempt should use.
     *
     * <p>Chooses among nodes not marked dead. If every node is marked dead,
     * chooses among all nodes. Never blocks on I/O and never fails.
     */
    public SearchNode select() {
        lock.lock();
        try {
            reviveExpired(clock.instant());
            if (deadSince.isEmpty()) {
                return strategy.select(nodes);
            }

            List<SearchNode> live = new ArrayList<>(nodes.size() - deadSince.size());
            for (SearchNode node : nodes) {
                if (!deadSince.containsKey(node)) {
                    live.add(node);
                }
            }
            if (!live.isEmpty()) {
                return strategy.select(live);
            }

            SearchNode fallback = strategy.select(nodes);
            log.debug("All nodes marked dead, trying one anyway: nodeId={}, nodes={}", fallback.getId(), nodes.size());
            return fallback;
        } finally {
            lock.unlock();
        }
    }

    private void reviveExpired(Instant now) {
        if (deadSince.isEmpty()) {
            return;
        }
        deadSince.entrySet().removeIf(entry -> {
            boolean expired = !now.isBefore(entry.getValue().plus(revivalDelay));
            if (expired) {
                log.info("Node eligible again after revival delay: nodeId={}, deadSince={}",
                        entry.getKey().getId(), entry.getValue());
            }
            return expired;
        });
    }

    /**
     * Marks the node dead as of now.
     *
     * @return true if the node was live and is now marked, false if it was already dead
     */
    public boolean markDead(SearchNode node) {
        return markDead(node, clock.instant());
    }

    /**
     * Marks the node dead as of the given instant. An existing mark is kept
     * unchanged, so repeated failures do not push the revival further away.
     *
     * @return true if the node was live and is now marked, false if it was already dead
     */
    public boolean markDead(SearchNode node, Instant now) {
        requireMember(node);
        lock.lock();
        try {
            Instant previous = deadSince.putIfAbsent(node, now);
            if (previous == null) {
                log.info("Node marked dead: nodeId={}, revivalDelayMs={}", node.getId(), revivalDelay.toMillis());
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the dead mark of a node that just answered.
     *
     * @return true if the node was marked dead
     */
    public boolean markLive(SearchNode node) {
        requireMember(node);
        lock.lock();
        try {
            Instant removed = deadSince.remove(node);
            if (removed != null) {
                log.info("Node back in rotation: nodeId={}, deadSince={}", node.getId(), removed);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void requireMember(SearchNode node) {
        Objects.requireNonNull(node, "Node is required");
        if (!nodes.contains(node)) {
            throw new IllegalArgumentException("Node is not part of this pool: " + node);
        }
    }

    /**
     * Returns whether the node currently carries a dead mark. Marks past the
     * revival delay count as dead until the next selection evicts them.
     */
    public boolean isDead(SearchNode node) {
        lock.lock();
        try {
            return deadSince.containsKey(node);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> getDeadSince(SearchNode node) {
        lock.lock();
        try {
            return Optional.ofNullable(deadSince.get(node));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the dead marks, in configuration order.
     */
    public Map<SearchNode, Instant> getDeadNodes() {
        lock.lock();
        try {
            Map<SearchNode, Instant> snapshot = new LinkedHashMap<>();
            for (SearchNode node : nodes) {
                Instant since = deadSince.get(node);
                if (since != null) {
                    snapshot.put(node, since);
                }
            }
            return Collections.unmodifiableMap(snapshot);
        } finally {
            lock.unlock();
        }
    }

    public int deadCount() {
        lock.lock();
        try {
            return deadSince.size();
        } finally {
            lock.unlock();
        }
    }

    public int liveCount() {
        return nodes.size() - deadCount();
    }

    public List<SearchNode> getNodes() {
        return nodes;
    }

    public Duration getRevivalDelay() {
        return revivalDelay;
    }

    public NodeSelectionStrategy getStrategy() {
        return strategy;
    }

    @Override
    public String toString() {
        return "NodePool{" +
                "nodes=" + nodes.size() +
                ", dead=" + deadCount() +
                ", strategy=" + strategy.getName() +
                '}';
    }
}
