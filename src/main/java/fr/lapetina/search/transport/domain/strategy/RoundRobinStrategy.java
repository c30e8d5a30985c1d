package fr.lapetina.search.transport.domain.strategy;

import fr.lapetina.search.transport.domain.model.SearchNode;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin selection strategy.
 *
 * Cycles through the candidate list in order. The candidate list shrinks and
 * grows as nodes die and revive, so the rotation is only approximately fair
 * across membership changes.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements NodeSelectionStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public SearchNode select(List<SearchNode> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidate nodes to select from");
        }
        int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return candidates.get(index);
    }
}
