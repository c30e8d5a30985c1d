package fr.lapetina.search.transport.domain.strategy;

import fr.lapetina.search.transport.domain.model.SearchNode;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random selection strategy.
 *
 * Picks uniformly among the candidates. Suits clusters of interchangeable
 * nodes, and spreads retries across the cluster without coordination.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements NodeSelectionStrategy {

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public SearchNode select(List<SearchNode> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidate nodes to select from");
        }
        int index = ThreadLocalRandom.current().nextInt(candidates.size());
        return candidates.get(index);
    }
}
