package fr.lapetina.search.transport.domain.strategy;

import fr.lapetina.search.transport.domain.model.SearchNode;

import java.util.List;

/**
 * Strategy interface for picking one node out of a candidate list.
 *
 * The node pool decides which nodes are candidates (live ones, or every node
 * under total outage); the strategy only decides the distribution.
 * Implementations must be thread-safe as they are called from every caller
 * sharing the pool.
 */
public interface NodeSelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    String getName();

    /**
     * Selects a node from the candidates.
     *
     * @param candidates Non-empty list of eligible nodes
     * @return One of the candidates
     */
    SearchNode select(List<SearchNode> candidates);
}
