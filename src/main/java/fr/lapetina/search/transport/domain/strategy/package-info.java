/**
 * Node selection strategies for distributing attempts across search nodes.
 *
 * <p>The node pool narrows the candidates (live nodes, or all nodes when every
 * one is marked dead); a strategy picks one of them. All implementations are
 * thread-safe.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code random}</td><td>Uniform random choice (default)</td></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through candidates in order</td></tr>
 * </table>
 *
 * <h2>Custom Strategies</h2>
 * <p>Implement {@link fr.lapetina.search.transport.domain.strategy.NodeSelectionStrategy} and register
 * with {@link fr.lapetina.search.transport.domain.strategy.StrategyFactory}.
 */
package fr.lapetina.search.transport.domain.strategy;
