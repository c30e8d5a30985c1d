package fr.lapetina.search.transport.infrastructure.health;

import fr.lapetina.search.transport.domain.model.SearchNode;
import fr.lapetina.search.transport.domain.strategy.RandomStrategy;
import fr.lapetina.search.transport.domain.strategy.RoundRobinStrategy;
import fr.lapetina.search.transport.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodePoolTest {

    private static final Duration REVIVAL_DELAY = Duration.ofSeconds(300);

    private SearchNode a;
    private SearchNode b;
    private SearchNode c;
    private MutableClock clock;
    private NodePool pool;

    @BeforeEach
    void setUp() {
        a = SearchNode.of("http://a:9200");
        b = SearchNode.of("http://b:9200");
        c = SearchNode.of("http://c:9200");
        clock = new MutableClock();
        pool = new NodePool(List.of(a, b, c), REVIVAL_DELAY, new RandomStrategy(), clock, null);
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("should never select a dead node while a live one exists")
        void shouldNeverSelectDeadNode() {
            pool.markDead(a);

            for (int i = 0; i < 10_000; i++) {
                assertThat(pool.select()).isNotEqualTo(a);
            }
        }

        @Test
        @DisplayName("should spread selections over all live nodes")
        void shouldSpreadOverLiveNodes() {
            Set<SearchNode> seen = new HashSet<>();
            for (int i = 0; i < 1_000; i++) {
                seen.add(pool.select());
            }

            assertThat(seen).containsExactlyInAnyOrder(a, b, c);
        }

        @Test
        @DisplayName("should fall back to all nodes when every node is dead")
        void shouldFallBackWhenAllDead() {
            pool.markDead(a);
            pool.markDead(b);
            pool.markDead(c);

            Set<SearchNode> seen = new HashSet<>();
            for (int i = 0; i < 1_000; i++) {
                seen.add(pool.select());
            }

            assertThat(seen).containsExactlyInAnyOrder(a, b, c);
            // Selection does not clear marks
            assertThat(pool.deadCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should apply the configured strategy to live candidates")
        void shouldApplyStrategyToLiveCandidates() {
            NodePool roundRobin = new NodePool(List.of(a, b, c), REVIVAL_DELAY, new RoundRobinStrategy(), clock, null);
            roundRobin.markDead(b);

            assertThat(List.of(roundRobin.select(), roundRobin.select(), roundRobin.select(), roundRobin.select()))
                    .containsExactly(a, c, a, c);
        }
    }

    @Nested
    @DisplayName("Dead marks")
    class DeadMarkTests {

        @Test
        @DisplayName("should record the time a node was marked dead")
        void shouldRecordDeadSince() {
            Instant start = clock.instant();

            assertThat(pool.markDead(a)).isTrue();

            assertThat(pool.isDead(a)).isTrue();
            assertThat(pool.getDeadSince(a)).contains(start);
            assertThat(pool.getDeadSince(b)).isEmpty();
        }

        @Test
        @DisplayName("should keep the first timestamp when marked dead again")
        void shouldBeIdempotent() {
            Instant first = clock.instant();
            pool.markDead(a);
            clock.advance(Duration.ofSeconds(100));

            assertThat(pool.markDead(a)).isFalse();

            assertThat(pool.getDeadSince(a)).contains(first);
        }

        @Test
        @DisplayName("should clear the mark on markLive")
        void shouldClearOnMarkLive() {
            pool.markDead(a);

            assertThat(pool.markLive(a)).isTrue();
            assertThat(pool.markLive(a)).isFalse();

            assertThat(pool.isDead(a)).isFalse();
            assertThat(pool.liveCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should list dead nodes in configuration order")
        void shouldListDeadNodesInOrder() {
            pool.markDead(c);
            pool.markDead(a);

            assertThat(pool.getDeadNodes().keySet()).containsExactly(a, c);
            assertThat(pool.deadCount()).isEqualTo(2);
            assertThat(pool.liveCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject nodes that are not part of the pool")
        void shouldRejectForeignNodes() {
            SearchNode stranger = SearchNode.of("http://elsewhere:9200");

            assertThatThrownBy(() -> pool.markDead(stranger)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> pool.markLive(stranger)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Revival")
    class RevivalTests {

        @Test
        @DisplayName("should keep a node dead until the revival delay has passed")
        void shouldStayDeadBeforeDelay() {
            pool.markDead(a);
            clock.advance(REVIVAL_DELAY.minusSeconds(1));

            pool.select();

            assertThat(pool.isDead(a)).isTrue();
        }

        @Test
        @DisplayName("should revive a node on the first selection after the delay")
        void shouldReviveAfterDelay() {
            pool.markDead(a);
            clock.advance(REVIVAL_DELAY);

            // The mark is still there until a selection looks at it
            assertThat(pool.isDead(a)).isTrue();
            pool.select();

            assertThat(pool.isDead(a)).isFalse();
        }

        @Test
        @DisplayName("should select a revived node again")
        void shouldSelectRevivedNode() {
            NodePool pair = new NodePool(List.of(a, b), REVIVAL_DELAY, new RoundRobinStrategy(), clock, null);
            pair.markDead(a);
            assertThat(pair.select()).isEqualTo(b);

            clock.advance(REVIVAL_DELAY.plusSeconds(1));

            Set<SearchNode> seen = new HashSet<>();
            for (int i = 0; i < 4; i++) {
                seen.add(pair.select());
            }
            assertThat(seen).contains(a);
        }

        @Test
        @DisplayName("should revive immediately with a zero delay")
        void shouldReviveImmediatelyWithZeroDelay() {
            NodePool eager = new NodePool(List.of(a, b), Duration.ZERO, new RandomStrategy(), clock, null);
            eager.markDead(a);

            eager.select();

            assertThat(eager.isDead(a)).isFalse();
        }
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("should reject an empty node list")
        void shouldRejectEmptyList() {
            assertThatThrownBy(() -> new NodePool(List.of(), REVIVAL_DELAY))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject duplicate URLs after normalization")
        void shouldRejectDuplicates() {
            assertThatThrownBy(() -> NodePool.fromUrls(List.of("http://a:9200", "http://a:9200/"), REVIVAL_DELAY))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("should reject a negative revival delay")
        void shouldRejectNegativeDelay() {
            assertThatThrownBy(() -> new NodePool(List.of(a), Duration.ofSeconds(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should expose nodes in configuration order")
        void shouldExposeNodes() {
            NodePool fromUrls = NodePool.fromUrls(List.of("http://b:9200/", "http://a:9200"), REVIVAL_DELAY);

            assertThat(fromUrls.getNodes()).extracting(SearchNode::getId)
                    .containsExactly("http://b:9200", "http://a:9200");
            assertThat(fromUrls.getStrategy().getName()).isEqualTo("random");
        }
    }

    @Test
    @DisplayName("should stay consistent under concurrent marks and selections")
    void shouldBeThreadSafe() throws InterruptedException {
        int threads = 8;
        int iterations = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        Set<SearchNode> selected = ConcurrentHashMap.newKeySet();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        List<SearchNode> nodes = pool.getNodes();

        for (int t = 0; t < threads; t++) {
            int offset = t;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        SearchNode node = nodes.get((i + offset) % nodes.size());
                        if (i % 3 == 0) {
                            pool.markDead(node);
                        } else if (i % 3 == 1) {
                            pool.markLive(node);
                        }
                        selected.add(pool.select());
                    }
                } catch (Throwable e) {
                    failure.compareAndSet(null, e);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(failure.get()).isNull();
        assertThat(nodes).containsAll(selected);
        assertThat(pool.deadCount()).isBetween(0, 3);
    }
}
