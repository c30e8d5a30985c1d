package fr.lapetina.search.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.domain.model.SearchNode;
import fr.lapetina.search.transport.domain.model.TransportRequest;
import fr.lapetina.search.transport.domain.strategy.NodeSelectionStrategy;
import fr.lapetina.search.transport.domain.strategy.RandomStrategy;
import fr.lapetina.search.transport.domain.strategy.StrategyFactory;
import fr.lapetina.search.transport.infrastructure.config.ConfigLoader;
import fr.lapetina.search.transport.infrastructure.config.TransportConfig;
import fr.lapetina.search.transport.infrastructure.health.NodePool;
import fr.lapetina.search.transport.infrastructure.http.RequestExecutor;
import fr.lapetina.search.transport.infrastructure.http.ResponseDecoder;
import fr.lapetina.search.transport.infrastructure.http.SearchHttpClient;
import fr.lapetina.search.transport.infrastructure.json.JsonSerializer;
import fr.lapetina.search.transport.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point: a fully wired transport over a fixed set of search nodes.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SearchTransport transport = SearchTransport.builder()
 *         .nodes("http://es1:9200", "http://es2:9200")
 *         .maxRetries(1)
 *         .build()) {
 *     JsonNode doc = transport.execute(HttpMethod.GET, List.of("tweets", "tweet", "1"), null, Map.of());
 * }
 * }</pre>
 *
 * One instance is meant to be shared by all threads of an application.
 */
public final class SearchTransport implements AutoCloseable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_REVIVAL_DELAY = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_RETRIES = 0;

    private static final Logger log = LoggerFactory.getLogger(SearchTransport.class);

    private final NodePool pool;
    private final SearchHttpClient httpClient;
    private final JsonSerializer serializer;
    private final RequestExecutor executor;
    private final MetricsRegistry metricsRegistry;

    private SearchTransport(Builder builder) {
        NodeSelectionStrategy strategy = builder.strategy != null ? builder.strategy : new RandomStrategy();
        List<SearchNode> nodes = new ArrayList<>(builder.nodeUrls.size());
        for (String url : builder.nodeUrls) {
            nodes.add(SearchNode.of(url));
        }

        this.pool = new NodePool(nodes, builder.revivalDelay, strategy, builder.clock, builder.logger);
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : new SearchHttpClient(builder.connectTimeout != null ? builder.connectTimeout : builder.timeout,
                        builder.username, builder.password);
        this.serializer = new JsonSerializer(builder.objectMapper);
        this.metricsRegistry = builder.metricsRegistry != null ? builder.metricsRegistry : MetricsRegistry.noop();
        this.executor = new RequestExecutor(
                pool,
                httpClient,
                serializer,
                new ResponseDecoder(builder.objectMapper),
                metricsRegistry,
                builder.timeout,
                builder.maxRetries,
                builder.logger
        );
        metricsRegistry.registerDeadNodes(pool::deadCount);

        log.info("SearchTransport initialized: nodes={}, maxRetries={}, timeoutMs={}, revivalDelayMs={}, strategy={}",
                nodes, builder.maxRetries, builder.timeout.toMillis(), builder.revivalDelay.toMillis(), strategy.getName());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a transport from a YAML file on the file system or the classpath.
     */
    public static SearchTransport fromConfig(String configPath) {
        return fromConfig(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a transport from an already loaded configuration.
     */
    public static SearchTransport fromConfig(TransportConfig config) {
        return builder().fromConfig(config).build();
    }

    /**
     * Performs one logical request, blocking until it succeeds or fails.
     *
     * @param pathSegments path segments, escaped individually; empty segments are dropped
     * @param body         structured body, or {@code null}
     * @param queryParams  query options; each value is encoded with {@link #encodeScalar(Object)}
     */
    public JsonNode execute(HttpMethod method, List<String> pathSegments, Object body, Map<String, ?> queryParams) {
        return executor.execute(buildRequest(method, pathSegments, body, queryParams, null));
    }

    /**
     * Same as {@link #execute(HttpMethod, List, Object, Map)} with a per-attempt timeout override.
     */
    public JsonNode execute(HttpMethod method, List<String> pathSegments, Object body, Map<String, ?> queryParams,
                            Duration timeout) {
        return executor.execute(buildRequest(method, pathSegments, body, queryParams, timeout));
    }

    public JsonNode execute(TransportRequest request) {
        return executor.execute(request);
    }

    public CompletableFuture<JsonNode> executeAsync(HttpMethod method, List<String> pathSegments, Object body,
                                                    Map<String, ?> queryParams) {
        TransportRequest request;
        try {
            request = buildRequest(method, pathSegments, body, queryParams, null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return executor.executeAsync(request);
    }

    public CompletableFuture<JsonNode> executeAsync(TransportRequest request) {
        return executor.executeAsync(request);
    }

    private TransportRequest buildRequest(HttpMethod method, List<String> pathSegments, Object body,
                                          Map<String, ?> queryParams, Duration timeout) {
        return TransportRequest.builder(method)
                .path(pathSegments != null ? pathSegments : List.of())
                .body(body)
                .queryParams(encodeQuery(queryParams))
                .timeout(timeout)
                .build();
    }

    /**
     * Encodes every value of a query map with {@link #encodeScalar(Object)}, keeping key order.
     */
    public Map<String, String> encodeQuery(Map<String, ?> queryParams) {
        Map<String, String> encoded = new LinkedHashMap<>();
        if (queryParams != null) {
            queryParams.forEach((name, value) -> encoded.put(name, serializer.encodeScalar(value)));
        }
        return encoded;
    }

    public byte[] encodeBody(Object value) {
        return serializer.encodeBody(value);
    }

    public String encodeScalar(Object value) {
        return serializer.encodeScalar(value);
    }

    public NodePool getPool() {
        return pool;
    }

    public JsonSerializer getSerializer() {
        return serializer;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public int getMaxRetries() {
        return executor.getMaxRetries();
    }

    public Duration getTimeout() {
        return executor.getDefaultTimeout();
    }

    @Override
    public void close() {
        log.info("Closing SearchTransport");
        httpClient.close();
        metricsRegistry.close();
    }

    public static final class Builder {
        private final List<String> nodeUrls = new ArrayList<>();
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration connectTimeout;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration revivalDelay = DEFAULT_REVIVAL_DELAY;
        private NodeSelectionStrategy strategy;
        private String username;
        private String password;
        private SearchHttpClient httpClient;
        private MetricsRegistry metricsRegistry;
        private ObjectMapper objectMapper = new ObjectMapper();
        private Clock clock = Clock.systemUTC();
        private Logger logger;

        private Builder() {
        }

        public Builder nodes(String... urls) {
            return nodes(Arrays.asList(urls));
        }

        public Builder nodes(List<String> urls) {
            nodeUrls.addAll(urls);
            return this;
        }

        /**
         * Per-attempt timeout. The worst-case duration of a call is
         * {@code (maxRetries + 1) * timeout}.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Bound on establishing a connection. Defaults to the request timeout.
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder revivalDelay(Duration revivalDelay) {
            this.revivalDelay = revivalDelay;
            return this;
        }

        public Builder strategy(NodeSelectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        /**
         * Replaces the HTTP client; credentials and connect timeout are then ignored.
         */
        public Builder httpClient(SearchHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Logger for pool and executor events. Defaults to the classes' own loggers.
         */
        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public Builder fromConfig(TransportConfig config) {
            ConfigLoader.validate(config);
            nodes(config.getNodes());
            timeout(Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()));
            connectTimeout(Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()));
            maxRetries(config.getRetry().getMaxRetries());
            revivalDelay(Duration.ofMillis(config.getPool().getRevivalDelayMs()));
            strategy(StrategyFactory.createOrDefault(config.getPool().getStrategy(), new RandomStrategy()));
            if (config.getAuth().getUsername() != null) {
                credentials(config.getAuth().getUsername(), config.getAuth().getPassword());
            }
            if (config.getMetrics().isEnabled()) {
                metricsRegistry(new MetricsRegistry(config.getMetrics().getPrefix()));
            }
            return this;
        }

        public SearchTransport build() {
            return new SearchTransport(this);
        }
    }
}
