package fr.lapetina.search.transport.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.search.transport.domain.model.ErrorKind;
import fr.lapetina.search.transport.domain.model.SearchNode;
import fr.lapetina.search.transport.domain.model.TransportRequest;
import fr.lapetina.search.transport.exception.ConnectionFailureException;
import fr.lapetina.search.transport.exception.RequestCancelledException;
import fr.lapetina.search.transport.exception.RequestTimeoutException;
import fr.lapetina.search.transport.exception.TransportException;
import fr.lapetina.search.transport.infrastructure.health.NodePool;
import fr.lapetina.search.transport.infrastructure.json.JsonSerializer;
import fr.lapetina.search.transport.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one logical request against the pool with bounded retries.
 *
 * <p>Each attempt selects a node, sends the request and classifies the outcome:
 * <ul>
 *   <li>transport failure (refused, reset, timed out): the node is marked dead and,
 *       while attempts remain, the request is retried on a newly selected node</li>
 *   <li>2xx with a JSON body: the node is marked live and the tree returned</li>
 *   <li>non-2xx or a body that is not JSON: raised at once, never retried</li>
 * </ul>
 * A request makes at most {@code maxRetries + 1} attempts. There is no backoff
 * between attempts; the dead marks steer retries away from failed nodes.
 *
 * <p>The body is encoded once, before the first attempt, so an unencodable
 * value fails without contacting any node.
 *
 * Thread-safe; shared by all callers of a transport.
 */
public final class RequestExecutor {

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_HTTP_ERROR = "http_error";
    static final String OUTCOME_MALFORMED = "malformed";
    static final String OUTCOME_CONNECTION_FAILURE = "connection_failure";
    static final String OUTCOME_TIMEOUT = "timeout";

    private final NodePool pool;
    private final SearchHttpClient httpClient;
    private final JsonSerializer serializer;
    private final ResponseDecoder decoder;
    private final MetricsRegistry metrics;
    private final Duration defaultTimeout;
    private final int maxRetries;
    private final Logger log;

    public RequestExecutor(
            NodePool pool,
            SearchHttpClient httpClient,
            JsonSerializer serializer,
            ResponseDecoder decoder,
            MetricsRegistry metrics,
            Duration defaultTimeout,
            int maxRetries,
            Logger logger
    ) {
        this.pool = Objects.requireNonNull(pool, "Pool is required");
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client is required");
        this.serializer = Objects.requireNonNull(serializer, "Serializer is required");
        this.decoder = Objects.requireNonNull(decoder, "Decoder is required");
        this.metrics = metrics != null ? metrics : MetricsRegistry.noop();
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "Timeout is required");
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + defaultTimeout);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.log = logger != null ? logger : LoggerFactory.getLogger(RequestExecutor.class);
    }

    /**
     * Executes the request, blocking the calling thread until a response is
     * decoded or the retry budget is spent.
     *
     * @throws fr.lapetina.search.transport.exception.EncodingException   if the body cannot be encoded
     * @throws ConnectionFailureException                                  if every attempt failed at the transport level
     * @throws RequestTimeoutException                                     if the last attempt timed out
     * @throws fr.lapetina.search.transport.exception.HttpErrorException   on a non-2xx status
     * @throws fr.lapetina.search.transport.exception.MalformedResponseException on a body that is not JSON
     * @throws RequestCancelledException                                   if the calling thread is interrupted
     */
    public JsonNode execute(TransportRequest request) {
        byte[] body = encodeBody(request);
        Duration timeout = timeoutOf(request);
        List<SearchNode> nodesTried = new ArrayList<>();
        List<IOException> failures = new ArrayList<>();

        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            HttpAttempt httpAttempt = prepareAttempt(request, body, timeout, attempt);
            nodesTried.add(httpAttempt.node());
            long startNanos = System.nanoTime();

            RawResponse response;
            try {
                response = httpClient.send(httpAttempt);
            } catch (IOException e) {
                onTransportFailure(httpAttempt, e, elapsedSince(startNanos));
                failures.add(e);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metrics.incrementErrorCount(ErrorKind.CANCELLED);
                log.warn("Request interrupted: method={}, url={}, attempt={}",
                        request.method(), httpAttempt.uri(), attempt);
                throw new RequestCancelledException("Request interrupted: " + request.method() + " " + httpAttempt.uri(), e);
            }
            return onResponse(httpAttempt, response, elapsedSince(startNanos));
        }

        throw exhausted(request, nodesTried, failures);
    }

    /**
     * Executes the request without blocking the caller.
     *
     * <p>The returned future completes with the decoded tree or exceptionally
     * with the same {@link TransportException} {@link #execute} would throw.
     * Cancelling it aborts the in-flight attempt, starts no further attempt and
     * leaves the node's dead mark untouched.
     */
    public CompletableFuture<JsonNode> executeAsync(TransportRequest request) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        byte[] body;
        try {
            body = encodeBody(request);
        } catch (TransportException e) {
            result.completeExceptionally(e);
            return result;
        }
        new AsyncExecution(request, body, timeoutOf(request), result).nextAttempt();
        return result;
    }

    private byte[] encodeBody(TransportRequest request) {
        try {
            if (request.body() != null) {
                return serializer.encode(request.body());
            }
            return request.rawBody();
        } catch (TransportException e) {
            metrics.incrementErrorCount(e.getKind());
            throw e;
        }
    }

    private Duration timeoutOf(TransportRequest request) {
        return request.timeout() != null ? request.timeout() : defaultTimeout;
    }

    private HttpAttempt prepareAttempt(TransportRequest request, byte[] body, Duration timeout, int attempt) {
        SearchNode node = pool.select();
        URI uri = URI.create(node.getId() + request.pathAndQuery());
        HttpAttempt httpAttempt = new HttpAttempt(node, request.method(), uri, body, timeout, attempt);
        log.debug("Sending request: method={}, url={}, nodeId={}, attempt={}/{}, timeoutMs={}",
                request.method(), uri, node.getId(), attempt, maxRetries + 1, timeout.toMillis());
        return httpAttempt;
    }

    private JsonNode onResponse(HttpAttempt attempt, RawResponse response, Duration latency) {
        SearchNode node = attempt.node();
        metrics.recordLatency(node.getId(), latency);
        try {
            JsonNode json = decoder.decode(attempt, response);
            pool.markLive(node);
            metrics.incrementAttemptCount(node.getId(), OUTCOME_SUCCESS);
            log.debug("Request completed: method={}, url={}, status={}, latencyMs={}",
                    attempt.method(), attempt.uri(), response.statusCode(), latency.toMillis());
            return json;
        } catch (TransportException e) {
            boolean malformed = e.getKind() == ErrorKind.MALFORMED_RESPONSE;
            metrics.incrementAttemptCount(node.getId(), malformed ? OUTCOME_MALFORMED : OUTCOME_HTTP_ERROR);
            metrics.incrementErrorCount(e.getKind());
            log.debug("Request rejected: method={}, url={}, status={}, kind={}, latencyMs={}",
                    attempt.method(), attempt.uri(), response.statusCode(), e.getKind(), latency.toMillis());
            throw e;
        }
    }

    private void onTransportFailure(HttpAttempt attempt, IOException failure, Duration latency) {
        SearchNode node = attempt.node();
        boolean timeout = isTimeout(failure);
        metrics.recordLatency(node.getId(), latency);
        metrics.incrementAttemptCount(node.getId(), timeout ? OUTCOME_TIMEOUT : OUTCOME_CONNECTION_FAILURE);
        pool.markDead(node);
        log.warn("Attempt failed: method={}, url={}, nodeId={}, attempt={}/{}, errorType={}, error={}, latencyMs={}",
                attempt.method(),
                attempt.uri(),
                node.getId(),
                attempt.attemptNumber(),
                maxRetries + 1,
                timeout ? ErrorKind.TIMEOUT : ErrorKind.CONNECTION_FAILURE,
                failure.toString(),
                latency.toMillis());
    }

    private ConnectionFailureException exhausted(
            TransportRequest request,
            List<SearchNode> nodesTried,
            List<IOException> failures
    ) {
        IOException last = failures.get(failures.size() - 1);
        String message = String.format("%s %s failed after %d attempt(s) on %s: %s",
                request.method(), request.pathAndQuery(), nodesTried.size(), nodesTried, last);

        ConnectionFailureException failure = isTimeout(last)
                ? new RequestTimeoutException(message, nodesTried, last)
                : new ConnectionFailureException(message, nodesTried, last);
        for (int i = 0; i < failures.size() - 1; i++) {
            failure.addSuppressed(failures.get(i));
        }
        metrics.incrementErrorCount(failure.getKind());
        log.error("Request failed: method={}, path={}, attempts={}, errorType={}, error={}",
                request.method(), request.pathAndQuery(), nodesTried.size(), failure.getKind(), last.toString());
        return failure;
    }

    static boolean isTimeout(Throwable failure) {
        return failure instanceof HttpTimeoutException || failure instanceof SocketTimeoutException;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * State of one asynchronous request. Attempts run one after another, each
     * started from the completion callback of the previous one.
     */
    private final class AsyncExecution {

        private final TransportRequest request;
        private final byte[] body;
        private final Duration timeout;
        private final CompletableFuture<JsonNode> result;
        private final List<SearchNode> nodesTried = new ArrayList<>();
        private final List<IOException> failures = new ArrayList<>();
        private final AtomicReference<CompletableFuture<RawResponse>> inFlight = new AtomicReference<>();

        AsyncExecution(TransportRequest request, byte[] body, Duration timeout, CompletableFuture<JsonNode> result) {
            this.request = request;
            this.body = body;
            this.timeout = timeout;
            this.result = result;
            result.whenComplete((json, throwable) -> {
                if (result.isCancelled()) {
                    CompletableFuture<RawResponse> pending = inFlight.get();
                    if (pending != null) {
                        pending.cancel(true);
                    }
                    log.debug("Request cancelled by caller: method={}, path={}, attempts={}",
                            request.method(), request.pathAndQuery(), nodesTried.size());
                }
            });
        }

        void nextAttempt() {
            if (result.isDone()) {
                return;
            }
            HttpAttempt attempt;
            CompletableFuture<RawResponse> pending;
            long startNanos = System.nanoTime();
            try {
                attempt = prepareAttempt(request, body, timeout, nodesTried.size() + 1);
                nodesTried.add(attempt.node());
                pending = httpClient.sendAsync(attempt);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }
            inFlight.set(pending);
            if (result.isCancelled()) {
                pending.cancel(true);
                return;
            }
            pending.whenComplete((response, throwable) ->
                    onAttemptComplete(attempt, response, throwable, elapsedSince(startNanos)));
        }

        private void onAttemptComplete(HttpAttempt attempt, RawResponse response, Throwable throwable, Duration latency) {
            if (result.isDone()) {
                return;
            }
            if (throwable == null) {
                try {
                    result.complete(onResponse(attempt, response, latency));
                } catch (TransportException e) {
                    result.completeExceptionally(e);
                }
                return;
            }

            Throwable cause = unwrap(throwable);
            if (cause instanceof IOException failure) {
                onTransportFailure(attempt, failure, latency);
                failures.add(failure);
                if (nodesTried.size() <= maxRetries) {
                    nextAttempt();
                } else {
                    result.completeExceptionally(exhausted(request, nodesTried, failures));
                }
                return;
            }
            if (cause instanceof CancellationException) {
                metrics.incrementErrorCount(ErrorKind.CANCELLED);
                result.completeExceptionally(new RequestCancelledException(
                        "Attempt cancelled: " + attempt.method() + " " + attempt.uri(), cause));
                return;
            }
            result.completeExceptionally(cause);
        }
    }
}
