package fr.lapetina.search.transport.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the transport.
 * Designed to be populated from YAML.
 */
public class TransportConfig {

    private List<String> nodes = new ArrayList<>();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private PoolConfig pool = new PoolConfig();
    private AuthConfig auth = new AuthConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<String> getNodes() { return nodes; }
    public void setNodes(List<String> nodes) { this.nodes = nodes; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public AuthConfig getAuth() { return auth; }
    public void setAuth(AuthConfig auth) { this.auth = auth; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Timeout configuration. The request timeout bounds each attempt, not
     * the whole call.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 60000;
        private long connectTimeoutMs = 60000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxRetries = 0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    /**
     * Node pool configuration.
     */
    public static class PoolConfig {
        private long revivalDelayMs = 300000;
        private String strategy = "random";

        public long getRevivalDelayMs() { return revivalDelayMs; }
        public void setRevivalDelayMs(long revivalDelayMs) { this.revivalDelayMs = revivalDelayMs; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }

    /**
     * HTTP basic authentication. Anonymous when no username is set.
     */
    public static class AuthConfig {
        private String username;
        private String password;

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        @Override
        public String toString() {
            return "AuthConfig{username=" + username + ", password=" + (password == null ? "null" : "****") + '}';
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "search_transport";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
