package fr.lapetina.search.transport.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Query-string options for one endpoint call.
 *
 * <p>Options the endpoint documents are set with {@link #option}; anything
 * else the server understands but the endpoint does not name yet goes through
 * {@link #extra}. The endpoint checks both when the call is made: an
 * unrecognized option or an extra shadowing a recognized name is an
 * {@link IllegalArgumentException}.
 *
 * <pre>{@code
 * client.get("tweets", "tweet", "1", QueryParameters.create()
 *         .option("routing", "user-7")
 *         .extra("version", 3));
 * }</pre>
 *
 * Not thread-safe; build one per call.
 */
public final class QueryParameters {

    private static final QueryParameters NONE = new QueryParameters(Map.of(), Map.of());

    private final Map<String, Object> options;
    private final Map<String, Object> extras;

    private QueryParameters(Map<String, Object> options, Map<String, Object> extras) {
        this.options = options;
        this.extras = extras;
    }

    public static QueryParameters create() {
        return new QueryParameters(new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /**
     * Returns an empty, immutable instance.
     */
    public static QueryParameters none() {
        return NONE;
    }

    public QueryParameters option(String name, Object value) {
        options.put(requireName(name), Objects.requireNonNull(value, () -> "Value of option " + name));
        return this;
    }

    public QueryParameters extra(String name, Object value) {
        extras.put(requireName(name), Objects.requireNonNull(value, () -> "Value of extra " + name));
        return this;
    }

    private static String requireName(String name) {
        Objects.requireNonNull(name, "Parameter name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        return name;
    }

    public Map<String, Object> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    public Map<String, Object> getExtras() {
        return Collections.unmodifiableMap(extras);
    }

    public boolean isEmpty() {
        return options.isEmpty() && extras.isEmpty();
    }

    /**
     * Checks the parameters against the option names an endpoint recognizes
     * and merges them, options first.
     *
     * @throws IllegalArgumentException on an unrecognized option or an extra named like a recognized option
     */
    public Map<String, Object> resolve(String endpoint, Set<String> recognized) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Object> option : options.entrySet()) {
            if (!recognized.contains(option.getKey())) {
                throw new IllegalArgumentException("Unknown option '" + option.getKey() + "' for " + endpoint
                        + "; recognized options are " + recognized + ", pass others with extra()");
            }
            merged.put(option.getKey(), option.getValue());
        }
        for (Map.Entry<String, Object> extra : extras.entrySet()) {
            if (recognized.contains(extra.getKey())) {
                throw new IllegalArgumentException("Extra '" + extra.getKey() + "' for " + endpoint
                        + " shadows a recognized option; pass it with option()");
            }
            merged.put(extra.getKey(), extra.getValue());
        }
        return merged;
    }

    @Override
    public String toString() {
        return "QueryParameters{options=" + options + ", extras=" + extras + '}';
    }
}
