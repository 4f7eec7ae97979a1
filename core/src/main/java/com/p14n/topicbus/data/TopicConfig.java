package com.p14n.topicbus.data;

import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

import com.p14n.topicbus.broker.ErrorHandler;
import com.p14n.topicbus.broker.ErrorStrategy;

/**
 * Settings for a single topic.
 *
 * <p>
 * An empty whitelist places no restriction on senders. The blacklist is always
 * checked first.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var cfg = new TopicConfig("filters", "2.0.0", ErrorStrategy.WARN);
 * Topic topic = broker.createTopic(cfg);
 * }</pre>
 *
 * @param id             topic identifier used for broker routing
 * @param version        interface version, combined with the id as {@code id@version}
 * @param errorStrategy  how handler failures surface
 * @param errorHandler   invoked for failures when the strategy is CUSTOM, may be null
 * @param blacklist      senders that may never publish
 * @param whitelist      when non-empty, the only senders that may publish
 * @param maxDeadLetters capacity of the failure buffer
 * @param debug          enables debug logging for the topic
 */
public record TopicConfig(String id,
        String version,
        ErrorStrategy errorStrategy,
        ErrorHandler errorHandler,
        Set<String> blacklist,
        Set<String> whitelist,
        int maxDeadLetters,
        boolean debug) {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final int DEFAULT_MAX_DEAD_LETTERS = 100;
    public static final String PROPERTY_PREFIX = "topicbus.topic.";

    public TopicConfig {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (maxDeadLetters <= 0) {
            throw new IllegalArgumentException("maxDeadLetters must be positive");
        }
        version = version == null ? DEFAULT_VERSION : version;
        errorStrategy = errorStrategy == null ? ErrorStrategy.RAISE : errorStrategy;
        blacklist = blacklist == null ? Set.of() : Set.copyOf(blacklist);
        whitelist = whitelist == null ? Set.of() : Set.copyOf(whitelist);
    }

    public TopicConfig(String id, String version, ErrorStrategy errorStrategy) {
        this(id, version, errorStrategy, null, null, null, DEFAULT_MAX_DEAD_LETTERS, false);
    }

    public TopicConfig(String id, ErrorStrategy errorStrategy) {
        this(id, DEFAULT_VERSION, errorStrategy);
    }

    public TopicConfig(String id) {
        this(id, DEFAULT_VERSION, ErrorStrategy.RAISE);
    }

    /**
     * @return {@code id@version}
     */
    public String fullId() {
        return id + "@" + version;
    }

    public TopicConfig withErrorHandler(ErrorHandler handler) {
        return new TopicConfig(id, version, ErrorStrategy.CUSTOM, handler, blacklist, whitelist, maxDeadLetters,
                debug);
    }

    public TopicConfig withDebug(boolean debug) {
        return new TopicConfig(id, version, errorStrategy, errorHandler, blacklist, whitelist, maxDeadLetters,
                debug);
    }

    /**
     * Reads a topic's settings from properties keyed
     * {@code topicbus.topic.<id>.<setting>}. Settings that are absent keep their
     * defaults.
     *
     * @param id    the topic id
     * @param props source properties
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static TopicConfig fromProperties(String id, Properties props) {
        String prefix = PROPERTY_PREFIX + id + ".";
        String strategy = props.getProperty(prefix + "errorStrategy");
        String maxDeadLetters = props.getProperty(prefix + "maxDeadLetters");
        int capacity;
        try {
            capacity = maxDeadLetters == null ? DEFAULT_MAX_DEAD_LETTERS : Integer.parseInt(maxDeadLetters.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid maxDeadLetters for topic " + id + ": " + maxDeadLetters, e);
        }
        return new TopicConfig(id,
                props.getProperty(prefix + "version", DEFAULT_VERSION).trim(),
                strategy == null ? ErrorStrategy.RAISE
                        : ErrorStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)),
                null,
                splitList(props.getProperty(prefix + "blacklist")),
                splitList(props.getProperty(prefix + "whitelist")),
                capacity,
                parseFlag(id, "debug", props.getProperty(prefix + "debug")));
    }

    private static boolean parseFlag(String id, String setting, String value) {
        if (value == null) {
            return false;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException("Invalid " + setting + " for topic " + id + ": " + value);
        }
    }

    private static Set<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }
}
