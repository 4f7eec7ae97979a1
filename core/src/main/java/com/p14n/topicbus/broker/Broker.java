package com.p14n.topicbus.broker;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.topicbus.data.Message;
import com.p14n.topicbus.data.TopicConfig;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Registry of topics keyed by topic id, routing published messages to them.
 *
 * <p>
 * A broker is created once by the application entry point and passed to the
 * code that needs it. Topics it creates share its {@link AsyncExecutor} and
 * {@link OpenTelemetry} instance.
 * </p>
 *
 * <p>
 * Unlike a denied sender, which the topic absorbs according to its error
 * strategy, publishing to an unknown topic always fails with
 * {@link TopicNotFoundException}.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Broker broker = new Broker("dashboard", openTelemetry);
 * Topic refresh = broker.createTopic("data_refresh");
 * refresh.register("reload", data -> reload(data));
 * broker.publish("data_refresh", Message.create("refresh_button", null, "reload"));
 * }</pre>
 */
public class Broker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Broker.class);

    private final String name;
    private final boolean debug;
    private final ConcurrentHashMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AsyncExecutor asyncExecutor;
    private final OpenTelemetry openTelemetry;

    /**
     * Creates a new broker with default executor configuration.
     *
     * @param name broker name, used in logs
     * @param ot   the OpenTelemetry instance for metrics and tracing
     */
    public Broker(String name, OpenTelemetry ot) {
        this(name, new DefaultExecutor(), ot, false);
    }

    /**
     * Creates a new broker with a custom executor.
     *
     * @param name          broker name, used in logs
     * @param asyncExecutor runs asynchronous handlers of the topics it creates
     * @param ot            the OpenTelemetry instance for metrics and tracing
     */
    public Broker(String name, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        this(name, asyncExecutor, ot, false);
    }

    public Broker(String name, AsyncExecutor asyncExecutor, OpenTelemetry ot, boolean debug) {
        if (asyncExecutor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        if (ot == null) {
            throw new IllegalArgumentException("OpenTelemetry cannot be null");
        }
        this.name = name;
        this.asyncExecutor = asyncExecutor;
        this.openTelemetry = ot;
        this.debug = debug;
    }

    public Topic createTopic(String id) {
        return createTopic(new TopicConfig(id));
    }

    /**
     * Creates a topic and registers it with this broker.
     *
     * @param id             topic id
     * @param version        topic version
     * @param errorStrategy  failure strategy
     * @param errorHandler   handler used with {@link ErrorStrategy#CUSTOM}, may be
     *                       null
     * @param blacklist      denied senders, may be null
     * @param whitelist      exclusively allowed senders, may be null
     * @param maxDeadLetters failure buffer capacity
     * @param debug          debug logging for the topic
     * @return the registered topic
     */
    public Topic createTopic(String id,
            String version,
            ErrorStrategy errorStrategy,
            ErrorHandler errorHandler,
            Collection<String> blacklist,
            Collection<String> whitelist,
            int maxDeadLetters,
            boolean debug) {
        return createTopic(new TopicConfig(id, version, errorStrategy, errorHandler,
                blacklist == null ? null : new HashSet<>(blacklist),
                whitelist == null ? null : new HashSet<>(whitelist),
                maxDeadLetters, debug));
    }

    /**
     * Creates a topic from its configuration and registers it with this broker.
     *
     * @param config topic settings
     * @return the registered topic
     * @throws IllegalStateException if the broker is closed
     */
    public Topic createTopic(TopicConfig config) {
        checkOpen();
        var topic = new Topic(config, asyncExecutor, openTelemetry);
        subscribe(topic);
        return topic;
    }

    /**
     * Registers an externally built topic under its id, replacing any topic
     * already registered under the same id.
     *
     * @param topic the topic to register
     * @throws IllegalStateException    if the broker is closed
     * @throws IllegalArgumentException if topic is null
     */
    public void subscribe(Topic topic) {
        checkOpen();
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        topic.attach(this);
        Topic previous = topics.put(topic.getId(), topic);
        if (previous != null && previous != topic) {
            logger.atWarn().log("Broker '{}' replaced topic {} with {}", name, previous.getFullId(),
                    topic.getFullId());
        }
        if (debug) {
            logger.atDebug().log("Broker '{}' registered topic {}", name, topic.getFullId());
        }
    }

    /**
     * Publishes a message to the topic registered under {@code topicId}.
     *
     * @param topicId the topic to publish to
     * @param message the message to publish
     * @throws TopicNotFoundException   if no topic has that id
     * @throws IllegalStateException    if the broker is closed
     * @throws IllegalArgumentException if topicId is null
     * @throws TopicProcessingException if the topic uses
     *                                  {@link ErrorStrategy#RAISE} and delivery
     *                                  failed
     */
    public void publish(String topicId, Message message) {
        checkOpen();
        if (topicId == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        Topic topic = topics.get(topicId);
        if (topic == null) {
            throw new TopicNotFoundException(topicId);
        }
        if (debug) {
            logger.atDebug().log("Broker '{}' routing message from '{}' to {}", name,
                    message == null ? null : message.sender(), topic.getFullId());
        }
        topic.publishEvent(message);
    }

    public Optional<Topic> getTopic(String topicId) {
        return Optional.ofNullable(topicId == null ? null : topics.get(topicId));
    }

    public List<Topic> topics() {
        return List.copyOf(topics.values());
    }

    /**
     * Waits for asynchronous handlers of every registered topic to finish.
     *
     * @param timeout maximum time to wait in total
     * @param unit    unit of the timeout
     * @return true if all finished within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitPending(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        for (Topic topic : topics.values()) {
            if (!topic.awaitPending(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                return false;
            }
        }
        return true;
    }

    public String getName() {
        return name;
    }

    AsyncExecutor getAsyncExecutor() {
        return asyncExecutor;
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
    }

    /**
     * Closes the broker, stops its executor and any executor a subscribed topic
     * started for itself, and forgets all topics. After closing
     * no topics can be created or published to through it.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            List<Runnable> dropped = asyncExecutor.shutdownNow();
            if (!dropped.isEmpty()) {
                logger.atWarn().log("Broker '{}' closed with {} async handlers not yet run", name, dropped.size());
            }
            topics.values().forEach(Topic::close);
            topics.clear();
        }
    }
}
