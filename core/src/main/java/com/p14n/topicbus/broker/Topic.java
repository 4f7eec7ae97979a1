package com.p14n.topicbus.broker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.topicbus.data.DeadLetter;
import com.p14n.topicbus.data.HandlerInfo;
import com.p14n.topicbus.data.Message;
import com.p14n.topicbus.data.TopicConfig;
import com.p14n.topicbus.data.TopicMetrics;
import com.p14n.topicbus.telemetry.TopicTelemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import static com.p14n.topicbus.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * A named, versioned channel that dispatches messages to registered handlers.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Handlers run in descending priority order, equal priorities in
 * registration order</li>
 * <li>Routing by destination: a handler receives a message addressed to its
 * name or one of its aliases, generic handlers receive everything</li>
 * <li>Sender blacklist and whitelist checked before any handler runs</li>
 * <li>Configurable {@link ErrorStrategy} applied to handler failures and denied
 * publishes alike</li>
 * <li>Bounded failure buffer that drops new entries once full</li>
 * <li>Running metrics with an exponential moving average of handler
 * latency</li>
 * <li>{@link AsyncMessageHandler}s dispatched to an {@link AsyncExecutor}
 * without waiting for them</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Topic filters = broker.createTopic(new TopicConfig("filters", ErrorStrategy.WARN));
 * filters.register("validate", HandlerOptions.priority(100), data -> validate(data));
 * filters.register("audit", HandlerOptions.genericHandler(), data -> audit(data));
 * broker.publish("filters", Message.create("month_filter", months, "validate"));
 * }</pre>
 */
public class Topic implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Topic.class);

    /**
     * Smoothing factor of the latency moving average.
     */
    public static final double LATENCY_ALPHA = 0.2;

    public static final String SCOPE_NAME = "topicbus";

    private final String id;
    private final String version;
    private final String fullId;
    private final ErrorStrategy errorStrategy;
    private final ErrorHandler errorHandler;
    private final boolean debug;

    private final Set<String> blacklist = ConcurrentHashMap.newKeySet();
    private final Set<String> whitelist = ConcurrentHashMap.newKeySet();

    private final CopyOnWriteArrayList<HandlerRegistration> handlers = new CopyOnWriteArrayList<>();
    private final Map<MessageHandler, HandlerRegistration> registrations = new IdentityHashMap<>();
    private final Map<String, Event> events = new ConcurrentHashMap<>();

    private final ArrayBlockingQueue<DeadLetter> deadLetters;

    private final Object metricsLock = new Object();
    private long eventsProcessed;
    private long errors;
    private long denied;
    private Instant lastProcessed;
    private double latencyAvg;

    private final AsyncExecutor asyncExecutor;
    private final Object executorLock = new Object();
    private AsyncExecutor ownExecutor;
    private final Queue<Future<?>> pending = new ConcurrentLinkedQueue<>();
    private final Tracer tracer;
    private final TopicTelemetry telemetry;

    private volatile Broker broker;

    /**
     * Creates a topic with no telemetry export that runs asynchronous handlers on
     * the executor of the broker it is subscribed to.
     *
     * @param config topic settings
     */
    public Topic(TopicConfig config) {
        this(config, null, OpenTelemetry.noop());
    }

    /**
     * Creates a topic.
     *
     * <p>
     * With a null {@code asyncExecutor} the topic uses its broker's executor once
     * subscribed. Before that it starts a {@link DefaultExecutor} of its own on the
     * first asynchronous dispatch, which {@link #close()} stops.
     * </p>
     *
     * @param config        topic settings
     * @param asyncExecutor runs asynchronous handlers, may be null
     * @param ot            source of the meter and tracer
     */
    public Topic(TopicConfig config, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.id = config.id();
        this.version = config.version();
        this.fullId = config.fullId();
        this.errorStrategy = config.errorStrategy();
        this.errorHandler = config.errorHandler();
        this.debug = config.debug();
        this.blacklist.addAll(config.blacklist());
        this.whitelist.addAll(config.whitelist());
        this.deadLetters = new ArrayBlockingQueue<>(config.maxDeadLetters());
        this.asyncExecutor = asyncExecutor;
        this.tracer = ot.getTracer(SCOPE_NAME);
        this.telemetry = new TopicTelemetry(ot.getMeter(SCOPE_NAME), fullId);

        if (errorStrategy == ErrorStrategy.CUSTOM && errorHandler == null) {
            logger.atWarn().log("Topic '{}' uses the CUSTOM error strategy without an error handler, "
                    + "failures will only be buffered", fullId);
        }
        if (debug) {
            logger.atDebug().log("Topic initialized: {}", fullId);
        }
    }

    /**
     * Registers a handler with default options.
     *
     * @see #register(String, HandlerOptions, MessageHandler)
     */
    public <H extends MessageHandler> H register(String name, H handler) {
        return register(name, HandlerOptions.DEFAULTS, handler);
    }

    /**
     * Registers a handler, keeping the registry sorted by descending priority
     * with equal priorities in registration order. Handlers implementing
     * {@link AsyncMessageHandler} are dispatched asynchronously.
     *
     * @param name    handler name, unique within this topic
     * @param options aliases, priority, generic and transactional flags
     * @param handler the callable
     * @return the handler, unchanged
     * @throws IllegalArgumentException if the name is blank or already registered,
     *                                  or the handler is null or already
     *                                  registered
     */
    public <H extends MessageHandler> H register(String name, HandlerOptions options, H handler) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Handler name cannot be null or empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        HandlerOptions opts = options == null ? HandlerOptions.DEFAULTS : options;
        var info = new HandlerInfo(fullId, name, opts.priority(), opts.aliases(), opts.generic(),
                handler instanceof AsyncMessageHandler, opts.transactional());
        var registration = new HandlerRegistration(info, handler);

        synchronized (registrations) {
            if (findByName(name).isPresent()) {
                throw new IllegalArgumentException(
                        String.format("Handler '%s' already registered in topic '%s'", name, fullId));
            }
            if (registrations.containsKey(handler)) {
                throw new IllegalArgumentException(String.format("Handler already registered as '%s' in topic '%s'",
                        registrations.get(handler).name(), fullId));
            }
            insertByPriority(registration);
            registrations.put(handler, registration);
        }
        telemetry.recordHandlerRegistered();

        if (debug) {
            logger.atDebug().log("Registered handler '{}' for {} (priority={}, generic={}, async={}, transactional={})",
                    name, fullId, info.priority(), info.generic(), info.async(), info.transactional());
        }
        return handler;
    }

    private void insertByPriority(HandlerRegistration registration) {
        for (int i = 0; i < handlers.size(); i++) {
            if (registration.priority() > handlers.get(i).priority()) {
                handlers.add(i, registration);
                return;
            }
        }
        handlers.add(registration);
    }

    private Optional<HandlerRegistration> findByName(String name) {
        return handlers.stream().filter(h -> h.name().equals(name)).findFirst();
    }

    /**
     * Checks a sender against the security policy. The blacklist wins; a non-empty
     * whitelist then admits only its members.
     *
     * @param senderId the sender to check
     * @return true if the sender may publish
     */
    public boolean isSenderAllowed(String senderId) {
        if (senderId == null || blacklist.contains(senderId)) {
            return false;
        }
        return whitelist.isEmpty() || whitelist.contains(senderId);
    }

    public void addToBlacklist(String senderId) {
        if (blacklist.add(senderId) && debug) {
            logger.atDebug().log("Added '{}' to blacklist of {}", senderId, fullId);
        }
    }

    public void removeFromBlacklist(String senderId) {
        if (blacklist.remove(senderId) && debug) {
            logger.atDebug().log("Removed '{}' from blacklist of {}", senderId, fullId);
        }
    }

    public void addToWhitelist(String senderId) {
        if (whitelist.add(senderId) && debug) {
            logger.atDebug().log("Added '{}' to whitelist of {}", senderId, fullId);
        }
    }

    public void removeFromWhitelist(String senderId) {
        if (whitelist.remove(senderId) && debug) {
            logger.atDebug().log("Removed '{}' from whitelist of {}", senderId, fullId);
        }
    }

    /**
     * Publishes a message to this topic. A denied sender never reaches any
     * handler: the denial is captured like a handler failure and surfaces
     * according to the error strategy.
     *
     * @param message the message to publish
     * @throws IllegalArgumentException if the message is null or has no sender
     * @throws TopicProcessingException under {@link ErrorStrategy#RAISE} when the
     *                                  sender is denied or a handler fails
     */
    public void publishEvent(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (message.sender() == null || message.sender().trim().isEmpty()) {
            throw new IllegalArgumentException("sender cannot be null or empty");
        }

        processWithTelemetry(tracer, "publish_message", fullId, message, null, () -> {
            if (!isSenderAllowed(message.sender())) {
                recordDenied();
                telemetry.recordDenied();
                handleError(new SenderDeniedException(message.sender(), fullId), message);
                return false;
            }
            if (debug) {
                logger.atDebug().log("Event published to {}: {}", fullId, message);
            }
            telemetry.recordPublished();
            handleEvent(message);
            return true;
        });
    }

    /**
     * Delivers a message to every matching handler in priority order. Synchronous
     * handlers run inline; asynchronous ones are submitted and not awaited.
     * Under {@link ErrorStrategy#RAISE} the first failure stops delivery.
     *
     * @param message the message to deliver
     */
    public void handleEvent(Message message) {
        for (HandlerRegistration registration : handlers) {
            if (!registration.accepts(message.destination())) {
                continue;
            }
            if (registration.async()) {
                dispatchAsync(registration, message);
            } else {
                invoke(registration, message);
            }
        }
    }

    private boolean invoke(HandlerRegistration registration, Message message) {
        return processWithTelemetry(tracer, "process_message", fullId, message, registration.name(), () -> {
            long start = System.nanoTime();
            try {
                registration.handler().onMessage(message.data());
            } catch (Exception e) {
                updateMetrics(false, 0.0);
                handleError(new HandlerExecutionException(registration.name(), e), message.data());
                return false;
            }
            updateMetrics(true, (System.nanoTime() - start) / 1_000_000.0);
            return true;
        });
    }

    private void dispatchAsync(HandlerRegistration registration, Message message) {
        pending.removeIf(Future::isDone);
        Callable<Boolean> task = () -> {
            try {
                return invoke(registration, message);
            } catch (TopicProcessingException e) {
                logger.atError().setCause(e).log("Async handler '{}' failed in topic '{}' with no caller to raise to",
                        registration.name(), fullId);
                return false;
            }
        };
        Future<Boolean> future;
        try {
            future = executor().submit(Context.current().wrap(task));
        } catch (RejectedExecutionException e) {
            updateMetrics(false, 0.0);
            handleError(new HandlerExecutionException(registration.name(), e), message.data());
            return;
        }
        pending.add(future);
        if (debug) {
            logger.atDebug().log("Scheduled async handler '{}' on {}", registration.name(), fullId);
        }
    }

    private AsyncExecutor executor() {
        if (asyncExecutor != null) {
            return asyncExecutor;
        }
        Broker b = broker;
        if (b != null) {
            return b.getAsyncExecutor();
        }
        synchronized (executorLock) {
            if (ownExecutor == null) {
                ownExecutor = new DefaultExecutor();
            }
            return ownExecutor;
        }
    }

    /**
     * Waits for asynchronous handlers dispatched so far to finish.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of the timeout
     * @return true if all finished within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitPending(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        Future<?> future;
        while ((future = pending.peek()) != null) {
            try {
                future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                logger.atWarn().setCause(e.getCause()).log("Async handler task failed in topic '{}'", fullId);
            } catch (CancellationException e) {
                logger.atDebug().log("Async handler task cancelled in topic '{}'", fullId);
            }
            pending.remove(future);
        }
        return true;
    }

    /**
     * Captures a failure in the failure buffer, dropping it if the buffer is full,
     * then applies the error strategy. A custom error handler that throws is
     * logged and never rethrown.
     *
     * @param error the failure
     * @param data  the payload being processed
     * @throws TopicProcessingException under {@link ErrorStrategy#RAISE}
     */
    public void handleError(Throwable error, Object data) {
        if (!deadLetters.offer(new DeadLetter(error, data, Instant.now())) && debug) {
            logger.atDebug().log("Failure buffer of {} is full, dropping: {}", fullId, error.getMessage());
        }

        if (errorStrategy == ErrorStrategy.CUSTOM && errorHandler != null) {
            try {
                errorHandler.onError(error, data);
            } catch (Exception e) {
                logger.atError().setCause(e).log("Error in custom error handler for topic '{}'", fullId);
            }
            return;
        }

        switch (errorStrategy) {
            case RAISE:
                throw new TopicProcessingException(fullId, error);
            case WARN:
                logger.atWarn().log("Non-critical error in topic '{}': {}", fullId, error.getMessage());
                break;
            default:
                break;
        }
    }

    /**
     * Records one handler invocation. Latency feeds the moving average only on
     * success.
     *
     * @param success   whether the handler completed normally
     * @param latencyMs handler duration in milliseconds
     */
    protected void updateMetrics(boolean success, double latencyMs) {
        synchronized (metricsLock) {
            eventsProcessed++;
            lastProcessed = Instant.now();
            if (success) {
                latencyAvg = LATENCY_ALPHA * latencyMs + (1 - LATENCY_ALPHA) * latencyAvg;
            } else {
                errors++;
            }
        }
        telemetry.recordInvocation(success, latencyMs);
    }

    private void recordDenied() {
        synchronized (metricsLock) {
            errors++;
            denied++;
        }
    }

    public TopicMetrics getMetrics() {
        synchronized (metricsLock) {
            return new TopicMetrics(fullId, handlers.size(), eventsProcessed, errors, denied, lastProcessed,
                    latencyAvg);
        }
    }

    /**
     * @return captured failures, oldest first
     */
    public List<DeadLetter> getDeadLetters() {
        return new ArrayList<>(deadLetters);
    }

    /**
     * @return registered handlers in delivery order
     */
    public List<HandlerInfo> activeHandlers() {
        return handlers.stream().map(HandlerRegistration::info).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Finds the first handler, in delivery order, whose name or alias matches.
     *
     * @param name handler name or alias
     * @return the handler's metadata if found
     */
    public Optional<HandlerInfo> getHandler(String name) {
        return handlers.stream()
                .map(HandlerRegistration::info)
                .filter(h -> h.answersTo(name))
                .findFirst();
    }

    /**
     * Looks up the registration metadata for a handler object.
     *
     * @param handler a handler previously passed to {@code register}
     * @return its metadata, or empty if it is not registered here
     */
    public Optional<HandlerInfo> registrationOf(MessageHandler handler) {
        synchronized (registrations) {
            return Optional.ofNullable(registrations.get(handler)).map(HandlerRegistration::info);
        }
    }

    /**
     * Creates a sender that publishes to a registered handler through the broker,
     * with sender id {@code <fullId>.<handlerName>}.
     *
     * @param handlerName name of a registered handler
     * @return the sender
     * @throws IllegalArgumentException if no handler has that name
     */
    public TopicSender sender(String handlerName) {
        var registration = findByName(handlerName).orElseThrow(() -> new IllegalArgumentException(
                String.format("No handler '%s' registered in topic '%s'", handlerName, fullId)));
        return new TopicSender(this, registration.info());
    }

    Optional<Message> sendFrom(HandlerInfo handler, Object data, Map<String, Object> metadata) {
        Broker b = broker;
        if (b == null) {
            handleError(new IllegalStateException(
                    String.format("No broker assigned to topic %s. Cannot send message.", fullId)), null);
            return Optional.empty();
        }
        var message = new Message(fullId + "." + handler.name(),
                data,
                handler.name(),
                handler.generic() ? "generic" : handler.name(),
                System.currentTimeMillis(),
                null,
                metadata);
        b.publish(id, message);
        if (debug) {
            logger.atDebug().log("Message sent to {}: {}", id, message);
        }
        return Optional.of(message);
    }

    public TopicEvent addEvent(String name) {
        return addEvent(name, 1, null, false);
    }

    /**
     * Creates a named event bound to this topic.
     *
     * @throws IllegalArgumentException if an event with that name exists
     */
    public TopicEvent addEvent(String name, int priority, String alias, boolean allowBroadcast) {
        var event = new TopicEvent(name, this, priority, alias, allowBroadcast);
        if (events.putIfAbsent(name, event) != null) {
            throw new IllegalArgumentException(
                    String.format("Event '%s' already exists in topic '%s'", name, fullId));
        }
        return event;
    }

    public Optional<Event> getEvent(String name) {
        return Optional.ofNullable(events.get(name));
    }

    void attach(Broker broker) {
        this.broker = broker;
    }

    public Optional<Broker> getBroker() {
        return Optional.ofNullable(broker);
    }

    public String getId() {
        return id;
    }

    public String getVersion() {
        return version;
    }

    public String getFullId() {
        return fullId;
    }

    public ErrorStrategy getErrorStrategy() {
        return errorStrategy;
    }

    public Set<String> getBlacklist() {
        return Collections.unmodifiableSet(blacklist);
    }

    public Set<String> getWhitelist() {
        return Collections.unmodifiableSet(whitelist);
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Stops the executor this topic started for itself, if any. An executor passed
     * in or shared with the broker is left running.
     */
    @Override
    public void close() {
        AsyncExecutor own;
        synchronized (executorLock) {
            own = ownExecutor;
            ownExecutor = null;
        }
        if (own != null) {
            List<Runnable> dropped = own.shutdownNow();
            if (!dropped.isEmpty()) {
                logger.atWarn().log("Topic '{}' closed with {} async handlers not yet run", fullId, dropped.size());
            }
        }
    }
}
