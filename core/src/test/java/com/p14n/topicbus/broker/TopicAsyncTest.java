package com.p14n.topicbus.broker;

import com.p14n.topicbus.data.Message;
import com.p14n.topicbus.data.TopicConfig;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class TopicAsyncTest {

    @Test
    void shouldReturnBeforeAsyncHandlersRun() {
        var executor = new TestAsyncExecutor();
        var topic = new Topic(new TopicConfig("t"), executor, OpenTelemetry.noop());
        List<String> calls = new CopyOnWriteArrayList<>();
        topic.register("async", HandlerOptions.priority(10).asGeneric(),
                (AsyncMessageHandler) data -> calls.add("async:" + data));
        topic.register("sync", HandlerOptions.priority(1).asGeneric(), data -> calls.add("sync:" + data));

        topic.publishEvent(Message.create("s", 1));

        assertEquals(List.of("sync:1"), calls);
        assertEquals(1, executor.pendingCount());

        executor.runAll();

        assertEquals(List.of("sync:1", "async:1"), calls);
        assertEquals(2, topic.getMetrics().eventsProcessed());
    }

    @Test
    void shouldMarkAsyncHandlersOnRegistration() {
        var executor = new TestAsyncExecutor();
        var topic = new Topic(new TopicConfig("t"), executor, OpenTelemetry.noop());
        AsyncMessageHandler handler = data -> {
        };

        topic.register("async", handler);

        assertTrue(topic.registrationOf(handler).orElseThrow().async());
        assertTrue(topic.getHandler("async").orElseThrow().async());
    }

    @Test
    void shouldRecordAsyncFailuresWithoutRaisingToPublisher() {
        var executor = new TestAsyncExecutor();
        var topic = new Topic(new TopicConfig("t", ErrorStrategy.RAISE), executor, OpenTelemetry.noop());
        List<Object> observed = new CopyOnWriteArrayList<>();
        topic.register("async", HandlerOptions.priority(10).asGeneric(), (AsyncMessageHandler) data -> {
            throw new IllegalStateException("async boom");
        });
        topic.register("sync", HandlerOptions.priority(1).asGeneric(), observed::add);

        assertDoesNotThrow(() -> topic.publishEvent(Message.create("s", 3)));
        assertEquals(List.of(3), observed);

        executor.runAll();

        assertEquals(1, topic.getDeadLetters().size());
        var failure = assertInstanceOf(HandlerExecutionException.class, topic.getDeadLetters().get(0).error());
        assertEquals("async", failure.getHandlerName());
        assertEquals(1, topic.getMetrics().errors());
    }

    @Test
    void shouldRecordRejectedAsyncDispatchAndKeepDelivering() {
        var executor = new TestAsyncExecutor();
        var topic = new Topic(new TopicConfig("t", ErrorStrategy.WARN), executor, OpenTelemetry.noop());
        List<Object> observed = new CopyOnWriteArrayList<>();
        topic.register("async", HandlerOptions.priority(10).asGeneric(), (AsyncMessageHandler) observed::add);
        topic.register("sync", HandlerOptions.priority(1).asGeneric(), observed::add);
        executor.shutdownNow();

        assertDoesNotThrow(() -> topic.publishEvent(Message.create("s", 7)));

        assertEquals(List.of(7), observed);
        assertEquals(1, topic.getDeadLetters().size());
        var failure = assertInstanceOf(HandlerExecutionException.class, topic.getDeadLetters().get(0).error());
        assertEquals("async", failure.getHandlerName());
        assertInstanceOf(RejectedExecutionException.class, failure.getCause());
        assertEquals(1, topic.getMetrics().errors());
        assertEquals(2, topic.getMetrics().eventsProcessed());
    }

    @Test
    void shouldRaiseRejectedAsyncDispatchUnderRaise() {
        var executor = new TestAsyncExecutor();
        var topic = new Topic(new TopicConfig("t", ErrorStrategy.RAISE), executor, OpenTelemetry.noop());
        topic.register("async", HandlerOptions.genericHandler(), (AsyncMessageHandler) data -> {
        });
        executor.shutdownNow();

        var e = assertThrows(TopicProcessingException.class, () -> topic.publishEvent(Message.create("s", 1)));

        assertInstanceOf(HandlerExecutionException.class, e.getCause());
        assertEquals(1, topic.getDeadLetters().size());
    }

    @Test
    void shouldStartOwnExecutorOnlyWhenNotSubscribed() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        try (var topic = new Topic(new TopicConfig("standalone"))) {
            topic.register("async", HandlerOptions.genericHandler(), (AsyncMessageHandler) data -> latch.countDown());

            topic.publishEvent(Message.create("s", 1));

            assertTrue(topic.awaitPending(2, TimeUnit.SECONDS));
            assertEquals(0, latch.getCount());
        }
    }

    @Test
    void shouldUseBrokerExecutorOnceSubscribed() {
        var executor = new TestAsyncExecutor();
        List<Object> received = new CopyOnWriteArrayList<>();
        try (var broker = new Broker("b", executor, OpenTelemetry.noop())) {
            var topic = new Topic(new TopicConfig("external"));
            topic.register("async", HandlerOptions.genericHandler(), (AsyncMessageHandler) received::add);
            broker.subscribe(topic);

            broker.publish("external", Message.create("s", 5));

            assertEquals(1, executor.pendingCount());
            executor.runAll();
            assertEquals(List.of(5), received);
        }
    }

    @Test
    void shouldDeliverEveryAsyncMessageWhateverTheCompletionOrder() {
        var executor = new TestAsyncExecutor();
        var topic = new Topic(new TopicConfig("t"), executor, OpenTelemetry.noop());
        Set<Object> received = ConcurrentHashMap.newKeySet();
        topic.register("async", HandlerOptions.genericHandler(), (AsyncMessageHandler) received::add);

        for (int i = 0; i < 20; i++) {
            topic.publishEvent(Message.create("s", i));
        }
        var random = new Random(42);
        while (executor.pendingCount() > 0) {
            executor.tick(random);
        }

        assertEquals(20, received.size());
        assertEquals(20, topic.getMetrics().eventsProcessed());
    }

    @Test
    void shouldAwaitAsyncHandlersOnDefaultExecutor() throws InterruptedException {
        try (var executor = new DefaultExecutor(2)) {
            var topic = new Topic(new TopicConfig("t"), executor, OpenTelemetry.noop());
            CountDownLatch latch = new CountDownLatch(3);
            topic.register("async", HandlerOptions.genericHandler(), (AsyncMessageHandler) data -> latch.countDown());

            for (int i = 0; i < 3; i++) {
                topic.publishEvent(Message.create("s", i));
            }

            assertTrue(topic.awaitPending(2, TimeUnit.SECONDS));
            assertEquals(0, latch.getCount());
            assertEquals(3, topic.getMetrics().eventsProcessed());
        }
    }

    @Test
    void shouldReportTimeoutWhileAsyncHandlersAreBlocked() throws InterruptedException {
        try (var executor = new DefaultExecutor(1)) {
            var topic = new Topic(new TopicConfig("t"), executor, OpenTelemetry.noop());
            CountDownLatch release = new CountDownLatch(1);
            topic.register("async", HandlerOptions.genericHandler(), (AsyncMessageHandler) data -> release.await());

            topic.publishEvent(Message.create("s", 1));

            assertFalse(topic.awaitPending(100, TimeUnit.MILLISECONDS));
            release.countDown();
            assertTrue(topic.awaitPending(2, TimeUnit.SECONDS));
        }
    }
}
