package com.p14n.topicbus.broker;

import com.p14n.topicbus.data.DeadLetter;
import com.p14n.topicbus.data.Message;
import com.p14n.topicbus.data.TopicConfig;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BrokerTest {

    private TestAsyncExecutor executor;
    private Broker broker;

    @BeforeEach
    void setUp() {
        executor = new TestAsyncExecutor();
        broker = new Broker("test", executor, OpenTelemetry.noop());
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    @Test
    void shouldFailFastForUnknownTopic() {
        var e = assertThrows(TopicNotFoundException.class,
                () -> broker.publish("missing", Message.create("s", 1)));
        assertEquals("missing", e.getTopicId());
    }

    @Test
    void shouldRouteToCreatedTopic() {
        List<Object> received = new CopyOnWriteArrayList<>();
        Topic topic = broker.createTopic("orders");
        topic.register("all", HandlerOptions.genericHandler(), received::add);

        broker.publish("orders", Message.create("s", "order-1"));

        assertEquals(List.of("order-1"), received);
        assertSame(topic, broker.getTopic("orders").orElseThrow());
        assertSame(broker, topic.getBroker().orElseThrow());
        assertEquals("orders@1.0.0", topic.getFullId());
    }

    @Test
    void shouldCreateTopicFromPositionalSettings() {
        Topic topic = broker.createTopic("secure", "2.1.0", ErrorStrategy.IGNORE, null,
                List.of("intruder"), null, 5, false);
        List<Object> received = new CopyOnWriteArrayList<>();
        topic.register("all", HandlerOptions.genericHandler(), received::add);

        broker.publish("secure", Message.create("intruder", 1));
        broker.publish("secure", Message.create("friend", 2));

        assertEquals(List.of(2), received);
        assertEquals("secure@2.1.0", topic.getFullId());
        assertEquals(ErrorStrategy.IGNORE, topic.getErrorStrategy());
        assertEquals(1, topic.getDeadLetters().size());
    }

    @Test
    void shouldAbsorbDeniedSenderUnlessRaiseIsConfigured() {
        broker.createTopic(new TopicConfig("lenient", ErrorStrategy.WARN)).addToBlacklist("bad");
        broker.createTopic(new TopicConfig("strict", ErrorStrategy.RAISE)).addToBlacklist("bad");

        assertDoesNotThrow(() -> broker.publish("lenient", Message.create("bad", 1)));
        assertThrows(TopicProcessingException.class, () -> broker.publish("strict", Message.create("bad", 1)));
    }

    @Test
    void shouldRegisterExternallyBuiltTopic() {
        var topic = new Topic(new TopicConfig("external"), executor, OpenTelemetry.noop());
        List<Object> received = new CopyOnWriteArrayList<>();
        topic.register("all", HandlerOptions.genericHandler(), received::add);

        broker.subscribe(topic);
        broker.publish("external", Message.create("s", 1));

        assertEquals(List.of(1), received);
        assertSame(broker, topic.getBroker().orElseThrow());
    }

    @Test
    void shouldReplaceTopicRegisteredUnderSameId() {
        broker.createTopic("dup");
        var replacement = new Topic(new TopicConfig("dup", "2.0.0", ErrorStrategy.RAISE), executor,
                OpenTelemetry.noop());

        broker.subscribe(replacement);

        assertSame(replacement, broker.getTopic("dup").orElseThrow());
        assertEquals(1, broker.topics().size());
    }

    @Test
    void shouldSendToHandlerThroughSenderClosure() {
        Topic topic = broker.createTopic("ui");
        List<Object> echoed = new CopyOnWriteArrayList<>();
        topic.register("echo", echoed::add);

        Message sent = topic.sender("echo").send("hello", Map.of("source", "button")).orElseThrow();

        assertEquals(List.of("hello"), echoed);
        assertEquals("ui@1.0.0.echo", sent.sender());
        assertEquals("echo", sent.destination());
        assertEquals("echo", sent.messageType());
        assertEquals("button", sent.metadata().get("source"));
        assertNotNull(sent.timestamp());
    }

    @Test
    void shouldMarkMessagesFromGenericHandlerSenders() {
        Topic topic = broker.createTopic("ui");
        topic.register("watcher", HandlerOptions.genericHandler(), data -> {
        });

        Message sent = topic.sender("watcher").send(1).orElseThrow();

        assertEquals("generic", sent.messageType());
    }

    @Test
    void shouldCaptureSendWithoutBroker() {
        var topic = new Topic(new TopicConfig("alone", ErrorStrategy.IGNORE), executor, OpenTelemetry.noop());
        topic.register("echo", data -> {
        });

        assertTrue(topic.sender("echo").send("x").isEmpty());
        List<DeadLetter> deadLetters = topic.getDeadLetters();
        assertEquals(1, deadLetters.size());
        assertInstanceOf(IllegalStateException.class, deadLetters.get(0).error());
    }

    @Test
    void shouldRejectSenderForUnknownHandler() {
        Topic topic = broker.createTopic("ui");
        assertThrows(IllegalArgumentException.class, () -> topic.sender("nobody"));
    }

    @Test
    void shouldDrainAsyncHandlersAcrossTopics() throws InterruptedException {
        List<Object> received = new CopyOnWriteArrayList<>();
        broker.createTopic("a").register("h", HandlerOptions.genericHandler(), (AsyncMessageHandler) received::add);
        broker.createTopic("b").register("h", HandlerOptions.genericHandler(), (AsyncMessageHandler) received::add);

        broker.publish("a", Message.create("s", "a"));
        broker.publish("b", Message.create("s", "b"));
        assertTrue(received.isEmpty());

        executor.runAll();

        assertTrue(broker.awaitPending(1, TimeUnit.SECONDS));
        assertEquals(2, received.size());
    }

    @Test
    void shouldRejectUseAfterClose() {
        broker.createTopic("t");
        broker.close();

        assertThrows(IllegalStateException.class, () -> broker.publish("t", Message.create("s", 1)));
        assertThrows(IllegalStateException.class, () -> broker.createTopic("other"));
        assertTrue(broker.topics().isEmpty());
    }

    @Test
    void shouldRejectNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> broker.publish(null, Message.create("s", 1)));
        assertThrows(IllegalArgumentException.class, () -> broker.subscribe(null));
        broker.createTopic("t");
        assertThrows(IllegalArgumentException.class, () -> broker.publish("t", null));
    }
}
