package com.p14n.topicbus;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.topicbus.broker.AsyncMessageHandler;
import com.p14n.topicbus.broker.Broker;
import com.p14n.topicbus.broker.HandlerOptions;
import com.p14n.topicbus.broker.Topic;
import com.p14n.topicbus.broker.TopicEvent;
import com.p14n.topicbus.broker.TopicSender;
import com.p14n.topicbus.data.Message;
import com.p14n.topicbus.data.TopicConfig;

/**
 * Wires the dashboard's topics and handlers onto a broker and keeps the state
 * those handlers update.
 *
 * <p>
 * Two topics are created:
 * </p>
 * <ul>
 * <li>{@code data_refresh}: counts refreshes and logs who asked for them</li>
 * <li>{@code notifications}: counts notifications, mirrors every one to the
 * alert log and archives them asynchronously</li>
 * </ul>
 */
public class Dashboard {

    private static final Logger logger = LoggerFactory.getLogger(Dashboard.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public static final String DATA_REFRESH = "data_refresh";
    public static final String NOTIFICATIONS = "notifications";
    static final int MAX_ALERTS = 10;

    private final Broker broker;
    private final Topic refreshTopic;
    private final Topic notificationTopic;
    private final TopicEvent refreshRequested;
    private final TopicSender notify;

    private final AtomicInteger refreshCount = new AtomicInteger();
    private final AtomicInteger notificationCount = new AtomicInteger();
    private final LinkedList<String> alerts = new LinkedList<>();
    private final List<Object> archive = new ArrayList<>();

    public Dashboard(Broker broker, Properties props) {
        this.broker = broker;
        this.refreshTopic = broker.createTopic(TopicConfig.fromProperties(DATA_REFRESH, props));
        this.notificationTopic = broker.createTopic(TopicConfig.fromProperties(NOTIFICATIONS, props));

        refreshRequested = refreshTopic.addEvent("refresh_requested", 1, "refresh", false);
        refreshRequested.register("refresh_handler", data -> {
            int count = refreshCount.incrementAndGet();
            logger.atInfo().log("Data refreshed, count {}", count);
        });
        refreshTopic.register("log_refresh_handler", HandlerOptions.priority(2).withAliases("refresh"),
                data -> alert("Data refresh triggered by " + data));

        notificationTopic.register("notification_handler", HandlerOptions.priority(1),
                data -> notificationCount.incrementAndGet());
        notificationTopic.register("generic_notification_logger", HandlerOptions.genericHandler(),
                data -> alert("Notification: " + data));
        notificationTopic.register("archive", HandlerOptions.genericHandler().withPriority(-1),
                (AsyncMessageHandler) data -> {
                    synchronized (archive) {
                        archive.add(data);
                    }
                });
        notify = notificationTopic.sender("notification_handler");
    }

    /**
     * Called by the refresh control.
     */
    public void refresh(String requestedBy) {
        refreshRequested.trigger(requestedBy, requestedBy);
    }

    /**
     * Called by any control that wants the user to see a message.
     */
    public void notify(String text) {
        notify.send(text);
    }

    /**
     * Publishes a notification from an arbitrary sender, subject to the topic's
     * security lists.
     */
    public void notifyFrom(String sender, String text) {
        broker.publish(NOTIFICATIONS, Message.create(sender, text, "notification_handler"));
    }

    private void alert(String text) {
        synchronized (alerts) {
            alerts.add("[" + LocalTime.now().format(TIME) + "] " + text);
            while (alerts.size() > MAX_ALERTS) {
                alerts.removeFirst();
            }
        }
    }

    public int getRefreshCount() {
        return refreshCount.get();
    }

    public int getNotificationCount() {
        return notificationCount.get();
    }

    public List<String> getAlerts() {
        synchronized (alerts) {
            return List.copyOf(alerts);
        }
    }

    public List<Object> getArchive() {
        synchronized (archive) {
            return List.copyOf(archive);
        }
    }

    public Topic getRefreshTopic() {
        return refreshTopic;
    }

    public Topic getNotificationTopic() {
        return notificationTopic;
    }
}
