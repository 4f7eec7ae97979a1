package com.p14n.topicbus.broker;

import com.p14n.topicbus.data.Message;

/**
 * Event that addresses its own handlers. A message without a destination is
 * sent to the event's target unless broadcasting is allowed, in which case it
 * reaches generic handlers only.
 */
public class TopicEvent extends Event {

    public TopicEvent(String name, Topic topic, int priority, String alias, boolean allowBroadcast) {
        super(name, topic, priority, alias, allowBroadcast);
    }

    @Override
    public void trigger(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        Message m = message;
        if (!m.hasDestination() && !allowBroadcast) {
            m = m.withDestination(target());
        }
        if (m.messageType() == null) {
            m = m.withMessageType(name);
        }
        if (m.timestamp() == null) {
            m = m.withTimestamp(System.currentTimeMillis());
        }
        topic.publishEvent(m);
    }
}
