package com.p14n.topicbus.broker;

import com.p14n.topicbus.data.HandlerInfo;

/**
 * A handler together with the metadata it was registered with.
 */
record HandlerRegistration(HandlerInfo info, MessageHandler handler) {

    String name() {
        return info.name();
    }

    int priority() {
        return info.priority();
    }

    boolean async() {
        return info.async();
    }

    /**
     * Generic handlers take everything, the rest only messages addressed to their
     * name or an alias.
     */
    boolean accepts(String destination) {
        return info.generic() || info.answersTo(destination);
    }
}
