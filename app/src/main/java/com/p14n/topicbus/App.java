package com.p14n.topicbus;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.topicbus.broker.Broker;
import com.p14n.topicbus.broker.Topic;

public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static Properties loadProperties(String resource) throws IOException {
        var props = new Properties();
        try (InputStream in = App.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.atWarn().log("{} not found on the classpath, using defaults", resource);
            } else {
                props.load(in);
            }
        }
        return props;
    }

    public static void main(String[] args) throws Exception {
        var props = loadProperties("topicbus.properties");
        try (var telemetry = Opentelemetry.create("topicbus-app");
                var broker = new Broker("dashboard_broker", telemetry)) {
            var dashboard = new Dashboard(broker, props);

            dashboard.refresh("refresh_button");
            dashboard.notify("Report exported");
            dashboard.notifyFrom("blocked_widget", "Should never be shown");
            dashboard.refresh("auto_refresh");

            if (!broker.awaitPending(5, TimeUnit.SECONDS)) {
                logger.atWarn().log("Async handlers still running at shutdown");
            }
            dashboard.getAlerts().forEach(alert -> logger.atInfo().log(alert));
            report(broker);
        }
    }

    private static void report(Broker broker) {
        for (Topic topic : broker.topics()) {
            var metrics = topic.getMetrics();
            logger.atInfo().log("{}: processed={} errors={} denied={} latencyAvg={}ms",
                    metrics.id(), metrics.eventsProcessed(), metrics.errors(), metrics.denied(),
                    String.format("%.3f", metrics.latencyAvg()));
            topic.getDeadLetters().forEach(dl -> logger.atInfo().log("  dead letter: {} ({})",
                    dl.error().getMessage(), dl.data()));
        }
    }
}
