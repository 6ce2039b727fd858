package com.incidentlearn.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingAlertSink implements AlertSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void deliver(AlertEvent event) {
        if (event.severity() == AlertSeverity.CRITICAL || event.severity() == AlertSeverity.HIGH) {
            log.error("alert.fired rule={} severity={} metric={} value={} message={}",
                    event.ruleName(), event.severity(), event.metricName(), event.observedValue(), event.message());
        } else {
            log.warn("alert.fired rule={} severity={} metric={} value={} message={}",
                    event.ruleName(), event.severity(), event.metricName(), event.observedValue(), event.message());
        }
    }
}
