package com.incidentlearn.metrics;

import java.io.IOException;

public interface AlertSink {
    void deliver(AlertEvent event) throws IOException;
}
