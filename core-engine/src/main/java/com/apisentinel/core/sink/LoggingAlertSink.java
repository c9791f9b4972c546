package com.apisentinel.core.sink;

import com.apisentinel.core.alert.AlertNotification;
import com.apisentinel.core.config.SinkSettings;
import com.apisentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the {@code api-sentinel.alerts} log.
 *
 * @since 1.0.0
 */
public class LoggingAlertSink implements AlertSink {

    private static final Logger ALERTS = LoggerFactory.getLogger("api-sentinel.alerts");

    @Override
    public void deliver(AlertNotification notification) {
        Alert alert = notification.getAlert();
        String summary = alert.getExplanation() != null ? alert.getExplanation().getSummary() : "";
        ALERTS.warn("[{}] {} {} alert {} on {}: {}", alert.getSeverity(), notification.getType(),
                alert.getStatus(), alert.getId(), alert.getEndpoint(), summary);
        if (alert.getExplanation() != null) {
            for (String recommendation : alert.getExplanation().getRecommendations()) {
                ALERTS.warn("  -> {}", recommendation);
            }
        }
    }

    @Override
    public String getName() {
        return SinkSettings.CONSOLE;
    }
}
