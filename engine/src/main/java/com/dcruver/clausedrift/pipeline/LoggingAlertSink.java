package com.dcruver.clausedrift.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sink: writes alerts to the application log.
 */
@Component
@Slf4j
public class LoggingAlertSink implements ComparisonResultSink {

    @Override
    public void accept(ComparisonResult result) {
        if (result.getAlerts().isEmpty()) {
            log.info("No alerts for comparison {}", result.getComparisonId());
            return;
        }
        for (DriftAlert alert : result.getAlerts()) {
            log.warn("ALERT [{}] {}", alert.getComparisonId(), alert.getMessage());
        }
    }
}
