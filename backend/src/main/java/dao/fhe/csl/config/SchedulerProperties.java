package dao.fhe.csl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private StallMonitorConfig stallMonitor = new StallMonitorConfig();

    @Data
    public static class StallMonitorConfig {
        /**
         * Enable/disable the stalled settlement report
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to scan open settlement requests (in milliseconds)
         * Default: 30000ms
         */
        private long checkIntervalMs = 30000;

        /**
         * Age in seconds after which an unprocessed settlement request is reported as stalled
         * Default: 600 seconds
         */
        private long stallThresholdSeconds = 600;
    }
}
