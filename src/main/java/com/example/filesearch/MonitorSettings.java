package com.example.filesearch;

import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Tuning of {@link ChangeMonitor}.
 *
 * @param cooldown           minimum time between two processing passes of the same path
 * @param createdSuppression window after a create in which modify events for that path are dropped
 * @param settle             wait before processing so that editors can finish writing
 * @param stopTimeout        how long {@link ChangeMonitor#stop()} waits for in-flight work
 * @param workers            size of the event worker pool
 * @param ignorePatterns     filename substrings that are never processed
 */
public record MonitorSettings(
        Duration cooldown,
        Duration createdSuppression,
        Duration settle,
        Duration stopTimeout,
        int workers,
        List<String> ignorePatterns
) {

    public static final String DEFAULT_IGNORE = "desktop.ini,Thumbs.db,.DS_Store,.tmp,.crdownload,.part,~$";

    public MonitorSettings {
        ignorePatterns = List.copyOf(ignorePatterns);
        if (workers < 1) throw new IllegalArgumentException("monitor.workers must be at least 1");
    }

    public static MonitorSettings defaults() {
        return new MonitorSettings(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofMillis(500),
                Duration.ofSeconds(5), 4, parseIgnore(DEFAULT_IGNORE));
    }

    public static MonitorSettings fromEnvironment(Environment env) {
        return new MonitorSettings(
                Duration.ofMillis(Long.parseLong(env.getProperty("monitor.cooldown.ms", "1000"))),
                Duration.ofMillis(Long.parseLong(env.getProperty("monitor.created.suppression.ms", "2000"))),
                Duration.ofMillis(Long.parseLong(env.getProperty("monitor.settle.ms", "500"))),
                Duration.ofMillis(Long.parseLong(env.getProperty("monitor.stop.timeout.ms", "5000"))),
                Integer.parseInt(env.getProperty("monitor.workers", "4")),
                parseIgnore(env.getProperty("monitor.ignore", DEFAULT_IGNORE)));
    }

    static List<String> parseIgnore(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
