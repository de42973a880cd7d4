package dev.timedqueue.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;

@Getter
@Setter
@Accessors(chain = true)
public class TimedQueueConfig {
    // System property helpers for test configurability (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v.trim()); } catch (NumberFormatException e) { return def; }
    }

    // Identity
    private String name = prop("tq.name", "timed-queue");   // shows up in logs, MDC and thread names

    // Queue behavior
    private Duration delay = Duration.ofMillis(longProp("tq.delayMillis", 1000L)); // same for every entry

    // Worker
    private String workerThreadName = null;                  // null -> "<name>-expiry"
    private boolean daemonWorker = boolProp("tq.daemonWorker", true);
    private Duration shutdownTimeout = Duration.ofMillis(longProp("tq.shutdownTimeoutMillis", 5000L)); // join budget before interrupting

    public String resolveWorkerThreadName() {
        return workerThreadName != null ? workerThreadName : name + "-expiry";
    }
}
