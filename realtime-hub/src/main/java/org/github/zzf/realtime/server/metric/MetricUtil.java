package org.github.zzf.realtime.server.metric;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public class MetricUtil {

    public static volatile boolean metricOn = true;

    private MetricUtil() {
    }

    private static final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    /**
     * Counter
     *
     * @param metricName 指标名
     * @param tags key/value pairs, can be empty
     */
    public static void count(String metricName, String... tags) {
        if (!metricOn) {
            return;
        }
        Metrics.counter(metricName, tags).increment();
    }

    /**
     * Gauge, the last value wins
     *
     * @param metricName 指标名
     * @param val current value
     * @param tags key/value pairs, can be empty
     */
    public static void gauge(String metricName, long val, String... tags) {
        if (!metricOn) {
            return;
        }
        String id = id(metricName, tags);
        AtomicLong gauge = gauges.computeIfAbsent(id,
            k -> Metrics.gauge(metricName, Tags.of(tags), new AtomicLong(0)));
        gauge.set(val);
    }

    private static String id(String metricName, String[] tags) {
        StringBuilder buf = new StringBuilder(metricName);
        for (String tag : tags) {
            buf.append(tag);
        }
        return buf.toString();
    }

}
