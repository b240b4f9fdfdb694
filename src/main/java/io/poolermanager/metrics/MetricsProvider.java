package io.poolermanager.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/*
 * MetricsProvider creates counters and gauges tagged with the pooler they belong to.
 */
@Slf4j
public class MetricsProvider {
    private static final String POOLER_TAG = "pooler";

    private final MeterRegistry registry;
    private final String poolerName;

    public MetricsProvider(MeterRegistry registry, String poolerName) {
        this.registry = registry;
        this.poolerName = poolerName != null ? poolerName : "unknown";
        log.info("MetricsProvider initialized for pooler: {}", this.poolerName);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create a Gauge metric with the given name and tags, starting at zero.
     *
     * @param name the name of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance backing the gauge
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        AtomicDouble value = new AtomicDouble(0);
        Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
        return value;
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = POOLER_TAG;
        tagArray[index] = poolerName;
        return tagArray;
    }
}
