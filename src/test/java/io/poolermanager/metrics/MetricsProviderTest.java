package io.poolermanager.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_POOLER_NAME = "pooler-rw";

    @Test
    void testCounterCreatesCounterWithGivenName() {
        String counterName = "test.counter";
        MeterRegistry realRegistry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(realRegistry, TEST_POOLER_NAME);
        Map<String, String> tags = new HashMap<>();
        tags.put("pipe", "stdout");
        Counter counter = provider.counter(counterName, tags);
        assertThat(counter.getId().getName()).isEqualTo(counterName);
        assertThat(counter.getId().getTag("pooler")).isEqualTo(TEST_POOLER_NAME);
        assertThat(counter.getId().getTag("pipe")).isEqualTo("stdout");

        counter.increment();
        counter.increment(5.0);
        assertThat(counter.count()).isEqualTo(6.0);
    }

    @Test
    void testCounterIsSharedForSameNameAndTags() {
        MeterRegistry realRegistry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(realRegistry, TEST_POOLER_NAME);

        provider.counter("test.counter", Map.of("result", "updated")).increment();
        provider.counter("test.counter", Map.of("result", "updated")).increment();
        provider.counter("test.counter", Map.of("result", "error")).increment();

        assertThat(realRegistry.get("test.counter").tag("result", "updated").counter().count()).isEqualTo(2.0);
        assertThat(realRegistry.get("test.counter").tag("result", "error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testGaugeCreatesGaugeWithGivenName() {
        String gaugeName = "test.gauge";
        MeterRegistry realRegistry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(realRegistry, TEST_POOLER_NAME);
        AtomicDouble gaugeValue = provider.gauge(gaugeName, Map.of());

        assertThat(gaugeValue.get()).isEqualTo(0.0);

        Gauge gauge = realRegistry.find(gaugeName).gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.getId().getTag("pooler")).isEqualTo(TEST_POOLER_NAME);

        gaugeValue.set(1.0);
        assertThat(gauge.value()).isEqualTo(1.0);
    }

    @Test
    void testNullPoolerNameIsTaggedUnknown() {
        MeterRegistry realRegistry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(realRegistry, null);

        Counter counter = provider.counter("test.counter", Map.of());

        assertThat(counter.getId().getTag("pooler")).isEqualTo("unknown");
    }
}
