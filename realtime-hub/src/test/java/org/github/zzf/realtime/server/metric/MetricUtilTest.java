package org.github.zzf.realtime.server.metric;

import static org.assertj.core.api.BDDAssertions.then;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MetricUtilTest {

    final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @BeforeEach
    void setUp() {
        Metrics.addRegistry(registry);
    }

    @AfterEach
    void tearDown() {
        Metrics.removeRegistry(registry);
        MetricUtil.metricOn = true;
    }

    @Test
    void givenTags_whenCount_thenCounterIncremented() {
        MetricUtil.count("metric.util.test.counter", "result", "delivered");
        MetricUtil.count("metric.util.test.counter", "result", "delivered");
        MetricUtil.count("metric.util.test.counter", "result", "dropped");
        then(registry.get("metric.util.test.counter").tag("result", "delivered").counter().count())
            .isCloseTo(2.0d, Offset.offset(0.1d));
        then(registry.get("metric.util.test.counter").tag("result", "dropped").counter().count())
            .isCloseTo(1.0d, Offset.offset(0.1d));
    }

    @Test
    void givenGauge_whenSetTwice_thenLastValueWins() {
        MetricUtil.gauge("metric.util.test.gauge", 5);
        MetricUtil.gauge("metric.util.test.gauge", 3);
        then(registry.get("metric.util.test.gauge").gauge().value()).isCloseTo(3.0d, Offset.offset(0.1d));
    }

    @Test
    void givenMetricOff_whenCount_thenNothingRegistered() {
        MetricUtil.metricOn = false;
        MetricUtil.count("metric.util.test.off");
        then(registry.find("metric.util.test.off").counter()).isNull();
    }

}
