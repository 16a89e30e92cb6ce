/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.ingest;

import ai.asserts.prw.model.Datapoint;
import ai.asserts.prw.model.DatapointValue;
import com.google.common.collect.ImmutableList;
import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.Collector.MetricFamilySamples.Sample;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import static ai.asserts.prw.model.MetricKind.COUNTER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IngestCountersTest {
    private final Instant now = Instant.parse("2022-01-24T07:20:25Z");

    @Test
    void datapoints() {
        IngestCounters testClass = counters();
        testClass.incrementErrors();
        testClass.incrementNaNs();
        testClass.incrementNaNs();
        testClass.addBadDatapoints(3);
        testClass.recordBatchSize(7);
        testClass.recordRequestTime(1500L);

        Map<String, Datapoint> datapoints = testClass.datapoints().stream()
                .collect(Collectors.toMap(Datapoint::getMetric, Function.identity()));

        assertEquals(Datapoint.builder()
                .metric("prometheus.invalid_requests")
                .value(DatapointValue.ofInt(1))
                .kind(COUNTER)
                .timestamp(now)
                .build(), datapoints.get("prometheus.invalid_requests"));
        assertEquals(DatapointValue.ofInt(2), datapoints.get("prometheus.total_NAN_samples").getValue());
        assertEquals(DatapointValue.ofInt(3), datapoints.get("prometheus.total_bad_datapoints").getValue());
        assertEquals(DatapointValue.ofInt(7), datapoints.get("drain_size.sum").getValue());
        assertEquals(DatapointValue.ofInt(1500), datapoints.get("request_time.ns.sum").getValue());
        assertEquals(DatapointValue.ofInt(1), datapoints.get("request_time.ns.count").getValue());
    }

    @Test
    void instancesAreIndependent() {
        IngestCounters first = counters();
        IngestCounters second = counters();
        first.incrementErrors();
        first.addBadDatapoints(2);

        assertEquals(1, first.getTotalErrors());
        assertEquals(0, second.getTotalErrors());
        assertEquals(0, second.getTotalBadDatapoints());
    }

    @Test
    void concurrentUpdates() throws Exception {
        IngestCounters testClass = counters();
        ExecutorService executorService = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 1000; i++) {
            executorService.submit(() -> {
                testClass.incrementErrors();
                testClass.incrementNaNs();
                testClass.addBadDatapoints(2);
                testClass.recordBatchSize(1);
                testClass.recordRequestTime(10L);
            });
        }
        executorService.shutdown();
        assertTrue(executorService.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(1000, testClass.getTotalErrors());
        assertEquals(1000, testClass.getTotalNaNs());
        assertEquals(2000, testClass.getTotalBadDatapoints());
        assertEquals(1000, testClass.getDrainSize().getCount());
        assertEquals(1000.0D, testClass.getDrainSize().getSum());
        assertEquals(10000.0D, testClass.getRequestTime().getSum());
    }

    @Test
    void collect() {
        IngestCounters testClass = counters();
        testClass.incrementErrors();

        List<MetricFamilySamples> familySamples = testClass.collect();

        List<Sample> samples = new ArrayList<>();
        familySamples.forEach(family -> samples.addAll(family.samples));
        Map<String, Double> values = samples.stream()
                .collect(Collectors.toMap(sample -> sample.name, sample -> sample.value));
        assertEquals(1.0D, values.get("prometheus_invalid_requests"));
        assertEquals(0.0D, values.get("prometheus_total_NAN_samples"));
        assertEquals(0.0D, values.get("request_time_ns_count"));
    }

    @Test
    void collect_NamesAndTypes() {
        IngestCounters testClass = counters();
        testClass.addBadDatapoints(4);
        testClass.recordBatchSize(2);

        Map<String, MetricFamilySamples> families = testClass.collect().stream()
                .collect(Collectors.toMap(family -> family.name, Function.identity()));

        MetricFamilySamples badDatapoints = families.get("prometheus_total_bad_datapoints");
        assertEquals(Collector.Type.UNKNOWN, badDatapoints.type);
        assertEquals(ImmutableList.of(new Sample("prometheus_total_bad_datapoints",
                Collections.emptyList(), Collections.emptyList(), 4.0D)), badDatapoints.samples);
        assertEquals(Collector.Type.UNKNOWN, families.get("drain_size_count").type);
        assertEquals("drain_size_count", families.get("drain_size_count").samples.get(0).name);
        assertEquals(Collector.Type.UNKNOWN, families.get("drain_size_sumsquare").type);
        assertEquals(Collector.Type.GAUGE, families.get("drain_size_max").type);
        assertEquals(2.0D, families.get("drain_size_max").samples.get(0).value);
        families.values().forEach(family -> family.samples.forEach(sample ->
                assertFalse(sample.name.endsWith("_total"), sample.name)));
    }

    private IngestCounters counters() {
        return new IngestCounters(new RollingDistribution(IngestCounters.REQUEST_TIME, 60),
                new RollingDistribution(IngestCounters.DRAIN_SIZE, 60),
                Clock.fixed(now, ZoneOffset.UTC));
    }
}
