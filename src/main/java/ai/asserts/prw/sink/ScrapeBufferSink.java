/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.sink;

import ai.asserts.prw.model.Datapoint;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps received datapoints in memory until the next Prometheus scrape, which drains them. Each datapoint is
 * exposed with the timestamp it was received with. Batches that do not fit in the remaining capacity are
 * rejected as a whole. Counters not ending in {@code _total} are exposed untyped so their names are kept.
 */
@Component
@Slf4j
public class ScrapeBufferSink extends Collector implements DatapointSink, InitializingBean {
    private final CollectorRegistry collectorRegistry;
    private final int capacity;
    private List<Datapoint> buffered = new ArrayList<>();

    public ScrapeBufferSink(CollectorRegistry collectorRegistry,
                            @Value("${prw_receiver.sink.max_buffered_datapoints:100000}") int capacity) {
        this.collectorRegistry = collectorRegistry;
        this.capacity = capacity;
        log.info("Created ScrapeBufferSink with capacity {}", capacity);
    }

    @Override
    public void afterPropertiesSet() {
        collectorRegistry.register(this);
    }

    @Override
    public CompletableFuture<Void> addDatapoints(List<Datapoint> datapoints) {
        synchronized (this) {
            if (buffered.size() + datapoints.size() > capacity) {
                return CompletableFuture.failedFuture(new SinkFullException(String.format(
                        "Buffer holds %d of %d datapoints, cannot take %d more",
                        buffered.size(), capacity, datapoints.size())));
            }
            buffered.addAll(datapoints);
        }
        return CompletableFuture.completedFuture(null);
    }

    public synchronized int getBufferedCount() {
        return buffered.size();
    }

    @Override
    public List<MetricFamilySamples> collect() {
        List<Datapoint> drained;
        synchronized (this) {
            drained = buffered;
            buffered = new ArrayList<>();
        }
        List<MetricFamilySamples> familySamples = toFamilies(drained);
        if (!drained.isEmpty()) {
            log.debug("Drained {} datapoints in {} metric families", drained.size(), familySamples.size());
        }
        return familySamples;
    }

    /**
     * A name-filtered scrape only reads the buffer. Datapoints are drained by unfiltered scrapes, so with
     * several unfiltered scrapers each datapoint reaches only one of them.
     */
    @Override
    public List<MetricFamilySamples> collect(Predicate<String> sampleNameFilter) {
        if (sampleNameFilter == null) {
            return collect();
        }
        List<Datapoint> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(buffered);
        }
        snapshot.removeIf(datapoint -> !sampleNameFilter.test(datapoint.getMetric()));
        return toFamilies(snapshot);
    }

    private List<MetricFamilySamples> toFamilies(List<Datapoint> datapoints) {
        if (datapoints.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, List<Datapoint>> byMetric = new TreeMap<>();
        datapoints.forEach(datapoint ->
                byMetric.computeIfAbsent(datapoint.getMetric(), k -> new ArrayList<>()).add(datapoint));

        List<MetricFamilySamples> familySamples = new ArrayList<>();
        byMetric.forEach((metric, forMetric) -> {
            List<MetricFamilySamples.Sample> samples = new ArrayList<>();
            forMetric.forEach(datapoint -> samples.add(new MetricFamilySamples.Sample(
                    metric,
                    new ArrayList<>(datapoint.getDimensions().keySet()),
                    new ArrayList<>(datapoint.getDimensions().values()),
                    datapoint.getValue().doubleValue(),
                    datapoint.getTimestamp().toEpochMilli())));
            Type type = MetricFamilyTypes.typeOf(metric, forMetric.get(0).getKind());
            familySamples.add(new MetricFamilySamples(metric, type, "", samples));
        });
        return familySamples;
    }
}
