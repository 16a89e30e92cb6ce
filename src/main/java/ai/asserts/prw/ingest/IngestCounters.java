/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.ingest;

import ai.asserts.prw.model.Datapoint;
import ai.asserts.prw.model.DatapointValue;
import ai.asserts.prw.sink.MetricFamilyTypes;
import com.google.common.annotations.VisibleForTesting;
import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples.Sample;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static ai.asserts.prw.model.MetricKind.COUNTER;

/**
 * Self observability of one {@link RemoteWriteIngestor}. Every instance keeps its own tallies, they are only
 * reset by creating a new instance.
 * <p>
 * Exposed to Prometheus under the reported names with {@code .} replaced by {@code _}, e.g.
 * {@code prometheus_invalid_requests} and {@code request_time_ns_count}, without a {@code _total} suffix.
 */
@Slf4j
public class IngestCounters extends Collector {
    public static final String REQUEST_TIME = "request_time.ns";
    public static final String DRAIN_SIZE = "drain_size";
    public static final String INVALID_REQUESTS = "prometheus.invalid_requests";
    public static final String TOTAL_NAN_SAMPLES = "prometheus.total_NAN_samples";
    public static final String TOTAL_BAD_DATAPOINTS = "prometheus.total_bad_datapoints";

    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicLong totalNaNs = new AtomicLong();
    private final AtomicLong totalBadDatapoints = new AtomicLong();
    private final RollingDistribution requestTime;
    private final RollingDistribution drainSize;
    private final Clock clock;

    public IngestCounters(long windowSeconds) {
        this(new RollingDistribution(REQUEST_TIME, windowSeconds),
                new RollingDistribution(DRAIN_SIZE, windowSeconds),
                Clock.systemUTC());
    }

    @VisibleForTesting
    IngestCounters(RollingDistribution requestTime, RollingDistribution drainSize, Clock clock) {
        this.requestTime = requestTime;
        this.drainSize = drainSize;
        this.clock = clock;
    }

    public void incrementErrors() {
        totalErrors.incrementAndGet();
    }

    public void incrementNaNs() {
        totalNaNs.incrementAndGet();
    }

    public void addBadDatapoints(long count) {
        totalBadDatapoints.addAndGet(count);
    }

    public void recordRequestTime(long nanos) {
        requestTime.add(nanos);
    }

    public void recordBatchSize(int size) {
        drainSize.add(size);
    }

    public long getTotalErrors() {
        return totalErrors.get();
    }

    public long getTotalNaNs() {
        return totalNaNs.get();
    }

    public long getTotalBadDatapoints() {
        return totalBadDatapoints.get();
    }

    public RollingDistribution getRequestTime() {
        return requestTime;
    }

    public RollingDistribution getDrainSize() {
        return drainSize;
    }

    public List<Datapoint> datapoints() {
        Instant now = clock.instant();
        List<Datapoint> datapoints = new ArrayList<>(requestTime.datapoints(now));
        datapoints.addAll(drainSize.datapoints(now));
        datapoints.add(cumulative(INVALID_REQUESTS, totalErrors.get(), now));
        datapoints.add(cumulative(TOTAL_NAN_SAMPLES, totalNaNs.get(), now));
        datapoints.add(cumulative(TOTAL_BAD_DATAPOINTS, totalBadDatapoints.get(), now));
        return datapoints;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        List<MetricFamilySamples> familySamples = new ArrayList<>();
        try {
            datapoints().forEach(datapoint -> {
                String name = datapoint.getMetric().replace('.', '_');
                Sample sample = new Sample(name, Collections.emptyList(), Collections.emptyList(),
                        datapoint.getValue().doubleValue());
                Type type = MetricFamilyTypes.typeOf(name, datapoint.getKind());
                familySamples.add(new MetricFamilySamples(name, type, "", Collections.singletonList(sample)));
            });
        } catch (Exception e) {
            log.error("Failed to collect ingest counters", e);
        }
        return familySamples;
    }

    private Datapoint cumulative(String metric, long value, Instant now) {
        return Datapoint.builder()
                .metric(metric)
                .value(DatapointValue.ofInt(value))
                .kind(COUNTER)
                .timestamp(now)
                .build();
    }
}
