/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.ingest;

import ai.asserts.prw.model.Datapoint;
import ai.asserts.prw.model.DatapointValue;
import ai.asserts.prw.model.MetricKind;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.AtomicDouble;
import io.prometheus.client.Summary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static ai.asserts.prw.model.MetricKind.COUNTER;
import static ai.asserts.prw.model.MetricKind.GAUGE;

/**
 * Distribution of observed values. Count, sum and sum of squares are cumulative. Quantiles are computed
 * over a sliding window and min/max over the current window. Safe for concurrent use.
 */
public class RollingDistribution {
    private final String name;
    private final Summary summary;
    private final AtomicDouble sumOfSquares = new AtomicDouble(0);
    private final Ticker ticker;
    private final long windowNanos;

    private final Object windowLock = new Object();
    private long windowStart;
    private double windowMin = Double.NaN;
    private double windowMax = Double.NaN;

    public RollingDistribution(String name, long windowSeconds) {
        this(name, windowSeconds, Ticker.systemTicker());
    }

    @VisibleForTesting
    RollingDistribution(String name, long windowSeconds, Ticker ticker) {
        this.name = name;
        this.ticker = ticker;
        this.windowNanos = TimeUnit.SECONDS.toNanos(windowSeconds);
        this.windowStart = ticker.read();
        this.summary = Summary.build()
                .name(name.replace('.', '_'))
                .help("Rolling distribution of " + name)
                .quantile(0.5, 0.05)
                .quantile(0.9, 0.01)
                .quantile(0.99, 0.001)
                .maxAgeSeconds(windowSeconds)
                .ageBuckets(5)
                .create();
    }

    public void add(double value) {
        summary.observe(value);
        sumOfSquares.addAndGet(value * value);
        synchronized (windowLock) {
            rollWindow();
            if (Double.isNaN(windowMin) || value < windowMin) {
                windowMin = value;
            }
            if (Double.isNaN(windowMax) || value > windowMax) {
                windowMax = value;
            }
        }
    }

    public long getCount() {
        return (long) summary.get().count;
    }

    public double getSum() {
        return summary.get().sum;
    }

    /**
     * Reports {@code <name>.count}, {@code .sum} and {@code .sumsquare} as counters, {@code .min},
     * {@code .max} and the {@code .p50}, {@code .p90}, {@code .p99} quantiles as gauges. Window statistics
     * are left out while the window holds no observation.
     */
    public List<Datapoint> datapoints(Instant now) {
        Summary.Child.Value value = summary.get();
        List<Datapoint> datapoints = new ArrayList<>();
        datapoints.add(datapoint(name + ".count", DatapointValue.ofInt((long) value.count), COUNTER, now));
        datapoints.add(datapoint(name + ".sum", DatapointValue.of(value.sum), COUNTER, now));
        datapoints.add(datapoint(name + ".sumsquare", DatapointValue.of(sumOfSquares.get()), COUNTER, now));

        double min;
        double max;
        synchronized (windowLock) {
            rollWindow();
            min = windowMin;
            max = windowMax;
        }
        if (!Double.isNaN(min)) {
            datapoints.add(datapoint(name + ".min", DatapointValue.of(min), GAUGE, now));
            datapoints.add(datapoint(name + ".max", DatapointValue.of(max), GAUGE, now));
        }
        for (Map.Entry<Double, Double> quantile : value.quantiles.entrySet()) {
            if (!Double.isNaN(quantile.getValue())) {
                String suffix = ".p" + Math.round(quantile.getKey() * 100);
                datapoints.add(datapoint(name + suffix, DatapointValue.of(quantile.getValue()), GAUGE, now));
            }
        }
        return datapoints;
    }

    // caller holds windowLock
    private void rollWindow() {
        long now = ticker.read();
        if (now - windowStart >= windowNanos) {
            windowStart = now;
            windowMin = Double.NaN;
            windowMax = Double.NaN;
        }
    }

    private Datapoint datapoint(String metric, DatapointValue value, MetricKind kind, Instant now) {
        return Datapoint.builder()
                .metric(metric)
                .value(value)
                .kind(kind)
                .timestamp(now)
                .build();
    }
}
