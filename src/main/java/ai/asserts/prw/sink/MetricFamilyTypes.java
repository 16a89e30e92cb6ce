/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.sink;

import ai.asserts.prw.model.MetricKind;
import io.prometheus.client.Collector;

import static ai.asserts.prw.model.MetricKind.COUNTER;

/**
 * Picks the Prometheus family type a datapoint is exposed with. Counter families rename every sample that
 * does not end in {@code _total}, so only those counters are exposed as counters. Other counters
 * ({@code _bucket}, {@code _count}, self metrics) are untyped to keep their names.
 */
public final class MetricFamilyTypes {
    private static final String TOTAL_SUFFIX = "_total";

    private MetricFamilyTypes() {
    }

    public static Collector.Type typeOf(String metricName, MetricKind kind) {
        if (kind == COUNTER) {
            return metricName.endsWith(TOTAL_SUFFIX) ? Collector.Type.COUNTER : Collector.Type.UNKNOWN;
        }
        return Collector.Type.GAUGE;
    }
}
