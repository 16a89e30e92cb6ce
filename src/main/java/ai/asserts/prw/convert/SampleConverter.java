/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.convert;

import ai.asserts.prw.ingest.IngestCounters;
import ai.asserts.prw.model.Datapoint;
import ai.asserts.prw.model.DatapointValue;
import ai.asserts.prw.model.MetricKind;
import com.google.common.collect.ImmutableSortedMap;
import org.springframework.stereotype.Component;
import prometheus.Types.Sample;

import java.time.Instant;
import java.util.Optional;

@Component
public class SampleConverter {
    /**
     * Converts one sample. NaN samples are counted on {@code counters} and produce nothing. Infinite values
     * are kept as floating point values.
     */
    public Optional<Datapoint> convert(String metricName, ImmutableSortedMap<String, String> dimensions,
                                       MetricKind kind, Sample sample, IngestCounters counters) {
        double value = sample.getValue();
        if (Double.isNaN(value)) {
            counters.incrementNaNs();
            return Optional.empty();
        }
        return Optional.of(Datapoint.builder()
                .metric(metricName)
                .dimensions(dimensions)
                .value(DatapointValue.of(value))
                .kind(kind)
                .timestamp(toTimestamp(sample.getTimestamp()))
                .build());
    }

    /**
     * Millisecond timestamps are taken as is, there is no substitution of zero or out of range values.
     */
    public static Instant toTimestamp(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }
}
