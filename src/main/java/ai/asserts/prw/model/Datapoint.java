/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.model;

import com.google.common.collect.ImmutableSortedMap;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A single converted measurement. The dimensions never contain the metric name label.
 */
@Value
@Builder
public class Datapoint {
    @NonNull
    String metric;
    @NonNull
    @Builder.Default
    ImmutableSortedMap<String, String> dimensions = ImmutableSortedMap.of();
    @NonNull
    DatapointValue value;
    @NonNull
    MetricKind kind;
    @NonNull
    Instant timestamp;
}
