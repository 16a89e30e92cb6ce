/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.convert;

import com.google.common.collect.ImmutableSortedMap;
import lombok.Value;

import java.util.Optional;

@Value
public class SeriesLabels {
    Optional<String> metricName;
    ImmutableSortedMap<String, String> dimensions;
}
