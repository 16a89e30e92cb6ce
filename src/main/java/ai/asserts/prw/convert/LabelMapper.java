/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.convert;

import com.google.common.collect.ImmutableSortedMap;
import org.springframework.stereotype.Component;
import prometheus.Types.Label;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Converts the label list of a time series into a metric name and its dimensions.
 * <p>
 * The wire format does not forbid repeated label names within a series. When a name repeats, the last
 * occurrence in wire order wins. Senders are not expected to rely on this.
 */
@Component
public class LabelMapper {
    public static final String METRIC_NAME_LABEL = "__name__";

    public SeriesLabels map(List<Label> labels) {
        SortedMap<String, String> dimensions = new TreeMap<>();
        labels.forEach(label -> dimensions.put(label.getName(), label.getValue()));
        Optional<String> metricName = Optional.ofNullable(dimensions.remove(METRIC_NAME_LABEL));
        return new SeriesLabels(metricName, ImmutableSortedMap.copyOfSorted(dimensions));
    }
}
