/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.convert;

import ai.asserts.prw.model.MetricKind;
import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;

import static ai.asserts.prw.model.MetricKind.COUNTER;
import static ai.asserts.prw.model.MetricKind.GAUGE;

/**
 * Infers the kind of a metric from the naming conventions at
 * https://prometheus.io/docs/practices/naming/ and https://prometheus.io/docs/practices/histograms/.
 * Rules are evaluated in order and the first matching suffix wins. Anything unmatched is a gauge.
 */
@Component
public class MetricKindClassifier {
    public static final List<SuffixRule> DEFAULT_RULES = ImmutableList.of(
            // counters
            new SuffixRule("_total", COUNTER),
            // cumulative counters of the observation buckets, <basename>_bucket{le="<upper bound>"}
            new SuffixRule("_bucket", COUNTER),
            // number of observed events, <basename>_count
            new SuffixRule("_count", COUNTER)
            // <basename>_sum may go down with negative observations so it stays a gauge
    );

    private final List<SuffixRule> rules;

    public MetricKindClassifier() {
        this(DEFAULT_RULES);
    }

    public MetricKindClassifier(List<SuffixRule> rules) {
        this.rules = ImmutableList.copyOf(rules);
    }

    public MetricKind classify(String metricName) {
        for (SuffixRule rule : rules) {
            if (metricName.endsWith(rule.getSuffix())) {
                return rule.getKind();
            }
        }
        return GAUGE;
    }

    @Getter
    @AllArgsConstructor
    public static class SuffixRule {
        private final String suffix;
        private final MetricKind kind;
    }
}
