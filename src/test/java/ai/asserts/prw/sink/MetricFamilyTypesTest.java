/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.sink;

import io.prometheus.client.Collector;
import org.junit.jupiter.api.Test;

import static ai.asserts.prw.model.MetricKind.COUNTER;
import static ai.asserts.prw.model.MetricKind.GAUGE;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class MetricFamilyTypesTest {
    @Test
    void typeOf() {
        assertEquals(Collector.Type.COUNTER, MetricFamilyTypes.typeOf("http_requests_total", COUNTER));
        assertEquals(Collector.Type.UNKNOWN, MetricFamilyTypes.typeOf("latency_bucket", COUNTER));
        assertEquals(Collector.Type.UNKNOWN, MetricFamilyTypes.typeOf("latency_count", COUNTER));
        assertEquals(Collector.Type.GAUGE, MetricFamilyTypes.typeOf("latency_sum", GAUGE));
        assertEquals(Collector.Type.GAUGE, MetricFamilyTypes.typeOf("requests_total", GAUGE));
    }
}
