/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.convert;

import ai.asserts.prw.ingest.IngestCounters;
import ai.asserts.prw.model.Datapoint;
import ai.asserts.prw.model.DatapointValue;
import com.google.common.collect.ImmutableSortedMap;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import prometheus.Types.Sample;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static ai.asserts.prw.model.MetricKind.COUNTER;
import static ai.asserts.prw.model.MetricKind.GAUGE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SampleConverterTest extends EasyMockSupport {
    private static final ImmutableSortedMap<String, String> DIMENSIONS = ImmutableSortedMap.of("method", "GET");

    private IngestCounters counters;
    private SampleConverter testClass;

    @BeforeEach
    public void setup() {
        counters = mock(IngestCounters.class);
        testClass = new SampleConverter();
    }

    @Test
    void convert_Integer() {
        replayAll();
        assertEquals(Optional.of(Datapoint.builder()
                        .metric("http_requests_total")
                        .dimensions(DIMENSIONS)
                        .value(DatapointValue.ofInt(5))
                        .kind(COUNTER)
                        .timestamp(Instant.ofEpochSecond(1))
                        .build()),
                testClass.convert("http_requests_total", DIMENSIONS, COUNTER, sample(5.0D, 1000L), counters));
        verifyAll();
    }

    @Test
    void convert_Float() {
        replayAll();
        Optional<Datapoint> datapoint =
                testClass.convert("http_requests_total", DIMENSIONS, COUNTER, sample(5.5D, 1000L), counters);

        assertTrue(datapoint.isPresent());
        assertEquals(DatapointValue.ofFloat(5.5D), datapoint.get().getValue());
        assertEquals(Instant.ofEpochSecond(1), datapoint.get().getTimestamp());
        verifyAll();
    }

    @Test
    void convert_NumericKindIndependentOfMetricKind() {
        replayAll();
        assertEquals(DatapointValue.ofInt(42),
                testClass.convert("temperature", DIMENSIONS, GAUGE, sample(42.0D, 0L), counters).get().getValue());
        assertEquals(DatapointValue.ofFloat(0.5D),
                testClass.convert("x_total", DIMENSIONS, COUNTER, sample(0.5D, 0L), counters).get().getValue());
        verifyAll();
    }

    @Test
    void convert_NaN() {
        counters.incrementNaNs();
        replayAll();
        assertEquals(Optional.empty(),
                testClass.convert("up", DIMENSIONS, GAUGE, sample(Double.NaN, 1000L), counters));
        verifyAll();
    }

    @Test
    void convert_InfinityIsKeptAsFloat() {
        replayAll();
        assertEquals(DatapointValue.ofFloat(Double.POSITIVE_INFINITY),
                testClass.convert("up", DIMENSIONS, GAUGE, sample(Double.POSITIVE_INFINITY, 0L), counters)
                        .get().getValue());
        assertEquals(DatapointValue.ofFloat(Double.NEGATIVE_INFINITY),
                testClass.convert("up", DIMENSIONS, GAUGE, sample(Double.NEGATIVE_INFINITY, 0L), counters)
                        .get().getValue());
        verifyAll();
    }

    @Test
    void convert_TimestampNotSubstituted() {
        replayAll();
        assertEquals(Instant.EPOCH,
                testClass.convert("up", DIMENSIONS, GAUGE, sample(1.0D, 0L), counters).get().getTimestamp());
        assertEquals(Instant.ofEpochMilli(-86_400_000L),
                testClass.convert("up", DIMENSIONS, GAUGE, sample(1.0D, -86_400_000L), counters).get()
                        .getTimestamp());
        verifyAll();
    }

    @Test
    void toTimestamp_Nanoseconds() {
        Instant timestamp = SampleConverter.toTimestamp(1000L);
        assertEquals(1_000_000_000L, ChronoUnit.NANOS.between(Instant.EPOCH, timestamp));
    }

    @ParameterizedTest
    @ValueSource(longs = {0L, 1L, -1L, 1000L, 1_600_000_000_123L, 9_223_372_036_854L, -9_223_372_036L})
    void toTimestamp_RoundTrip(long millis) {
        Instant timestamp = SampleConverter.toTimestamp(millis);
        long nanos = ChronoUnit.NANOS.between(Instant.EPOCH, timestamp);
        assertEquals(millis * 1_000_000L, nanos);
        assertEquals(millis, nanos / 1_000_000L);
    }

    @ParameterizedTest
    @ValueSource(longs = {Long.MAX_VALUE, Long.MIN_VALUE, 253_402_300_800_000L})
    void toTimestamp_RoundTripOutsideNanosecondLongRange(long millis) {
        assertEquals(millis, SampleConverter.toTimestamp(millis).toEpochMilli());
    }

    @Test
    void convert_SharesDimensions() {
        replayAll();
        Datapoint first = testClass.convert("up", DIMENSIONS, GAUGE, sample(1.0D, 0L), counters).get();
        Datapoint second = testClass.convert("up", DIMENSIONS, GAUGE, sample(2.0D, 1L), counters).get();

        assertEquals(first.getDimensions(), second.getDimensions());
        assertFalse(first.getDimensions().containsKey(LabelMapper.METRIC_NAME_LABEL));
        verifyAll();
    }

    private Sample sample(double value, long timestamp) {
        return Sample.newBuilder().setValue(value).setTimestamp(timestamp).build();
    }
}
