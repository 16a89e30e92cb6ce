/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.ingest;

import ai.asserts.prw.ReadException;
import ai.asserts.prw.ReceiverConfig;
import ai.asserts.prw.RemoteWriteException;
import ai.asserts.prw.SinkForwardException;
import ai.asserts.prw.codec.WriteRequestDecoder;
import ai.asserts.prw.convert.LabelMapper;
import ai.asserts.prw.convert.MetricKindClassifier;
import ai.asserts.prw.convert.SampleConverter;
import ai.asserts.prw.convert.SeriesLabels;
import ai.asserts.prw.model.Datapoint;
import ai.asserts.prw.model.MetricKind;
import ai.asserts.prw.sink.DatapointSink;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import prometheus.Remote.WriteRequest;
import prometheus.Types.Sample;
import prometheus.Types.TimeSeries;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Processes remote-write requests: decode the body, convert every time series and forward all resulting
 * datapoints to the sink in a single batch. Requests are independent of each other and may be processed
 * concurrently; only the {@link IngestCounters} are shared.
 */
@Component
@Slf4j
public class RemoteWriteIngestor {
    private final WriteRequestDecoder decoder;
    private final LabelMapper labelMapper;
    private final MetricKindClassifier classifier;
    private final SampleConverter sampleConverter;
    private final DatapointSink sink;
    private final IngestCounters counters;
    private final long timeoutMillis;
    private final Ticker ticker;

    @Autowired
    public RemoteWriteIngestor(WriteRequestDecoder decoder, LabelMapper labelMapper,
                               MetricKindClassifier classifier, SampleConverter sampleConverter,
                               DatapointSink sink, IngestCounters counters, ReceiverConfig receiverConfig) {
        this(decoder, labelMapper, classifier, sampleConverter, sink, counters, receiverConfig.getTimeoutMillis(),
                Ticker.systemTicker());
    }

    @VisibleForTesting
    RemoteWriteIngestor(WriteRequestDecoder decoder, LabelMapper labelMapper,
                        MetricKindClassifier classifier, SampleConverter sampleConverter,
                        DatapointSink sink, IngestCounters counters, long timeoutMillis, Ticker ticker) {
        this.decoder = decoder;
        this.labelMapper = labelMapper;
        this.classifier = classifier;
        this.sampleConverter = sampleConverter;
        this.sink = sink;
        this.counters = counters;
        this.timeoutMillis = timeoutMillis;
        this.ticker = ticker;
        log.info("Created RemoteWriteIngestor with sink timeout {} ms", timeoutMillis);
    }

    /**
     * @param body the compressed request body, read completely before decoding
     * @throws RemoteWriteException when the request could not be processed. The error counter has been
     *                              incremented once and the failure logged.
     */
    public IngestResult ingest(ByteSource body) throws RemoteWriteException {
        long start = ticker.read();
        try {
            return process(body);
        } catch (RemoteWriteException e) {
            counters.incrementErrors();
            log.error("Failed to process remote write request: {}", e.getMessage(), e);
            throw e;
        } finally {
            counters.recordRequestTime(ticker.read() - start);
        }
    }

    public List<Datapoint> datapoints() {
        return counters.datapoints();
    }

    public IngestCounters getCounters() {
        return counters;
    }

    private IngestResult process(ByteSource body) throws RemoteWriteException {
        byte[] compressed;
        try {
            compressed = body.read();
        } catch (IOException e) {
            throw new ReadException("Failed to read request body: " + e.getMessage(), e);
        }

        WriteRequest request = decoder.decode(compressed);

        List<Datapoint> batch = new ArrayList<>();
        long samples = 0;
        long unnamed = 0;
        for (TimeSeries timeSeries : request.getTimeseriesList()) {
            samples += timeSeries.getSamplesCount();
            if (!convertSeries(timeSeries, batch)) {
                unnamed += timeSeries.getSamplesCount();
            }
        }

        counters.recordBatchSize(batch.size());
        if (!batch.isEmpty()) {
            forward(ImmutableList.copyOf(batch));
        }
        log.debug("Forwarded {} datapoints from {} time series", batch.size(), request.getTimeseriesCount());
        return IngestResult.builder()
                .timeSeries(request.getTimeseriesCount())
                .samples(samples)
                .datapoints(batch.size())
                .nanSamples(samples - unnamed - batch.size())
                .unnamedSamples(unnamed)
                .build();
    }

    /**
     * @return false when the series has no metric name and was dropped
     */
    @VisibleForTesting
    boolean convertSeries(TimeSeries timeSeries, List<Datapoint> batch) {
        SeriesLabels labels = labelMapper.map(timeSeries.getLabelsList());
        Optional<String> metricName = labels.getMetricName().filter(name -> !name.isEmpty());
        if (metricName.isEmpty()) {
            counters.addBadDatapoints(timeSeries.getSamplesCount());
            return false;
        }
        MetricKind kind = classifier.classify(metricName.get());
        for (Sample sample : timeSeries.getSamplesList()) {
            sampleConverter.convert(metricName.get(), labels.getDimensions(), kind, sample, counters)
                    .ifPresent(batch::add);
        }
        return true;
    }

    private void forward(List<Datapoint> batch) throws SinkForwardException {
        CompletableFuture<Void> future;
        try {
            future = sink.addDatapoints(batch);
        } catch (RuntimeException e) {
            throw new SinkForwardException("Sink failed to accept " + batch.size() + " datapoints", e);
        }
        try {
            future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new SinkForwardException("Sink rejected " + batch.size() + " datapoints: "
                    + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SinkForwardException("Timed out after " + timeoutMillis + " ms forwarding "
                    + batch.size() + " datapoints", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SinkForwardException("Interrupted while forwarding " + batch.size() + " datapoints", e);
        } catch (CancellationException e) {
            throw new SinkForwardException("Sink cancelled " + batch.size() + " datapoints", e);
        }
    }
}
