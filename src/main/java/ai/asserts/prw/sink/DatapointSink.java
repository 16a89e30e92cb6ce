/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.sink;

import ai.asserts.prw.model.Datapoint;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Destination of the datapoints converted from one remote-write request.
 */
public interface DatapointSink {
    /**
     * Accepts the batch as one unit. The returned future completes once the sink owns the batch and fails
     * when the sink rejects it. Callers that stop waiting cancel the future; a sink should then drop the
     * batch if it has not taken it yet. Delivery and retries past that point are up to the sink.
     */
    CompletableFuture<Void> addDatapoints(List<Datapoint> datapoints);
}
