/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.ingest;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one successfully processed request.
 */
@Value
@Builder
public class IngestResult {
    int timeSeries;
    long samples;
    int datapoints;
    long nanSamples;
    long unnamedSamples;
}
