/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.model;

/**
 * How downstream consumers aggregate a metric.
 */
public enum MetricKind {
    /**
     * Monotonically accumulating value.
     */
    COUNTER,
    /**
     * Value that may go up and down.
     */
    GAUGE
}
