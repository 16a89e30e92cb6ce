/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.sink;

public class SinkFullException extends RuntimeException {
    public SinkFullException(String message) {
        super(message);
    }
}
