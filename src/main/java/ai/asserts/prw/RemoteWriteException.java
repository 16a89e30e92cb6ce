/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw;

import lombok.Getter;

/**
 * A failure that aborts the processing of one remote-write request. The status is the HTTP status the
 * request is answered with.
 */
@Getter
public abstract class RemoteWriteException extends Exception {
    private final int status;

    protected RemoteWriteException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
