/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw;

import static javax.servlet.http.HttpServletResponse.SC_BAD_REQUEST;

public class DeserializationException extends RemoteWriteException {
    public DeserializationException(String message) {
        super(SC_BAD_REQUEST, message, null);
    }

    public DeserializationException(String message, Throwable cause) {
        super(SC_BAD_REQUEST, message, cause);
    }
}
