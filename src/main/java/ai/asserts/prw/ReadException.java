/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw;

import static javax.servlet.http.HttpServletResponse.SC_INTERNAL_SERVER_ERROR;

public class ReadException extends RemoteWriteException {
    public ReadException(String message) {
        super(SC_INTERNAL_SERVER_ERROR, message, null);
    }

    public ReadException(String message, Throwable cause) {
        super(SC_INTERNAL_SERVER_ERROR, message, cause);
    }
}
