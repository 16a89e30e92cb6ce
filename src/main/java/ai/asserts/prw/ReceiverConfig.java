/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Settings of the remote-write endpoint. The listen address and port are the web server's
 * ({@code server.address}, {@code server.port}).
 */
@Component
@Getter
public class ReceiverConfig {
    private final String listenPath;
    private final long timeoutMillis;
    private final long rollingWindowSeconds;

    public ReceiverConfig(@Value("${prw_receiver.listen_path:/write}") String listenPath,
                          @Value("${prw_receiver.timeout_millis:30000}") long timeoutMillis,
                          @Value("${prw_receiver.rolling_window_seconds:60}") long rollingWindowSeconds) {
        if (!listenPath.startsWith("/")) {
            listenPath = "/" + listenPath;
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("prw_receiver.timeout_millis must be positive: " + timeoutMillis);
        }
        if (rollingWindowSeconds <= 0) {
            throw new IllegalArgumentException(
                    "prw_receiver.rolling_window_seconds must be positive: " + rollingWindowSeconds);
        }
        this.listenPath = listenPath;
        this.timeoutMillis = timeoutMillis;
        this.rollingWindowSeconds = rollingWindowSeconds;
    }
}
