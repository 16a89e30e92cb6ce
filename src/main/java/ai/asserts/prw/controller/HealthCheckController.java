/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.controller;

import ai.asserts.prw.ReceiverConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.http.MediaType.TEXT_PLAIN_VALUE;

/**
 * Reports the receiver healthy until the application context starts closing, then answers 503 so load
 * balancers stop sending remote-write traffic.
 */
@RestController
@Slf4j
public class HealthCheckController implements ApplicationListener<ContextClosedEvent> {
    private final String listenPath;
    private volatile boolean closed;

    public HealthCheckController(ReceiverConfig receiverConfig) {
        this.listenPath = receiverConfig.getListenPath();
    }

    @GetMapping(
            path = "/health-check",
            produces = {TEXT_PLAIN_VALUE}
    )
    public ResponseEntity<String> healthCheck() {
        if (closed) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Receiver at " + listenPath + " is shutting down");
        }
        return ResponseEntity.ok("Healthy! Receiving remote write requests at " + listenPath);
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        closed = true;
        log.info("Health check reports receiver at {} as closed", listenPath);
    }

    public boolean isClosed() {
        return closed;
    }
}
