/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.controller;

import ai.asserts.prw.RemoteWriteException;
import ai.asserts.prw.ingest.IngestResult;
import ai.asserts.prw.ingest.RemoteWriteIngestor;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteSource;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;

/**
 * Endpoint for the Prometheus remote-write protocol. See
 * https://prometheus.io/docs/concepts/remote_write_spec/ for the request format. Prometheus uses POST, PUT is
 * accepted too. Registered at the configured listen path by the bean configuration.
 */
@AllArgsConstructor
@Slf4j
public class RemoteWriteServlet extends HttpServlet {
    private final RemoteWriteIngestor ingestor;

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        doPutDoPost(req, resp);
    }

    @Override
    protected void doPut(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        doPutDoPost(req, resp);
    }

    private void doPutDoPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        try {
            IngestResult result = ingestor.ingest(requestBody(req));
            log.debug("Processed remote write request {}", result);
            resp.setStatus(HttpServletResponse.SC_OK);
        } catch (RemoteWriteException e) {
            resp.sendError(e.getStatus(), e.getMessage());
        }
    }

    @VisibleForTesting
    ByteSource requestBody(HttpServletRequest req) {
        return new ByteSource() {
            @Override
            public InputStream openStream() throws IOException {
                return req.getInputStream();
            }
        };
    }
}
