/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw;

import ai.asserts.prw.controller.RemoteWriteServlet;
import ai.asserts.prw.ingest.IngestCounters;
import ai.asserts.prw.ingest.RemoteWriteIngestor;
import io.prometheus.client.CollectorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
@SuppressWarnings("unused")
public class BeanConfiguration {
    @Bean
    public IngestCounters ingestCounters(ReceiverConfig receiverConfig, CollectorRegistry collectorRegistry) {
        IngestCounters ingestCounters = new IngestCounters(receiverConfig.getRollingWindowSeconds());
        collectorRegistry.register(ingestCounters);
        return ingestCounters;
    }

    @Bean
    public ServletRegistrationBean<RemoteWriteServlet> remoteWriteServlet(RemoteWriteIngestor ingestor,
                                                                          ReceiverConfig receiverConfig) {
        log.info("Receiving remote write requests at {}", receiverConfig.getListenPath());
        return new ServletRegistrationBean<>(new RemoteWriteServlet(ingestor), receiverConfig.getListenPath());
    }
}
