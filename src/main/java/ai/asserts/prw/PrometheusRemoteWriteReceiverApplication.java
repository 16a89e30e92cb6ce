/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = {"ai.asserts.prw"})
public class PrometheusRemoteWriteReceiverApplication {
    public static void main(String[] args) {
        SpringApplication.run(PrometheusRemoteWriteReceiverApplication.class, args);
    }
}
