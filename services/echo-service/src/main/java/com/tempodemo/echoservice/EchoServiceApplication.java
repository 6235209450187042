package com.tempodemo.echoservice;

import com.tempodemo.echoservice.config.EchoServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Echo service: the upstream behind the proxy. {@code GET /test} prints the request headers it
 * received, including the {@code x-user-info} header injected after authorization.
 */
@SpringBootApplication
@EnableConfigurationProperties(EchoServiceProperties.class)
public class EchoServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(EchoServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EchoServiceApplication.class, args);
        log.info("Echo service started");
    }
}
