package com.tempodemo.echoservice.config;

import com.tempodemo.echoservice.domain.ResponseDelay;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the {@code /test} pause from {@code tempo.echo.max-delay}. */
@Configuration
public class EchoConfig {

    @Bean
    public ResponseDelay responseDelay(EchoServiceProperties properties) {
        return new ResponseDelay(properties.echo().maxDelay(), new Random());
    }
}
