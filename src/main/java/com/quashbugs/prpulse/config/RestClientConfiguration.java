package com.quashbugs.prpulse.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfiguration {

    @Value("${spring.http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${spring.http.read-timeout-ms:15000}")
    private long readTimeoutMs;

    // every provider call goes through this template, so no call can hang a schedule run
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
