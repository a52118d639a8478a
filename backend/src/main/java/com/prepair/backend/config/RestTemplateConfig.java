package com.prepair.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate for model server calls, with explicit timeouts so a hung
 * model server cannot pin evaluation threads.
 */
@Configuration
@RequiredArgsConstructor
public class RestTemplateConfig {

    private final OllamaProperties ollamaProperties;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(ollamaProperties.getConnectTimeout())
                .setReadTimeout(ollamaProperties.getReadTimeout())
                .build();
    }
}
