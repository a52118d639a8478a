package com.prepair.backend.service.provider;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class GenerationOptions {

    // yes/no judgements
    public static final GenerationOptions DETERMINISTIC = GenerationOptions.builder()
            .temperature(0.0)
            .maxOutputTokens(10)
            .build();

    private final double temperature;
    private final Integer maxOutputTokens;
    private final boolean jsonFormat;

    public static GenerationOptions prose(int maxOutputTokens) {
        return GenerationOptions.builder()
                .temperature(0.7)
                .maxOutputTokens(maxOutputTokens)
                .jsonFormat(true)
                .build();
    }
}
