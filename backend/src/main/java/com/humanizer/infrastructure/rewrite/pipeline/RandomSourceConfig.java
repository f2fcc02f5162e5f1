package com.humanizer.infrastructure.rewrite.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Slf4j
@Configuration
public class RandomSourceConfig {

    @Value("${humanizer.random.seed:#{null}}")
    private Long seed;

    @Bean
    public Random randomSource() {
        if (seed != null) {
            log.info("[Random] Seeded random source: {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
