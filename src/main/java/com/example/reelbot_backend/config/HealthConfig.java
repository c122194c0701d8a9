package com.example.reelbot_backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator generationProviderHealth(@Qualifier("providerWebClient") WebClient provider) {
        return () -> {
            try {
                // any HTTP answer means the queue host is reachable
                provider.head().uri("/")
                        .exchangeToMono(resp -> resp.releaseBody().thenReturn(resp.statusCode().value()))
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("provider", "reachable").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("provider", "unreachable").build();
            }
        };
    }
}
