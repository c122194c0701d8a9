package com.example.reelbot_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Duration;

/**
 * Progress streams are served as async MVC responses. The async timeout must outlast
 * {@code progress.max-session} plus one provider sync, otherwise the container cuts the stream
 * before the broadcaster can send its final snapshot.
 */
@Configuration
@EnableConfigurationProperties({ProgressProperties.class, ProviderProperties.class})
public class ProgressStreamConfig implements WebMvcConfigurer {
    private final ProgressProperties progress;
    private final ProviderProperties provider;

    public ProgressStreamConfig(ProgressProperties progress, ProviderProperties provider) {
        this.progress = progress;
        this.provider = provider;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setDefaultTimeout(streamTimeout().toMillis());
    }

    Duration streamTimeout() {
        Duration slack = Duration.ofSeconds(Math.max(1, provider.getTimeoutSeconds()))
                .plus(progress.getTick())
                .plusSeconds(5);
        return progress.getMaxSession().plus(slack);
    }
}
