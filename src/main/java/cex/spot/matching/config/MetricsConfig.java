package cex.spot.matching.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics configuration
 * Adds the service name as a common tag on every matching meter
 */
@Slf4j
@Configuration
public class MetricsConfig {

    @Value("${spring.application.name:spot-matching-engine}")
    private String applicationName;

    @Bean
    public MeterBinder commonTagsBinder() {
        List<Tag> commonTags = List.of(
            Tag.of("service", applicationName),
            Tag.of("component", "matching-engine")
        );
        return (MeterRegistry registry) -> {
            registry.config().commonTags(commonTags);
            log.info("Registered common metric tags: {}", commonTags);
        };
    }
}
