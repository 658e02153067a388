package com.example.baselinediff.config;

import com.example.baselinediff.repository.support.BatchQueryPlanner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA configuration.
 *
 * Enables auditing for created_at/updated_at and exposes the batch planner
 * used by the native-SQL repository fragments.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {

    @Bean
    public BatchQueryPlanner batchQueryPlanner(BaselineProperties properties) {
        return new BatchQueryPlanner(properties.getStorage().getBatchSize());
    }
}
