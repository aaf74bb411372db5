package io.github.drompincen.crewflow.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.crewflow.runtime.context.ProjectSnapshotProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RuntimeConfig {

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    /** Empty snapshot until a project data source is plugged in. */
    @Bean
    @ConditionalOnMissingBean
    ProjectSnapshotProvider projectSnapshotProvider(ObjectMapper objectMapper) {
        return (projectId, agentId) -> objectMapper.createObjectNode();
    }
}
