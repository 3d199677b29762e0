package com.poc.xlstaging.config;

import com.poc.xlstaging.dto.RoutingConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StagingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Default routing for uploads; callers may override per request with {@link RoutingConfig#toBuilder()}.
     */
    @Bean
    public RoutingConfig routingConfig(@Value("${xl.staging.auto-confirm:false}") boolean autoConfirm,
                                       @Value("${xl.staging.persist-staging-artifact:true}") boolean persistStagingArtifact,
                                       @Value("${xl.staging.full-field-overwrite:false}") boolean fullFieldOverwrite) {
        return RoutingConfig.builder()
                .autoConfirm(autoConfirm)
                .persistStagingArtifact(persistStagingArtifact)
                .fullFieldOverwrite(fullFieldOverwrite)
                .build();
    }
}
