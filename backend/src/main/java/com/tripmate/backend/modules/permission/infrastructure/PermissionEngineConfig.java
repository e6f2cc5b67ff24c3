package com.tripmate.backend.modules.permission.infrastructure;

import com.tripmate.backend.modules.permission.application.PermissionEngine;
import com.tripmate.backend.modules.permission.infrastructure.persistence.RelationTupleRepository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PermissionEngineConfig {

    @Bean
    @ConditionalOnProperty(name = "app.permissions.enabled", havingValue = "true", matchIfMissing = true)
    public PermissionEngine relationTuplePermissionEngine(RelationTupleRepository relationTupleRepository) {
        return new RelationTuplePermissionEngine(relationTupleRepository);
    }

    @Bean
    @ConditionalOnProperty(name = "app.permissions.enabled", havingValue = "false")
    public PermissionEngine disabledPermissionEngine() {
        return new DisabledPermissionEngine();
    }
}
