package com.tripmate.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "app.bootstrap.superadmin")
public record SuperAdminBootstrapProperties(
        String email,
        String password,
        @DefaultValue("Super Admin") String name,
        @DefaultValue("0000000000") String phone
) {

    public boolean isConfigured() {
        return StringUtils.hasText(email) && StringUtils.hasText(password);
    }
}
