package com.tripmate.backend.global.config;

import java.net.URI;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Builds the Redis connection from {@link CacheProperties} instead of Boot's implicit
 * {@code spring.data.redis.*} binding, so the short command timeout the auth core relies on is set
 * in one place. Spring starts and destroys the factory with the context.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    private static final int DEFAULT_PORT = 6379;

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(CacheProperties properties) {
        URI uri = URI.create(properties.url());
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(
                uri.getHost(),
                uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT
        );
        applyCredentials(standalone, uri.getUserInfo());
        String path = uri.getPath();
        if (path != null && path.length() > 1) {
            standalone.setDatabase(Integer.parseInt(path.substring(1)));
        }

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(SocketOptions.builder().connectTimeout(properties.connectTimeout()).build())
                .build();
        LettuceClientConfiguration.LettuceClientConfigurationBuilder clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(properties.commandTimeout())
                .clientOptions(clientOptions);
        if ("rediss".equalsIgnoreCase(uri.getScheme())) {
            clientConfig.useSsl();
        }
        return new LettuceConnectionFactory(standalone, clientConfig.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    private static void applyCredentials(RedisStandaloneConfiguration standalone, String userInfo) {
        if (userInfo == null || userInfo.isEmpty()) {
            return;
        }
        int separator = userInfo.indexOf(':');
        if (separator < 0) {
            standalone.setPassword(RedisPassword.of(userInfo));
            return;
        }
        String username = userInfo.substring(0, separator);
        if (!username.isEmpty()) {
            standalone.setUsername(username);
        }
        standalone.setPassword(RedisPassword.of(userInfo.substring(separator + 1)));
    }
}
