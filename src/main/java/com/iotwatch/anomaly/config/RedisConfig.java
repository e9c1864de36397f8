package com.iotwatch.anomaly.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotwatch.anomaly.model.WindowSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis wiring for the window hot cache. Only active with {@code pipeline.sinks.redis-enabled=true};
 * the connection itself comes from the {@code spring.data.redis.*} settings.
 */
@Configuration
@ConditionalOnProperty(name = "pipeline.sinks.redis-enabled", havingValue = "true")
public class RedisConfig {

    /**
     * Template keyed by {@code window:...} strings holding {@link WindowSnapshot} JSON, written
     * with the application mapper so instants stay ISO-8601.
     */
    @Bean
    public RedisTemplate<String, WindowSnapshot> windowCacheTemplate(RedisConnectionFactory connectionFactory,
                                                                     ObjectMapper objectMapper) {
        RedisTemplate<String, WindowSnapshot> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(windowSerializer(objectMapper));
        return template;
    }

    static Jackson2JsonRedisSerializer<WindowSnapshot> windowSerializer(ObjectMapper objectMapper) {
        return new Jackson2JsonRedisSerializer<>(objectMapper, WindowSnapshot.class);
    }
}
