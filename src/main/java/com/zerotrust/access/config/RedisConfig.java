package com.zerotrust.access.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zerotrust.access.stepup.StepUpChallenge;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for step-up challenges. Values are plain JSON (no @class)
 * written with the same mapper as the Kafka payloads, so instants are ISO-8601 strings.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, StepUpChallenge> stepUpChallengeRedisTemplate(
            RedisConnectionFactory connectionFactory,
            @Qualifier("zeroTrustKafkaObjectMapper") ObjectMapper objectMapper) {
        RedisTemplate<String, StepUpChallenge> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new Jackson2JsonRedisSerializer<>(objectMapper, StepUpChallenge.class));
        template.afterPropertiesSet();
        return template;
    }
}
