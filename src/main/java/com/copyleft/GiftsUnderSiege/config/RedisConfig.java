package com.copyleft.GiftsUnderSiege.config;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, GameSession> gameSessionRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                       ObjectMapper objectMapper) {
        RedisTemplate<String, GameSession> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        Jackson2JsonRedisSerializer<GameSession> valueSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, GameSession.class);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(valueSerializer);
        template.afterPropertiesSet();

        return template;
    }
}
