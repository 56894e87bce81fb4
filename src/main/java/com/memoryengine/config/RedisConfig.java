package com.memoryengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the live value store.
 *
 * <p>Values are JSON via {@link GenericJackson2JsonRedisSerializer}. Live records carry
 * epoch-millisecond timestamps, so no JSR-310 module is needed.
 *
 * <p>Key schema (the Redis server is shared with the sampling runtime):
 * <pre>
 *   mem:point:{guid}   → PointSample JSON (written by the runtime, value updated by IF memory outputs)
 *   mem:gv:{name}      → GlobalVariableValue JSON (present only while the variable is enabled)
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "mem:";

    public static final String KEY_PREFIX_POINT = KEY_PREFIX + "point:";
    public static final String KEY_PREFIX_GLOBAL_VARIABLE = KEY_PREFIX + "gv:";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
