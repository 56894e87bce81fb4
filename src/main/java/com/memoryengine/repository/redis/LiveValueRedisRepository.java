package com.memoryengine.repository.redis;

import com.memoryengine.config.RedisConfig;
import com.memoryengine.domain.model.GlobalVariableValue;
import com.memoryengine.domain.model.PointSample;
import com.memoryengine.ifmemory.LiveValueStore;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis-backed {@link LiveValueStore}.
 *
 * <p>Point samples are produced by the sampling runtime; this service only overwrites
 * the value of existing output points. Global-variable records are created and removed
 * by GlobalVariableService and updated by IF memory outputs and manual writes.
 */
@Repository
@RequiredArgsConstructor
public class LiveValueRedisRepository implements LiveValueStore {

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public Optional<PointSample> findPoint(String pointId) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_POINT + pointId);
        return Optional.ofNullable((PointSample) value);
    }

    @Override
    public boolean writePoint(String pointId, double value) {
        Optional<PointSample> existing = findPoint(pointId);
        if (existing.isEmpty()) {
            return false;
        }
        PointSample sample = existing.get();
        sample.setValue(value);
        sample.setSampledAtEpochMs(System.currentTimeMillis());
        redisTemplate.opsForValue().set(RedisConfig.KEY_PREFIX_POINT + pointId, sample);
        return true;
    }

    @Override
    public Optional<GlobalVariableValue> findGlobalVariable(String name) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_GLOBAL_VARIABLE + name);
        return Optional.ofNullable((GlobalVariableValue) value);
    }

    @Override
    public void saveGlobalVariable(GlobalVariableValue value) {
        redisTemplate.opsForValue().set(RedisConfig.KEY_PREFIX_GLOBAL_VARIABLE + value.getName(), value);
    }

    @Override
    public void deleteGlobalVariable(String name) {
        redisTemplate.delete(RedisConfig.KEY_PREFIX_GLOBAL_VARIABLE + name);
    }
}
