package com.flow.discovery.service.api.health;

import com.flow.discovery.service.engine.LruCache;
import com.flow.discovery.service.engine.MiningCache;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the mining cache.
 *
 * Reports size, hit rate and evictions of every region. Always up: a full
 * cache only evicts.
 */
@Component
@RequiredArgsConstructor
public class MiningCacheHealthIndicator implements HealthIndicator {

    private final MiningCache cache;

    @Override
    public Health health() {
        Health.Builder builder = Health.up()
                .withDetail("totalEntries", cache.size());

        for (LruCache<?, ?> region : cache.regions()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("size", region.size());
            details.put("maxEntries", region.getMaxEntries());
            details.put("hitRate", region.getHitRate());
            details.put("evictions", region.getEvictions());
            builder.withDetail(region.getName(), details);
        }
        return builder.build();
    }
}
