package com.bit.gauge.config;

import com.bit.gauge.event.GaugeEvent;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class CommonConfig {

    @Autowired
    private SystemConfig config;

    @PostConstruct
    public void init() {
        if (config.getAccumulatorScale() <= 0 || config.getEmissionWindowSeconds() <= 0) {
            throw new IllegalStateException("累加器精度与排放窗口必须为正数");
        }
        if (config.getEventCacheSize() <= 0) {
            throw new IllegalStateException("eventCacheSize 必须为正数: " + config.getEventCacheSize());
        }
        if (config.getBoostBasePercent() < 0 || config.getBoostBasePercent() > 100) {
            throw new IllegalStateException("boostBasePercent 必须在 0~100 之间: " + config.getBoostBasePercent());
        }
        log.info("引擎配置加载完成，治理者: {}, 托管账户: {}, 奖励资产: {}",
                config.governorAddress(), config.custodyAddress(), config.rewardAssetId());
        log.info("累加器精度: {}, 排放窗口: {}秒, 基础质押占比: {}%",
                config.getAccumulatorScale(), config.getEmissionWindowSeconds(), config.getBoostBasePercent());
    }

    /**
     * 引擎时间源（epoch秒），测试中替换为可拨动的时钟
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 近期事件缓存：序号 -> 事件
     * 容量由 RecentEventStore 按序号截断维护，不交给 Caffeine 的按频率淘汰
     */
    @Bean
    public Cache<Long, GaugeEvent> recentEventCache() {
        return Caffeine.newBuilder()
                .initialCapacity(Math.min(config.getEventCacheSize(), 1024))
                .build();
    }
}
