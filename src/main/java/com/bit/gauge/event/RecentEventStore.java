package com.bit.gauge.event;

import com.bit.gauge.config.SystemConfig;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 近期事件存储：监听引擎发布的事件，记录日志并保存最近 capacity 条
 *
 * 每条事件按递增序号写入缓存，写入后立即删除序号 <= latest - capacity 的条目，
 * 缓存中始终是连续的最新一段。
 */
@Slf4j
@Component
public class RecentEventStore {

    private final Cache<Long, GaugeEvent> cache;
    private final int capacity;
    // 最新事件的序号，0 表示还没有事件
    private long latest;

    public RecentEventStore(Cache<Long, GaugeEvent> recentEventCache, SystemConfig config) {
        this.cache = recentEventCache;
        this.capacity = config.getEventCacheSize();
    }

    @EventListener
    public synchronized void onEvent(GaugeEvent event) {
        log.info("事件 {} pool={} participant={} amount={}",
                event.getType(), event.getPoolId(), event.getParticipant(), event.getAmount());
        latest++;
        cache.put(latest, event);
        cache.invalidate(latest - capacity);
    }

    /**
     * 最近的事件，新事件在前
     */
    public synchronized List<GaugeEvent> recent(int limit) {
        int count = (int) Math.min(Math.min(Math.max(limit, 0), capacity), latest);
        List<GaugeEvent> result = new ArrayList<>(count);
        for (long seq = latest; seq > latest - count; seq--) {
            GaugeEvent event = cache.getIfPresent(seq);
            if (event != null) {
                result.add(event);
            }
        }
        return result;
    }
}
