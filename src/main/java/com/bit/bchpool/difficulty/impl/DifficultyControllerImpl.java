package com.bit.bchpool.difficulty.impl;

import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.difficulty.DifficultyChangedEvent;
import com.bit.bchpool.difficulty.DifficultyController;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

@Slf4j
@Service
public class DifficultyControllerImpl implements DifficultyController {

    // ==================== 核心配置参数 ====================
    private static final long MINUTE_MILLIS = 60_000L;
    private static final long HOUR_MILLIS = 60 * MINUTE_MILLIS;
    // 统计数据保留24小时
    private static final long RETENTION_MILLIS = 24 * HOUR_MILLIS;
    // 每个矿工最多保留的份额时间戳
    private static final int MAX_MINER_SAMPLES = 1000;
    // 难度1的份额平均需要 2^32 次哈希
    private static final double HASHES_PER_DIFF1_SHARE = 4294967296.0;

    private final PoolConfig.Difficulty settings;
    private final ApplicationEventPublisher eventPublisher;

    // 全池已接受份额时间戳（毫秒），按到达顺序
    private final ConcurrentLinkedDeque<Long> shareTimes = new ConcurrentLinkedDeque<>();
    // 矿工地址 -> 最近份额时间戳，空闲一天后过期
    private final Cache<String, EvictingQueue<Long>> minerShareTimes;

    private final LongAdder totalShares = new LongAdder();
    private final LongAdder adjustmentCount = new LongAdder();

    private volatile double currentDifficulty;
    private volatile long lastAdjustTime;
    private Clock clock = Clock.systemUTC();

    @Autowired
    public DifficultyControllerImpl(PoolConfig config, ApplicationEventPublisher eventPublisher) {
        this.settings = config.getDifficulty();
        this.eventPublisher = eventPublisher;
        this.currentDifficulty = clamp(settings.getInitial(), settings.getMin(), settings.getMax());
        this.minerShareTimes = Caffeine.newBuilder()
                .maximumSize(100_000)
                .expireAfterAccess(1, TimeUnit.DAYS)
                .build();
        log.info("难度控制器初始化: 初始难度={}, 范围=[{}, {}], 目标{}份额/分钟, 动态调整={}",
                currentDifficulty, settings.getMin(), settings.getMax(),
                settings.getTargetSharesPerMinute(), settings.isDynamic());
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void recordShare(String minerAddress) {
        recordShare(minerAddress, clock.millis());
    }

    @Override
    public void recordShare(String minerAddress, long timestampMillis) {
        shareTimes.addLast(timestampMillis);
        totalShares.increment();
        if (minerAddress != null) {
            EvictingQueue<Long> times = minerShareTimes.get(minerAddress, k -> EvictingQueue.create(MAX_MINER_SAMPLES));
            synchronized (times) {
                times.add(timestampMillis);
            }
        }
        trimOlderThan(clock.millis() - HOUR_MILLIS);
    }

    @Override
    public double recompute() {
        double current = currentDifficulty;
        if (!settings.isDynamic()) {
            return current;
        }
        int sharesLastHour = getSharesLastHour();
        if (sharesLastHour < settings.getMinSamples()) {
            log.debug("样本不足，保持难度{}: 最近一小时{}个份额", current, sharesLastHour);
            return current;
        }
        double ratio = (sharesLastHour / 60.0) / settings.getTargetSharesPerMinute();
        double candidate = current * Math.sqrt(ratio);

        double factor = settings.getMaxChangeFactor();
        candidate = clamp(candidate, current / factor, current * factor);
        return clamp(candidate, settings.getMin(), settings.getMax());
    }

    @Override
    public boolean apply() {
        double previous = currentDifficulty;
        double next = recompute();
        if (Math.abs(next - previous) / previous < settings.getMinRelativeChange()) {
            log.debug("难度变化不足{}%，跳过: {} -> {}", settings.getMinRelativeChange() * 100, previous, next);
            return false;
        }
        currentDifficulty = next;
        lastAdjustTime = clock.millis();
        adjustmentCount.increment();
        log.info("矿池难度调整: {} -> {}, 最近一小时份额: {}", previous, next, getSharesLastHour());
        eventPublisher.publishEvent(new DifficultyChangedEvent(previous, next));
        return true;
    }

    @Override
    public double getCurrentDifficulty() {
        return currentDifficulty;
    }

    @Override
    public void setCurrentDifficulty(double difficulty) {
        double previous = currentDifficulty;
        currentDifficulty = clamp(difficulty, settings.getMin(), settings.getMax());
        if (previous != currentDifficulty) {
            log.info("矿池难度手动设置: {} -> {}", previous, currentDifficulty);
            eventPublisher.publishEvent(new DifficultyChangedEvent(previous, currentDifficulty));
        }
    }

    @Override
    public int getSharesLastHour() {
        return countSince(clock.millis() - HOUR_MILLIS);
    }

    @Override
    public int getSharesLastMinute() {
        return countSince(clock.millis() - MINUTE_MILLIS);
    }

    private int countSince(long since) {
        int count = 0;
        Iterator<Long> it = shareTimes.descendingIterator();
        while (it.hasNext()) {
            if (it.next() < since) {
                break;
            }
            count++;
        }
        return count;
    }

    private void trimOlderThan(long since) {
        Long head;
        while ((head = shareTimes.peekFirst()) != null && head < since) {
            shareTimes.pollFirst();
        }
    }

    /**
     * 算力 = 难度 × 2^32 / 平均出份额间隔
     */
    @Override
    public double getMinerHashrate(String minerAddress) {
        EvictingQueue<Long> times = minerShareTimes.getIfPresent(minerAddress);
        if (times == null) {
            return 0;
        }
        List<Long> samples;
        synchronized (times) {
            samples = new ArrayList<>(times);
        }
        long since = clock.millis() - HOUR_MILLIS;
        samples.removeIf(t -> t < since);
        if (samples.size() < 2) {
            return 0;
        }
        double intervalSeconds = (samples.get(samples.size() - 1) - samples.get(0)) / 1000.0 / (samples.size() - 1);
        if (intervalSeconds <= 0) {
            return 0;
        }
        return currentDifficulty * HASHES_PER_DIFF1_SHARE / intervalSeconds;
    }

    @Override
    public double getPoolHashrate() {
        double total = 0;
        for (String miner : minerShareTimes.asMap().keySet()) {
            total += getMinerHashrate(miner);
        }
        return total;
    }

    @Override
    public int cleanupOldData() {
        long since = clock.millis() - RETENTION_MILLIS;
        int removed = 0;
        for (Map.Entry<String, EvictingQueue<Long>> entry : minerShareTimes.asMap().entrySet()) {
            EvictingQueue<Long> times = entry.getValue();
            boolean empty;
            synchronized (times) {
                int before = times.size();
                times.removeIf(t -> t < since);
                removed += before - times.size();
                empty = times.isEmpty();
            }
            if (empty) {
                minerShareTimes.invalidate(entry.getKey());
            }
        }
        trimOlderThan(clock.millis() - HOUR_MILLIS);
        if (removed > 0) {
            log.info("清理过期份额统计{}条", removed);
        }
        return removed;
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("currentDifficulty", currentDifficulty);
        stats.put("minDifficulty", settings.getMin());
        stats.put("maxDifficulty", settings.getMax());
        stats.put("targetSharesPerMinute", settings.getTargetSharesPerMinute());
        stats.put("sharesLastMinute", getSharesLastMinute());
        stats.put("sharesLastHour", getSharesLastHour());
        stats.put("totalShares", totalShares.sum());
        stats.put("adjustments", adjustmentCount.sum());
        stats.put("lastAdjustTime", lastAdjustTime);
        stats.put("trackedMiners", minerShareTimes.estimatedSize());
        stats.put("dynamic", settings.isDynamic());
        return stats;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
