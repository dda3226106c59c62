package com.bit.bchpool.share;

import com.bit.bchpool.config.PoolConfig;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按任务记录已使用的nonce，每个任务容量固定，超出时淘汰最早的记录
 */
@Slf4j
@Component
public class NonceTracker {

    private final ConcurrentHashMap<String, JobNonces> usedNonces = new ConcurrentHashMap<>();

    private final int maxNoncesPerJob;

    @Autowired
    public NonceTracker(PoolConfig config) {
        this.maxNoncesPerJob = config.getJob().getMaxNoncesPerJob();
    }

    /**
     * 原子地检查并登记 (jobId, nonce)
     * @return 首次出现返回true，重复返回false
     */
    public boolean markUsed(String jobId, String nonce) {
        JobNonces nonces = usedNonces.computeIfAbsent(jobId, id -> new JobNonces(maxNoncesPerJob));
        return nonces.add(nonce.toLowerCase(Locale.ROOT));
    }

    /**
     * 任务移除时一并丢弃
     */
    public void dropJob(String jobId) {
        usedNonces.remove(jobId);
    }

    public int trackedJobs() {
        return usedNonces.size();
    }

    public int trackedNonces(String jobId) {
        JobNonces nonces = usedNonces.get(jobId);
        return nonces == null ? 0 : nonces.size();
    }

    // 环形队列记录顺序，集合负责O(1)查重
    private static final class JobNonces {
        private final EvictingQueue<String> order;
        private final Set<String> seen = new HashSet<>();

        JobNonces(int capacity) {
            this.order = EvictingQueue.create(capacity);
        }

        synchronized boolean add(String nonce) {
            if (seen.contains(nonce)) {
                return false;
            }
            if (order.remainingCapacity() == 0) {
                seen.remove(order.peek());
            }
            order.add(nonce);
            seen.add(nonce);
            return true;
        }

        synchronized int size() {
            return seen.size();
        }
    }
}
