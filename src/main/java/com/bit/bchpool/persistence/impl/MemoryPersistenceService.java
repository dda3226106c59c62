package com.bit.bchpool.persistence.impl;

import com.bit.bchpool.persistence.BlockRecord;
import com.bit.bchpool.persistence.Miner;
import com.bit.bchpool.persistence.PersistenceService;
import com.bit.bchpool.persistence.ShareRecord;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * 内存存储，进程重启后数据丢失
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "pool.persistence", name = "type", havingValue = "MEMORY", matchIfMissing = true)
public class MemoryPersistenceService implements PersistenceService {

    // 只保留最近的份额明细，总数单独计数
    private static final int RECENT_SHARE_CAPACITY = 10_000;

    private final ConcurrentHashMap<String, Miner> miners = new ConcurrentHashMap<>();
    private final EvictingQueue<ShareRecord> recentShares = EvictingQueue.create(RECENT_SHARE_CAPACITY);
    private final List<BlockRecord> blocks = new CopyOnWriteArrayList<>();
    private final AtomicLong minerIdGenerator = new AtomicLong();
    private final LongAdder shareCount = new LongAdder();

    @Override
    public Miner registerMiner(String address, String workerName) {
        long now = System.currentTimeMillis();
        return miners.compute(address, (key, existing) -> {
            if (existing == null) {
                Miner miner = new Miner();
                miner.setId(minerIdGenerator.incrementAndGet());
                miner.setAddress(address);
                miner.setWorkerName(workerName);
                miner.setCreatedAt(now);
                miner.setLastSeen(now);
                log.info("新矿工注册: {}, 矿机: {}", address, workerName);
                return miner;
            }
            existing.setWorkerName(workerName);
            existing.setLastSeen(now);
            return existing;
        });
    }

    @Override
    public Miner getMinerByAddress(String address) {
        return miners.get(address);
    }

    @Override
    public boolean setMinerActive(String address, boolean active) {
        Miner miner = miners.computeIfPresent(address, (key, existing) -> {
            existing.setActive(active);
            return existing;
        });
        return miner != null;
    }

    @Override
    public void saveShare(ShareRecord share) {
        synchronized (recentShares) {
            recentShares.add(share);
        }
        shareCount.increment();
        if (share.isAccepted()) {
            miners.computeIfPresent(share.getMinerAddress(), (key, miner) -> {
                miner.setAcceptedShares(miner.getAcceptedShares() + 1);
                miner.setLastSeen(share.getCreatedAt());
                return miner;
            });
        }
    }

    @Override
    public void saveBlock(long height, String hash, String minerAddress) {
        blocks.add(new BlockRecord(height, hash, minerAddress, System.currentTimeMillis()));
        miners.computeIfPresent(minerAddress, (key, miner) -> {
            miner.setBlocksFound(miner.getBlocksFound() + 1);
            return miner;
        });
        log.info("区块已记录: 高度{}, 哈希{}, 矿工{}", height, hash, minerAddress);
    }

    @Override
    public List<Miner> listMiners() {
        return new ArrayList<>(miners.values());
    }

    @Override
    public List<BlockRecord> listBlocks(int limit) {
        List<BlockRecord> result = new ArrayList<>(blocks);
        Collections.reverse(result);
        return result.subList(0, Math.min(Math.max(limit, 0), result.size()));
    }

    @Override
    public long countShares() {
        return shareCount.sum();
    }

    @Override
    public long countBlocks() {
        return blocks.size();
    }
}
