package com.bit.bchpool.persistence.impl;

import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.database.DataBase;
import com.bit.bchpool.database.rocksDb.RocksDb;
import com.bit.bchpool.database.rocksDb.TableEnum;
import com.bit.bchpool.exception.ErrorType;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.persistence.BlockRecord;
import com.bit.bchpool.persistence.Miner;
import com.bit.bchpool.persistence.PersistenceService;
import com.bit.bchpool.persistence.ShareRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Longs;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RocksDB 存储：MINER / SHARE / BLOCK 三个列族，值为JSON
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "pool.persistence", name = "type", havingValue = "ROCKSDB")
public class RocksDbPersistenceService implements PersistenceService {

    private final String path;
    private final ObjectMapper objectMapper;
    private final DataBase dataBase = new RocksDb();

    private final Object minerLock = new Object();
    private final AtomicLong minerIdGenerator = new AtomicLong();
    // 同一毫秒内的份额用序号区分
    private final AtomicLong shareSequence = new AtomicLong();
    private final AtomicLong shareCount = new AtomicLong();
    private final AtomicLong blockCount = new AtomicLong();

    @Autowired
    public RocksDbPersistenceService(PoolConfig config, ObjectMapper objectMapper) {
        this.path = config.getPersistence().getPath();
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        log.info("持久化数据路径:{}", path);
        if (!dataBase.createDatabase(path)) {
            throw new PoolException(ErrorType.PERSISTENCE_FAILED, "数据库创建失败: " + path);
        }
        long[] maxId = {0};
        dataBase.iterate(TableEnum.MINER, false, (key, value) -> {
            maxId[0] = Math.max(maxId[0], read(value, Miner.class).getId());
            return true;
        });
        minerIdGenerator.set(maxId[0]);
        shareCount.set(dataBase.count(TableEnum.SHARE));
        blockCount.set(dataBase.count(TableEnum.BLOCK));
        log.info("持久化数据加载完成: 矿工{}个, 份额{}条, 区块{}个", maxId[0], shareCount.get(), blockCount.get());
    }

    @PreDestroy
    public void shutdown() {
        dataBase.closeDatabase();
    }

    @Override
    public Miner registerMiner(String address, String workerName) {
        long now = System.currentTimeMillis();
        synchronized (minerLock) {
            Miner miner = getMinerByAddress(address);
            if (miner == null) {
                miner = new Miner();
                miner.setId(minerIdGenerator.incrementAndGet());
                miner.setAddress(address);
                miner.setCreatedAt(now);
                log.info("新矿工注册: {}, 矿机: {}", address, workerName);
            }
            miner.setWorkerName(workerName);
            miner.setLastSeen(now);
            putMiner(miner);
            return miner;
        }
    }

    @Override
    public Miner getMinerByAddress(String address) {
        byte[] value = dataBase.get(TableEnum.MINER, minerKey(address));
        return value == null ? null : read(value, Miner.class);
    }

    @Override
    public boolean setMinerActive(String address, boolean active) {
        synchronized (minerLock) {
            Miner miner = getMinerByAddress(address);
            if (miner == null) {
                return false;
            }
            miner.setActive(active);
            putMiner(miner);
            log.info("矿工{}状态更新为{}", address, active ? "启用" : "停用");
            return true;
        }
    }

    @Override
    public void saveShare(ShareRecord share) {
        byte[] key = Longs.toByteArray(share.getCreatedAt());
        key = Bytes.concat(key, Longs.toByteArray(shareSequence.incrementAndGet()));
        dataBase.insert(TableEnum.SHARE, key, write(share));
        shareCount.incrementAndGet();
        if (share.isAccepted()) {
            synchronized (minerLock) {
                Miner miner = getMinerByAddress(share.getMinerAddress());
                if (miner != null) {
                    miner.setAcceptedShares(miner.getAcceptedShares() + 1);
                    miner.setLastSeen(share.getCreatedAt());
                    putMiner(miner);
                }
            }
        }
    }

    @Override
    public void saveBlock(long height, String hash, String minerAddress) {
        BlockRecord block = new BlockRecord(height, hash, minerAddress, System.currentTimeMillis());
        dataBase.insert(TableEnum.BLOCK, Longs.toByteArray(height), write(block));
        blockCount.incrementAndGet();
        synchronized (minerLock) {
            Miner miner = getMinerByAddress(minerAddress);
            if (miner != null) {
                miner.setBlocksFound(miner.getBlocksFound() + 1);
                putMiner(miner);
            }
        }
        log.info("区块已记录: 高度{}, 哈希{}, 矿工{}", height, hash, minerAddress);
    }

    @Override
    public List<Miner> listMiners() {
        List<Miner> miners = new ArrayList<>();
        dataBase.iterate(TableEnum.MINER, false, (key, value) -> miners.add(read(value, Miner.class)));
        return miners;
    }

    @Override
    public List<BlockRecord> listBlocks(int limit) {
        List<BlockRecord> blocks = new ArrayList<>();
        if (limit <= 0) {
            return blocks;
        }
        // 键为大端高度，倒序即最新在前
        dataBase.iterate(TableEnum.BLOCK, true, (key, value) -> {
            blocks.add(read(value, BlockRecord.class));
            return blocks.size() < limit;
        });
        return blocks;
    }

    @Override
    public long countShares() {
        return shareCount.get();
    }

    @Override
    public long countBlocks() {
        return blockCount.get();
    }

    private void putMiner(Miner miner) {
        dataBase.update(TableEnum.MINER, minerKey(miner.getAddress()), write(miner));
    }

    private static byte[] minerKey(String address) {
        return address.getBytes(StandardCharsets.UTF_8);
    }

    private byte[] write(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new PoolException(ErrorType.PERSISTENCE_FAILED, "序列化失败: " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(byte[] value, Class<T> type) {
        try {
            return objectMapper.readValue(value, type);
        } catch (IOException e) {
            throw new PoolException(ErrorType.PERSISTENCE_FAILED, "反序列化失败: " + type.getSimpleName(), e);
        }
    }
}
