package com.bit.bchpool.persistence;

import java.util.List;

/**
 * 矿工、份额、区块的持久化
 * 失败时抛出 PoolException(PERSISTENCE_FAILED)
 */
public interface PersistenceService {

    /**
     * 注册矿工，已存在时更新矿机名与最近活跃时间
     */
    Miner registerMiner(String address, String workerName);

    /**
     * @return 不存在时返回null
     */
    Miner getMinerByAddress(String address);

    boolean setMinerActive(String address, boolean active);

    void saveShare(ShareRecord share);

    void saveBlock(long height, String hash, String minerAddress);

    List<Miner> listMiners();

    /**
     * 最近找到的区块，新的在前
     */
    List<BlockRecord> listBlocks(int limit);

    long countShares();

    long countBlocks();
}
