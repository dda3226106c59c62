package com.bit.bchpool.difficulty;

import java.util.Map;

/**
 * 难度控制：按最近一小时的份额速率调整矿池难度
 */
public interface DifficultyController {

    /**
     * 记录一次被接受的份额
     */
    void recordShare(String minerAddress);

    void recordShare(String minerAddress, long timestampMillis);

    /**
     * 计算新难度，不修改当前值
     */
    double recompute();

    /**
     * 计算并提交新难度，相对变化小于阈值时不做任何事
     * @return 是否发生变更
     */
    boolean apply();

    double getCurrentDifficulty();

    /**
     * 人工设置难度，超出上下限时截断
     */
    void setCurrentDifficulty(double difficulty);

    /**
     * 最近一小时被接受的份额数
     */
    int getSharesLastHour();

    int getSharesLastMinute();

    /**
     * 单个矿工算力（H/s）
     */
    double getMinerHashrate(String minerAddress);

    double getPoolHashrate();

    /**
     * 清理超过保留期的份额时间戳
     */
    int cleanupOldData();

    Map<String, Object> getStats();
}
