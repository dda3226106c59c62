package com.bit.bchpool.job;

import com.bit.bchpool.block.BlockTemplate;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 任务登记表：任务ID、生命周期、broadcast/个人任务区分
 */
public interface JobRegistry {

    /**
     * 生成任务ID：job_{unix秒}_{全局递增计数:08x}_{地址后缀|broadcast}
     */
    String createJobId(String ownerAddress);

    void addJob(Job job);

    /**
     * 移除任务，同时清理所属矿工的订阅与该任务的nonce记录
     */
    boolean removeJob(String jobId);

    Job getJob(String jobId);

    /**
     * 解析顺序：矿工自己的个人任务 -> 最新broadcast任务 -> 合成fallback任务
     */
    Job getJobForMiner(String minerAddress);

    Job getJobForMiner(String minerAddress, String extraNonce1);

    /**
     * 由模板生成任务并登记
     * @param owner 个人任务的矿工地址，null表示broadcast
     */
    Job createJob(BlockTemplate template, String owner, String payoutAddress, String extraNonce1, boolean cleanJobs);

    /**
     * 生成broadcast任务并设为最新broadcast任务
     */
    Job createBroadcastJob(BlockTemplate template, String extraNonce1);

    Job createFallbackJob(String minerAddress, String extraNonce1);

    BlockTemplate createSyntheticTemplate();

    int cleanupOldJobs(long maxAgeSeconds);

    int removeMinerJobs(String minerAddress);

    Set<String> getMinerJobs(String minerAddress);

    Job getLastBroadcastJob();

    String getPoolWallet();

    List<JobHistoryEntry> getJobHistory(int limit);

    Map<String, Object> getStats();
}
