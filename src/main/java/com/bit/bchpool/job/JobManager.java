package com.bit.bchpool.job;

import com.bit.bchpool.block.BlockTemplate;

import java.util.Map;

/**
 * 区块模板获取与任务生成
 */
public interface JobManager {

    /**
     * 向节点拉取新模板；节点不可用时依次退回上一个可用模板、合成模板
     */
    BlockTemplate refreshTemplate();

    /**
     * 当前模板，尚未拉取过时先拉取一次
     */
    BlockTemplate getCurrentTemplate();

    long getCurrentHeight();

    /**
     * 为已授权矿工生成个人任务
     */
    Job createMinerJob(String minerAddress, String extraNonce1, boolean cleanJobs);

    /**
     * 用最新模板生成broadcast任务
     */
    Job createBroadcastJob();

    Map<String, Object> getStats();
}
