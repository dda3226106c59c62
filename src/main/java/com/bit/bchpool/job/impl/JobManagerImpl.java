package com.bit.bchpool.job.impl;

import com.bit.bchpool.block.BlockTemplate;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.job.Job;
import com.bit.bchpool.job.JobManager;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.node.NodeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

@Slf4j
@Service
public class JobManagerImpl implements JobManager {

    private final NodeClient nodeClient;
    private final JobRegistry jobRegistry;

    private volatile BlockTemplate currentTemplate;
    // 最近一次从节点成功拉取的模板
    private volatile BlockTemplate lastGoodTemplate;
    private volatile long currentHeight;

    private final LongAdder refreshCount = new LongAdder();
    private final LongAdder nodeFailureCount = new LongAdder();
    private final LongAdder newBlockCount = new LongAdder();

    @Autowired
    public JobManagerImpl(NodeClient nodeClient, JobRegistry jobRegistry) {
        this.nodeClient = nodeClient;
        this.jobRegistry = jobRegistry;
    }

    @Override
    public synchronized BlockTemplate refreshTemplate() {
        refreshCount.increment();
        BlockTemplate template;
        try {
            template = nodeClient.getBlockTemplate();
            if (template == null) {
                throw new IllegalStateException("节点返回空模板");
            }
            lastGoodTemplate = template;
        } catch (PoolException | IllegalStateException e) {
            nodeFailureCount.increment();
            if (lastGoodTemplate != null) {
                log.warn("获取区块模板失败，沿用上一个模板(高度{}): {}", lastGoodTemplate.getHeight(), e.getMessage());
                template = lastGoodTemplate;
            } else {
                log.warn("获取区块模板失败且无历史模板，使用合成模板: {}", e.getMessage());
                template = jobRegistry.createSyntheticTemplate();
            }
        }

        if (template.getHeight() != currentHeight) {
            if (currentHeight != 0) {
                newBlockCount.increment();
            }
            log.info("区块高度变化: {} -> {}, 交易数: {}", currentHeight, template.getHeight(),
                    template.getTransactions().size());
            currentHeight = template.getHeight();
        }
        currentTemplate = template;
        return template;
    }

    @Override
    public BlockTemplate getCurrentTemplate() {
        BlockTemplate template = currentTemplate;
        return template != null ? template : refreshTemplate();
    }

    @Override
    public long getCurrentHeight() {
        return currentHeight;
    }

    @Override
    public Job createMinerJob(String minerAddress, String extraNonce1, boolean cleanJobs) {
        return jobRegistry.createJob(getCurrentTemplate(), minerAddress, minerAddress, extraNonce1, cleanJobs);
    }

    @Override
    public Job createBroadcastJob() {
        return jobRegistry.createBroadcastJob(getCurrentTemplate(), null);
    }

    @Override
    public Map<String, Object> getStats() {
        BlockTemplate template = currentTemplate;
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("currentHeight", currentHeight);
        stats.put("templateSynthetic", template != null && template.isSynthetic());
        stats.put("templateTransactions", template == null ? 0 : template.getTransactions().size());
        stats.put("refreshCount", refreshCount.sum());
        stats.put("nodeFailures", nodeFailureCount.sum());
        stats.put("newBlocks", newBlockCount.sum());
        stats.putAll(jobRegistry.getStats());
        return stats;
    }
}
