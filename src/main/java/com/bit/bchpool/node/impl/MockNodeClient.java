package com.bit.bchpool.node.impl;

import com.bit.bchpool.block.BlockTemplate;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.node.MiningInfo;
import com.bit.bchpool.node.NodeClient;
import com.bit.bchpool.node.SubmitResult;
import com.bit.bchpool.block.DifficultyTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 本地开发/测试用节点：返回固定高度递增的空模板，记录提交的区块
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "pool.node", name = "mode", havingValue = "MOCK")
public class MockNodeClient implements NodeClient {

    private static final long START_HEIGHT = 1_500_000L;

    private final PoolConfig.Block settings;
    private final AtomicLong height = new AtomicLong(START_HEIGHT);
    private final List<String> submittedBlocks = new CopyOnWriteArrayList<>();

    @Autowired
    public MockNodeClient(PoolConfig config) {
        this.settings = config.getBlock();
        log.info("使用模拟节点，起始高度{}", START_HEIGHT);
    }

    @Override
    public BlockTemplate getBlockTemplate() {
        BlockTemplate template = new BlockTemplate();
        template.setHeight(height.get());
        template.setPreviousBlockHash(settings.getFallbackPrevHash());
        template.setBits(settings.getBits());
        template.setCurTime(Instant.now().getEpochSecond());
        template.setVersion(settings.getVersion());
        template.setCoinbaseValue(settings.getFallbackCoinbaseValue());
        template.setTransactions(new ArrayList<>());
        return template;
    }

    @Override
    public SubmitResult submitBlock(String blockHex) {
        submittedBlocks.add(blockHex);
        long newHeight = height.incrementAndGet();
        log.info("模拟节点接受区块，新高度{}", newHeight);
        return SubmitResult.accepted();
    }

    @Override
    public MiningInfo getMiningInfo() {
        return new MiningInfo(height.get() - 1, DifficultyTarget.difficultyFromBits(settings.getBits()), 0, "mock");
    }

    @Override
    public Map<String, Object> getBlockchainInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("chain", "mock");
        info.put("blocks", height.get() - 1);
        info.put("bestblockhash", settings.getFallbackPrevHash());
        return info;
    }

    public List<String> getSubmittedBlocks() {
        return submittedBlocks;
    }
}
