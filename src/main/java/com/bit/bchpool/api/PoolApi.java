package com.bit.bchpool.api;

import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.difficulty.DifficultyController;
import com.bit.bchpool.job.JobManager;
import com.bit.bchpool.persistence.BlockRecord;
import com.bit.bchpool.persistence.PersistenceService;
import com.bit.bchpool.result.Result;
import com.bit.bchpool.share.ShareValidator;
import com.bit.bchpool.stratum.StratumSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/pool")
public class PoolApi {

    @Autowired
    private PoolConfig poolConfig;
    @Autowired
    private DifficultyController difficultyController;
    @Autowired
    private StratumSessionManager sessionManager;
    @Autowired
    private ShareValidator shareValidator;
    @Autowired
    private JobManager jobManager;
    @Autowired
    private PersistenceService persistenceService;

    /**
     * 矿池总览
     */
    @GetMapping("/stats")
    public Result<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("name", poolConfig.getName());
        stats.put("network", poolConfig.getNetwork().getType());
        stats.put("height", jobManager.getCurrentHeight());
        stats.put("difficulty", difficultyController.getCurrentDifficulty());
        stats.put("hashrate", difficultyController.getPoolHashrate());
        stats.put("connections", sessionManager.getActiveConnections());
        stats.put("acceptedShares", shareValidator.getAcceptedCount());
        stats.put("rejectedShares", shareValidator.getRejectedCount());
        stats.put("storedShares", persistenceService.countShares());
        stats.put("blocksFound", persistenceService.countBlocks());
        return Result.ok(stats);
    }

    /**
     * 算力与难度统计
     */
    @GetMapping("/hashrate")
    public Result<Map<String, Object>> getHashrate() {
        Map<String, Object> stats = new LinkedHashMap<>(difficultyController.getStats());
        stats.put("poolHashrate", difficultyController.getPoolHashrate());
        return Result.ok(stats);
    }

    /**
     * 最近找到的区块
     */
    @GetMapping("/blocks")
    public Result<List<BlockRecord>> getBlocks(@RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0 || limit > 1000) {
            return Result.error(Result.SC_BAD_REQUEST_400, "limit 必须在 1-1000 之间");
        }
        return Result.ok(persistenceService.listBlocks(limit));
    }
}
