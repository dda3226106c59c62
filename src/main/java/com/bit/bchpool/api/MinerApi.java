package com.bit.bchpool.api;

import com.bit.bchpool.address.AddressCodec;
import com.bit.bchpool.address.AddressFormatException;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.difficulty.DifficultyController;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.persistence.Miner;
import com.bit.bchpool.persistence.PersistenceService;
import com.bit.bchpool.result.Result;
import com.bit.bchpool.stratum.MinerSession;
import com.bit.bchpool.stratum.StratumSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/miners")
public class MinerApi {

    @Autowired
    private PoolConfig poolConfig;
    @Autowired
    private PersistenceService persistenceService;
    @Autowired
    private DifficultyController difficultyController;
    @Autowired
    private JobRegistry jobRegistry;
    @Autowired
    private StratumSessionManager sessionManager;

    @GetMapping
    public Result<List<Miner>> listMiners() {
        return Result.ok(persistenceService.listMiners());
    }

    /**
     * 单个矿工详情，地址可为 CashAddr（带或不带前缀）或传统地址
     */
    @GetMapping("/{address}")
    public Result<Map<String, Object>> getMiner(@PathVariable String address) {
        String normalized;
        try {
            normalized = AddressCodec.normalize(address, poolConfig.getNetwork().getType());
        } catch (AddressFormatException e) {
            return Result.error(Result.SC_BAD_REQUEST_400, e.getMessage());
        }
        Miner miner = persistenceService.getMinerByAddress(normalized);
        if (miner == null) {
            return Result.notFound("矿工不存在: " + normalized);
        }
        List<String> workers = new ArrayList<>();
        for (MinerSession session : sessionManager.getSessions()) {
            if (normalized.equals(session.getMinerAddress())) {
                workers.add(session.getWorkerName());
            }
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("miner", miner);
        detail.put("legacyAddress", AddressCodec.toLegacy(normalized));
        detail.put("hashrate", difficultyController.getMinerHashrate(normalized));
        detail.put("onlineWorkers", workers);
        detail.put("activeJobs", jobRegistry.getMinerJobs(normalized).size());
        return Result.ok(detail);
    }
}
