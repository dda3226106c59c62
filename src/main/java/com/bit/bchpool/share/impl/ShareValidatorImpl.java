package com.bit.bchpool.share.impl;

import com.bit.bchpool.block.BlockAssembler;
import com.bit.bchpool.block.DifficultyTarget;
import com.bit.bchpool.block.MerkleEngine;
import com.bit.bchpool.block.StratumJobData;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.difficulty.DifficultyController;
import com.bit.bchpool.job.Job;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.share.NonceTracker;
import com.bit.bchpool.share.RejectReason;
import com.bit.bchpool.share.ShareResult;
import com.bit.bchpool.share.ShareValidator;
import com.bit.bchpool.util.ByteUtils;
import com.bit.bchpool.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

@Slf4j
@Service
public class ShareValidatorImpl implements ShareValidator {

    private static final int NTIME_HEX_LENGTH = 8;
    private static final int NONCE_HEX_LENGTH = 8;

    private final JobRegistry jobRegistry;
    private final NonceTracker nonceTracker;
    private final BlockAssembler blockAssembler;
    private final DifficultyController difficultyController;
    private final int extraNonce2HexLength;
    private final long ntimeTolerance;

    // ==================== 统计 ====================
    private final LongAdder acceptedCount = new LongAdder();
    private final LongAdder rejectedCount = new LongAdder();
    private final Map<RejectReason, LongAdder> rejectedByReason = new EnumMap<>(RejectReason.class);

    private Clock clock = Clock.systemUTC();

    @Autowired
    public ShareValidatorImpl(PoolConfig config, JobRegistry jobRegistry, NonceTracker nonceTracker,
                              BlockAssembler blockAssembler, DifficultyController difficultyController) {
        this.jobRegistry = jobRegistry;
        this.nonceTracker = nonceTracker;
        this.blockAssembler = blockAssembler;
        this.difficultyController = difficultyController;
        this.extraNonce2HexLength = config.getStratum().getExtraNonce2Size() * 2;
        this.ntimeTolerance = config.getJob().getNtimeTolerance();
        for (RejectReason reason : RejectReason.values()) {
            rejectedByReason.put(reason, new LongAdder());
        }
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ShareResult validate(String jobId, String extraNonce1, String extraNonce2, String ntime, String nonce,
                                String minerAddress) {
        return validate(jobId, extraNonce1, extraNonce2, ntime, nonce, minerAddress,
                difficultyController.getCurrentDifficulty());
    }

    @Override
    public ShareResult validate(String jobId, String extraNonce1, String extraNonce2, String ntime, String nonce,
                                String minerAddress, double difficulty) {
        ShareResult result;
        try {
            result = doValidate(jobId, extraNonce1, extraNonce2, ntime, nonce, difficulty);
        } catch (RuntimeException e) {
            log.error("份额校验异常: job={}, miner={}", jobId, minerAddress, e);
            result = ShareResult.rejected(RejectReason.INTERNAL_ERROR, e.getMessage());
        }
        if (result.isAccepted()) {
            acceptedCount.increment();
            log.debug("份额通过: job={}, miner={}, hash={}", jobId, minerAddress, result.getHash());
        } else {
            rejectedCount.increment();
            rejectedByReason.get(result.getReason()).increment();
            log.warn("份额被拒绝: job={}, miner={}, 原因={}, 详情={}", jobId, minerAddress,
                    result.getReason(), result.getDetail());
        }
        return result;
    }

    private ShareResult doValidate(String jobId, String extraNonce1, String extraNonce2, String ntime, String nonce,
                                   double difficulty) {
        // 1. 任务存在
        Job job = jobRegistry.getJob(jobId);
        if (job == null) {
            return ShareResult.rejected(RejectReason.JOB_NOT_FOUND, jobId);
        }
        String en1 = extraNonce1 != null ? extraNonce1 : job.getExtraNonce1();

        // 2. 字段格式
        if (!ByteUtils.isHex(extraNonce2, extraNonce2HexLength)) {
            return ShareResult.rejected(RejectReason.INVALID_FORMAT, "extranonce2");
        }
        if (!ByteUtils.isHex(ntime, NTIME_HEX_LENGTH)) {
            return ShareResult.rejected(RejectReason.INVALID_FORMAT, "ntime");
        }
        if (!ByteUtils.isHex(nonce, NONCE_HEX_LENGTH)) {
            return ShareResult.rejected(RejectReason.INVALID_FORMAT, "nonce");
        }
        if (!ByteUtils.isHex(en1, -1)) {
            return ShareResult.rejected(RejectReason.INVALID_FORMAT, "extranonce1");
        }

        // 3. 时间窗口
        if (!isNtimeWithinTolerance(ntime, clock.millis() / 1000, ntimeTolerance)) {
            return ShareResult.rejected(RejectReason.STALE_TIME, ntime);
        }

        // 4. nonce唯一（原子登记）
        if (!nonceTracker.markUsed(jobId, nonce)) {
            return ShareResult.rejected(RejectReason.DUPLICATE_NONCE, nonce);
        }

        // 5. 重算 coinbase -> merkle根 -> 区块头 -> 哈希
        StratumJobData data = job.getStratumData();
        byte[] coinbase = ByteUtils.hexToBytes(data.getCoinb1() + en1 + extraNonce2 + data.getCoinb2());
        List<byte[]> branch = new ArrayList<>(data.getMerkleBranch().size());
        for (String sibling : data.getMerkleBranch()) {
            branch.add(ByteUtils.hexToBytes(sibling));
        }
        byte[] rootInternal = MerkleEngine.foldBranch(Sha.applyDoubleSHA256(coinbase), branch);
        String merkleRoot = ByteUtils.bytesToHex(ByteUtils.reverse(rootInternal));
        byte[] header = blockAssembler.buildHeader(job.getTemplate(), merkleRoot, ntime, nonce);
        byte[] hash = BlockAssembler.headerHash(header);

        // 6. 难度目标
        if (!DifficultyTarget.meetsDifficulty(hash, difficulty)) {
            return ShareResult.rejected(RejectReason.BELOW_TARGET, ByteUtils.bytesToHex(hash));
        }
        // 合成模板和静态coinbase的任务只记份额，不构成可提交的区块
        boolean meetsNetwork = !job.getTemplate().isSynthetic() && !job.isFallback()
                && BlockAssembler.meetsNetworkTarget(hash, job.getTemplate());
        return ShareResult.accepted(job, header, coinbase, ByteUtils.bytesToHex(hash), meetsNetwork);
    }

    /**
     * |ntime - now| <= tolerance
     */
    public static boolean isNtimeWithinTolerance(String ntimeHex, long nowSeconds, long toleranceSeconds) {
        long ntime = Long.parseLong(ntimeHex, 16);
        return Math.abs(ntime - nowSeconds) <= toleranceSeconds;
    }

    @Override
    public long getAcceptedCount() {
        return acceptedCount.sum();
    }

    @Override
    public long getRejectedCount() {
        return rejectedCount.sum();
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("accepted", acceptedCount.sum());
        stats.put("rejected", rejectedCount.sum());
        Map<String, Long> byReason = new LinkedHashMap<>();
        for (Map.Entry<RejectReason, LongAdder> entry : rejectedByReason.entrySet()) {
            byReason.put(entry.getKey().name(), entry.getValue().sum());
        }
        stats.put("rejectedByReason", byReason);
        return stats;
    }
}
