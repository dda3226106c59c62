package com.bit.bchpool.job.impl;

import com.bit.bchpool.address.AddressCodec;
import com.bit.bchpool.address.AddressType;
import com.bit.bchpool.address.DecodedAddress;
import com.bit.bchpool.block.BlockAssembler;
import com.bit.bchpool.block.BlockTemplate;
import com.bit.bchpool.block.StratumJobData;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.exception.ErrorType;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.job.Job;
import com.bit.bchpool.job.JobHistoryEntry;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.share.NonceTracker;
import com.bit.bchpool.util.ByteUtils;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class JobRegistryImpl implements JobRegistry {

    // ==================== 核心配置参数 ====================
    // 未指定extraNonce1时用于定位coinbase拆分点的占位值
    public static final String DEFAULT_EXTRA_NONCE1 = "ae6812eb4cd7735a302a8a9dd95cf71f";
    // 未配置矿池钱包时使用的公开测试地址hash160
    private static final String DEFAULT_POOL_HASH160 = "76a04053bda0a88bda5177b86a15c3b29f559873";
    // 组装失败时使用的静态coinbase片段
    private static final String FALLBACK_COINB1 =
            "01000000010000000000000000000000000000000000000000000000000000000000000000ffffffff";
    private static final String FALLBACK_COINB2 =
            "ffffffff0100f2052a010000001976a9147c154ed1dc59609e3d26abb2df2ea3d587cd8c4188ac00000000";
    private static final int OWNER_SUFFIX_LENGTH = 8;

    // ==================== 核心组件 ====================
    private final PoolConfig config;
    private final BlockAssembler blockAssembler;
    private final NonceTracker nonceTracker;
    private final String poolWallet;

    // ==================== 数据存储 ====================
    // 活跃任务 jobId -> Job
    private final ConcurrentHashMap<String, Job> activeJobs = new ConcurrentHashMap<>();
    // 矿工订阅 minerAddress -> jobIds
    private final ConcurrentHashMap<String, Set<String>> minerSubscriptions = new ConcurrentHashMap<>();
    // 全局递增计数
    private final AtomicLong jobCounter = new AtomicLong();
    // 最近N个任务（环形）
    private final EvictingQueue<JobHistoryEntry> history;
    private volatile Job lastBroadcastJob;

    @Autowired
    public JobRegistryImpl(PoolConfig config, BlockAssembler blockAssembler, NonceTracker nonceTracker) {
        this.config = config;
        this.blockAssembler = blockAssembler;
        this.nonceTracker = nonceTracker;
        this.history = EvictingQueue.create(config.getJob().getHistorySize());
        this.poolWallet = resolvePoolWallet(config);
        log.info("任务登记表初始化完成，矿池收款地址: {}", poolWallet);
    }

    private static String resolvePoolWallet(PoolConfig config) {
        String wallet = config.getWallet();
        if (wallet != null && !wallet.isBlank()) {
            DecodedAddress decoded = AddressCodec.decodeAny(wallet.trim(), config.getNetwork().getType());
            if (decoded.getType() != AddressType.P2KH) {
                throw new PoolException(ErrorType.CONFIG_INVALID, "矿池收款地址必须是P2KH地址: " + wallet);
            }
            return AddressCodec.encode(decoded.getNetwork(), decoded.getType(), decoded.getHash160());
        }
        return AddressCodec.encode(config.getNetwork().getType(), AddressType.P2KH,
                ByteUtils.hexToBytes(DEFAULT_POOL_HASH160));
    }

    @Override
    public String createJobId(String ownerAddress) {
        return buildJobId(ownerAddress, jobCounter.incrementAndGet());
    }

    private String buildJobId(String ownerAddress, long sequence) {
        long timestamp = Instant.now().getEpochSecond();
        String suffix = ownerAddress == null ? Job.BROADCAST_OWNER : ownerSuffix(ownerAddress);
        return String.format("job_%d_%08x_%s", timestamp, sequence, suffix);
    }

    /**
     * 地址去掉前缀后取前8个字符
     */
    static String ownerSuffix(String ownerAddress) {
        String body = ownerAddress.substring(ownerAddress.lastIndexOf(':') + 1);
        StringBuilder suffix = new StringBuilder(OWNER_SUFFIX_LENGTH);
        for (int i = 0; i < body.length() && suffix.length() < OWNER_SUFFIX_LENGTH; i++) {
            char c = body.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                suffix.append(c);
            }
        }
        return suffix.length() == 0 ? "miner" : suffix.toString();
    }

    @Override
    public void addJob(Job job) {
        if (job.getCreatedAt() <= 0) {
            job.setCreatedAt(Instant.now().getEpochSecond());
        }
        activeJobs.put(job.getJobId(), job);
        if (job.getOwner() != null) {
            minerSubscriptions.computeIfAbsent(job.getOwner(), k -> ConcurrentHashMap.newKeySet()).add(job.getJobId());
        }
        String type = job.isFallback() ? "fallback" : (job.isBroadcast() ? "broadcast" : "personal");
        synchronized (history) {
            history.add(new JobHistoryEntry(job.getJobId(), job.getCreatedAt(),
                    job.isBroadcast() ? Job.BROADCAST_OWNER : job.getOwner(), type,
                    job.getTemplate() == null ? 0 : job.getTemplate().getHeight()));
        }
        log.debug("任务已登记: {}, 类型: {}, 活跃任务数: {}", job.getJobId(), type, activeJobs.size());
    }

    @Override
    public boolean removeJob(String jobId) {
        Job removed = activeJobs.remove(jobId);
        if (removed == null) {
            log.debug("移除任务时未找到: {}", jobId);
            return false;
        }
        if (removed.getOwner() != null) {
            minerSubscriptions.computeIfPresent(removed.getOwner(), (owner, jobs) -> {
                jobs.remove(jobId);
                return jobs.isEmpty() ? null : jobs;
            });
        }
        nonceTracker.dropJob(jobId);
        if (lastBroadcastJob == removed) {
            lastBroadcastJob = null;
        }
        log.debug("任务已移除: {}", jobId);
        return true;
    }

    @Override
    public Job getJob(String jobId) {
        return jobId == null ? null : activeJobs.get(jobId);
    }

    @Override
    public Job getJobForMiner(String minerAddress) {
        return getJobForMiner(minerAddress, null);
    }

    @Override
    public Job getJobForMiner(String minerAddress, String extraNonce1) {
        Job personal = null;
        for (String jobId : getMinerJobs(minerAddress)) {
            Job job = activeJobs.get(jobId);
            if (job != null && (personal == null || job.getSequence() > personal.getSequence())) {
                personal = job;
            }
        }
        if (personal != null) {
            return personal;
        }
        Job broadcast = lastBroadcastJob;
        if (broadcast != null && activeJobs.containsKey(broadcast.getJobId())) {
            log.debug("矿工{}无个人任务，使用broadcast任务{}", minerAddress, broadcast.getJobId());
            return broadcast;
        }
        return createFallbackJob(minerAddress, extraNonce1);
    }

    @Override
    public Job createJob(BlockTemplate template, String owner, String payoutAddress, String extraNonce1,
                         boolean cleanJobs) {
        String en1 = extraNonce1 == null ? DEFAULT_EXTRA_NONCE1 : extraNonce1;
        String payout = payoutAddress == null ? poolWallet : payoutAddress;
        long sequence = jobCounter.incrementAndGet();

        Optional<StratumJobData> data = blockAssembler.createStratumJobData(template, payout, en1);
        Job job = new Job();
        job.setJobId(buildJobId(owner, sequence));
        job.setSequence(sequence);
        job.setTemplate(template);
        job.setOwner(owner);
        job.setPayoutAddress(payout);
        job.setCleanJobs(cleanJobs);
        job.setCreatedAt(Instant.now().getEpochSecond());
        if (data.isPresent()) {
            job.setStratumData(data.get());
        } else {
            log.warn("模板转换stratum任务失败，使用静态coinbase: job={}, payout={}", job.getJobId(), payout);
            job.setStratumData(staticStratumData(template, en1));
            job.setFallback(true);
        }
        addJob(job);
        return job;
    }

    @Override
    public Job createBroadcastJob(BlockTemplate template, String extraNonce1) {
        Job job = createJob(template, null, poolWallet, extraNonce1, true);
        lastBroadcastJob = job;
        log.info("broadcast任务已更新: {}, 高度: {}", job.getJobId(), template.getHeight());
        return job;
    }

    @Override
    public Job createFallbackJob(String minerAddress, String extraNonce1) {
        Job job = createJob(createSyntheticTemplate(), minerAddress,
                minerAddress == null ? poolWallet : minerAddress, extraNonce1, true);
        job.setFallback(true);
        log.warn("无可用任务，为矿工{}生成fallback任务{}", minerAddress == null ? "unknown" : minerAddress, job.getJobId());
        return job;
    }

    @Override
    public BlockTemplate createSyntheticTemplate() {
        PoolConfig.Block block = config.getBlock();
        BlockTemplate template = new BlockTemplate();
        template.setHeight(1);
        template.setPreviousBlockHash(block.getFallbackPrevHash());
        template.setBits(block.getBits());
        template.setVersion(block.getVersion());
        template.setCurTime(Instant.now().getEpochSecond());
        template.setCoinbaseValue(block.getFallbackCoinbaseValue());
        template.setTransactions(new ArrayList<>());
        template.setSynthetic(true);
        return template;
    }

    private StratumJobData staticStratumData(BlockTemplate template, String extraNonce1) {
        StratumJobData data = new StratumJobData();
        data.setPrevHash(BlockAssembler.toStratumPrevHash(template.getPreviousBlockHash()));
        data.setCoinb1(FALLBACK_COINB1);
        data.setCoinb2(FALLBACK_COINB2);
        data.setMerkleBranch(BlockAssembler.merkleBranchFor(template));
        data.setVersion(String.format("%08x", template.getVersion()));
        data.setNbits(template.getBits());
        data.setNtime(String.format("%08x", template.getCurTime()));
        data.setExtraNonce1(extraNonce1);
        return data;
    }

    @Override
    public int cleanupOldJobs(long maxAgeSeconds) {
        long now = Instant.now().getEpochSecond();
        List<String> expired = new ArrayList<>();
        for (Job job : activeJobs.values()) {
            // 创建时间缺失视为过期
            if (job.getCreatedAt() <= 0 || now - job.getCreatedAt() > maxAgeSeconds) {
                expired.add(job.getJobId());
            }
        }
        int removed = 0;
        for (String jobId : expired) {
            if (removeJob(jobId)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("清理过期任务{}个，剩余活跃任务{}个", removed, activeJobs.size());
        }
        return removed;
    }

    @Override
    public int removeMinerJobs(String minerAddress) {
        if (minerAddress == null) {
            return 0;
        }
        int removed = 0;
        for (String jobId : getMinerJobs(minerAddress)) {
            if (removeJob(jobId)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("已清理矿工{}的{}个任务", minerAddress, removed);
        }
        return removed;
    }

    @Override
    public Set<String> getMinerJobs(String minerAddress) {
        if (minerAddress == null) {
            return Collections.emptySet();
        }
        Set<String> jobs = minerSubscriptions.get(minerAddress);
        return jobs == null ? Collections.emptySet() : Set.copyOf(jobs);
    }

    @Override
    public Job getLastBroadcastJob() {
        return lastBroadcastJob;
    }

    @Override
    public String getPoolWallet() {
        return poolWallet;
    }

    @Override
    public List<JobHistoryEntry> getJobHistory(int limit) {
        List<JobHistoryEntry> entries;
        synchronized (history) {
            entries = new ArrayList<>(history);
        }
        // 新的在前
        Collections.reverse(entries);
        return entries.subList(0, Math.min(Math.max(limit, 0), entries.size()));
    }

    @Override
    public Map<String, Object> getStats() {
        int totalSubscriptions = 0;
        for (Set<String> jobs : minerSubscriptions.values()) {
            totalSubscriptions += jobs.size();
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("activeJobs", activeJobs.size());
        stats.put("subscribedMiners", minerSubscriptions.size());
        stats.put("totalSubscriptions", totalSubscriptions);
        stats.put("jobCounter", jobCounter.get());
        synchronized (history) {
            stats.put("historySize", history.size());
        }
        stats.put("hasBroadcastJob", lastBroadcastJob != null);
        stats.put("trackedNonceJobs", nonceTracker.trackedJobs());
        return stats;
    }
}
