package com.bit.bchpool.share;

import com.bit.bchpool.block.BlockAssembler;
import com.bit.bchpool.block.BlockTemplate;
import com.bit.bchpool.block.TemplateTransaction;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.difficulty.impl.DifficultyControllerImpl;
import com.bit.bchpool.job.Job;
import com.bit.bchpool.job.impl.JobRegistryImpl;
import com.bit.bchpool.share.impl.ShareValidatorImpl;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class ShareValidatorTest {

    private static final long NOW = 1_700_000_000L;
    private static final String MINER = "bchtest:qqjr7yu573z4faxw8ltgvjwpntwys08fysk07zmvce";
    private static final String EN1 = "0123456789abcdef0123456789abcdef";
    private static final double EASY = 1e-10;

    private JobRegistryImpl registry;
    private ShareValidatorImpl validator;

    @BeforeEach
    void setUp() {
        PoolConfig config = new PoolConfig();
        config.getDifficulty().setInitial(EASY);
        config.getDifficulty().setMin(EASY);
        NonceTracker nonceTracker = new NonceTracker(config);
        BlockAssembler assembler = new BlockAssembler(config);
        registry = new JobRegistryImpl(config, assembler, nonceTracker);
        DifficultyControllerImpl difficulty = new DifficultyControllerImpl(config, event -> { });
        validator = new ShareValidatorImpl(config, registry, nonceTracker, assembler, difficulty);
        validator.setClock(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
    }

    private BlockTemplate template(String bits) {
        BlockTemplate template = new BlockTemplate();
        template.setHeight(1_500_000L);
        template.setPreviousBlockHash("000000000000000007cbc708a5e00de8fd5e4b5b3e2a4f61c5aec6d6b7a9b8c9");
        template.setBits(bits);
        template.setCurTime(NOW);
        template.setVersion(0x20000000L);
        template.setCoinbaseValue(625_000_000L);
        template.getTransactions().add(new TemplateTransaction(
                "d5ada064c6417ca25c4308bd158c34b77e1c0eca2a73cda16c737e7424afba2f", 1000, "0100"));
        return template;
    }

    private Job minerJob(String bits) {
        return registry.createJob(template(bits), MINER, MINER, EN1, true);
    }

    private static String ntime(long seconds) {
        return String.format("%08x", seconds);
    }

    @Test
    void acceptsValidShare() {
        Job job = minerJob("1d00ffff");
        ShareResult result = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "00000001", MINER);
        assertTrue(result.isAccepted());
        assertEquals(64, result.getHash().length());
        assertEquals(80, result.getHeader().length);
        assertFalse(result.isMeetsNetwork());
        assertEquals(1, validator.getAcceptedCount());
    }

    @Test
    void unknownJobRejected() {
        ShareResult result = validator.validate("job_missing", EN1, "00000001", ntime(NOW), "00000001", MINER);
        assertFalse(result.isAccepted());
        assertEquals(RejectReason.JOB_NOT_FOUND, result.getReason());
        assertEquals(21, result.getReason().getCode());
        assertEquals("Job job_missing not found", result.errorMessage());
    }

    @Test
    void malformedFieldsRejected() {
        Job job = minerJob("1d00ffff");
        ShareResult shortEn2 = validator.validate(job.getJobId(), EN1, "0001", ntime(NOW), "00000001", MINER);
        assertEquals(RejectReason.INVALID_FORMAT, shortEn2.getReason());
        assertEquals("Invalid extranonce2", shortEn2.errorMessage());

        ShareResult badNonce = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "xyz00001", MINER);
        assertEquals(RejectReason.INVALID_FORMAT, badNonce.getReason());
        assertEquals("Invalid nonce", badNonce.errorMessage());

        ShareResult badNtime = validator.validate(job.getJobId(), EN1, "00000001", "123", "00000001", MINER);
        assertEquals("Invalid ntime", badNtime.errorMessage());
        assertEquals(3, validator.getRejectedCount());
    }

    @Test
    void ntimeToleranceBoundary() {
        assertTrue(ShareValidatorImpl.isNtimeWithinTolerance(ntime(NOW - 7200), NOW, 7200));
        assertFalse(ShareValidatorImpl.isNtimeWithinTolerance(ntime(NOW - 7201), NOW, 7200));
        assertTrue(ShareValidatorImpl.isNtimeWithinTolerance(ntime(NOW + 7200), NOW, 7200));
        assertFalse(ShareValidatorImpl.isNtimeWithinTolerance(ntime(NOW + 7201), NOW, 7200));

        Job job = minerJob("1d00ffff");
        assertTrue(validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW - 7200), "00000001", MINER)
                .isAccepted());
        ShareResult stale = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW - 7201), "00000002", MINER);
        assertEquals(RejectReason.STALE_TIME, stale.getReason());
        assertEquals(20, stale.getReason().getCode());
    }

    @Test
    void duplicateNonceRejected() {
        Job job = minerJob("1d00ffff");
        assertTrue(validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "0000abcd", MINER).isAccepted());
        ShareResult duplicate = validator.validate(job.getJobId(), EN1, "00000002", ntime(NOW), "0000abcd", MINER);
        assertEquals(RejectReason.DUPLICATE_NONCE, duplicate.getReason());
        assertEquals(22, duplicate.getReason().getCode());
    }

    @Test
    void lowDifficultyRejected() {
        Job job = minerJob("1d00ffff");
        ShareResult result = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "00000001", MINER, 1e15);
        assertEquals(RejectReason.BELOW_TARGET, result.getReason());
        assertEquals(23, result.getReason().getCode());
    }

    @Test
    void networkTargetDetected() {
        // 目标值超过 2^256，任何哈希都满足
        Job job = minerJob("2200ffff");
        ShareResult result = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "00000001", MINER);
        assertTrue(result.isAccepted());
        assertTrue(result.isMeetsNetwork());
        assertNotNull(result.getCoinbase());
    }

    @Test
    void syntheticTemplateNeverSubmitted() {
        BlockTemplate synthetic = registry.createSyntheticTemplate();
        synthetic.setBits("2200ffff");
        synthetic.setCurTime(NOW);
        Job job = registry.createJob(synthetic, MINER, MINER, EN1, true);
        ShareResult result = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "00000001", MINER);
        assertTrue(result.isAccepted());
        assertFalse(result.isMeetsNetwork());
    }

    @Test
    void broadcastJobUsesSessionExtraNonce() {
        Job broadcast = registry.createBroadcastJob(template("1d00ffff"), null);
        ShareResult first = validator.validate(broadcast.getJobId(), EN1, "00000001", ntime(NOW), "00000001", MINER);
        ShareResult other = validator.validate(broadcast.getJobId(), "ffffffffffffffffffffffffffffffff",
                "00000001", ntime(NOW), "00000002", MINER);
        assertTrue(first.isAccepted());
        assertTrue(other.isAccepted());
        assertNotEquals(first.getHash(), other.getHash());
    }

    @Test
    void nonAsciiDigitsRejected() {
        Job job = minerJob("1d00ffff");
        assertTrue(validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "00000001", MINER).isAccepted());

        // 阿拉伯-印度数字、全角数字解码后与 00000001 相同
        String arabicIndic = "٠٠٠٠٠٠٠1";
        String fullwidth = "０００００００1";
        ShareResult arabic = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), arabicIndic, MINER);
        assertEquals(RejectReason.INVALID_FORMAT, arabic.getReason());
        assertEquals("Invalid nonce", arabic.errorMessage());
        ShareResult wide = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), fullwidth, MINER);
        assertEquals(RejectReason.INVALID_FORMAT, wide.getReason());

        ShareResult wideEn2 = validator.validate(job.getJobId(), EN1, "０００００００2",
                ntime(NOW), "00000002", MINER);
        assertEquals(RejectReason.INVALID_FORMAT, wideEn2.getReason());
        assertEquals(1, validator.getAcceptedCount());
    }

    @Test
    void nonceCaseDoesNotBypassDuplicateCheck() {
        Job job = minerJob("1d00ffff");
        assertTrue(validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "0000abcd", MINER).isAccepted());
        ShareResult upper = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "0000ABCD", MINER);
        assertEquals(RejectReason.DUPLICATE_NONCE, upper.getReason());
    }

    @Test
    void fallbackCoinbaseNeverSubmitted() {
        // P2SH 收款地址无法生成 coinbase，任务退回静态 coinbase
        String p2sh = "bchtest:pr6m7j9njldwwzlg9v7v53unlr4jkmx6eyvwc0uz5t";
        Job job = registry.createJob(template("2200ffff"), p2sh, p2sh, EN1, true);
        assertTrue(job.isFallback());
        assertFalse(job.getTemplate().isSynthetic());

        ShareResult result = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "00000001", p2sh);
        assertTrue(result.isAccepted());
        assertFalse(result.isMeetsNetwork());
    }

    @Test
    void unexpectedFaultBecomesInternalError() {
        Job job = minerJob("1d00ffff");
        job.setStratumData(null);
        ShareResult result = validator.validate(job.getJobId(), EN1, "00000001", ntime(NOW), "00000001", MINER);
        assertFalse(result.isAccepted());
        assertEquals(RejectReason.INTERNAL_ERROR, result.getReason());
        assertEquals(1, validator.getRejectedCount());
    }
}
