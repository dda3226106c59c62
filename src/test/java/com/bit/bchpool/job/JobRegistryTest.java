package com.bit.bchpool.job;

import com.bit.bchpool.block.BlockAssembler;
import com.bit.bchpool.block.BlockTemplate;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.job.impl.JobRegistryImpl;
import com.bit.bchpool.share.NonceTracker;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class JobRegistryTest {

    private static final String MINER = "bchtest:qqjr7yu573z4faxw8ltgvjwpntwys08fysk07zmvce";
    private static final String JOB_ID_PATTERN = "job_\\d+_[0-9a-f]{8}_[0-9A-Za-z]+";

    private NonceTracker nonceTracker;
    private JobRegistryImpl registry;

    @BeforeEach
    void setUp() {
        PoolConfig config = new PoolConfig();
        nonceTracker = new NonceTracker(config);
        registry = new JobRegistryImpl(config, new BlockAssembler(config), nonceTracker);
    }

    private BlockTemplate template(long height) {
        BlockTemplate template = registry.createSyntheticTemplate();
        template.setHeight(height);
        template.setSynthetic(false);
        return template;
    }

    @Test
    void jobIdFormat() {
        String personal = registry.createJobId(MINER);
        assertTrue(personal.matches(JOB_ID_PATTERN), personal);
        assertTrue(personal.endsWith("_qqjr7yu5"));

        String broadcast = registry.createJobId(null);
        assertTrue(broadcast.matches(JOB_ID_PATTERN), broadcast);
        assertTrue(broadcast.endsWith("_broadcast"));
        assertNotEquals(personal, broadcast);
    }

    @Test
    void defaultPoolWalletUsesNetworkPrefix() {
        assertTrue(registry.getPoolWallet().startsWith("bchtest:q"));
    }

    @Test
    void poolWalletMustBePayToPubKeyHash() {
        PoolConfig config = new PoolConfig();
        config.setWallet("bchtest:pr6m7j9njldwwzlg9v7v53unlr4jkmx6eyvwc0uz5t");
        assertThrows(PoolException.class, () -> new JobRegistryImpl(config, new BlockAssembler(config), nonceTracker));

        config.setWallet("mipcBbFg9gMiCh81Kj8tqqdgoZub1ZJRfn");
        JobRegistryImpl legacy = new JobRegistryImpl(config, new BlockAssembler(config), nonceTracker);
        assertEquals(MINER, legacy.getPoolWallet());
    }

    @Test
    void resolutionPrefersPersonalThenBroadcastThenFallback() {
        Job fallback = registry.getJobForMiner(MINER);
        assertTrue(fallback.isFallback());
        assertTrue(fallback.getTemplate().isSynthetic());
        registry.removeJob(fallback.getJobId());

        Job broadcast = registry.createBroadcastJob(template(100), null);
        assertTrue(broadcast.isBroadcast());
        assertSame(broadcast, registry.getJobForMiner(MINER));

        Job older = registry.createJob(template(100), MINER, MINER, null, true);
        Job newer = registry.createJob(template(101), MINER, MINER, null, false);
        assertSame(newer, registry.getJobForMiner(MINER));
        assertTrue(older.getSequence() < newer.getSequence());
        assertEquals(2, registry.getMinerJobs(MINER).size());
    }

    @Test
    void removeJobDropsSubscriptionAndNonces() {
        Job job = registry.createJob(template(100), MINER, MINER, null, true);
        nonceTracker.markUsed(job.getJobId(), "00000001");

        assertTrue(registry.removeJob(job.getJobId()));
        assertNull(registry.getJob(job.getJobId()));
        assertTrue(registry.getMinerJobs(MINER).isEmpty());
        assertEquals(0, nonceTracker.trackedNonces(job.getJobId()));
        assertFalse(registry.removeJob(job.getJobId()));
    }

    @Test
    void removingLastBroadcastClearsIt() {
        Job broadcast = registry.createBroadcastJob(template(100), null);
        registry.removeJob(broadcast.getJobId());
        assertNull(registry.getLastBroadcastJob());
    }

    @Test
    void cleanupRemovesOldAndUndatedJobs() {
        Job fresh = registry.createJob(template(100), MINER, MINER, null, true);
        Job old = registry.createJob(template(100), MINER, MINER, null, true);
        old.setCreatedAt(Instant.now().getEpochSecond() - 1000);
        Job undated = registry.createJob(template(100), null, null, null, true);
        undated.setCreatedAt(0);

        assertEquals(2, registry.cleanupOldJobs(300));
        assertNotNull(registry.getJob(fresh.getJobId()));
        assertNull(registry.getJob(old.getJobId()));
        assertNull(registry.getJob(undated.getJobId()));
    }

    @Test
    void removeMinerJobsOnlyTouchesOwner() {
        registry.createJob(template(100), MINER, MINER, null, true);
        registry.createJob(template(100), MINER, MINER, null, true);
        Job broadcast = registry.createBroadcastJob(template(100), null);

        assertEquals(2, registry.removeMinerJobs(MINER));
        assertNotNull(registry.getJob(broadcast.getJobId()));
    }

    @Test
    void historyNewestFirst() {
        Job first = registry.createJob(template(100), MINER, MINER, null, true);
        Job second = registry.createBroadcastJob(template(101), null);
        List<JobHistoryEntry> history = registry.getJobHistory(10);
        assertEquals(2, history.size());
        assertEquals(second.getJobId(), history.get(0).getJobId());
        assertEquals("broadcast", history.get(0).getType());
        assertEquals(first.getJobId(), history.get(1).getJobId());
        assertEquals("personal", history.get(1).getType());
        assertEquals(1, registry.getJobHistory(1).size());
    }

    @Test
    void notifyParamsHaveNineFields() {
        Job job = registry.createBroadcastJob(template(100), null);
        List<Object> params = job.toNotifyParams();
        assertEquals(9, params.size());
        assertEquals(job.getJobId(), params.get(0));
        assertEquals(Boolean.TRUE, params.get(8));
        assertFalse(job.isFallback());
    }
}
