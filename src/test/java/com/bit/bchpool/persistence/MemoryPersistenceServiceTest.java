package com.bit.bchpool.persistence;

import com.bit.bchpool.persistence.impl.MemoryPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class MemoryPersistenceServiceTest {

    private static final String MINER = "bchtest:qqjr7yu573z4faxw8ltgvjwpntwys08fysk07zmvce";

    @Test
    void registerIsIdempotent() {
        PersistenceService service = new MemoryPersistenceService();
        Miner first = service.registerMiner(MINER, "worker1");
        Miner again = service.registerMiner(MINER, "worker2");
        assertEquals(first.getId(), again.getId());
        assertEquals("worker2", again.getWorkerName());
        assertEquals(1, service.listMiners().size());
    }

    @Test
    void sharesAndBlocksCounted() {
        PersistenceService service = new MemoryPersistenceService();
        service.registerMiner(MINER, "worker1");
        ShareRecord share = new ShareRecord();
        share.setMinerAddress(MINER);
        share.setAccepted(true);
        share.setCreatedAt(System.currentTimeMillis());
        service.saveShare(share);
        service.saveBlock(10, "aa".repeat(32), MINER);
        service.saveBlock(11, "bb".repeat(32), MINER);

        assertEquals(1, service.countShares());
        assertEquals(2, service.countBlocks());
        assertEquals(11, service.listBlocks(5).get(0).getHeight());
        Miner miner = service.getMinerByAddress(MINER);
        assertEquals(1, miner.getAcceptedShares());
        assertEquals(2, miner.getBlocksFound());
    }
}
