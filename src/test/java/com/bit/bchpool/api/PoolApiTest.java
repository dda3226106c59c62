package com.bit.bchpool.api;

import com.bit.bchpool.address.AddressCodec;
import com.bit.bchpool.address.AddressType;
import com.bit.bchpool.config.NetworkType;
import com.bit.bchpool.persistence.PersistenceService;
import com.bit.bchpool.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@SpringBootTest
public class PoolApiTest {

    @Autowired
    private PoolApi poolApi;

    @Autowired
    private MinerApi minerApi;

    @Autowired
    private JobApi jobApi;

    @Autowired
    private StratumApi stratumApi;

    @Autowired
    private PersistenceService persistenceService;

    @Test
    void poolStats() {
        Result<Map<String, Object>> result = poolApi.getStats();
        assertTrue(result.isSuccess());
        assertEquals(200, result.getCode());
        assertTrue(result.getData().containsKey("difficulty"));
        assertTrue(result.getData().containsKey("connections"));
    }

    @Test
    void blocksLimitValidated() {
        assertEquals(400, poolApi.getBlocks(0).getCode());
        assertEquals(200, poolApi.getBlocks(10).getCode());
    }

    @Test
    void minerLookupAcceptsLegacyAddress() {
        persistenceService.registerMiner("bchtest:qqjr7yu573z4faxw8ltgvjwpntwys08fysk07zmvce", "worker1");

        Result<Map<String, Object>> result = minerApi.getMiner("mipcBbFg9gMiCh81Kj8tqqdgoZub1ZJRfn");
        assertEquals(200, result.getCode());
        assertEquals("mipcBbFg9gMiCh81Kj8tqqdgoZub1ZJRfn", result.getData().get("legacyAddress"));

        assertEquals(400, minerApi.getMiner("not-an-address").getCode());
        String unknown = AddressCodec.encode(NetworkType.TESTNET, AddressType.P2KH, new byte[20]);
        assertEquals(404, minerApi.getMiner(unknown).getCode());
    }

    @Test
    void jobAndStratumEndpoints() {
        assertEquals(200, jobApi.getStats().getCode());
        assertEquals(400, jobApi.getHistory(0).getCode());
        assertEquals(200, jobApi.getHistory(5).getCode());
        assertTrue(jobApi.getHistory(5).getData().size() <= 5);

        Result<Map<String, Object>> stratum = stratumApi.getStats();
        assertEquals(200, stratum.getCode());
        assertTrue(stratum.getData().containsKey("tcpPort"));
        assertTrue(stratum.getData().containsKey("websocketPort"));
    }
}
