package com.bit.bchpool.stratum;

import com.bit.bchpool.address.AddressCodec;
import com.bit.bchpool.address.AddressType;
import com.bit.bchpool.config.NetworkType;
import com.bit.bchpool.job.Job;
import com.bit.bchpool.job.JobManager;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.persistence.PersistenceService;
import com.bit.bchpool.server.handler.StratumTcpHandler;
import com.bit.bchpool.server.handler.StratumWebSocketHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 通过内嵌通道走完整的 TCP 行协议管线
 */
@Slf4j
@SpringBootTest
public class StratumSessionManagerTest {

    private static final String MINER = "bchtest:qqjr7yu573z4faxw8ltgvjwpntwys08fysk07zmvce";
    private static final String JOB_ID_PATTERN = "job_\\d+_[0-9a-f]{8}_[0-9A-Za-z]+";

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<EmbeddedChannel> channels = new ArrayList<>();

    @Autowired
    private StratumSessionManager sessionManager;

    @Autowired
    private JobManager jobManager;

    @Autowired
    private PersistenceService persistenceService;

    @Autowired
    private JobRegistry jobRegistry;

    @AfterEach
    void closeChannels() {
        for (EmbeddedChannel channel : channels) {
            channel.finishAndReleaseAll();
        }
        channels.clear();
    }

    private EmbeddedChannel connect() {
        EmbeddedChannel channel = new EmbeddedChannel(
                new LineBasedFrameDecoder(16 * 1024),
                new StringDecoder(StandardCharsets.UTF_8),
                new StringEncoder(StandardCharsets.UTF_8),
                new StratumTcpHandler(sessionManager));
        channels.add(channel);
        return channel;
    }

    private void send(EmbeddedChannel channel, String json) {
        channel.writeInbound(Unpooled.copiedBuffer(json + "\n", StandardCharsets.UTF_8));
    }

    private JsonNode read(EmbeddedChannel channel) throws Exception {
        ByteBuf buf = channel.readOutbound();
        assertNotNull(buf, "没有待读取的报文");
        try {
            String line = buf.toString(StandardCharsets.UTF_8);
            assertTrue(line.endsWith("\n"));
            return mapper.readTree(line);
        } finally {
            buf.release();
        }
    }

    private String subscribe(EmbeddedChannel channel) throws Exception {
        send(channel, "{\"id\":1,\"method\":\"mining.subscribe\",\"params\":[\"cpuminer/2.5\"]}");
        JsonNode response = read(channel);
        JsonNode setDifficulty = read(channel);
        assertEquals("mining.set_difficulty", setDifficulty.get("method").asText());
        return response.get("result").get(1).asText();
    }

    private JsonNode authorize(EmbeddedChannel channel, String username) throws Exception {
        send(channel, "{\"id\":2,\"method\":\"mining.authorize\",\"params\":[\"" + username + "\",\"x\"]}");
        JsonNode response = read(channel);
        assertTrue(response.get("result").asBoolean(), response.toString());
        return read(channel);
    }

    @Test
    void subscribeThenAuthorizeReceivesJob() throws Exception {
        EmbeddedChannel channel = connect();
        send(channel, "{\"id\":1,\"method\":\"mining.subscribe\",\"params\":[\"cpuminer/2.5\"]}");

        JsonNode response = read(channel);
        assertEquals(1, response.get("id").asInt());
        assertTrue(response.get("error").isNull());
        JsonNode result = response.get("result");
        assertEquals("mining.set_difficulty", result.get(0).get(0).get(0).asText());
        assertEquals("mining.notify", result.get(0).get(1).get(0).asText());
        assertTrue(result.get(1).asText().matches("[0-9a-f]{32}"));
        assertEquals(4, result.get(2).asInt());

        JsonNode difficulty = read(channel);
        assertEquals("mining.set_difficulty", difficulty.get("method").asText());
        assertTrue(difficulty.get("params").get(0).asDouble() > 0);

        JsonNode notify = authorize(channel, MINER + ".worker1");
        assertEquals("mining.notify", notify.get("method").asText());
        JsonNode params = notify.get("params");
        assertEquals(9, params.size());
        assertTrue(params.get(0).asText().matches(JOB_ID_PATTERN), params.get(0).asText());
        assertTrue(params.get(0).asText().endsWith("_qqjr7yu5"));
        assertTrue(params.get(8).asBoolean());

        assertNotNull(persistenceService.getMinerByAddress(MINER));
        assertEquals("worker1", persistenceService.getMinerByAddress(MINER).getWorkerName());
    }

    @Test
    void legacyAddressIsNormalized() throws Exception {
        EmbeddedChannel channel = connect();
        subscribe(channel);
        JsonNode notify = authorize(channel, "mipcBbFg9gMiCh81Kj8tqqdgoZub1ZJRfn");
        assertEquals("mining.notify", notify.get("method").asText());
        assertNotNull(persistenceService.getMinerByAddress(MINER));
    }

    @Test
    void unknownJobRejected() throws Exception {
        EmbeddedChannel channel = connect();
        subscribe(channel);
        JsonNode notify = authorize(channel, MINER + ".worker1");
        String ntime = notify.get("params").get(7).asText();

        send(channel, "{\"id\":3,\"method\":\"mining.submit\",\"params\":[\"" + MINER
                + ".worker1\",\"job_nope\",\"00000001\",\"" + ntime + "\",\"00000001\"]}");
        JsonNode response = read(channel);
        assertEquals(3, response.get("id").asInt());
        assertFalse(response.get("result").asBoolean());
        JsonNode error = response.get("error");
        assertEquals(21, error.get(0).asInt());
        assertEquals("Job job_nope not found", error.get(1).asText());
        assertTrue(error.get(2).isNull());
    }

    @Test
    void validShareAccepted() throws Exception {
        EmbeddedChannel channel = connect();
        subscribe(channel);
        JsonNode params = authorize(channel, MINER + ".worker1").get("params");

        send(channel, "{\"id\":4,\"method\":\"mining.submit\",\"params\":[\"" + MINER + ".worker1\",\""
                + params.get(0).asText() + "\",\"0000002a\",\"" + params.get(7).asText() + "\",\"1234abcd\"]}");
        JsonNode response = read(channel);
        assertTrue(response.get("result").asBoolean(), response.toString());
        assertTrue(response.get("error").isNull());
    }

    @Test
    void duplicateSubmissionOnBroadcastJobAcceptedOnce() throws Exception {
        EmbeddedChannel first = connect();
        EmbeddedChannel second = connect();
        subscribe(first);
        subscribe(second);
        authorize(first, MINER + ".rig1");
        authorize(second, MINER + ".rig2");

        Job broadcast = jobManager.createBroadcastJob();
        String submit = "{\"id\":7,\"method\":\"mining.submit\",\"params\":[\"" + MINER + ".rig\",\""
                + broadcast.getJobId() + "\",\"00000001\",\"" + broadcast.getStratumData().getNtime()
                + "\",\"cafebabe\"]}";

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<JsonNode>> responses = new ArrayList<>();
        for (EmbeddedChannel channel : new EmbeddedChannel[]{first, second}) {
            responses.add(pool.submit(() -> {
                start.await();
                send(channel, submit);
                return read(channel);
            }));
        }
        start.countDown();

        int accepted = 0;
        int duplicates = 0;
        for (Future<JsonNode> future : responses) {
            JsonNode response = future.get(10, TimeUnit.SECONDS);
            if (response.get("result").asBoolean()) {
                accepted++;
            } else if (response.get("error").get(0).asInt() == 22) {
                duplicates++;
            }
        }
        pool.shutdownNow();
        assertEquals(1, accepted);
        assertEquals(1, duplicates);
    }

    @Test
    void unknownMethodKeepsConnection() throws Exception {
        EmbeddedChannel channel = connect();
        subscribe(channel);
        send(channel, "{\"id\":5,\"method\":\"mining.foo\",\"params\":[]}");
        JsonNode response = read(channel);
        assertEquals(5, response.get("id").asInt());
        assertEquals(20, response.get("error").get(0).asInt());
        assertTrue(channel.isActive());

        send(channel, "this is not json");
        JsonNode parseError = read(channel);
        assertEquals(20, parseError.get("error").get(0).asInt());
        assertTrue(channel.isActive());
    }

    @Test
    void unparseableHandshakeClosesConnection() {
        EmbeddedChannel channel = connect();
        int before = sessionManager.getActiveConnections();
        send(channel, "GET / HTTP/1.1");
        assertFalse(channel.isActive());
        assertEquals(before - 1, sessionManager.getActiveConnections());
    }

    @Test
    void authorizeBeforeSubscribeRejected() throws Exception {
        EmbeddedChannel channel = connect();
        send(channel, "{\"id\":2,\"method\":\"mining.authorize\",\"params\":[\"" + MINER + "\",\"x\"]}");
        JsonNode response = read(channel);
        assertFalse(response.get("result").asBoolean());
        assertEquals(25, response.get("error").get(0).asInt());
    }

    @Test
    void submitBeforeAuthorizeRejected() throws Exception {
        EmbeddedChannel channel = connect();
        subscribe(channel);
        send(channel, "{\"id\":3,\"method\":\"mining.submit\",\"params\":[\"w\",\"job\",\"00000001\",\"00000000\",\"00000001\"]}");
        JsonNode response = read(channel);
        assertEquals(24, response.get("error").get(0).asInt());
    }

    @Test
    void invalidAddressUnauthorized() throws Exception {
        EmbeddedChannel channel = connect();
        subscribe(channel);
        send(channel, "{\"id\":2,\"method\":\"mining.authorize\",\"params\":[\"bchtest:qqqqqq.worker\",\"x\"]}");
        JsonNode response = read(channel);
        assertFalse(response.get("result").asBoolean());
        assertEquals(24, response.get("error").get(0).asInt());
    }

    @Test
    void scriptHashAddressUnauthorized() throws Exception {
        String p2sh = "bchtest:pr6m7j9njldwwzlg9v7v53unlr4jkmx6eyvwc0uz5t";
        EmbeddedChannel channel = connect();
        subscribe(channel);
        send(channel, "{\"id\":2,\"method\":\"mining.authorize\",\"params\":[\"" + p2sh + ".rig\",\"x\"]}");
        JsonNode response = read(channel);
        assertFalse(response.get("result").asBoolean());
        assertEquals(24, response.get("error").get(0).asInt());
        assertTrue(response.get("error").get(1).asText().contains("P2KH"));
        assertNull(channel.readOutbound());
        assertNull(persistenceService.getMinerByAddress(p2sh));
    }

    @Test
    void deactivatedMinerUnauthorized() throws Exception {
        byte[] hash160 = new byte[20];
        for (int i = 0; i < hash160.length; i++) {
            hash160[i] = (byte) (i + 1);
        }
        String address = AddressCodec.encode(NetworkType.TESTNET, AddressType.P2KH, hash160);
        persistenceService.registerMiner(address, "rig");
        persistenceService.setMinerActive(address, false);

        EmbeddedChannel channel = connect();
        subscribe(channel);
        send(channel, "{\"id\":2,\"method\":\"mining.authorize\",\"params\":[\"" + address + ".rig\",\"x\"]}");
        JsonNode response = read(channel);
        assertFalse(response.get("result").asBoolean());
        assertEquals(24, response.get("error").get(0).asInt());
    }

    @Test
    void closingSessionReleasesPersonalJobs() throws Exception {
        EmbeddedChannel channel = connect();
        subscribe(channel);
        String jobId = authorize(channel, MINER + ".worker1").get("params").get(0).asText();
        assertNotNull(jobRegistry.getJob(jobId));

        channel.close();
        assertNull(jobRegistry.getJob(jobId));
    }

    @Test
    void websocketFramesCarryOneMessageEach() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel(new StratumWebSocketHandler(sessionManager));
        channels.add(channel);
        channel.pipeline().fireUserEventTriggered(
                new WebSocketServerProtocolHandler.HandshakeComplete("/stratum", EmptyHttpHeaders.INSTANCE, null));

        channel.writeInbound(new TextWebSocketFrame("{\"id\":1,\"method\":\"mining.subscribe\",\"params\":[]}"));
        TextWebSocketFrame response = channel.readOutbound();
        try {
            JsonNode json = mapper.readTree(response.text());
            assertTrue(json.get("result").get(1).asText().matches("[0-9a-f]{32}"));
        } finally {
            response.release();
        }
        TextWebSocketFrame difficulty = channel.readOutbound();
        try {
            assertEquals("mining.set_difficulty", mapper.readTree(difficulty.text()).get("method").asText());
        } finally {
            difficulty.release();
        }

        boolean found = false;
        for (MinerSession session : sessionManager.getSessions()) {
            if (session.getChannel() == channel) {
                assertEquals(TransportType.WEBSOCKET, session.getTransport());
                assertEquals(SessionState.SUBSCRIBED, session.getState());
                found = true;
            }
        }
        assertTrue(found);
    }
}
