package com.bit.bchpool.block;

import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class BlockAssemblerTest {

    private static final String TEST_LEGACY = "mipcBbFg9gMiCh81Kj8tqqdgoZub1ZJRfn";
    private static final String EN1 = "ae6812eb4cd7735a302a8a9dd95cf71f";

    private BlockAssembler assembler;
    private BlockTemplate template;

    @BeforeEach
    void setUp() {
        assembler = new BlockAssembler(new PoolConfig());
        template = new BlockTemplate();
        template.setHeight(1_500_000L);
        template.setPreviousBlockHash("000000000000000007cbc708a5e00de8fd5e4b5b3e2a4f61c5aec6d6b7a9b8c9");
        template.setBits("1d00ffff");
        template.setCurTime(1_700_000_000L);
        template.setVersion(0x20000000L);
        template.setCoinbaseValue(625_000_000L);
        template.getTransactions().add(new TemplateTransaction(
                "d5ada064c6417ca25c4308bd158c34b77e1c0eca2a73cda16c737e7424afba2f", 1000, "0100"));
    }

    @Test
    void legacyTestnetAddressBuildsP2pkhOutput() {
        Optional<CoinbaseTransaction> coinbase = assembler.buildCoinbaseTransaction(template, TEST_LEGACY, EN1, "00000000");
        assertTrue(coinbase.isPresent());

        String script = ByteUtils.bytesToHex(coinbase.get().getScriptPubKey());
        assertEquals(50, script.length());
        assertEquals("76a914243f1394f44554f4ce3fd68649c19adc483ce92488ac", script);
        assertTrue(coinbase.get().toHex().contains(script));
        assertEquals(64, coinbase.get().getTxid().length());
    }

    @Test
    void p2shAddressRejected() {
        assertFalse(assembler.buildCoinbaseTransaction(template,
                "bchtest:pr6m7j9njldwwzlg9v7v53unlr4jkmx6eyvwc0uz5t", EN1, "00000000").isPresent());
        assertFalse(assembler.buildCoinbaseTransaction(template, "garbage", EN1, "00000000").isPresent());
    }

    @Test
    void encodeHeightFollowsBip34() {
        assertEquals("00", ByteUtils.bytesToHex(BlockAssembler.encodeHeight(0)));
        assertEquals("51", ByteUtils.bytesToHex(BlockAssembler.encodeHeight(1)));
        assertEquals("60", ByteUtils.bytesToHex(BlockAssembler.encodeHeight(16)));
        assertEquals("0111", ByteUtils.bytesToHex(BlockAssembler.encodeHeight(17)));
        assertEquals("028000", ByteUtils.bytesToHex(BlockAssembler.encodeHeight(128)));
        assertEquals("0360e316", ByteUtils.bytesToHex(BlockAssembler.encodeHeight(1_500_000L)));
    }

    @Test
    void headerIsEightyBytes() {
        String merkleRoot = MerkleEngine.computeRootHex(Collections.singletonList(
                "d5ada064c6417ca25c4308bd158c34b77e1c0eca2a73cda16c737e7424afba2f"));
        byte[] header = assembler.buildHeader(template, merkleRoot, "6553f100", "00000001");
        assertEquals(BlockAssembler.HEADER_LENGTH, header.length);
        // version 小端
        assertEquals("00000020", ByteUtils.bytesToHex(Arrays.copyOf(header, 4)));
        assertEquals(32, BlockAssembler.headerHash(header).length);
    }

    @Test
    void headerRejectsWrongFieldLength() {
        String merkleRoot = "00".repeat(32);
        assertThrows(PoolException.class, () -> assembler.buildHeader(template, merkleRoot, "6553f1", "00000001"));
        assertThrows(PoolException.class, () -> assembler.buildHeader(template, merkleRoot, "6553f100", "zzzzzzzz"));
        assertThrows(PoolException.class, () -> assembler.buildHeader(template, "abcd", "6553f100", "00000001"));
    }

    @Test
    void stratumSplitRebuildsCoinbase() {
        Optional<StratumJobData> data = assembler.createStratumJobData(template, TEST_LEGACY, EN1);
        assertTrue(data.isPresent());
        String en2 = "0000002a";
        String rebuilt = data.get().getCoinb1() + EN1 + en2 + data.get().getCoinb2();

        CoinbaseTransaction coinbase = assembler.buildCoinbaseTransaction(template, TEST_LEGACY, EN1, en2).get();
        assertEquals(coinbase.toHex(), rebuilt);
        assertEquals(1, data.get().getMerkleBranch().size());
        assertEquals("20000000", data.get().getVersion());
        assertEquals("1d00ffff", data.get().getNbits());
    }

    @Test
    void fullBlockCountsCoinbase() {
        byte[] header = assembler.buildHeader(template, "00".repeat(32), "6553f100", "00000001");
        CoinbaseTransaction coinbase = assembler.buildCoinbaseTransaction(template, TEST_LEGACY, EN1, "00000000").get();
        CompleteBlock block = assembler.assembleBlock(template, header, coinbase.getRaw());
        assertEquals(2, block.getTransactionCount());
        // 80字节头 + 1字节交易数量 + coinbase + 2字节交易
        assertEquals((80 + 1 + coinbase.getRaw().length + 2) * 2, block.getBlockHex().length());
        assertTrue(block.getBlockHex().startsWith(ByteUtils.bytesToHex(header) + "02"));
    }

    @Test
    void stratumPrevHashSwapsWords() {
        String prev = "00000000000000000000000000000000000000000000000000000000000001ff";
        String swapped = BlockAssembler.toStratumPrevHash(prev);
        assertEquals(64, swapped.length());
        assertTrue(swapped.startsWith("000001ff"));
    }
}
