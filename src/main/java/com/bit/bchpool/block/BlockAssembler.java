package com.bit.bchpool.block;

import com.bit.bchpool.address.AddressCodec;
import com.bit.bchpool.address.AddressFormatException;
import com.bit.bchpool.address.AddressType;
import com.bit.bchpool.address.DecodedAddress;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.exception.ErrorType;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.util.ByteUtils;
import com.bit.bchpool.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.VarInt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 区块组装：coinbase交易、80字节区块头、完整区块、工作量校验、stratum任务拆分
 */
@Slf4j
@Component
public class BlockAssembler {

    public static final int HEADER_LENGTH = 80;

    // ====== 脚本操作码 ======
    private static final byte OP_0 = 0x00;
    private static final byte OP_1 = 0x51;
    private static final byte OP_DUP = 0x76;
    private static final byte OP_HASH160 = (byte) 0xa9;
    private static final byte OP_EQUALVERIFY = (byte) 0x88;
    private static final byte OP_CHECKSIG = (byte) 0xac;

    private static final byte[] NULL_PREVOUT_HASH = new byte[32];
    private static final long MAX_UINT32 = 0xffffffffL;

    private final PoolConfig config;

    @Autowired
    public BlockAssembler(PoolConfig config) {
        this.config = config;
    }

    /**
     * 构建coinbase交易
     * @return 地址无法解析为P2KH时返回空
     */
    public Optional<CoinbaseTransaction> buildCoinbaseTransaction(BlockTemplate template, String payoutAddress,
                                                                  String extraNonce1, String extraNonce2) {
        byte[] hash160 = extractP2khHash(payoutAddress);
        if (hash160 == null) {
            return Optional.empty();
        }
        if (!ByteUtils.isHex(extraNonce1, -1) || !ByteUtils.isHex(extraNonce2, -1)) {
            log.warn("extraNonce格式非法: en1={}, en2={}", extraNonce1, extraNonce2);
            return Optional.empty();
        }
        byte[] scriptSig = buildScriptSig(template.getHeight(),
                ByteUtils.hexToBytes(extraNonce1), ByteUtils.hexToBytes(extraNonce2));
        byte[] scriptPubKey = buildP2pkhScript(hash160);
        long value = template.getCoinbaseValue() + template.totalFees();

        byte[] raw = serializeCoinbase(scriptSig, value, scriptPubKey);
        String txid = ByteUtils.bytesToHex(ByteUtils.reverse(Sha.applyDoubleSHA256(raw)));
        return Optional.of(new CoinbaseTransaction(raw, scriptPubKey, txid));
    }

    /**
     * ScriptSig = BIP34高度 + 矿池签名 + extraNonce1 + extraNonce2，超长截断
     */
    public byte[] buildScriptSig(long height, byte[] extraNonce1, byte[] extraNonce2) {
        byte[] script = ByteUtils.concat(
                encodeHeight(height),
                config.getBlock().getCoinbasePrefix().getBytes(StandardCharsets.UTF_8),
                extraNonce1,
                extraNonce2);
        int max = config.getBlock().getMaxScriptSigSize();
        if (script.length > max) {
            log.warn("ScriptSig超长({}字节)，截断至{}字节", script.length, max);
            return Arrays.copyOf(script, max);
        }
        return script;
    }

    /**
     * BIP34：区块高度按最小脚本数字编码后压栈
     */
    public static byte[] encodeHeight(long height) {
        if (height == 0) {
            return new byte[]{OP_0};
        }
        if (height >= 1 && height <= 16) {
            return new byte[]{(byte) (OP_1 + height - 1)};
        }
        ByteArrayOutputStream number = new ByteArrayOutputStream();
        long value = height;
        while (value > 0) {
            number.write((int) (value & 0xff));
            value >>>= 8;
        }
        byte[] bytes = number.toByteArray();
        // 最高位为1时补0，避免被解释为负数
        if ((bytes[bytes.length - 1] & 0x80) != 0) {
            bytes = Arrays.copyOf(bytes, bytes.length + 1);
        }
        return ByteUtils.concat(new byte[]{(byte) bytes.length}, bytes);
    }

    /**
     * OP_DUP OP_HASH160 <20字节> OP_EQUALVERIFY OP_CHECKSIG
     */
    public static byte[] buildP2pkhScript(byte[] hash160) {
        if (hash160 == null || hash160.length != AddressCodec.HASH160_LENGTH) {
            throw new PoolException(ErrorType.BLOCK_ASSEMBLY_FAILED, "hash160长度必须为20字节");
        }
        return ByteUtils.concat(
                new byte[]{OP_DUP, OP_HASH160, (byte) AddressCodec.HASH160_LENGTH},
                hash160,
                new byte[]{OP_EQUALVERIFY, OP_CHECKSIG});
    }

    private byte[] serializeCoinbase(byte[] scriptSig, long value, byte[] scriptPubKey) {
        return ByteUtils.concat(
                ByteUtils.uint32ToBytesLE(1),                  // version
                new VarInt(1).encode(),                        // 输入数量
                NULL_PREVOUT_HASH,
                ByteUtils.uint32ToBytesLE(MAX_UINT32),         // prevout index
                new VarInt(scriptSig.length).encode(),
                scriptSig,
                ByteUtils.uint32ToBytesLE(MAX_UINT32),         // sequence
                new VarInt(1).encode(),                        // 输出数量
                ByteUtils.longToBytesLE(value),
                new VarInt(scriptPubKey.length).encode(),
                scriptPubKey,
                ByteUtils.uint32ToBytesLE(0));                 // locktime
    }

    private byte[] extractP2khHash(String payoutAddress) {
        try {
            DecodedAddress decoded = AddressCodec.decodeAny(payoutAddress, config.getNetwork().getType());
            if (decoded.getType() != AddressType.P2KH) {
                log.warn("收款地址不是P2KH类型: {}", payoutAddress);
                return null;
            }
            return decoded.getHash160();
        } catch (AddressFormatException e) {
            log.warn("收款地址解析失败: {}, 原因: {}", payoutAddress, e.getReason());
            return null;
        }
    }

    /**
     * 组装80字节区块头，各字段小端
     * @param merkleRoot 显示顺序hex
     * @param ntime 8位hex（大端数值）
     * @param nonce 8位hex（大端数值）
     */
    public byte[] buildHeader(BlockTemplate template, String merkleRoot, String ntime, String nonce) {
        if (template.getVersion() < 0 || template.getVersion() > MAX_UINT32) {
            throw new PoolException(ErrorType.HEADER_ASSEMBLY_FAILED, "version越界: " + template.getVersion());
        }
        byte[] header = ByteUtils.concat(
                ByteUtils.uint32ToBytesLE(template.getVersion()),
                reversedField("previousBlockHash", template.getPreviousBlockHash(), 32),
                reversedField("merkleRoot", merkleRoot, 32),
                reversedField("ntime", ntime, 4),
                reversedField("bits", template.getBits(), 4),
                reversedField("nonce", nonce, 4));
        if (header.length != HEADER_LENGTH) {
            throw new PoolException(ErrorType.HEADER_ASSEMBLY_FAILED, "区块头长度错误: " + header.length);
        }
        return header;
    }

    private static byte[] reversedField(String name, String hex, int length) {
        if (!ByteUtils.isHex(hex, length * 2)) {
            throw new PoolException(ErrorType.HEADER_ASSEMBLY_FAILED,
                    name + " 必须为" + (length * 2) + "位hex: " + hex);
        }
        return ByteUtils.reverse(ByteUtils.hexToBytes(hex));
    }

    /**
     * 区块哈希（显示顺序）
     */
    public static byte[] headerHash(byte[] header) {
        return ByteUtils.reverse(Sha.applyDoubleSHA256(header));
    }

    /**
     * 完整区块 = 区块头 + 交易数量varint + coinbase + 其余交易（模板顺序）
     */
    public byte[] assembleFullBlock(byte[] header, byte[] coinbaseTx, List<byte[]> otherTxs) {
        if (header == null || header.length != HEADER_LENGTH) {
            throw new PoolException(ErrorType.BLOCK_ASSEMBLY_FAILED, "区块头必须为80字节");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(header);
        out.writeBytes(new VarInt(1L + otherTxs.size()).encode());
        out.writeBytes(coinbaseTx);
        for (byte[] tx : otherTxs) {
            out.writeBytes(tx);
        }
        return out.toByteArray();
    }

    /**
     * 用模板中的交易拼出完整区块
     */
    public CompleteBlock assembleBlock(BlockTemplate template, byte[] header, byte[] coinbaseTx) {
        List<byte[]> others = new ArrayList<>(template.getTransactions().size());
        for (TemplateTransaction tx : template.getTransactions()) {
            if (!ByteUtils.isHex(tx.getData(), -1)) {
                throw new PoolException(ErrorType.BLOCK_ASSEMBLY_FAILED, "模板交易数据非法: " + tx.getTxid());
            }
            others.add(ByteUtils.hexToBytes(tx.getData()));
        }
        byte[] block = assembleFullBlock(header, coinbaseTx, others);
        return new CompleteBlock(template.getHeight(),
                ByteUtils.bytesToHex(headerHash(header)),
                ByteUtils.bytesToHex(header),
                ByteUtils.bytesToHex(block),
                others.size() + 1);
    }

    /**
     * 重算区块头哈希并与 DIFF1/difficulty 比较
     */
    public boolean validateSolution(BlockTemplate template, String merkleRoot, String ntime, String nonce,
                                    double difficulty) {
        byte[] header = buildHeader(template, merkleRoot, ntime, nonce);
        return DifficultyTarget.meetsDifficulty(headerHash(header), difficulty);
    }

    /**
     * 是否达到网络目标（模板 bits）
     */
    public static boolean meetsNetworkTarget(byte[] hashBigEndian, BlockTemplate template) {
        return DifficultyTarget.meetsTarget(hashBigEndian, DifficultyTarget.compactToTarget(template.getBits()));
    }

    /**
     * 生成stratum任务字段：用占位extraNonce2构建coinbase，在extraNonce1处拆分出coinb1/coinb2
     */
    public Optional<StratumJobData> createStratumJobData(BlockTemplate template, String payoutAddress,
                                                        String extraNonce1) {
        int extraNonce2Size = config.getStratum().getExtraNonce2Size();
        byte[] placeholder = new byte[extraNonce2Size];
        Optional<CoinbaseTransaction> coinbase = buildCoinbaseTransaction(template, payoutAddress,
                extraNonce1, ByteUtils.bytesToHex(placeholder));
        if (coinbase.isEmpty()) {
            return Optional.empty();
        }

        byte[] raw = coinbase.get().getRaw();
        byte[] marker = ByteUtils.concat(ByteUtils.hexToBytes(extraNonce1), placeholder);
        int index = ByteUtils.indexOf(raw, marker);
        if (index < 0) {
            log.error("coinbase中未找到extraNonce位置，ScriptSig可能被截断: en1={}", extraNonce1);
            return Optional.empty();
        }

        StratumJobData data = new StratumJobData();
        data.setCoinb1(ByteUtils.bytesToHex(Arrays.copyOfRange(raw, 0, index)));
        data.setCoinb2(ByteUtils.bytesToHex(Arrays.copyOfRange(raw, index + marker.length, raw.length)));
        data.setMerkleBranch(merkleBranchFor(template));
        data.setPrevHash(toStratumPrevHash(template.getPreviousBlockHash()));
        data.setVersion(String.format("%08x", template.getVersion()));
        data.setNbits(template.getBits());
        data.setNtime(String.format("%08x", template.getCurTime()));
        data.setExtraNonce1(extraNonce1);
        return Optional.of(data);
    }

    /**
     * coinbase（下标0）的分支，内部字节序hex
     */
    public static List<String> merkleBranchFor(BlockTemplate template) {
        List<byte[]> leaves = new ArrayList<>(template.getTransactions().size() + 1);
        // coinbase占位，不参与兄弟节点
        leaves.add(new byte[MerkleEngine.HASH_LENGTH]);
        for (TemplateTransaction tx : template.getTransactions()) {
            leaves.add(ByteUtils.hexToBytes(tx.getTxid()));
        }
        List<String> branch = new ArrayList<>();
        for (byte[] sibling : MerkleEngine.computeBranch(leaves, 0)) {
            branch.add(ByteUtils.bytesToHex(ByteUtils.reverse(sibling)));
        }
        return branch;
    }

    /**
     * 显示顺序 -> 内部字节序 -> 每4字节翻转
     */
    public static String toStratumPrevHash(String previousBlockHash) {
        byte[] internal = ByteUtils.reverse(ByteUtils.hexToBytes(previousBlockHash));
        byte[] swapped = new byte[internal.length];
        for (int i = 0; i + 4 <= internal.length; i += 4) {
            swapped[i] = internal[i + 3];
            swapped[i + 1] = internal[i + 2];
            swapped[i + 2] = internal[i + 1];
            swapped[i + 3] = internal[i];
        }
        return ByteUtils.bytesToHex(swapped);
    }
}
