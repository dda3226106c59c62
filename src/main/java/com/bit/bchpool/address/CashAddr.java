package com.bit.bchpool.address;

import java.io.ByteArrayOutputStream;

/**
 * CashAddr 底层算法：字符表、BCH多项式校验和、位重组
 */
public final class CashAddr {

    public static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";

    public static final int CHECKSUM_LENGTH = 8;

    private static final long[] GENERATORS = {
            0x98f2bc8e61L, 0x79b76d99e2L, 0xf33e5fb3c4L, 0xae2eabe2a8L, 0x1e4f43e470L
    };

    // 字符 -> 5位值，非法字符为-1
    private static final int[] CHARSET_REV = new int[128];

    static {
        for (int i = 0; i < CHARSET_REV.length; i++) {
            CHARSET_REV[i] = -1;
        }
        for (int i = 0; i < CHARSET.length(); i++) {
            CHARSET_REV[CHARSET.charAt(i)] = i;
        }
    }

    private CashAddr() {
    }

    /**
     * 40位BCH码多项式取模，结果已异或常量1（校验通过时整体结果为0）
     */
    public static long polymod(byte[] values) {
        long c = 1;
        for (byte value : values) {
            long c0 = c >>> 35;
            c = ((c & 0x07ffffffffL) << 5) ^ (value & 0xff);
            for (int i = 0; i < GENERATORS.length; i++) {
                if (((c0 >>> i) & 1) != 0) {
                    c ^= GENERATORS[i];
                }
            }
        }
        return c ^ 1;
    }

    /**
     * 前缀展开：每个字符取低5位，末尾追加一个0分隔
     */
    public static byte[] expandPrefix(String prefix) {
        byte[] expanded = new byte[prefix.length() + 1];
        for (int i = 0; i < prefix.length(); i++) {
            expanded[i] = (byte) (prefix.charAt(i) & 0x1f);
        }
        expanded[prefix.length()] = 0;
        return expanded;
    }

    /**
     * 计算8位校验和（5位一组）
     */
    public static byte[] createChecksum(String prefix, byte[] payload5) {
        byte[] expanded = expandPrefix(prefix);
        byte[] input = new byte[expanded.length + payload5.length + CHECKSUM_LENGTH];
        System.arraycopy(expanded, 0, input, 0, expanded.length);
        System.arraycopy(payload5, 0, input, expanded.length, payload5.length);
        long mod = polymod(input);
        byte[] checksum = new byte[CHECKSUM_LENGTH];
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            checksum[i] = (byte) ((mod >>> (5 * (7 - i))) & 0x1f);
        }
        return checksum;
    }

    /**
     * 校验 payload（含末尾8位校验和）
     */
    public static boolean verifyChecksum(String prefix, byte[] payloadWithChecksum) {
        byte[] expanded = expandPrefix(prefix);
        byte[] input = new byte[expanded.length + payloadWithChecksum.length];
        System.arraycopy(expanded, 0, input, 0, expanded.length);
        System.arraycopy(payloadWithChecksum, 0, input, expanded.length, payloadWithChecksum.length);
        return polymod(input) == 0;
    }

    /**
     * 位重组，高位在前
     * @param pad true 时末尾补零；false 时剩余位必须为零且不足一组，否则返回null
     */
    public static byte[] convertBits(byte[] data, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxValue = (1 << toBits) - 1;
        int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte b : data) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                return null;
            }
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxValue);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (toBits - bits)) & maxValue);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxValue) != 0) {
            return null;
        }
        return out.toByteArray();
    }

    public static String toChars(byte[] values5) {
        StringBuilder sb = new StringBuilder(values5.length);
        for (byte value : values5) {
            sb.append(CHARSET.charAt(value));
        }
        return sb.toString();
    }

    /**
     * 字符映射回5位值，遇到非法字符返回null
     */
    public static byte[] fromChars(String chars) {
        byte[] values = new byte[chars.length()];
        for (int i = 0; i < chars.length(); i++) {
            char c = chars.charAt(i);
            if (c >= 128 || CHARSET_REV[c] < 0) {
                return null;
            }
            values[i] = (byte) CHARSET_REV[c];
        }
        return values;
    }
}
