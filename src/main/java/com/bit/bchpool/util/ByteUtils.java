package com.bit.bchpool.util;

import com.google.common.base.CharMatcher;
import com.google.common.primitives.Bytes;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

public class ByteUtils {

    // 只接受 ASCII 十六进制字符
    private static final CharMatcher HEX_DIGIT = CharMatcher.anyOf("0123456789abcdefABCDEF");

    /**
     * 字节数组转十六进制字符串（小写）
     */
    public static String bytesToHex(byte[] bytes) {
        return Hex.encodeHexString(bytes);
    }

    /**
     * 十六进制字符串转字节数组，调用前应先用 isHex 校验
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null || !HEX_DIGIT.matchesAllOf(hex)) {
            throw new IllegalArgumentException("非法十六进制字符串: " + hex);
        }
        try {
            return Hex.decodeHex(hex);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("非法十六进制字符串: " + hex, e);
        }
    }

    /**
     * 是否为指定长度的十六进制字符串（expectedLength < 0 时只校验偶数长度）
     */
    public static boolean isHex(String value, int expectedLength) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        if (expectedLength >= 0 && value.length() != expectedLength) {
            return false;
        }
        if (value.length() % 2 != 0) {
            return false;
        }
        return HEX_DIGIT.matchesAllOf(value);
    }

    /**
     * 字节序翻转（返回新数组）
     */
    public static byte[] reverse(byte[] bytes) {
        byte[] reversed = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            reversed[i] = bytes[bytes.length - 1 - i];
        }
        return reversed;
    }

    /**
     * 十六进制按字节翻转：显示顺序 <-> 内部顺序
     */
    public static String reverseHex(String hex) {
        return bytesToHex(reverse(hexToBytes(hex)));
    }

    /**
     * uint32 小端
     */
    public static byte[] uint32ToBytesLE(long value) {
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            bytes[i] = (byte) (value >>> (8 * i));
        }
        return bytes;
    }

    /**
     * long 类型转 byte[]，小端模式（低位在前）
     */
    public static byte[] longToBytesLE(long value) {
        byte[] bytes = new byte[8];
        for (int i = 0; i < 8; i++) {
            bytes[i] = (byte) (value >>> (8 * i));
        }
        return bytes;
    }

    public static byte[] concat(byte[]... arrays) {
        return Bytes.concat(arrays);
    }

    /**
     * 子数组查找，未找到返回-1
     */
    public static int indexOf(byte[] array, byte[] target) {
        return Bytes.indexOf(array, target);
    }
}
