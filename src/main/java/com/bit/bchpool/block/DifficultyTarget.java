package com.bit.bchpool.block;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * 难度与目标值换算
 */
public final class DifficultyTarget {

    // 难度1对应的目标值（256位）
    public static final BigInteger DIFF1_TARGET =
            new BigInteger("00000000FFFF0000000000000000000000000000000000000000000000000000", 16);

    private DifficultyTarget() {
    }

    /**
     * target = DIFF1 / difficulty，向下取整，支持小数难度
     */
    public static BigInteger targetForDifficulty(double difficulty) {
        if (difficulty <= 0 || Double.isNaN(difficulty) || Double.isInfinite(difficulty)) {
            throw new IllegalArgumentException("难度必须为正数: " + difficulty);
        }
        return new BigDecimal(DIFF1_TARGET)
                .divide(BigDecimal.valueOf(difficulty), 0, RoundingMode.FLOOR)
                .toBigInteger();
    }

    /**
     * 哈希（显示顺序，大端）按无符号整数比较，小于等于目标即满足
     */
    public static boolean meetsTarget(byte[] hashBigEndian, BigInteger target) {
        return new BigInteger(1, hashBigEndian).compareTo(target) <= 0;
    }

    public static boolean meetsDifficulty(byte[] hashBigEndian, double difficulty) {
        return meetsTarget(hashBigEndian, targetForDifficulty(difficulty));
    }

    /**
     * 紧凑格式 nBits -> 目标值
     */
    public static BigInteger compactToTarget(String bitsHex) {
        long bits = Long.parseLong(bitsHex, 16);
        int exponent = (int) (bits >>> 24);
        BigInteger mantissa = BigInteger.valueOf(bits & 0x007fffffL);
        if (exponent <= 3) {
            return mantissa.shiftRight(8 * (3 - exponent));
        }
        return mantissa.shiftLeft(8 * (exponent - 3));
    }

    /**
     * 网络难度 = DIFF1 / 网络目标
     */
    public static double difficultyFromBits(String bitsHex) {
        BigInteger target = compactToTarget(bitsHex);
        if (target.signum() == 0) {
            return 0;
        }
        return new BigDecimal(DIFF1_TARGET).divide(new BigDecimal(target), 8, RoundingMode.HALF_UP).doubleValue();
    }
}
