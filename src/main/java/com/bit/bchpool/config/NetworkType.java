package com.bit.bchpool.config;

import lombok.Getter;

/**
 * 网络类型：CashAddr前缀 + 传统地址版本字节
 */
@Getter
public enum NetworkType {
    MAINNET("bitcoincash", 0x00, 0x05),
    TESTNET("bchtest", 0x6f, 0xc4),
    REGTEST("bchreg", 0x6f, 0xc4);

    private final String prefix;        // CashAddr前缀
    private final int p2khVersion;      // 传统地址P2KH版本
    private final int p2shVersion;      // 传统地址P2SH版本

    NetworkType(String prefix, int p2khVersion, int p2shVersion) {
        this.prefix = prefix;
        this.p2khVersion = p2khVersion;
        this.p2shVersion = p2shVersion;
    }

    /**
     * 根据CashAddr前缀查找网络，未知前缀返回null
     */
    public static NetworkType fromPrefix(String prefix) {
        if (prefix == null) {
            return null;
        }
        for (NetworkType type : values()) {
            if (type.prefix.equals(prefix)) {
                return type;
            }
        }
        return null;
    }
}
