package com.bit.bchpool.block;

import com.bit.bchpool.util.ByteUtils;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CoinbaseTransaction {
    private byte[] raw;
    private byte[] scriptPubKey;
    // 显示顺序
    private String txid;

    public String toHex() {
        return ByteUtils.bytesToHex(raw);
    }
}
