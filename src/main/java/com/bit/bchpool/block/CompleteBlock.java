package com.bit.bchpool.block;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CompleteBlock {
    private long height;
    private String blockHash;   // 显示顺序
    private String headerHex;
    private String blockHex;
    private int transactionCount;
}
