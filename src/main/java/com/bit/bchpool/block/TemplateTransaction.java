package com.bit.bchpool.block;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 区块模板中的候选交易
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateTransaction {
    private String txid;    // 显示顺序
    private long fee;       // 聪
    private String data;    // 原始交易hex
}
