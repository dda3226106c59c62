package com.bit.bchpool.block;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 节点下发的区块模板，获取后不再修改，下一次获取时整体替换
 */
@Data
public class BlockTemplate {
    private long height;
    private String previousBlockHash;   // 显示顺序
    private String bits;                // 紧凑难度 hex
    private long curTime;
    private long version;
    /**
     * 区块补贴（不含手续费），coinbase输出 = 补贴 + 手续费合计
     */
    private long coinbaseValue;
    private List<TemplateTransaction> transactions = new ArrayList<>();
    // 节点不可用时由默认配置合成
    private boolean synthetic;

    public long totalFees() {
        long fees = 0;
        for (TemplateTransaction tx : transactions) {
            fees += tx.getFee();
        }
        return fees;
    }
}
