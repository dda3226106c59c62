package com.bit.bchpool.node;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * submitblock 结果，节点返回null即接受，否则为拒绝原因
 */
@Data
@AllArgsConstructor
public class SubmitResult {
    private boolean accepted;
    private String message;

    public static SubmitResult accepted() {
        return new SubmitResult(true, null);
    }

    public static SubmitResult rejected(String message) {
        return new SubmitResult(false, message);
    }
}
