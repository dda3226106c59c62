package com.bit.bchpool.stratum.message;

import com.bit.bchpool.stratum.StratumMethod;
import lombok.Data;

/**
 * 已解码的客户端请求，每种方法一个子类
 */
@Data
public abstract class StratumRequest {
    // 原样回显给客户端，可能是数字、字符串或null
    private Object id;

    /**
     * @return 未知或格式错误的请求返回null
     */
    public abstract StratumMethod getMethod();
}
