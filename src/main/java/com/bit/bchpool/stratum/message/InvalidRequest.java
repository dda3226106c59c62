package com.bit.bchpool.stratum.message;

import com.bit.bchpool.stratum.StratumMethod;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 能解析成JSON但方法未知或参数不合法的请求
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class InvalidRequest extends StratumRequest {
    private String methodName;
    private String reason;

    @Override
    public StratumMethod getMethod() {
        return null;
    }
}
