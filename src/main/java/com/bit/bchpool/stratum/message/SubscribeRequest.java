package com.bit.bchpool.stratum.message;

import com.bit.bchpool.stratum.StratumMethod;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SubscribeRequest extends StratumRequest {
    private String userAgent;

    @Override
    public StratumMethod getMethod() {
        return StratumMethod.SUBSCRIBE;
    }
}
