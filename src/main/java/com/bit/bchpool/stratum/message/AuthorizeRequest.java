package com.bit.bchpool.stratum.message;

import com.bit.bchpool.stratum.StratumMethod;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class AuthorizeRequest extends StratumRequest {
    // address[.worker]
    private String username;
    private String password;

    @Override
    public StratumMethod getMethod() {
        return StratumMethod.AUTHORIZE;
    }
}
