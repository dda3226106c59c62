package com.bit.bchpool.stratum.message;

import com.bit.bchpool.stratum.StratumMethod;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SubmitRequest extends StratumRequest {
    private String workerName;
    private String jobId;
    private String extraNonce2;
    private String ntime;
    private String nonce;

    @Override
    public StratumMethod getMethod() {
        return StratumMethod.SUBMIT;
    }
}
