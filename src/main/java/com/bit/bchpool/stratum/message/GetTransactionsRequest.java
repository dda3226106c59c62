package com.bit.bchpool.stratum.message;

import com.bit.bchpool.stratum.StratumMethod;

public class GetTransactionsRequest extends StratumRequest {

    @Override
    public StratumMethod getMethod() {
        return StratumMethod.GET_TRANSACTIONS;
    }
}
