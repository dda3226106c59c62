package com.bit.bchpool.stratum;

public enum SessionState {
    CONNECTED,
    SUBSCRIBED,
    AUTHORIZED,
    WORKING,
    CLOSED;

    public boolean isAuthorized() {
        return this == AUTHORIZED || this == WORKING;
    }
}
