package com.bit.bchpool.stratum;

import java.util.HashMap;
import java.util.Map;

public enum StratumMethod {
    // 客户端 -> 服务端
    SUBSCRIBE("mining.subscribe"),
    AUTHORIZE("mining.authorize"),
    SUBMIT("mining.submit"),
    GET_TRANSACTIONS("mining.get_transactions"),
    // 服务端 -> 客户端
    NOTIFY("mining.notify"),
    SET_DIFFICULTY("mining.set_difficulty");

    private final String wireName;

    StratumMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    private static final Map<String, StratumMethod> BY_NAME = new HashMap<>();

    static {
        for (StratumMethod method : values()) {
            BY_NAME.put(method.wireName, method);
        }
    }

    /**
     * @return 未知方法返回null
     */
    public static StratumMethod fromWireName(String name) {
        return name == null ? null : BY_NAME.get(name);
    }
}
