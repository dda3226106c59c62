package com.bit.bchpool.exception;

public enum ErrorType {
    PROTOCOL_ERROR("协议错误（报文无法解析/未知方法）"),
    AUTHORIZATION_FAILED("矿工授权失败（地址非法/已停用）"),
    ADDRESS_FORMAT_INVALID("地址格式错误（校验和/长度/前缀/版本）"),
    HEADER_ASSEMBLY_FAILED("区块头组装失败（字段长度非法）"),
    BLOCK_ASSEMBLY_FAILED("区块组装失败（coinbase/交易数据异常）"),
    NODE_UNAVAILABLE("节点不可用（RPC超时/返回错误）"),
    PERSISTENCE_FAILED("数据持久化失败"),
    CONFIG_INVALID("矿池配置无效");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
