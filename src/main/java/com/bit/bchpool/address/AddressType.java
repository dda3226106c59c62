package com.bit.bchpool.address;

import lombok.Getter;

@Getter
public enum AddressType {
    P2KH(0),
    P2SH(1);

    // CashAddr版本字节高位中的类型编号
    private final int code;

    AddressType(int code) {
        this.code = code;
    }

    public static AddressType fromCode(int code) {
        for (AddressType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }
}
