package com.bit.bchpool.address;

import com.bit.bchpool.config.NetworkType;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 解码后的地址：网络 + 类型 + 20字节hash160
 */
@Data
@AllArgsConstructor
public class DecodedAddress {
    private NetworkType network;
    private AddressType type;
    private byte[] hash160;

    public String getPrefix() {
        return network.getPrefix();
    }
}
