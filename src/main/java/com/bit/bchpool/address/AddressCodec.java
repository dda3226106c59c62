package com.bit.bchpool.address;

import com.bit.bchpool.config.NetworkType;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Base58;

import java.util.Arrays;
import java.util.Locale;

import static com.bit.bchpool.address.AddressFormatException.Reason;

/**
 * 收款地址编解码：CashAddr 与传统 Base58Check 互转
 * 所有解码失败统一抛出 {@link AddressFormatException}，不会出现其它运行时异常
 */
@Slf4j
public final class AddressCodec {

    public static final int HASH160_LENGTH = 20;

    private AddressCodec() {
    }

    public static String encode(NetworkType network, AddressType type, byte[] hash160) {
        return encode(network.getPrefix(), type, hash160);
    }

    /**
     * 编码 CashAddr：版本字节(type<<3) + hash160，8位转5位，追加8位校验和
     */
    public static String encode(String prefix, AddressType type, byte[] hash160) {
        if (hash160 == null || hash160.length != HASH160_LENGTH) {
            throw new AddressFormatException(Reason.BAD_LENGTH, "hash160长度必须为20字节");
        }
        if (NetworkType.fromPrefix(prefix) == null) {
            throw new AddressFormatException(Reason.UNKNOWN_PREFIX, "未知前缀: " + prefix);
        }
        byte[] payload = new byte[HASH160_LENGTH + 1];
        payload[0] = (byte) (type.getCode() << 3);
        System.arraycopy(hash160, 0, payload, 1, HASH160_LENGTH);

        byte[] payload5 = CashAddr.convertBits(payload, 8, 5, true);
        byte[] checksum = CashAddr.createChecksum(prefix, payload5);
        return prefix + ":" + CashAddr.toChars(payload5) + CashAddr.toChars(checksum);
    }

    /**
     * 解码带前缀的 CashAddr
     */
    public static DecodedAddress decode(String address) {
        return decode(address, null);
    }

    /**
     * 解码 CashAddr，地址不带前缀时使用 defaultNetwork 的前缀
     */
    public static DecodedAddress decode(String address, NetworkType defaultNetwork) {
        if (address == null || address.isEmpty()) {
            throw new AddressFormatException(Reason.BAD_LENGTH, "地址为空");
        }
        String lower = address.toLowerCase(Locale.ROOT);
        if (!lower.equals(address) && !address.toUpperCase(Locale.ROOT).equals(address)) {
            throw new AddressFormatException(Reason.MIXED_CASE, "地址大小写混用: " + address);
        }

        String prefix;
        String data;
        int separator = lower.lastIndexOf(':');
        if (separator >= 0) {
            prefix = lower.substring(0, separator);
            data = lower.substring(separator + 1);
        } else if (defaultNetwork != null) {
            prefix = defaultNetwork.getPrefix();
            data = lower;
        } else {
            throw new AddressFormatException(Reason.UNKNOWN_PREFIX, "地址缺少前缀: " + address);
        }

        NetworkType network = NetworkType.fromPrefix(prefix);
        if (network == null) {
            throw new AddressFormatException(Reason.UNKNOWN_PREFIX, "未知前缀: " + prefix);
        }

        byte[] values = CashAddr.fromChars(data);
        if (values == null) {
            throw new AddressFormatException(Reason.BAD_CHARACTER, "地址包含非法字符: " + address);
        }
        if (values.length <= CashAddr.CHECKSUM_LENGTH) {
            throw new AddressFormatException(Reason.BAD_LENGTH, "地址过短: " + address);
        }
        if (!CashAddr.verifyChecksum(prefix, values)) {
            throw new AddressFormatException(Reason.BAD_CHECKSUM, "校验和不匹配: " + address);
        }

        byte[] payload5 = Arrays.copyOfRange(values, 0, values.length - CashAddr.CHECKSUM_LENGTH);
        byte[] payload = CashAddr.convertBits(payload5, 5, 8, false);
        if (payload == null || payload.length != HASH160_LENGTH + 1) {
            throw new AddressFormatException(Reason.BAD_LENGTH, "解码长度错误: " + address);
        }

        int versionByte = payload[0] & 0xff;
        // 低3位是哈希长度编码，只支持160位
        AddressType type = AddressType.fromCode((versionByte >>> 3) & 0x0f);
        if (type == null || (versionByte & 0x07) != 0 || (versionByte & 0x80) != 0) {
            throw new AddressFormatException(Reason.UNKNOWN_VERSION, "不支持的版本字节: " + versionByte);
        }
        return new DecodedAddress(network, type, Arrays.copyOfRange(payload, 1, payload.length));
    }

    /**
     * CashAddr -> 传统 Base58Check 地址
     */
    public static String toLegacy(String cashAddress) {
        DecodedAddress decoded = decode(cashAddress);
        NetworkType network = decoded.getNetwork();
        int version = decoded.getType() == AddressType.P2KH ? network.getP2khVersion() : network.getP2shVersion();
        return Base58.encodeChecked(version, decoded.getHash160());
    }

    /**
     * 传统 Base58Check 地址 -> CashAddr
     * @param network 测试网与回归测试网的版本字节相同，由调用方指定落在哪个前缀；为空时按版本字节推断
     */
    public static String fromLegacy(String legacyAddress, NetworkType network) {
        DecodedAddress decoded = decodeLegacy(legacyAddress, network);
        return encode(decoded.getNetwork(), decoded.getType(), decoded.getHash160());
    }

    public static DecodedAddress decodeLegacy(String legacyAddress, NetworkType network) {
        byte[] versionAndHash;
        try {
            versionAndHash = Base58.decodeChecked(legacyAddress);
        } catch (org.bitcoinj.core.AddressFormatException e) {
            Reason reason = e instanceof org.bitcoinj.core.AddressFormatException.InvalidChecksum
                    ? Reason.BAD_CHECKSUM : Reason.BAD_CHARACTER;
            throw new AddressFormatException(reason, "Base58Check解码失败: " + legacyAddress, e);
        }
        if (versionAndHash.length != HASH160_LENGTH + 1) {
            throw new AddressFormatException(Reason.BAD_LENGTH, "传统地址长度错误: " + legacyAddress);
        }
        int version = versionAndHash[0] & 0xff;
        byte[] hash160 = Arrays.copyOfRange(versionAndHash, 1, versionAndHash.length);

        if (network != null) {
            if (version == network.getP2khVersion()) {
                return new DecodedAddress(network, AddressType.P2KH, hash160);
            }
            if (version == network.getP2shVersion()) {
                return new DecodedAddress(network, AddressType.P2SH, hash160);
            }
        }
        for (NetworkType candidate : NetworkType.values()) {
            if (version == candidate.getP2khVersion()) {
                return new DecodedAddress(candidate, AddressType.P2KH, hash160);
            }
            if (version == candidate.getP2shVersion()) {
                return new DecodedAddress(candidate, AddressType.P2SH, hash160);
            }
        }
        throw new AddressFormatException(Reason.UNKNOWN_VERSION, "未知的传统地址版本: " + version);
    }

    /**
     * 解码任意格式：带前缀/不带前缀的 CashAddr，或传统地址
     */
    public static DecodedAddress decodeAny(String address, NetworkType network) {
        if (address == null || address.isEmpty()) {
            throw new AddressFormatException(Reason.BAD_LENGTH, "地址为空");
        }
        if (isLikelyLegacy(address)) {
            return decodeLegacy(address, network);
        }
        return decode(address, network);
    }

    /**
     * 提取任意格式地址中的 hash160
     */
    public static byte[] extractHash160(String address, NetworkType network) {
        return decodeAny(address, network).getHash160();
    }

    /**
     * 统一成带前缀的小写 CashAddr
     */
    public static String normalize(String address, NetworkType network) {
        DecodedAddress decoded = decodeAny(address, network);
        return encode(decoded.getNetwork(), decoded.getType(), decoded.getHash160());
    }

    public static boolean isValid(String address, NetworkType network) {
        try {
            decodeAny(address, network);
            return true;
        } catch (AddressFormatException e) {
            log.debug("地址无效: {}, 原因: {}", address, e.getReason());
            return false;
        }
    }

    // 无前缀的 CashAddr 以 q/p 开头，传统地址以 1/3/m/n/2 开头
    private static boolean isLikelyLegacy(String address) {
        if (address.indexOf(':') >= 0) {
            return false;
        }
        char first = address.charAt(0);
        return (first == '1' || first == '3' || first == 'm' || first == 'n' || first == '2')
                && address.length() >= 26 && address.length() <= 35;
    }
}
