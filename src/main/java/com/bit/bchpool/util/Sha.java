package com.bit.bchpool.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.MessageDigest;
import java.security.Security;

@Slf4j
public class Sha {
    // ThreadLocal存储每个线程独立的SHA-256实例
    private static final ThreadLocal<MessageDigest> SHA256_THREAD_LOCAL = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256", BouncyCastleProvider.PROVIDER_NAME);
        } catch (Exception e) {
            throw new RuntimeException("创建线程本地SHA-256实例失败", e);
        }
    });

    private static final ThreadLocal<MessageDigest> RIPEMD160_THREAD_LOCAL = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("RIPEMD160", BouncyCastleProvider.PROVIDER_NAME);
        } catch (Exception e) {
            throw new RuntimeException("创建线程本地RIPEMD160实例失败", e);
        }
    });

    // 静态代码块：确保BouncyCastle先注册
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        try {
            SHA256_THREAD_LOCAL.get();
            RIPEMD160_THREAD_LOCAL.get();
        } catch (Exception e) {
            throw new RuntimeException("哈希算法初始化验证失败：" + e.getMessage()
                    + "，请确保BouncyCastle依赖正确", e);
        }
    }

    /**
     * 线程安全的SHA-256计算（每个线程复用自己的实例）
     */
    public static byte[] applySHA256(byte[] data) {
        // 允许空数组（哈希计算空数组是合法的）
        data = data == null ? new byte[0] : data;
        MessageDigest digest = SHA256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 双重SHA-256：区块头、交易ID、Base58Check校验和都使用它
     */
    public static byte[] applyDoubleSHA256(byte[] data) {
        return applySHA256(applySHA256(data));
    }

    /**
     * 两段拼接后双重SHA-256（Merkle节点合并）
     */
    public static byte[] applyDoubleSHA256(byte[] left, byte[] right) {
        MessageDigest digest = SHA256_THREAD_LOCAL.get();
        digest.reset();
        digest.update(left);
        digest.update(right);
        byte[] first = digest.digest();
        return applySHA256(first);
    }

    public static byte[] applyRIPEMD160(byte[] data) {
        data = data == null ? new byte[0] : data;
        MessageDigest digest = RIPEMD160_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * HASH160 = RIPEMD160(SHA256(data))，公钥/脚本哈希
     */
    public static byte[] applyHash160(byte[] data) {
        return applyRIPEMD160(applySHA256(data));
    }

    /**
     * 手动清理线程本地资源（线程池任务结束时调用）
     */
    public static void clearThreadLocals() {
        SHA256_THREAD_LOCAL.remove();
        RIPEMD160_THREAD_LOCAL.remove();
    }
}
