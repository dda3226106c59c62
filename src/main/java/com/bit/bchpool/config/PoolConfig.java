package com.bit.bchpool.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 矿池静态配置（application.yml 中 pool.* 节点）
 * 默认值与线上部署保持一致
 */
@Slf4j
@Data
@Component
@Order(0)
@ConfigurationProperties(prefix = "pool")
public class PoolConfig {

    private String name = "BCH Solo Pool";
    //broadcast任务的收款地址 为空时使用文档公开地址
    private String wallet = "";

    private Network network = new Network();
    private Stratum stratum = new Stratum();
    private Difficulty difficulty = new Difficulty();
    private Job job = new Job();
    private Block block = new Block();
    private Miner miner = new Miner();
    private Node node = new Node();
    private Persistence persistence = new Persistence();
    private Scheduler scheduler = new Scheduler();

    @PostConstruct
    public void init() {
        log.info("矿池配置加载完成: name={}, network={}, tcp={}:{}, ws={}:{}{}",
                name, network.getType(), stratum.getHost(), stratum.getTcpPort(),
                stratum.getHost(), stratum.getWebsocketPort(), stratum.getWebsocketPath());
        if (difficulty.getMin() <= 0 || difficulty.getMin() > difficulty.getMax()) {
            throw new IllegalStateException("难度上下限配置非法: min=" + difficulty.getMin() + ", max=" + difficulty.getMax());
        }
        if (stratum.getExtraNonce2Size() < 1 || stratum.getExtraNonce2Size() > 8) {
            throw new IllegalStateException("extraNonce2长度非法: " + stratum.getExtraNonce2Size());
        }
    }

    @Data
    public static class Network {
        private NetworkType type = NetworkType.TESTNET;
    }

    @Data
    public static class Stratum {
        private String host = "0.0.0.0";
        private int tcpPort = 3333;
        private int websocketPort = 3334;
        private String websocketPath = "/stratum";
        private boolean tcpEnabled = true;
        private boolean websocketEnabled = true;
        private int maxConnections = 1000;
        private int extraNonce2Size = 4;
        private int maxLineLength = 16 * 1024;
    }

    @Data
    public static class Difficulty {
        private double initial = 1.0;
        private double min = 0.001;
        private double max = 1000.0;
        private double targetSharesPerMinute = 60;
        private long updateInterval = 300;      // 秒
        private boolean dynamic = true;
        private int minSamples = 10;            // 最近一小时最少样本数
        private double maxChangeFactor = 4.0;
        private double minRelativeChange = 0.01;
    }

    @Data
    public static class Job {
        private long broadcastInterval = 30;    // 秒
        private long cleanupInterval = 300;     // 秒
        private long maxAge = 300;              // 秒
        private int historySize = 100;
        private int maxNoncesPerJob = 1000;
        private long ntimeTolerance = 7200;     // 秒
    }

    @Data
    public static class Block {
        private long version = 0x20000000L;
        private String bits = "1d00ffff";
        private String coinbasePrefix = "/BCHPool/";
        private int maxScriptSigSize = 100;
        private long fallbackCoinbaseValue = 3125000000L;
        private String fallbackPrevHash = "000000000000000007cbc708a5e00de8fd5e4b5b3e2a4f61c5aec6d6b7a9b8c9";
    }

    @Data
    public static class Miner {
        private boolean autoRegister = true;
        private String defaultWorker = "default";
    }

    @Data
    public static class Node {
        private NodeMode mode = NodeMode.RPC;
        private String host = "127.0.0.1";
        private int port = 28332;
        private String user;
        private String password;
        private boolean useCookie = true;
        private String cookiePath;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class Persistence {
        private PersistenceType type = PersistenceType.MEMORY;
        private String path = "data/bch-pool";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }

    public enum NodeMode { RPC, MOCK }

    public enum PersistenceType { MEMORY, ROCKSDB }
}
