package com.bit.bchpool.stratum.impl;

import com.bit.bchpool.address.AddressCodec;
import com.bit.bchpool.address.AddressFormatException;
import com.bit.bchpool.address.AddressType;
import com.bit.bchpool.address.DecodedAddress;
import com.bit.bchpool.block.BlockAssembler;
import com.bit.bchpool.block.CompleteBlock;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.difficulty.DifficultyChangedEvent;
import com.bit.bchpool.difficulty.DifficultyController;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.job.Job;
import com.bit.bchpool.job.JobManager;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.node.NodeClient;
import com.bit.bchpool.node.SubmitResult;
import com.bit.bchpool.persistence.Miner;
import com.bit.bchpool.persistence.PersistenceService;
import com.bit.bchpool.persistence.ShareRecord;
import com.bit.bchpool.share.RejectReason;
import com.bit.bchpool.share.ShareResult;
import com.bit.bchpool.share.ShareValidator;
import com.bit.bchpool.stratum.MinerSession;
import com.bit.bchpool.stratum.SessionState;
import com.bit.bchpool.stratum.StratumCodec;
import com.bit.bchpool.stratum.StratumErrorCode;
import com.bit.bchpool.stratum.StratumMethod;
import com.bit.bchpool.stratum.StratumSessionManager;
import com.bit.bchpool.stratum.TransportType;
import com.bit.bchpool.stratum.message.AuthorizeRequest;
import com.bit.bchpool.stratum.message.InvalidRequest;
import com.bit.bchpool.stratum.message.StratumRequest;
import com.bit.bchpool.stratum.message.SubmitRequest;
import com.bit.bchpool.stratum.message.SubscribeRequest;
import com.bit.bchpool.util.ByteUtils;
import io.netty.channel.Channel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Service
public class StratumSessionManagerImpl implements StratumSessionManager {

    // ==================== 核心配置参数 ====================
    private static final int EXTRA_NONCE1_SIZE = 16;
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    // ==================== 核心组件 ====================
    private final PoolConfig config;
    private final JobManager jobManager;
    private final JobRegistry jobRegistry;
    private final ShareValidator shareValidator;
    private final DifficultyController difficultyController;
    private final BlockAssembler blockAssembler;
    private final NodeClient nodeClient;
    private final PersistenceService persistenceService;

    // ==================== 会话登记 ====================
    private final ConcurrentHashMap<String, MinerSession> sessions = new ConcurrentHashMap<>();
    private final Set<String> allocatedExtraNonce1 = ConcurrentHashMap.newKeySet();
    // 广播持读锁遍历，连接建立/断开持写锁，断开中的会话要么完整收到广播要么完全收不到
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final SecureRandom random = new SecureRandom();
    private final AtomicLong sessionSequence = new AtomicLong();
    // 区块提交与随后的模板刷新都是阻塞RPC，不占用Netty的IO线程
    private final ExecutorService blockSubmitExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "pool-block-submit");
        thread.setDaemon(true);
        return thread;
    });

    // ==================== 统计 ====================
    private final AtomicInteger activeConnections = new AtomicInteger();
    private final LongAdder totalConnections = new LongAdder();
    private final LongAdder rejectedConnections = new LongAdder();
    private final LongAdder protocolErrors = new LongAdder();
    private final LongAdder blocksFound = new LongAdder();
    private final LongAdder blocksRejected = new LongAdder();

    @Autowired
    public StratumSessionManagerImpl(PoolConfig config, JobManager jobManager, JobRegistry jobRegistry,
                                     ShareValidator shareValidator, DifficultyController difficultyController,
                                     BlockAssembler blockAssembler, NodeClient nodeClient,
                                     PersistenceService persistenceService) {
        this.config = config;
        this.jobManager = jobManager;
        this.jobRegistry = jobRegistry;
        this.shareValidator = shareValidator;
        this.difficultyController = difficultyController;
        this.blockAssembler = blockAssembler;
        this.nodeClient = nodeClient;
        this.persistenceService = persistenceService;
    }

    @Override
    public MinerSession openSession(Channel channel, TransportType transport) {
        registryLock.writeLock().lock();
        try {
            if (sessions.size() >= config.getStratum().getMaxConnections()) {
                rejectedConnections.increment();
                log.warn("连接数已达上限{}，拒绝连接: {}", config.getStratum().getMaxConnections(), channel.remoteAddress());
                return null;
            }
            String sessionId = sessionSequence.incrementAndGet() + "-" + channel.id().asShortText();
            MinerSession session = new MinerSession(sessionId, transport, channel);
            sessions.put(session.getSessionId(), session);
            activeConnections.incrementAndGet();
            totalConnections.increment();
            log.info("矿工连接建立: {}, 传输: {}, 当前连接数: {}", channel.remoteAddress(), transport, sessions.size());
            return session;
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    @Override
    public void handleMessage(MinerSession session, String message) {
        if (session.getState() == SessionState.CLOSED) {
            return;
        }
        session.setLastActivity(System.currentTimeMillis());
        log.debug("收到报文 {}: {}", session.getSessionId(), message);

        StratumRequest request;
        try {
            request = StratumCodec.decode(message);
        } catch (PoolException e) {
            protocolErrors.increment();
            if (session.getState() == SessionState.CONNECTED) {
                // 握手阶段报文无法解析，只关闭这一个连接
                log.warn("握手报文无法解析，关闭连接 {}: {}", session.getRemoteAddress(), e.getMessage());
                session.getChannel().close();
            } else {
                log.warn("报文无法解析 {}: {}", session.getRemoteAddress(), e.getMessage());
                session.send(StratumCodec.encodeResponse(null, null, StratumErrorCode.OTHER.toError("Parse error")));
            }
            return;
        }

        StratumMethod method = request.getMethod();
        if (method == null) {
            handleInvalid(session, (InvalidRequest) request);
            return;
        }
        switch (method) {
            case SUBSCRIBE:
                handleSubscribe(session, (SubscribeRequest) request);
                break;
            case AUTHORIZE:
                handleAuthorize(session, (AuthorizeRequest) request);
                break;
            case SUBMIT:
                handleSubmit(session, (SubmitRequest) request);
                break;
            case GET_TRANSACTIONS:
                // 不公开部分交易树
                session.send(StratumCodec.encodeResponse(request.getId(), Collections.emptyList(), null));
                break;
            default:
                InvalidRequest invalid = new InvalidRequest();
                invalid.setId(request.getId());
                invalid.setMethodName(method.getWireName());
                invalid.setReason("Unknown method " + method.getWireName());
                handleInvalid(session, invalid);
                break;
        }
    }

    private void handleInvalid(MinerSession session, InvalidRequest request) {
        protocolErrors.increment();
        log.warn("无效请求 {}: method={}, 原因={}", session.getRemoteAddress(), request.getMethodName(), request.getReason());
        String reason = request.getReason() == null ? StratumErrorCode.OTHER.getMessage() : request.getReason();
        session.send(StratumCodec.encodeResponse(request.getId(), null, StratumErrorCode.OTHER.toError(reason)));
    }

    private void handleSubscribe(MinerSession session, SubscribeRequest request) {
        if (session.getExtraNonce1() == null) {
            session.setExtraNonce1(allocateExtraNonce1());
        }
        session.setUserAgent(request.getUserAgent());
        if (session.getState() == SessionState.CONNECTED) {
            session.setState(SessionState.SUBSCRIBED);
        }
        List<Object> subscriptions = Arrays.asList(
                Arrays.asList(StratumMethod.SET_DIFFICULTY.getWireName(), "difficulty"),
                Arrays.asList(StratumMethod.NOTIFY.getWireName(), "job_id"));
        List<Object> result = Arrays.asList(subscriptions, session.getExtraNonce1(),
                config.getStratum().getExtraNonce2Size());
        session.send(StratumCodec.encodeResponse(request.getId(), result, null));
        session.send(StratumCodec.encodeNotification(StratumMethod.SET_DIFFICULTY,
                List.of(difficultyController.getCurrentDifficulty())));
        log.info("矿工订阅成功: {}, extraNonce1={}, agent={}", session.getRemoteAddress(),
                session.getExtraNonce1(), request.getUserAgent());
    }

    private String allocateExtraNonce1() {
        byte[] bytes = new byte[EXTRA_NONCE1_SIZE];
        String candidate;
        do {
            random.nextBytes(bytes);
            candidate = ByteUtils.bytesToHex(bytes);
        } while (!allocatedExtraNonce1.add(candidate));
        return candidate;
    }

    private void handleAuthorize(MinerSession session, AuthorizeRequest request) {
        if (session.getState() == SessionState.CONNECTED) {
            session.send(StratumCodec.encodeResponse(request.getId(), false, StratumErrorCode.NOT_SUBSCRIBED.toError()));
            return;
        }
        String username = request.getUsername().trim();
        int dot = username.indexOf('.');
        String rawAddress = dot >= 0 ? username.substring(0, dot) : username;
        String worker = dot >= 0 && dot < username.length() - 1
                ? username.substring(dot + 1) : config.getMiner().getDefaultWorker();

        DecodedAddress decoded;
        try {
            decoded = AddressCodec.decodeAny(rawAddress, config.getNetwork().getType());
        } catch (AddressFormatException e) {
            log.warn("矿工授权失败，地址非法: {}, 原因: {}", rawAddress, e.getReason());
            session.send(StratumCodec.encodeResponse(request.getId(), false,
                    StratumErrorCode.UNAUTHORIZED.toError("Invalid address: " + e.getReason())));
            return;
        }
        // coinbase 只能付给 P2PKH 脚本
        if (decoded.getType() != AddressType.P2KH) {
            log.warn("矿工授权失败，不支持的地址类型{}: {}", decoded.getType(), rawAddress);
            session.send(StratumCodec.encodeResponse(request.getId(), false,
                    StratumErrorCode.UNAUTHORIZED.toError("Invalid address: only P2KH payout addresses are supported")));
            return;
        }
        String address = AddressCodec.encode(decoded.getNetwork(), decoded.getType(), decoded.getHash160());

        Miner miner;
        try {
            miner = persistenceService.getMinerByAddress(address);
            // 已停用的矿工不更新活跃时间
            if ((miner == null && config.getMiner().isAutoRegister()) || (miner != null && miner.isActive())) {
                miner = persistenceService.registerMiner(address, worker);
            }
        } catch (PoolException e) {
            log.error("矿工授权时持久化失败: {}", address, e);
            session.send(StratumCodec.encodeResponse(request.getId(), false,
                    StratumErrorCode.OTHER.toError("Internal error")));
            return;
        }
        if (miner == null) {
            log.warn("矿工授权失败，未注册: {}", address);
            session.send(StratumCodec.encodeResponse(request.getId(), false,
                    StratumErrorCode.UNAUTHORIZED.toError("Miner not registered")));
            return;
        }
        if (!miner.isActive()) {
            log.warn("矿工授权失败，已停用: {}", address);
            session.send(StratumCodec.encodeResponse(request.getId(), false,
                    StratumErrorCode.UNAUTHORIZED.toError("Miner deactivated")));
            return;
        }

        session.setMinerAddress(address);
        session.setWorkerName(worker);
        session.setState(SessionState.AUTHORIZED);
        session.send(StratumCodec.encodeResponse(request.getId(), true, null));
        log.info("矿工授权成功: {}.{}", address, worker);

        Job job;
        try {
            job = jobManager.createMinerJob(address, session.getExtraNonce1(), true);
        } catch (PoolException e) {
            log.warn("为矿工{}生成任务失败，按顺序解析可用任务: {}", address, e.getMessage());
            job = jobRegistry.getJobForMiner(address, session.getExtraNonce1());
        }
        sendJob(session, job);
        session.setState(SessionState.WORKING);
    }

    private void sendJob(MinerSession session, Job job) {
        session.addJob(job.getJobId());
        session.send(StratumCodec.encodeNotification(StratumMethod.NOTIFY, job.toNotifyParams()));
    }

    private void handleSubmit(MinerSession session, SubmitRequest request) {
        if (!session.getState().isAuthorized()) {
            session.send(StratumCodec.encodeResponse(request.getId(), false, StratumErrorCode.UNAUTHORIZED.toError()));
            return;
        }
        double difficulty = difficultyController.getCurrentDifficulty();
        ShareResult result = shareValidator.validate(request.getJobId(), session.getExtraNonce1(),
                request.getExtraNonce2(), request.getNtime(), request.getNonce(), session.getMinerAddress(), difficulty);

        if (result.isAccepted()) {
            session.getAcceptedShares().increment();
            session.send(StratumCodec.encodeResponse(request.getId(), true, null));
            log.info("份额通过: {}.{}, job={}, hash={}", session.getMinerAddress(), session.getWorkerName(),
                    request.getJobId(), result.getHash());
            difficultyController.recordShare(session.getMinerAddress());
        } else {
            session.getRejectedShares().increment();
            session.send(StratumCodec.encodeResponse(request.getId(), false,
                    StratumErrorCode.toError(result.getReason().getCode(), result.errorMessage())));
        }

        // 份额已应答，持久化失败不影响结果
        saveShare(session, request, result, difficulty);

        if (result.isAccepted() && result.isMeetsNetwork()) {
            String minerAddress = session.getMinerAddress();
            blockSubmitExecutor.execute(() -> {
                try {
                    submitFoundBlock(minerAddress, result);
                } catch (RuntimeException e) {
                    log.error("区块提交流程异常: job={}", result.getJob().getJobId(), e);
                }
            });
        }
    }

    private void saveShare(MinerSession session, SubmitRequest request, ShareResult result, double difficulty) {
        ShareRecord record = new ShareRecord();
        record.setMinerAddress(session.getMinerAddress());
        record.setWorkerName(session.getWorkerName());
        record.setJobId(request.getJobId());
        record.setExtraNonce2(request.getExtraNonce2());
        record.setNtime(request.getNtime());
        record.setNonce(request.getNonce());
        record.setHash(result.getHash());
        record.setDifficulty(difficulty);
        record.setAccepted(result.isAccepted());
        RejectReason reason = result.getReason();
        record.setRejectReason(reason == null ? null : reason.name());
        record.setCreatedAt(System.currentTimeMillis());
        try {
            persistenceService.saveShare(record);
        } catch (PoolException e) {
            log.error("份额持久化失败: miner={}, job={}", session.getMinerAddress(), request.getJobId(), e);
        }
    }

    private void submitFoundBlock(String minerAddress, ShareResult result) {
        Job job = result.getJob();
        CompleteBlock block;
        try {
            block = blockAssembler.assembleBlock(job.getTemplate(), result.getHeader(), result.getCoinbase());
        } catch (PoolException e) {
            log.error("区块组装失败: job={}", job.getJobId(), e);
            return;
        }
        log.info("发现区块! 高度: {}, 哈希: {}, 矿工: {}", block.getHeight(), block.getBlockHash(), minerAddress);

        SubmitResult submitResult;
        try {
            submitResult = nodeClient.submitBlock(block.getBlockHex());
        } catch (PoolException e) {
            blocksRejected.increment();
            log.error("区块提交失败: 高度{}, 哈希{}", block.getHeight(), block.getBlockHash(), e);
            return;
        }
        if (!submitResult.isAccepted()) {
            blocksRejected.increment();
            log.warn("节点拒绝区块: 高度{}, 原因: {}", block.getHeight(), submitResult.getMessage());
            return;
        }
        blocksFound.increment();
        try {
            persistenceService.saveBlock(block.getHeight(), block.getBlockHash(), minerAddress);
        } catch (PoolException e) {
            log.error("区块持久化失败: 高度{}, 哈希{}", block.getHeight(), block.getBlockHash(), e);
        }
        // 链已前进，立即下发新任务
        broadcastNewJobs();
    }

    @PreDestroy
    public void shutdown() {
        blockSubmitExecutor.shutdown();
        try {
            if (!blockSubmitExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                blockSubmitExecutor.shutdownNow();
                log.warn("区块提交线程未在{}秒内结束，已强制停止", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            blockSubmitExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void closeSession(MinerSession session) {
        registryLock.writeLock().lock();
        try {
            if (sessions.remove(session.getSessionId()) == null) {
                return;
            }
            session.setState(SessionState.CLOSED);
            activeConnections.decrementAndGet();
            if (session.getExtraNonce1() != null) {
                allocatedExtraNonce1.remove(session.getExtraNonce1());
            }
            int removed = 0;
            for (String jobId : session.getJobIds()) {
                Job job = jobRegistry.getJob(jobId);
                if (job != null && !job.isBroadcast() && jobRegistry.removeJob(jobId)) {
                    removed++;
                }
            }
            session.getJobIds().clear();
            log.info("矿工连接断开: {}, 地址: {}, 清理任务{}个, 当前连接数: {}", session.getRemoteAddress(),
                    session.getMinerAddress(), removed, sessions.size());
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    @Override
    public int broadcastNewJobs() {
        jobManager.refreshTemplate();
        Job broadcastJob = jobManager.createBroadcastJob();
        int notified = 0;
        registryLock.readLock().lock();
        try {
            for (MinerSession session : sessions.values()) {
                if (!session.isActive() || session.getState() == SessionState.CONNECTED) {
                    continue;
                }
                try {
                    Job job = session.getState().isAuthorized()
                            ? jobManager.createMinerJob(session.getMinerAddress(), session.getExtraNonce1(), true)
                            : broadcastJob;
                    sendJob(session, job);
                    notified++;
                } catch (PoolException e) {
                    log.error("向会话{}下发任务失败", session, e);
                }
            }
        } finally {
            registryLock.readLock().unlock();
        }
        log.info("新任务已广播: 高度{}, 会话数{}", broadcastJob.getTemplate().getHeight(), notified);
        return notified;
    }

    @Override
    public int broadcastDifficulty(double difficulty) {
        String message = StratumCodec.encodeNotification(StratumMethod.SET_DIFFICULTY, List.of(difficulty));
        int notified = 0;
        registryLock.readLock().lock();
        try {
            for (MinerSession session : sessions.values()) {
                if (session.isActive() && session.getState() != SessionState.CONNECTED) {
                    session.send(message);
                    notified++;
                }
            }
        } finally {
            registryLock.readLock().unlock();
        }
        log.info("难度已广播: {}, 会话数{}", difficulty, notified);
        return notified;
    }

    @EventListener
    public void onDifficultyChanged(DifficultyChangedEvent event) {
        broadcastDifficulty(event.getNewDifficulty());
    }

    @Override
    public MinerSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    @Override
    public Collection<MinerSession> getSessions() {
        return new ArrayList<>(sessions.values());
    }

    @Override
    public int getActiveConnections() {
        return activeConnections.get();
    }

    @Override
    public Map<String, Object> getStats() {
        int tcp = 0;
        int websocket = 0;
        int authorized = 0;
        for (MinerSession session : sessions.values()) {
            if (session.getTransport() == TransportType.TCP) {
                tcp++;
            } else {
                websocket++;
            }
            if (session.getState().isAuthorized()) {
                authorized++;
            }
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("activeConnections", activeConnections.get());
        stats.put("tcpConnections", tcp);
        stats.put("websocketConnections", websocket);
        stats.put("authorizedSessions", authorized);
        stats.put("totalConnections", totalConnections.sum());
        stats.put("rejectedConnections", rejectedConnections.sum());
        stats.put("protocolErrors", protocolErrors.sum());
        stats.put("blocksFound", blocksFound.sum());
        stats.put("blocksRejected", blocksRejected.sum());
        stats.put("shares", shareValidator.getStats());
        return stats;
    }
}
