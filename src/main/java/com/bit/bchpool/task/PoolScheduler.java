package com.bit.bchpool.task;

import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.difficulty.DifficultyController;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.stratum.StratumSessionManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 后台定时任务：任务广播、过期清理、难度调整
 */
@Slf4j
@Component
public class PoolScheduler {

    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final PoolConfig config;
    private final StratumSessionManager sessionManager;
    private final JobRegistry jobRegistry;
    private final DifficultyController difficultyController;

    private ScheduledExecutorService broadcastScheduler;
    private ScheduledExecutorService cleanupScheduler;
    private ScheduledExecutorService difficultyScheduler;

    @Autowired
    public PoolScheduler(PoolConfig config, StratumSessionManager sessionManager, JobRegistry jobRegistry,
                         DifficultyController difficultyController) {
        this.config = config;
        this.sessionManager = sessionManager;
        this.jobRegistry = jobRegistry;
        this.difficultyController = difficultyController;
    }

    @PostConstruct
    public void init() {
        if (!config.getScheduler().isEnabled()) {
            log.info("后台定时任务未启用");
            return;
        }
        initExecutors();
        startScheduledTasks();
    }

    private void initExecutors() {
        broadcastScheduler = newScheduler("pool-job-broadcast");
        cleanupScheduler = newScheduler("pool-cleanup");
        difficultyScheduler = newScheduler("pool-difficulty");
    }

    private static ScheduledExecutorService newScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    private void startScheduledTasks() {
        PoolConfig.Job job = config.getJob();

        // 启动后立即拉取一次模板
        broadcastScheduler.scheduleAtFixedRate(() -> {
            try {
                broadcastJobs();
            } catch (Exception e) {
                log.error("任务广播异常", e);
            }
        }, 0, job.getBroadcastInterval(), TimeUnit.SECONDS);

        cleanupScheduler.scheduleAtFixedRate(() -> {
            try {
                cleanup();
            } catch (Exception e) {
                log.error("过期数据清理异常", e);
            }
        }, job.getCleanupInterval(), job.getCleanupInterval(), TimeUnit.SECONDS);

        long difficultyInterval = config.getDifficulty().getUpdateInterval();
        difficultyScheduler.scheduleAtFixedRate(() -> {
            try {
                difficultyController.apply();
            } catch (Exception e) {
                log.error("难度调整异常", e);
            }
        }, difficultyInterval, difficultyInterval, TimeUnit.SECONDS);

        log.info("后台定时任务已启动: 广播间隔{}秒, 清理间隔{}秒, 难度调整间隔{}秒",
                job.getBroadcastInterval(), job.getCleanupInterval(), difficultyInterval);
    }

    void broadcastJobs() {
        int notified = sessionManager.broadcastNewJobs();
        log.debug("定时广播完成，推送会话{}个", notified);
    }

    void cleanup() {
        int jobs = jobRegistry.cleanupOldJobs(config.getJob().getMaxAge());
        int samples = difficultyController.cleanupOldData();
        log.debug("定时清理完成: 任务{}个, 份额统计{}条", jobs, samples);
    }

    @PreDestroy
    public void shutdown() {
        shutdownExecutor(broadcastScheduler, "任务广播");
        shutdownExecutor(cleanupScheduler, "过期清理");
        shutdownExecutor(difficultyScheduler, "难度调整");
    }

    private static void shutdownExecutor(ScheduledExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("{}定时任务未在{}秒内结束，已强制停止", name, SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("{}定时任务已停止", name);
    }
}
