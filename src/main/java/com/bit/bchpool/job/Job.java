package com.bit.bchpool.job;

import com.bit.bchpool.block.BlockTemplate;
import com.bit.bchpool.block.StratumJobData;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 挖矿任务：模板快照 + stratum线上字段
 */
@Data
public class Job {
    public static final String BROADCAST_OWNER = "broadcast";

    private String jobId;
    // 全局递增计数，同一秒内也能区分新旧
    private long sequence;
    private BlockTemplate template;
    private StratumJobData stratumData;
    private boolean cleanJobs;
    // 所属矿工地址，broadcast任务为null
    private String owner;
    private String payoutAddress;
    // 创建时间（秒），清理时使用
    private long createdAt;
    private boolean fallback;

    public boolean isBroadcast() {
        return owner == null;
    }

    public String getExtraNonce1() {
        return stratumData == null ? null : stratumData.getExtraNonce1();
    }

    /**
     * mining.notify 参数：[job_id, prevhash, coinb1, coinb2, merkle_branch, version, nbits, ntime, clean_jobs]
     */
    public List<Object> toNotifyParams() {
        return new ArrayList<>(Arrays.asList(
                jobId,
                stratumData.getPrevHash(),
                stratumData.getCoinb1(),
                stratumData.getCoinb2(),
                stratumData.getMerkleBranch(),
                stratumData.getVersion(),
                stratumData.getNbits(),
                stratumData.getNtime(),
                cleanJobs));
    }
}
