package com.bit.bchpool.api;

import com.bit.bchpool.job.JobHistoryEntry;
import com.bit.bchpool.job.JobManager;
import com.bit.bchpool.job.JobRegistry;
import com.bit.bchpool.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
public class JobApi {

    @Autowired
    private JobManager jobManager;
    @Autowired
    private JobRegistry jobRegistry;

    @GetMapping("/stats")
    public Result<Map<String, Object>> getStats() {
        return Result.ok(jobManager.getStats());
    }

    /**
     * 最近生成的任务，新的在前
     */
    @GetMapping("/history")
    public Result<List<JobHistoryEntry>> getHistory(@RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0) {
            return Result.error(Result.SC_BAD_REQUEST_400, "limit 必须为正数");
        }
        return Result.ok(jobRegistry.getJobHistory(limit));
    }
}
