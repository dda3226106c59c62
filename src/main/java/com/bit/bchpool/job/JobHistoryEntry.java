package com.bit.bchpool.job;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class JobHistoryEntry {
    private String jobId;
    private long createdAt;
    private String owner;       // broadcast任务为 "broadcast"
    private String type;        // personal / broadcast / fallback
    private long height;
}
