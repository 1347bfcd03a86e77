package com.homework.web.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 调度器状态："队列: N | 当前: kind"。
 */
@Data
@Builder
public class QueueStatus {

    private String state;
    private int queueDepth;
    /** 空闲时为 null */
    private String currentTask;
    private long completedCount;
    private long failedCount;
}
