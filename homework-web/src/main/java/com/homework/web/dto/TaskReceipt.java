package com.homework.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 任务提交回执：任务只是进入队列，执行结果通过通知和快照查看。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskReceipt {

    private String taskId;
    private String kind;
    private int queueDepth;
}
