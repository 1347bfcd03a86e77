package com.homework.common.util;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 任务 ID 生成器：前缀 + 进程内递增序号 + 随机后缀，如 "task-42-1f3a9c0b"。
 * <p>
 * 序号按生成顺序递增，日志里可以直接看出提交先后；随机后缀区分不同进程。
 */
public final class IdGenerator {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private IdGenerator() {
    }

    public static String withPrefix(String prefix) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return prefix + "-" + SEQUENCE.incrementAndGet() + "-" + suffix;
    }
}
