package com.homework.dispatcher.task;

/**
 * 无参数任务（加载、保存、刷新、统计、清空）使用的参数。
 */
public enum NoParams implements TaskParams {
    INSTANCE
}
